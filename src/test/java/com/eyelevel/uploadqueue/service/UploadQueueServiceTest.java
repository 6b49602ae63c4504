package com.eyelevel.uploadqueue.service;

import com.eyelevel.uploadqueue.dto.ingestion.IngestionStatusReport;
import com.eyelevel.uploadqueue.exception.UploadNotFoundException;
import com.eyelevel.uploadqueue.model.PayloadKind;
import com.eyelevel.uploadqueue.model.UploadItem;
import com.eyelevel.uploadqueue.model.UploadStatus;
import com.eyelevel.uploadqueue.service.notification.NotificationKind;
import com.eyelevel.uploadqueue.service.notification.UploadEvent;
import com.eyelevel.uploadqueue.support.UploadQueueHarness;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.core.io.ByteArrayResource;
import reactor.core.Disposable;
import reactor.core.publisher.Mono;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class UploadQueueServiceTest {

    private UploadQueueHarness harness;

    @BeforeEach
    void setUp() {
        harness = new UploadQueueHarness();
    }

    @Test
    void fivePayloadsWithThreeSlotsLeaveTwoPending() {
        final List<String> ids = addReferences(5);

        assertThat(harness.count(UploadStatus.ACTIVE)).isEqualTo(3);
        assertThat(harness.count(UploadStatus.PENDING)).isEqualTo(2);
        assertThat(harness.service.getActiveCount()).isEqualTo(3);
        assertThat(ids.subList(0, 3)).allSatisfy(id -> assertThat(harness.item(id).getStatus()).isEqualTo(UploadStatus.ACTIVE));
        assertThat(ids.subList(3, 5)).allSatisfy(id -> assertThat(harness.item(id).getStatus()).isEqualTo(UploadStatus.PENDING));
    }

    @Test
    void finishedTransferAdmitsTheOldestPendingUpload() {
        final List<String> ids = addReferences(5);
        harness.ingestion.respondWith(externalId -> Mono.just(IngestionStatusReport.succeeded()));

        harness.ingestion.accept(url(0), "res-0");

        assertThat(harness.item(ids.get(0)).getStatus()).isEqualTo(UploadStatus.PROCESSING);
        assertThat(harness.item(ids.get(3)).getStatus()).isEqualTo(UploadStatus.ACTIVE);
        assertThat(harness.item(ids.get(4)).getStatus()).isEqualTo(UploadStatus.PENDING);

        harness.advance(Duration.ofSeconds(5));

        final UploadItem completed = harness.item(ids.get(0));
        assertThat(completed.getStatus()).isEqualTo(UploadStatus.COMPLETED);
        assertThat(completed.getProgress()).isEqualTo(100);
        assertThat(completed.getStage()).isNull();
        assertThat(harness.count(UploadStatus.ACTIVE)).isEqualTo(3);
        assertThat(harness.notifier.ofKind(NotificationKind.SUCCESS))
                .extracting(notification -> notification.message())
                .containsExactly("Resource uploaded successfully");
    }

    @Test
    void rejectedReferenceFailsOnceWithoutPolling() {
        harness.ingestion.rejectOnSubmit("https://example.com/broken.pdf");

        final String id = harness.service.addReference("https://example.com/broken.pdf");
        harness.advance(Duration.ofMinutes(10));

        final UploadItem failed = harness.item(id);
        assertThat(harness.store.size()).isEqualTo(1);
        assertThat(failed.getStatus()).isEqualTo(UploadStatus.FAILED);
        assertThat(failed.getError()).isNotBlank();
        assertThat(failed.getExternalId()).isNull();
        assertThat(harness.notifier.all()).hasSize(1);
        assertThat(harness.notifier.ofKind(NotificationKind.ERROR).get(0).message()).startsWith("Upload failed: ");
        assertThat(harness.ingestion.totalStatusCalls()).isZero();
        assertThat(harness.service.getActiveCount()).isZero();
        assertThat(harness.registry.size()).isZero();
    }

    @Test
    void addingUploadsGrowsTheQueueByOneEach() {
        harness.service.addReference("https://example.com/a.pdf");
        final String fileId = harness.service.addFile("notes.txt",
                new ByteArrayResource("hello".getBytes(StandardCharsets.UTF_8)));

        assertThat(harness.store.size()).isEqualTo(2);
        assertThat(fileId).startsWith("upload-");
        assertThat(harness.item(fileId).getPayload().kind()).isEqualTo(PayloadKind.FILE);
        assertThat(harness.item(fileId).getPayload().displayName()).isEqualTo("notes.txt");
    }

    @Test
    void invalidReferenceIsRejectedWithoutQueueing() {
        assertThatThrownBy(() -> harness.service.addReference("ftp://example.com/a.pdf"))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> harness.service.addReference("  "))
                .isInstanceOf(IllegalArgumentException.class);
        assertThat(harness.store.size()).isZero();
    }

    @Test
    void eventsStreamTerminalTransitions() {
        final List<UploadEvent> events = new ArrayList<>();
        final Disposable subscription = harness.service.events().subscribe(events::add);
        harness.ingestion.rejectOnSubmit("https://example.com/bad.pdf");
        harness.ingestion.respondWith(externalId -> Mono.just(IngestionStatusReport.succeeded()));

        final String failedId = harness.service.addReference("https://example.com/bad.pdf");
        final String okId = harness.service.addReference("https://example.com/good.pdf");
        harness.ingestion.accept("https://example.com/good.pdf", "res-good");
        harness.advance(Duration.ofSeconds(5));
        subscription.dispose();

        assertThat(events).extracting(UploadEvent::type)
                .containsExactly(UploadEvent.Type.FAILED, UploadEvent.Type.COMPLETED);
        assertThat(events.get(0).item().getId()).isEqualTo(failedId);
        assertThat(events.get(0).error()).isNotBlank();
        assertThat(events.get(1).item().getId()).isEqualTo(okId);
    }

    @Test
    void countByStatusCoversEveryStatus() {
        addReferences(4);

        assertThat(harness.service.countByStatus())
                .containsEntry(UploadStatus.ACTIVE, 3L)
                .containsEntry(UploadStatus.PENDING, 1L)
                .containsEntry(UploadStatus.COMPLETED, 0L)
                .hasSize(UploadStatus.values().length);
    }

    @Test
    void findByIdRejectsUnknownIds() {
        assertThatThrownBy(() -> harness.service.findById("upload-missing"))
                .isInstanceOf(UploadNotFoundException.class);
    }

    private List<String> addReferences(final int count) {
        final List<String> ids = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            ids.add(harness.service.addReference(url(i)));
        }
        return ids;
    }

    private static String url(final int index) {
        return "https://example.com/doc-" + index + ".pdf";
    }
}
