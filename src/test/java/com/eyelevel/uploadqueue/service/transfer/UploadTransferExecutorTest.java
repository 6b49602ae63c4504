package com.eyelevel.uploadqueue.service.transfer;

import com.eyelevel.uploadqueue.common.apiclient.ingestion.IngestionClient;
import com.eyelevel.uploadqueue.dto.ingestion.TransferEvent;
import com.eyelevel.uploadqueue.exception.apiclient.IngestionRejectedException;
import com.eyelevel.uploadqueue.model.ProcessingStage;
import com.eyelevel.uploadqueue.model.UploadItem;
import com.eyelevel.uploadqueue.model.UploadPayload;
import com.eyelevel.uploadqueue.model.UploadStatus;
import com.eyelevel.uploadqueue.repository.InMemoryUploadItemStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import reactor.core.publisher.Flux;
import reactor.test.StepVerifier;
import reactor.test.scheduler.VirtualTimeScheduler;

import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class UploadTransferExecutorTest {

    private static final String ID = "upload-1";

    @Mock
    private IngestionClient ingestionClient;

    private InMemoryUploadItemStore store;
    private VirtualTimeScheduler scheduler;
    private UploadTransferExecutor executor;
    private UploadItem active;

    @BeforeEach
    void setUp() {
        store = new InMemoryUploadItemStore();
        scheduler = VirtualTimeScheduler.create();
        scheduler.advanceTimeBy(Duration.ofSeconds(42));
        executor = new UploadTransferExecutor(store, ingestionClient, scheduler);
        store.enqueue(UploadItem.pending(ID, UploadPayload.ofReference("https://example.com/a.pdf"), Instant.EPOCH));
        active = store.update(ID, UploadItem::toActive).orElseThrow();
    }

    @Test
    void acceptanceMovesTheUploadToProcessing() {
        when(ingestionClient.submit(any())).thenReturn(Flux.just(
                TransferEvent.progress(30), TransferEvent.progress(80), TransferEvent.accepted("res-9")));

        StepVerifier.create(executor.execute(active))
                .assertNext(outcome -> {
                    assertThat(outcome.kind()).isEqualTo(TransferOutcome.Kind.ACCEPTED);
                    assertThat(outcome.item().getExternalId()).isEqualTo("res-9");
                })
                .verifyComplete();

        final UploadItem processing = store.findById(ID).orElseThrow();
        assertThat(processing.getStatus()).isEqualTo(UploadStatus.PROCESSING);
        assertThat(processing.getProgress()).isEqualTo(100);
        assertThat(processing.getStage()).isEqualTo(ProcessingStage.DOWNLOADING);
        assertThat(processing.getError()).isNull();
        assertThat(processing.getProcessingStartedAt()).isEqualTo(Instant.ofEpochSecond(42));
    }

    @Test
    void backwardProgressIsDiscardedAndErrorsFailTheUpload() {
        when(ingestionClient.submit(any())).thenReturn(Flux.concat(
                Flux.just(TransferEvent.progress(50), TransferEvent.progress(20)),
                Flux.error(new IngestionRejectedException("File too large", 413))));

        StepVerifier.create(executor.execute(active))
                .assertNext(outcome -> assertThat(outcome.kind()).isEqualTo(TransferOutcome.Kind.FAILED))
                .verifyComplete();

        final UploadItem failed = store.findById(ID).orElseThrow();
        assertThat(failed.getStatus()).isEqualTo(UploadStatus.FAILED);
        assertThat(failed.getError()).isEqualTo("File too large");
        assertThat(failed.getProgress()).isEqualTo(50);
        assertThat(failed.getExternalId()).isNull();
    }

    @Test
    void transferWithoutAcceptanceFails() {
        when(ingestionClient.submit(any())).thenReturn(Flux.just(TransferEvent.progress(100)));

        StepVerifier.create(executor.execute(active))
                .assertNext(outcome -> assertThat(outcome.kind()).isEqualTo(TransferOutcome.Kind.FAILED))
                .verifyComplete();

        assertThat(store.findById(ID).orElseThrow().getError())
                .isEqualTo(UploadTransferExecutor.NO_ACCEPTANCE_MESSAGE);
    }

    @Test
    void removedUploadIsAbandonedWithoutBeingRecreated() {
        when(ingestionClient.submit(any())).thenReturn(Flux.defer(() -> {
            store.remove(ID);
            return Flux.just(TransferEvent.accepted("res-9"));
        }));

        StepVerifier.create(executor.execute(active))
                .assertNext(outcome -> {
                    assertThat(outcome.kind()).isEqualTo(TransferOutcome.Kind.ABANDONED);
                    assertThat(outcome.item()).isNull();
                })
                .verifyComplete();

        assertThat(store.size()).isZero();
    }
}
