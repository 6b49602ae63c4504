package com.eyelevel.uploadqueue.repository;

import com.eyelevel.uploadqueue.model.UploadItem;
import com.eyelevel.uploadqueue.model.UploadPayload;
import com.eyelevel.uploadqueue.model.UploadStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class InMemoryUploadItemStoreTest {

    private InMemoryUploadItemStore store;

    @BeforeEach
    void setUp() {
        store = new InMemoryUploadItemStore();
        for (String id : List.of("a", "b", "c")) {
            store.enqueue(UploadItem.pending(id, UploadPayload.ofReference("https://example.com/" + id), Instant.EPOCH));
        }
    }

    @Test
    void snapshotKeepsInsertionOrder() {
        assertThat(store.snapshot()).extracting(UploadItem::getId).containsExactly("a", "b", "c");
        assertThat(store.size()).isEqualTo(3);
    }

    @Test
    void duplicateIdsAreRefused() {
        final UploadItem duplicate = UploadItem.pending("b", UploadPayload.ofReference("https://example.com/x"),
                Instant.EPOCH);

        assertThatThrownBy(() -> store.enqueue(duplicate)).isInstanceOf(IllegalStateException.class);
        assertThat(store.size()).isEqualTo(3);
    }

    @Test
    void updatesOfUnknownIdsAreNoOps() {
        assertThat(store.update("missing", UploadItem::toActive)).isEmpty();
        assertThat(store.remove("missing")).isEmpty();
        assertThat(store.size()).isEqualTo(3);
    }

    @Test
    void compareAndUpdateRequiresTheExpectedStatus() {
        assertThat(store.compareAndUpdate("a", UploadStatus.ACTIVE, item -> item.withProgress(50))).isEmpty();

        assertThat(store.compareAndUpdate("a", UploadStatus.PENDING, UploadItem::toActive))
                .get()
                .extracting(UploadItem::getStatus)
                .isEqualTo(UploadStatus.ACTIVE);
        assertThat(store.findByStatus(UploadStatus.PENDING)).extracting(UploadItem::getId).containsExactly("b", "c");
    }

    @Test
    void mutationsMustKeepTheId() {
        assertThatThrownBy(() -> store.update("a", item -> item.toBuilder().id("z").build()))
                .isInstanceOf(IllegalArgumentException.class);
        assertThat(store.findById("a")).isPresent();
    }

    @Test
    void removeIfReturnsRemovedRecordsInOrder() {
        store.update("c", item -> item.toActive().toFailed("boom"));
        store.update("a", item -> item.toActive().toFailed("boom"));

        final List<UploadItem> removed = store.removeIf(item -> item.getStatus() == UploadStatus.FAILED);

        assertThat(removed).extracting(UploadItem::getId).containsExactly("a", "c");
        assertThat(store.snapshot()).extracting(UploadItem::getId).containsExactly("b");
    }

    @Test
    void snapshotIsACopy() {
        final List<UploadItem> snapshot = store.snapshot();
        store.removeAll();

        assertThat(snapshot).hasSize(3);
        assertThat(store.size()).isZero();
    }
}
