package com.eyelevel.uploadqueue.model;

import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

class UploadItemTest {

    private final UploadItem pending = UploadItem.pending("upload-1",
            UploadPayload.ofReference("https://example.com/a.pdf"), Instant.EPOCH);

    @Test
    void progressOnlyMovesForwardAndIsClamped() {
        final UploadItem active = pending.toActive().withProgress(40);

        assertThat(active.withProgress(10).getProgress()).isEqualTo(40);
        assertThat(active.withProgress(40)).isSameAs(active);
        assertThat(active.withProgress(250).getProgress()).isEqualTo(100);
    }

    @Test
    void failureAlwaysCarriesAReason() {
        final UploadItem failed = pending.toActive().toFailed("  ");

        assertThat(failed.getStatus()).isEqualTo(UploadStatus.FAILED);
        assertThat(failed.getError()).isEqualTo(UploadItem.DEFAULT_FAILURE_MESSAGE);
        assertThat(failed.getStage()).isNull();
    }

    @Test
    void completionClearsStageAndError() {
        final UploadItem completed = pending.toActive()
                .toProcessing("res-1", Instant.EPOCH)
                .withStage(ProcessingStage.ANALYZING)
                .toCompleted();

        assertThat(completed.getProgress()).isEqualTo(100);
        assertThat(completed.getStage()).isNull();
        assertThat(completed.getError()).isNull();
        assertThat(completed.getExternalId()).isEqualTo("res-1");
    }

    @Test
    void retryResetClearsEverythingFromThePreviousAttempt() {
        final UploadItem reset = pending.toActive()
                .toProcessing("res-1", Instant.EPOCH)
                .toFailed("Corrupt file")
                .toPendingForRetry();

        assertThat(reset.getStatus()).isEqualTo(UploadStatus.PENDING);
        assertThat(reset.getProgress()).isZero();
        assertThat(reset.getError()).isNull();
        assertThat(reset.getExternalId()).isNull();
        assertThat(reset.getProcessingStartedAt()).isNull();
        assertThat(reset.getCreatedAt()).isEqualTo(Instant.EPOCH);
    }
}
