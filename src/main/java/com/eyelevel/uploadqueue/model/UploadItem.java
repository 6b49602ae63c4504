package com.eyelevel.uploadqueue.model;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;
import org.springframework.util.StringUtils;

import java.time.Instant;

/**
 * Immutable snapshot of one queued upload.
 * <p>
 * Every state change produces a new instance through one of the transition methods below, so a reader
 * holding a snapshot never sees a half-applied update. The transition methods also keep the record's
 * invariants: {@code error} is set exactly when the status is {@link UploadStatus#FAILED},
 * {@code stage} only while {@link UploadStatus#PROCESSING}, and {@code externalId} only after a
 * successful transfer.
 */
@Value
@Builder(toBuilder = true)
public class UploadItem {

    static final String DEFAULT_FAILURE_MESSAGE = "Upload failed";

    @NonNull
    String id;

    @NonNull
    UploadPayload payload;

    @NonNull
    UploadStatus status;

    int progress;

    ProcessingStage stage;

    String error;

    String externalId;

    @NonNull
    Instant createdAt;

    /**
     * When the ingestion service accepted the transfer. The poll deadline is measured from here.
     */
    Instant processingStartedAt;

    public static UploadItem pending(final String id, final UploadPayload payload, final Instant createdAt) {
        return UploadItem.builder()
                .id(id)
                .payload(payload)
                .status(UploadStatus.PENDING)
                .progress(0)
                .createdAt(createdAt)
                .build();
    }

    public UploadItem toActive() {
        return toBuilder()
                .status(UploadStatus.ACTIVE)
                .progress(0)
                .stage(null)
                .error(null)
                .build();
    }

    /**
     * Applies a transfer progress report. Reports that would move progress backwards are ignored.
     */
    public UploadItem withProgress(final int reported) {
        final int clamped = Math.max(0, Math.min(100, reported));
        if (clamped <= progress) {
            return this;
        }
        return toBuilder().progress(clamped).build();
    }

    public UploadItem toProcessing(final String acceptedExternalId, final Instant startedAt) {
        return toBuilder()
                .status(UploadStatus.PROCESSING)
                .progress(100)
                .externalId(acceptedExternalId)
                .stage(ProcessingStage.DOWNLOADING)
                .error(null)
                .processingStartedAt(startedAt)
                .build();
    }

    public UploadItem withStage(final ProcessingStage reportedStage) {
        if (reportedStage == null || reportedStage == stage) {
            return this;
        }
        return toBuilder().stage(reportedStage).build();
    }

    public UploadItem toCompleted() {
        return toBuilder()
                .status(UploadStatus.COMPLETED)
                .progress(100)
                .stage(null)
                .error(null)
                .build();
    }

    public UploadItem toFailed(final String reason) {
        return toBuilder()
                .status(UploadStatus.FAILED)
                .stage(null)
                .error(StringUtils.hasText(reason) ? reason : DEFAULT_FAILURE_MESSAGE)
                .build();
    }

    /**
     * Resets a failed upload so admission picks it up again.
     */
    public UploadItem toPendingForRetry() {
        return toBuilder()
                .status(UploadStatus.PENDING)
                .progress(0)
                .stage(null)
                .error(null)
                .externalId(null)
                .processingStartedAt(null)
                .build();
    }
}
