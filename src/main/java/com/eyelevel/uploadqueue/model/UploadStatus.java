package com.eyelevel.uploadqueue.model;

/**
 * Lifecycle states of a queued upload.
 * <p>
 * Only {@link #ACTIVE} occupies a concurrency slot. {@link #COMPLETED} and {@link #FAILED} are terminal:
 * no automatic transition leaves them, a failed upload comes back only through an explicit retry.
 */
public enum UploadStatus {
    PENDING,
    ACTIVE,
    PROCESSING,
    COMPLETED,
    FAILED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }
}
