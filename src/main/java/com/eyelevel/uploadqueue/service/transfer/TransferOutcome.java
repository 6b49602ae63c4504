package com.eyelevel.uploadqueue.service.transfer;

import com.eyelevel.uploadqueue.model.UploadItem;

/**
 * Result of one transfer attempt.
 *
 * @param kind     How the transfer ended.
 * @param uploadId The upload the transfer belonged to.
 * @param item     The record after the transition; {@code null} when the upload was {@link Kind#ABANDONED}.
 */
public record TransferOutcome(Kind kind, String uploadId, UploadItem item) {

    public enum Kind {
        /**
         * The ingestion service accepted the upload, which is now processing.
         */
        ACCEPTED,
        /**
         * The transfer failed and the upload was marked failed.
         */
        FAILED,
        /**
         * The upload was removed or changed by someone else while transferring; nothing was recorded.
         */
        ABANDONED
    }

    public static TransferOutcome accepted(UploadItem item) {
        return new TransferOutcome(Kind.ACCEPTED, item.getId(), item);
    }

    public static TransferOutcome failed(UploadItem item) {
        return new TransferOutcome(Kind.FAILED, item.getId(), item);
    }

    public static TransferOutcome abandoned(String uploadId) {
        return new TransferOutcome(Kind.ABANDONED, uploadId, null);
    }
}
