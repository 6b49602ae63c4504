package com.eyelevel.uploadqueue.exception;

import com.eyelevel.uploadqueue.model.UploadStatus;
import lombok.Getter;

import java.io.Serial;

/**
 * Raised when a lifecycle operation does not apply to the upload's current status,
 * e.g. retrying an upload that has not failed. The queue is left untouched.
 */
@Getter
public class InvalidUploadOperationException extends RuntimeException {
    @Serial
    private static final long serialVersionUID = 4107815527018931742L;

    private final String uploadId;
    private final UploadStatus currentStatus;

    public InvalidUploadOperationException(String operation, String uploadId, UploadStatus currentStatus) {
        super(String.format("Cannot %s upload %s: current status is %s.", operation, uploadId, currentStatus));
        this.uploadId = uploadId;
        this.currentStatus = currentStatus;
    }
}
