package com.eyelevel.uploadqueue.service.notification;

import com.eyelevel.uploadqueue.model.UploadItem;

/**
 * Caller-supplied callbacks for terminal upload transitions. Cancelled uploads produce no callback.
 */
public interface UploadQueueListener {

    default void onCompleted(UploadItem item) {
    }

    default void onFailed(UploadItem item, String error) {
    }
}
