package com.eyelevel.uploadqueue.service.notification;

import com.eyelevel.uploadqueue.model.UploadItem;

import java.time.Instant;

/**
 * Terminal transition of an upload, as published on the queue's event stream.
 *
 * @param type       What happened.
 * @param item       The record right after the transition.
 * @param error      Failure reason for {@link Type#FAILED}, {@code null} otherwise.
 * @param occurredAt When the transition was observed.
 */
public record UploadEvent(Type type, UploadItem item, String error, Instant occurredAt) {

    public enum Type {
        COMPLETED,
        FAILED
    }

    public static UploadEvent completed(UploadItem item, Instant occurredAt) {
        return new UploadEvent(Type.COMPLETED, item, null, occurredAt);
    }

    public static UploadEvent failed(UploadItem item, String error, Instant occurredAt) {
        return new UploadEvent(Type.FAILED, item, error, occurredAt);
    }
}
