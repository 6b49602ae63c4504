package com.eyelevel.uploadqueue.dto.upload.response;

import com.eyelevel.uploadqueue.service.notification.UploadEvent;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record UploadEventView(UploadEvent.Type type, UploadItemView item, String error, Instant occurredAt) {

    public static UploadEventView from(final UploadEvent event) {
        return new UploadEventView(event.type(), UploadItemView.from(event.item()), event.error(), event.occurredAt());
    }
}
