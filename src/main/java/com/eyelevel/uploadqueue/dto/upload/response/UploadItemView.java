package com.eyelevel.uploadqueue.dto.upload.response;

import com.eyelevel.uploadqueue.model.PayloadKind;
import com.eyelevel.uploadqueue.model.ProcessingStage;
import com.eyelevel.uploadqueue.model.UploadItem;
import com.eyelevel.uploadqueue.model.UploadStatus;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;

import java.time.Instant;

/**
 * Read-only projection of an upload for API clients. Local content is never exposed, only its name.
 */
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public record UploadItemView(
        String id,
        PayloadKind kind,
        String displayName,
        UploadStatus status,
        int progress,
        ProcessingStage stage,
        String error,
        String externalId,
        Instant createdAt) {

    public static UploadItemView from(final UploadItem item) {
        return UploadItemView.builder()
                .id(item.getId())
                .kind(item.getPayload().kind())
                .displayName(item.getPayload().displayName())
                .status(item.getStatus())
                .progress(item.getProgress())
                .stage(item.getStage())
                .error(item.getError())
                .externalId(item.getExternalId())
                .createdAt(item.getCreatedAt())
                .build();
    }
}
