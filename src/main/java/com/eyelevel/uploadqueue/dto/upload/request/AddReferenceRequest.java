package com.eyelevel.uploadqueue.dto.upload.request;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;

/**
 * Request to queue a remote resource.
 *
 * @param url Absolute http(s) URL the ingestion service downloads the resource from.
 */
public record AddReferenceRequest(
        @Schema(description = "Absolute http(s) URL of the resource.", example = "https://example.com/report.pdf")
        @NotBlank(message = "The 'url' field cannot be empty.")
        String url) {
}
