package com.eyelevel.uploadqueue.dto.ingestion;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Response of the ingestion service once it has accepted a submission.
 *
 * @param id              The resource id used for subsequent status queries.
 * @param status          Acceptance status, usually {@code pending}.
 * @param ingestionStatus Initial ingestion status of the resource.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ResourceAccepted(String id,
                               String status,
                               @JsonProperty("ingestion_status") String ingestionStatus) {
}
