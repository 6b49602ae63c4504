package com.eyelevel.uploadqueue.dto.ingestion;

import com.eyelevel.uploadqueue.model.ProcessingStage;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Status of a resource as reported by the ingestion service.
 *
 * @param id                   The resource id.
 * @param ingestionStatus      One of {@code pending}, {@code processing}, {@code completed}, {@code failed}.
 * @param ingestionError       Failure reason, set when {@code ingestionStatus} is {@code failed}.
 * @param ingestionStage       Optional finer-grained stage while the resource is being processed.
 * @param ingestionStartedAt   When the service started working on the resource.
 * @param ingestionCompletedAt When the service finished, successfully or not.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ResourceStatusResponse(String id,
                                     @JsonProperty("ingestion_status") String ingestionStatus,
                                     @JsonProperty("ingestion_error") String ingestionError,
                                     @JsonProperty("ingestion_stage") String ingestionStage,
                                     @JsonProperty("ingestion_started_at") String ingestionStartedAt,
                                     @JsonProperty("ingestion_completed_at") String ingestionCompletedAt) {

    static final String DEFAULT_PROCESSING_ERROR = "Processing failed";

    /**
     * Reduces the response to what the status poller needs. An explicit stage wins over the one implied
     * by the ingestion status.
     */
    public IngestionStatusReport toReport() {
        final IngestionState state = IngestionState.convertByValue(ingestionStatus);
        return switch (state) {
            case COMPLETED -> IngestionStatusReport.succeeded();
            case FAILED -> IngestionStatusReport.failed(
                    ingestionError == null || ingestionError.isBlank() ? DEFAULT_PROCESSING_ERROR : ingestionError);
            default -> IngestionStatusReport.inProgress(
                    ProcessingStage.fromValue(ingestionStage).orElse(state.getImpliedStage()));
        };
    }
}
