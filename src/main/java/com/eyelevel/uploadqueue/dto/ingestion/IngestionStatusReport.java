package com.eyelevel.uploadqueue.dto.ingestion;

import com.eyelevel.uploadqueue.model.ProcessingStage;

/**
 * One status observation for an accepted upload.
 *
 * @param stage    Current stage while not terminal, {@code null} otherwise.
 * @param terminal Whether the ingestion service has finished with the resource.
 * @param success  Whether a terminal resource was ingested successfully.
 * @param error    Reported failure reason for a terminal failure.
 */
public record IngestionStatusReport(ProcessingStage stage, boolean terminal, boolean success, String error) {

    public static IngestionStatusReport inProgress(ProcessingStage stage) {
        return new IngestionStatusReport(stage, false, false, null);
    }

    public static IngestionStatusReport succeeded() {
        return new IngestionStatusReport(null, true, true, null);
    }

    public static IngestionStatusReport failed(String error) {
        return new IngestionStatusReport(null, true, false, error);
    }
}
