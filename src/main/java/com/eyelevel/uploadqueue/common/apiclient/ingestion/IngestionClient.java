package com.eyelevel.uploadqueue.common.apiclient.ingestion;

import com.eyelevel.uploadqueue.dto.ingestion.IngestionStatusReport;
import com.eyelevel.uploadqueue.dto.ingestion.TransferEvent;
import com.eyelevel.uploadqueue.model.UploadPayload;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * The external ingestion service as seen by the upload queue. Both operations are cold and cancellable:
 * nothing happens until subscription and cancelling the subscription aborts the call.
 */
public interface IngestionClient {

    /**
     * Submits a payload.
     *
     * @return progress events followed by one acceptance event carrying the external id; errors with an
     * {@link com.eyelevel.uploadqueue.exception.apiclient.ApiException} when the submission fails
     */
    Flux<TransferEvent> submit(UploadPayload payload);

    /**
     * Queries the processing status of an accepted submission.
     *
     * @return the current status; errors only when the query itself fails
     */
    Mono<IngestionStatusReport> fetchStatus(String externalId);
}
