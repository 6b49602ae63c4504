package com.eyelevel.uploadqueue.service.transfer;

import com.eyelevel.uploadqueue.common.apiclient.ingestion.IngestionClient;
import com.eyelevel.uploadqueue.common.time.SchedulerClock;
import com.eyelevel.uploadqueue.dto.ingestion.TransferEvent;
import com.eyelevel.uploadqueue.model.UploadItem;
import com.eyelevel.uploadqueue.model.UploadStatus;
import com.eyelevel.uploadqueue.repository.UploadItemStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;

/**
 * Transfers one admitted upload to the ingestion service.
 * <p>
 * Progress reports update the record while it is {@link UploadStatus#ACTIVE}; reports that would move
 * progress backwards are dropped. Acceptance moves the record to {@link UploadStatus#PROCESSING}, any
 * error (rejection, network failure, missing acceptance) moves it to {@link UploadStatus#FAILED}. Every
 * write is conditional on the record still being active, so a cancelled upload is never touched again.
 * <p>
 * The executor only records state. Releasing the concurrency slot, handing over to polling and
 * notifying are left to whoever consumes the returned {@link TransferOutcome}.
 */
@Slf4j
@Service
public class UploadTransferExecutor {

    static final String NO_ACCEPTANCE_MESSAGE = "Upload finished without the ingestion service accepting it";
    static final String GENERIC_FAILURE_MESSAGE = "Upload failed";

    private final UploadItemStore uploadItemStore;
    private final IngestionClient ingestionClient;
    private final Scheduler scheduler;

    public UploadTransferExecutor(final UploadItemStore uploadItemStore,
                                  final IngestionClient ingestionClient,
                                  @Qualifier("uploadQueueScheduler") final Scheduler scheduler) {
        this.uploadItemStore = uploadItemStore;
        this.ingestionClient = ingestionClient;
        this.scheduler = scheduler;
    }

    /**
     * Builds the transfer of {@code item}. Nothing is sent until subscription; cancelling the subscription
     * aborts the call to the ingestion service.
     *
     * @return a {@link Mono} that always completes with an outcome, never with an error
     */
    public Mono<TransferOutcome> execute(final UploadItem item) {
        final String uploadId = item.getId();
        return Flux.defer(() -> {
                    log.info("Starting transfer of upload {} ({}).", uploadId, item.getPayload().displayName());
                    return ingestionClient.submit(item.getPayload());
                })
                .doOnNext(event -> {
                    if (!event.isAccepted()) {
                        recordProgress(uploadId, event.progress());
                    }
                })
                .filter(TransferEvent::isAccepted)
                .next()
                .map(accepted -> markProcessing(uploadId, accepted.externalId()))
                .switchIfEmpty(Mono.fromSupplier(() -> markFailed(uploadId, NO_ACCEPTANCE_MESSAGE)))
                .onErrorResume(error -> {
                    log.warn("Transfer of upload {} failed: {}", uploadId, error.getMessage());
                    return Mono.just(markFailed(uploadId, describe(error)));
                });
    }

    private void recordProgress(final String uploadId, final int progress) {
        uploadItemStore.compareAndUpdate(uploadId, UploadStatus.ACTIVE, current -> current.withProgress(progress))
                .ifPresent(updated -> log.debug("Upload {} transfer progress: {}%", uploadId, updated.getProgress()));
    }

    private TransferOutcome markProcessing(final String uploadId, final String externalId) {
        return uploadItemStore.compareAndUpdate(uploadId, UploadStatus.ACTIVE,
                        current -> current.toProcessing(externalId, SchedulerClock.now(scheduler)))
                .map(updated -> {
                    log.info("Upload {} transferred, ingestion service resource id {}.", uploadId, externalId);
                    return TransferOutcome.accepted(updated);
                })
                .orElseGet(() -> abandoned(uploadId));
    }

    private TransferOutcome markFailed(final String uploadId, final String reason) {
        return uploadItemStore.compareAndUpdate(uploadId, UploadStatus.ACTIVE, current -> current.toFailed(reason))
                .map(TransferOutcome::failed)
                .orElseGet(() -> abandoned(uploadId));
    }

    private TransferOutcome abandoned(final String uploadId) {
        log.debug("Upload {} is no longer active, discarding its transfer result.", uploadId);
        return TransferOutcome.abandoned(uploadId);
    }

    private static String describe(final Throwable error) {
        return StringUtils.hasText(error.getMessage()) ? error.getMessage() : GENERIC_FAILURE_MESSAGE;
    }
}
