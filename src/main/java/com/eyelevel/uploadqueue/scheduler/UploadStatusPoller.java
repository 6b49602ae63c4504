package com.eyelevel.uploadqueue.scheduler;

import com.eyelevel.uploadqueue.common.apiclient.ingestion.IngestionClient;
import com.eyelevel.uploadqueue.common.time.SchedulerClock;
import com.eyelevel.uploadqueue.config.UploadQueueProperties;
import com.eyelevel.uploadqueue.dto.ingestion.IngestionStatusReport;
import com.eyelevel.uploadqueue.model.UploadItem;
import com.eyelevel.uploadqueue.model.UploadStatus;
import com.eyelevel.uploadqueue.repository.UploadItemStore;
import com.eyelevel.uploadqueue.service.inflight.CancellationToken;
import com.eyelevel.uploadqueue.service.inflight.InFlightOperationRegistry;
import com.eyelevel.uploadqueue.service.notification.NotificationBridge;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * Follows an accepted upload through the ingestion service's pipeline until it reports a final state.
 * <p>
 * Each poll cycle waits {@code pollInterval}, queries the service and then either finishes the upload,
 * records the reported stage, or, when the query itself failed, leaves the upload untouched. Before the
 * next cycle is scheduled the elapsed time since processing began is compared to {@code pollTimeout};
 * once reached the upload fails with a timeout, whatever stage it was last seen in. Transient query
 * errors therefore never extend the deadline.
 * <p>
 * The timer and the query of the current cycle are one subscription bound to the upload's
 * {@link CancellationToken}, so cancelling the upload stops polling without leaving a timer behind.
 * Processing uploads do not hold a concurrency slot.
 */
@Slf4j
@Component
public class UploadStatusPoller {

    static final String TIMEOUT_MESSAGE = "Processing timeout - please check resource status manually";

    private final UploadItemStore uploadItemStore;
    private final IngestionClient ingestionClient;
    private final NotificationBridge notificationBridge;
    private final InFlightOperationRegistry inFlightOperations;
    private final UploadQueueProperties properties;
    private final Scheduler scheduler;

    public UploadStatusPoller(final UploadItemStore uploadItemStore,
                              final IngestionClient ingestionClient,
                              final NotificationBridge notificationBridge,
                              final InFlightOperationRegistry inFlightOperations,
                              final UploadQueueProperties properties,
                              @Qualifier("uploadQueueScheduler") final Scheduler scheduler) {
        this.uploadItemStore = uploadItemStore;
        this.ingestionClient = ingestionClient;
        this.notificationBridge = notificationBridge;
        this.inFlightOperations = inFlightOperations;
        this.properties = properties;
        this.scheduler = scheduler;
    }

    /**
     * Starts polling an upload that has just entered {@link UploadStatus#PROCESSING}.
     */
    public void start(final UploadItem item, final CancellationToken token) {
        log.info("Polling status of upload {} (resource {}) every {} for up to {} (~{} attempts).",
                item.getId(), item.getExternalId(), properties.getPollInterval(), properties.getPollTimeout(),
                properties.maxAttempts());
        schedulePoll(item.getId(), item.getExternalId(), token);
    }

    private void schedulePoll(final String uploadId, final String externalId, final CancellationToken token) {
        Mono.delay(properties.getPollInterval(), scheduler)
                .then(Mono.defer(() -> ingestionClient.fetchStatus(externalId)))
                .map(PollResult::reported)
                .switchIfEmpty(Mono.fromSupplier(
                        () -> PollResult.transportError(new IllegalStateException("Empty status response"))))
                .onErrorResume(error -> Mono.just(PollResult.transportError(error)))
                .doOnSubscribe(subscription -> token.bind(subscription::cancel))
                .subscribe(result -> onPollResult(uploadId, externalId, token, result));
    }

    private void onPollResult(final String uploadId, final String externalId, final CancellationToken token,
                              final PollResult result) {
        if (token.isCancelled()) {
            log.debug("Upload {} was cancelled, dropping poll result.", uploadId);
            return;
        }
        final Optional<UploadItem> current = uploadItemStore.findById(uploadId);
        if (current.isEmpty() || current.get().getStatus() != UploadStatus.PROCESSING) {
            log.debug("Upload {} is no longer processing, stopping status polling.", uploadId);
            inFlightOperations.close(token);
            return;
        }

        if (result.failure() != null) {
            log.warn("Status query for upload {} (resource {}) failed, retrying in {}: {}", uploadId, externalId,
                    properties.getPollInterval(), result.failure().getMessage());
        } else {
            final IngestionStatusReport report = result.report();
            if (report.terminal() && report.success()) {
                complete(uploadId, token);
                return;
            }
            if (report.terminal()) {
                fail(uploadId, token, report.error());
                return;
            }
            uploadItemStore.compareAndUpdate(uploadId, UploadStatus.PROCESSING, item -> item.withStage(report.stage()))
                    .ifPresent(updated -> log.debug("Upload {} is {}.", uploadId, updated.getStage()));
        }

        rescheduleOrExpire(current.get(), token);
    }

    private void rescheduleOrExpire(final UploadItem item, final CancellationToken token) {
        final Instant startedAt = Optional.ofNullable(item.getProcessingStartedAt()).orElse(item.getCreatedAt());
        final Duration elapsed = Duration.between(startedAt, SchedulerClock.now(scheduler));
        if (elapsed.compareTo(properties.getPollTimeout()) >= 0) {
            log.warn("Upload {} still not finished after {}, giving up.", item.getId(), elapsed);
            fail(item.getId(), token, TIMEOUT_MESSAGE);
            return;
        }
        schedulePoll(item.getId(), item.getExternalId(), token);
    }

    private void complete(final String uploadId, final CancellationToken token) {
        inFlightOperations.close(token);
        uploadItemStore.compareAndUpdate(uploadId, UploadStatus.PROCESSING, UploadItem::toCompleted)
                .ifPresent(notificationBridge::completed);
    }

    private void fail(final String uploadId, final CancellationToken token, final String reason) {
        inFlightOperations.close(token);
        uploadItemStore.compareAndUpdate(uploadId, UploadStatus.PROCESSING, item -> item.toFailed(reason))
                .ifPresent(notificationBridge::failed);
    }

    private record PollResult(IngestionStatusReport report, Throwable failure) {

        static PollResult reported(final IngestionStatusReport report) {
            return new PollResult(report, null);
        }

        static PollResult transportError(final Throwable failure) {
            return new PollResult(null, failure);
        }
    }
}
