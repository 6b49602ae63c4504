package com.eyelevel.uploadqueue.scheduler;

import com.eyelevel.uploadqueue.config.UploadQueueProperties;
import com.eyelevel.uploadqueue.model.UploadItem;
import com.eyelevel.uploadqueue.model.UploadStatus;
import com.eyelevel.uploadqueue.repository.UploadItemStore;
import com.eyelevel.uploadqueue.service.inflight.CancellationToken;
import com.eyelevel.uploadqueue.service.inflight.InFlightOperationRegistry;
import com.eyelevel.uploadqueue.service.notification.NotificationBridge;
import com.eyelevel.uploadqueue.service.transfer.TransferOutcome;
import com.eyelevel.uploadqueue.service.transfer.UploadTransferExecutor;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;
import java.util.stream.Collectors;

/**
 * Moves pending uploads into the transfer stage while respecting the concurrency limit.
 * <p>
 * Only transferring uploads occupy a slot. A slot belongs to the {@link CancellationToken} of one transfer
 * attempt, not to the upload id, so a retried upload never shares a slot with its previous attempt.
 * Slots are claimed under {@link #admissionLock} together with the {@code PENDING -> ACTIVE} transition,
 * and released there together with store removals (see {@link #evict}), so overlapping triggers can never
 * admit more than {@code maxConcurrent} uploads. The transfers themselves are started after the lock is
 * released.
 * <p>
 * Admission is event driven (enqueue, slot release, retry, cancel). A periodic sweep re-runs it as a
 * safety net for triggers that found the queue momentarily full.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class UploadAdmissionScheduler {

    private final UploadItemStore uploadItemStore;
    private final UploadTransferExecutor transferExecutor;
    private final UploadStatusPoller statusPoller;
    private final InFlightOperationRegistry inFlightOperations;
    private final NotificationBridge notificationBridge;
    private final UploadQueueProperties properties;

    private final ReentrantLock admissionLock = new ReentrantLock();
    private final Set<CancellationToken> activeSlots = new LinkedHashSet<>();

    /**
     * Admits pending uploads in queue order until every slot is taken.
     *
     * @return the number of uploads admitted by this call
     */
    public int admitPending() {
        final List<Admission> admitted = new ArrayList<>();
        admissionLock.lock();
        try {
            final int limit = properties.getMaxConcurrent();
            if (activeSlots.size() >= limit) {
                return 0;
            }
            for (final UploadItem candidate : uploadItemStore.findByStatus(UploadStatus.PENDING)) {
                if (activeSlots.size() >= limit) {
                    break;
                }
                uploadItemStore.compareAndUpdate(candidate.getId(), UploadStatus.PENDING, UploadItem::toActive)
                        .ifPresent(active -> {
                            final CancellationToken token = inFlightOperations.open(active.getId());
                            activeSlots.add(token);
                            admitted.add(new Admission(active, token));
                        });
            }
            if (!admitted.isEmpty()) {
                log.info("Admitted {} upload(s); {} of {} slots in use.", admitted.size(), activeSlots.size(), limit);
            }
        } finally {
            admissionLock.unlock();
        }

        admitted.forEach(this::dispatch);
        return admitted.size();
    }

    @Scheduled(fixedDelayString = "${app.upload-queue.admission-sweep-interval:PT10S}")
    public void sweep() {
        try {
            final int admitted = admitPending();
            if (admitted > 0) {
                log.info("Admission sweep picked up {} pending upload(s).", admitted);
            }
        } catch (final RuntimeException e) {
            log.error("An unexpected error occurred during the admission sweep.", e);
        }
    }

    /**
     * Removes records from the queue and aborts whatever was driving them, as one step with respect to
     * admission. {@code removal} runs under the admission lock, so an upload enqueued concurrently is
     * either among the removed records or admitted afterwards into a slot that is really free.
     *
     * @param removal store removal returning the records it took out
     * @return what was removed, and how many slots and in-flight operations that freed
     */
    public Eviction evict(final Supplier<List<UploadItem>> removal) {
        admissionLock.lock();
        try {
            final List<UploadItem> removed = removal.get();
            final Set<String> removedIds = removed.stream().map(UploadItem::getId).collect(Collectors.toSet());
            final int slotsBefore = activeSlots.size();
            activeSlots.removeIf(token -> removedIds.contains(token.getUploadId()));
            int cancelled = 0;
            for (final String uploadId : removedIds) {
                if (inFlightOperations.cancel(uploadId)) {
                    cancelled++;
                }
            }
            return new Eviction(removed, slotsBefore - activeSlots.size(), cancelled);
        } finally {
            admissionLock.unlock();
        }
    }

    private void releaseSlot(final CancellationToken token) {
        admissionLock.lock();
        try {
            activeSlots.remove(token);
        } finally {
            admissionLock.unlock();
        }
    }

    public int getActiveCount() {
        admissionLock.lock();
        try {
            return activeSlots.size();
        } finally {
            admissionLock.unlock();
        }
    }

    private void dispatch(final Admission admission) {
        final UploadItem item = admission.item();
        final CancellationToken token = admission.token();
        transferExecutor.execute(item)
                .doOnSubscribe(subscription -> token.bind(subscription::cancel))
                .subscribe(outcome -> onTransferFinished(outcome, token),
                        error -> onTransferCrashed(item.getId(), token, error));
    }

    private void onTransferFinished(final TransferOutcome outcome, final CancellationToken token) {
        releaseSlot(token);
        switch (outcome.kind()) {
            case ACCEPTED -> {
                if (token.isCancelled()) {
                    log.debug("Upload {} was cancelled during transfer, ignoring its acceptance.", outcome.uploadId());
                } else {
                    statusPoller.start(outcome.item(), token);
                }
            }
            case FAILED -> {
                // The failure was recorded while the upload was still queued, so it is reported even if a
                // retry has already superseded this attempt.
                inFlightOperations.close(token);
                log.info("Upload {} failed during transfer: {}", outcome.uploadId(), outcome.item().getError());
                notificationBridge.failed(outcome.item());
            }
            case ABANDONED -> inFlightOperations.close(token);
        }
        admitPending();
    }

    private void onTransferCrashed(final String uploadId, final CancellationToken token, final Throwable error) {
        log.error("Transfer pipeline of upload {} terminated unexpectedly.", uploadId, error);
        inFlightOperations.close(token);
        releaseSlot(token);
        if (!token.isCancelled()) {
            uploadItemStore.compareAndUpdate(uploadId, UploadStatus.ACTIVE, item -> item.toFailed(error.getMessage()))
                    .ifPresent(notificationBridge::failed);
        }
        admitPending();
    }

    /**
     * Result of {@link #evict}.
     *
     * @param removed        The records taken out of the queue, in queue order.
     * @param releasedSlots  Transfer slots those records held.
     * @param cancelledOperations In-flight transfers and poll timers that were aborted.
     */
    public record Eviction(List<UploadItem> removed, int releasedSlots, int cancelledOperations) {
    }

    private record Admission(UploadItem item, CancellationToken token) {
    }
}
