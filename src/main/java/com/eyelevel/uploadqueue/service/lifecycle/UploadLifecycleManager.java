package com.eyelevel.uploadqueue.service.lifecycle;

import com.eyelevel.uploadqueue.exception.InvalidUploadOperationException;
import com.eyelevel.uploadqueue.exception.UploadNotFoundException;
import com.eyelevel.uploadqueue.model.UploadItem;
import com.eyelevel.uploadqueue.model.UploadStatus;
import com.eyelevel.uploadqueue.repository.UploadItemStore;
import com.eyelevel.uploadqueue.scheduler.UploadAdmissionScheduler;
import com.eyelevel.uploadqueue.scheduler.UploadAdmissionScheduler.Eviction;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Caller-driven transitions: retry, cancel and the bulk clear operations.
 * <p>
 * Removal from the store happens first and is what makes a cancel take effect. It runs through
 * {@link UploadAdmissionScheduler#evict} so that freeing slots and aborting operations only touches the
 * records actually removed. Every later write from a transfer or poll in flight is conditional on the
 * record's status, so it finds nothing to update and no notification is sent.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class UploadLifecycleManager {

    private final UploadItemStore uploadItemStore;
    private final UploadAdmissionScheduler admissionScheduler;

    /**
     * Puts a failed upload back in the queue.
     *
     * @return the record after the reset
     * @throws UploadNotFoundException         if the id is unknown
     * @throws InvalidUploadOperationException if the upload has not failed
     */
    public UploadItem retry(final String uploadId) {
        final UploadItem current = findOrThrow(uploadId);
        final UploadItem reset = uploadItemStore
                .compareAndUpdate(uploadId, UploadStatus.FAILED, UploadItem::toPendingForRetry)
                .orElseThrow(() -> rejected("retry", uploadId, current));
        log.info("Upload {} reset for retry (was: {}).", uploadId, current.getError());
        admissionScheduler.admitPending();
        return reset;
    }

    /**
     * Aborts and removes an upload that has not reached a terminal state.
     *
     * @return the removed record
     * @throws UploadNotFoundException         if the id is unknown
     * @throws InvalidUploadOperationException if the upload already completed or failed
     */
    public UploadItem cancel(final String uploadId) {
        final Eviction eviction = admissionScheduler.evict(() -> uploadItemStore.removeIf(
                item -> item.getId().equals(uploadId) && !item.getStatus().isTerminal()));
        if (eviction.removed().isEmpty()) {
            throw rejected("cancel", uploadId, findOrThrow(uploadId));
        }
        final UploadItem cancelled = eviction.removed().get(0);
        log.info("Cancelled upload {} while {}{}.", uploadId, cancelled.getStatus(),
                eviction.releasedSlots() > 0 ? ", slot released" : "");
        admissionScheduler.admitPending();
        return cancelled;
    }

    /**
     * @return the removed records, in queue order
     */
    public List<UploadItem> clearCompleted() {
        final List<UploadItem> removed = uploadItemStore.removeIf(item -> item.getStatus() == UploadStatus.COMPLETED);
        log.info("Cleared {} completed upload(s).", removed.size());
        return removed;
    }

    /**
     * Cancels everything in flight and empties the queue.
     *
     * @return the removed records, in queue order
     */
    public List<UploadItem> clearAll() {
        final Eviction eviction = admissionScheduler.evict(uploadItemStore::removeAll);
        log.info("Cleared all {} upload(s); cancelled {} in-flight operation(s), released {} slot(s).",
                eviction.removed().size(), eviction.cancelledOperations(), eviction.releasedSlots());
        admissionScheduler.admitPending();
        return eviction.removed();
    }

    private UploadItem findOrThrow(final String uploadId) {
        return uploadItemStore.findById(uploadId).orElseThrow(() -> new UploadNotFoundException(uploadId));
    }

    private InvalidUploadOperationException rejected(final String operation, final String uploadId,
                                                     final UploadItem current) {
        log.warn("Rejected {} of upload {} in status {}.", operation, uploadId, current.getStatus());
        return new InvalidUploadOperationException(operation, uploadId, current.getStatus());
    }
}
