package com.eyelevel.uploadqueue.repository;

import com.eyelevel.uploadqueue.model.UploadItem;
import com.eyelevel.uploadqueue.model.UploadStatus;

import java.util.List;
import java.util.Optional;
import java.util.function.Predicate;
import java.util.function.UnaryOperator;

/**
 * Ordered, thread-safe home of every queued upload. Insertion order is preserved and drives FIFO admission.
 * <p>
 * Mutations are atomic with respect to readers and never block on I/O. Updating or removing an id that is
 * no longer stored is a no-op, which keeps late callbacks harmless after a record was cancelled.
 */
public interface UploadItemStore {

    /**
     * Appends a record at the tail of the queue.
     *
     * @return the id of the stored record
     * @throws IllegalStateException if a record with the same id is already stored
     */
    String enqueue(UploadItem item);

    /**
     * Applies {@code mutation} to the stored record if it exists.
     *
     * @return the record after the mutation, or empty when the id is unknown
     */
    Optional<UploadItem> update(String id, UnaryOperator<UploadItem> mutation);

    /**
     * Applies {@code mutation} only while the stored record is in {@code expected} status.
     *
     * @return the record after the mutation, or empty when the id is unknown or the status did not match
     */
    Optional<UploadItem> compareAndUpdate(String id, UploadStatus expected, UnaryOperator<UploadItem> mutation);

    Optional<UploadItem> remove(String id);

    /**
     * Removes every record matching {@code filter}, in queue order.
     *
     * @return the removed records
     */
    List<UploadItem> removeIf(Predicate<UploadItem> filter);

    List<UploadItem> removeAll();

    Optional<UploadItem> findById(String id);

    /**
     * @return records in {@code status}, oldest first
     */
    List<UploadItem> findByStatus(UploadStatus status);

    /**
     * @return a consistent, ordered copy of every record
     */
    List<UploadItem> snapshot();

    int size();
}
