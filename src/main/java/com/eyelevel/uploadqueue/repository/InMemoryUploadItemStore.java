package com.eyelevel.uploadqueue.repository;

import com.eyelevel.uploadqueue.model.UploadItem;
import com.eyelevel.uploadqueue.model.UploadStatus;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Repository;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Predicate;
import java.util.function.UnaryOperator;

/**
 * {@link UploadItemStore} backed by a {@link LinkedHashMap} guarded by a single monitor.
 * Records are immutable, so snapshots are plain copies of the value list taken under the lock.
 * Queue state is intentionally not persisted across restarts.
 */
@Slf4j
@Repository
public class InMemoryUploadItemStore implements UploadItemStore {

    private final Map<String, UploadItem> items = new LinkedHashMap<>();

    @Override
    public synchronized String enqueue(final UploadItem item) {
        Objects.requireNonNull(item, "item must not be null");
        if (items.containsKey(item.getId())) {
            throw new IllegalStateException("Upload " + item.getId() + " is already queued.");
        }
        items.put(item.getId(), item);
        log.debug("Enqueued upload {} ({} records in queue).", item.getId(), items.size());
        return item.getId();
    }

    @Override
    public synchronized Optional<UploadItem> update(final String id, final UnaryOperator<UploadItem> mutation) {
        final UploadItem current = items.get(id);
        if (current == null) {
            log.trace("Ignoring update for unknown upload {}.", id);
            return Optional.empty();
        }
        return Optional.of(apply(current, mutation));
    }

    @Override
    public synchronized Optional<UploadItem> compareAndUpdate(final String id, final UploadStatus expected,
                                                              final UnaryOperator<UploadItem> mutation) {
        final UploadItem current = items.get(id);
        if (current == null || current.getStatus() != expected) {
            log.trace("Skipping update for upload {}: expected status {}, found {}.", id, expected,
                    current == null ? "none" : current.getStatus());
            return Optional.empty();
        }
        return Optional.of(apply(current, mutation));
    }

    @Override
    public synchronized Optional<UploadItem> remove(final String id) {
        return Optional.ofNullable(items.remove(id));
    }

    @Override
    public synchronized List<UploadItem> removeIf(final Predicate<UploadItem> filter) {
        final List<UploadItem> removed = new ArrayList<>();
        final Iterator<UploadItem> iterator = items.values().iterator();
        while (iterator.hasNext()) {
            final UploadItem item = iterator.next();
            if (filter.test(item)) {
                removed.add(item);
                iterator.remove();
            }
        }
        return removed;
    }

    @Override
    public synchronized List<UploadItem> removeAll() {
        final List<UploadItem> removed = new ArrayList<>(items.values());
        items.clear();
        return removed;
    }

    @Override
    public synchronized Optional<UploadItem> findById(final String id) {
        return Optional.ofNullable(items.get(id));
    }

    @Override
    public synchronized List<UploadItem> findByStatus(final UploadStatus status) {
        return items.values().stream()
                .filter(item -> item.getStatus() == status)
                .toList();
    }

    @Override
    public synchronized List<UploadItem> snapshot() {
        return List.copyOf(items.values());
    }

    @Override
    public synchronized int size() {
        return items.size();
    }

    private UploadItem apply(final UploadItem current, final UnaryOperator<UploadItem> mutation) {
        final UploadItem updated = Objects.requireNonNull(mutation.apply(current), "mutation must not return null");
        if (!current.getId().equals(updated.getId())) {
            throw new IllegalArgumentException("A mutation must not change the upload id.");
        }
        items.put(current.getId(), updated);
        return updated;
    }
}
