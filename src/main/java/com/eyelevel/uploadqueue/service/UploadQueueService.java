package com.eyelevel.uploadqueue.service;

import com.eyelevel.uploadqueue.common.time.SchedulerClock;
import com.eyelevel.uploadqueue.exception.UploadNotFoundException;
import com.eyelevel.uploadqueue.model.UploadItem;
import com.eyelevel.uploadqueue.model.UploadPayload;
import com.eyelevel.uploadqueue.model.UploadStatus;
import com.eyelevel.uploadqueue.repository.UploadItemStore;
import com.eyelevel.uploadqueue.scheduler.UploadAdmissionScheduler;
import com.eyelevel.uploadqueue.service.lifecycle.UploadLifecycleManager;
import com.eyelevel.uploadqueue.service.notification.NotificationBridge;
import com.eyelevel.uploadqueue.service.notification.UploadEvent;
import com.eyelevel.uploadqueue.service.notification.UploadQueueListener;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.io.Resource;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.scheduler.Scheduler;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

/**
 * Entry point of the upload queue for the host application.
 * <p>
 * Uploads are accepted immediately and run in the background: at most {@code maxConcurrent} transfer at
 * once, then each one is followed until the ingestion service finishes processing it. Callers observe
 * progress through {@link #snapshot()}, react to terminal transitions through {@link #events()} or an
 * {@link UploadQueueListener}, and steer individual uploads with {@link #retry(String)} and
 * {@link #cancel(String)}.
 */
@Slf4j
@Service
public class UploadQueueService {

    private static final String ID_PREFIX = "upload-";

    private final UploadItemStore uploadItemStore;
    private final UploadAdmissionScheduler admissionScheduler;
    private final UploadLifecycleManager lifecycleManager;
    private final NotificationBridge notificationBridge;
    private final Scheduler scheduler;

    public UploadQueueService(final UploadItemStore uploadItemStore,
                              final UploadAdmissionScheduler admissionScheduler,
                              final UploadLifecycleManager lifecycleManager,
                              final NotificationBridge notificationBridge,
                              @Qualifier("uploadQueueScheduler") final Scheduler scheduler) {
        this.uploadItemStore = uploadItemStore;
        this.admissionScheduler = admissionScheduler;
        this.lifecycleManager = lifecycleManager;
        this.notificationBridge = notificationBridge;
        this.scheduler = scheduler;
    }

    /**
     * Queues a payload for upload.
     *
     * @return the id of the new upload
     */
    public String addPayload(final UploadPayload payload) {
        Objects.requireNonNull(payload, "payload must not be null");
        final String uploadId = ID_PREFIX + UUID.randomUUID();
        uploadItemStore.enqueue(UploadItem.pending(uploadId, payload, SchedulerClock.now(scheduler)));
        log.info("Queued {} upload {} ({}).", payload.kind(), uploadId, payload.displayName());
        admissionScheduler.admitPending();
        return uploadId;
    }

    public String addFile(final String fileName, final Resource content) {
        return addPayload(UploadPayload.ofContent(fileName, content));
    }

    /**
     * Queues a remote resource the ingestion service downloads itself.
     *
     * @throws IllegalArgumentException if {@code url} is not an absolute http(s) URL
     */
    public String addReference(final String url) {
        return addPayload(UploadPayload.ofReference(url));
    }

    public UploadItem retry(final String uploadId) {
        return lifecycleManager.retry(uploadId);
    }

    public UploadItem cancel(final String uploadId) {
        return lifecycleManager.cancel(uploadId);
    }

    public List<UploadItem> clearCompleted() {
        return lifecycleManager.clearCompleted();
    }

    public List<UploadItem> clearAll() {
        return lifecycleManager.clearAll();
    }

    /**
     * @return every upload in queue order
     */
    public List<UploadItem> snapshot() {
        return uploadItemStore.snapshot();
    }

    public UploadItem findById(final String uploadId) {
        return uploadItemStore.findById(uploadId).orElseThrow(() -> new UploadNotFoundException(uploadId));
    }

    /**
     * @return the number of uploads currently holding a transfer slot
     */
    public int getActiveCount() {
        return admissionScheduler.getActiveCount();
    }

    public Map<UploadStatus, Long> countByStatus() {
        final Map<UploadStatus, Long> counts = new EnumMap<>(UploadStatus.class);
        for (final UploadStatus status : UploadStatus.values()) {
            counts.put(status, 0L);
        }
        snapshot().forEach(item -> counts.merge(item.getStatus(), 1L, Long::sum));
        return counts;
    }

    /**
     * Terminal transitions as they happen. Events emitted before subscription are not replayed.
     */
    public Flux<UploadEvent> events() {
        return notificationBridge.events();
    }

    public void addListener(final UploadQueueListener listener) {
        notificationBridge.addListener(listener);
    }

    public void removeListener(final UploadQueueListener listener) {
        notificationBridge.removeListener(listener);
    }
}
