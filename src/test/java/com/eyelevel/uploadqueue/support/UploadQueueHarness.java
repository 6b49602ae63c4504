package com.eyelevel.uploadqueue.support;

import com.eyelevel.uploadqueue.config.UploadQueueProperties;
import com.eyelevel.uploadqueue.model.UploadItem;
import com.eyelevel.uploadqueue.model.UploadStatus;
import com.eyelevel.uploadqueue.repository.InMemoryUploadItemStore;
import com.eyelevel.uploadqueue.scheduler.UploadAdmissionScheduler;
import com.eyelevel.uploadqueue.scheduler.UploadStatusPoller;
import com.eyelevel.uploadqueue.service.UploadQueueService;
import com.eyelevel.uploadqueue.service.inflight.InFlightOperationRegistry;
import com.eyelevel.uploadqueue.service.lifecycle.UploadLifecycleManager;
import com.eyelevel.uploadqueue.service.notification.NotificationBridge;
import com.eyelevel.uploadqueue.service.transfer.UploadTransferExecutor;
import reactor.test.scheduler.VirtualTimeScheduler;

import java.time.Duration;
import java.util.List;

/**
 * The full upload queue wired by hand around a fake ingestion service and a virtual clock.
 */
public class UploadQueueHarness {

    public final VirtualTimeScheduler scheduler = VirtualTimeScheduler.create();
    public final FakeIngestionClient ingestion = new FakeIngestionClient();
    public final RecordingNotifier notifier = new RecordingNotifier();
    public final InMemoryUploadItemStore store;
    public final InFlightOperationRegistry registry = new InFlightOperationRegistry();
    public final UploadQueueProperties properties = new UploadQueueProperties();
    public final NotificationBridge bridge;
    public final UploadStatusPoller poller;
    public final UploadAdmissionScheduler admission;
    public final UploadLifecycleManager lifecycle;
    public final UploadQueueService service;

    public UploadQueueHarness() {
        this(3, Duration.ofSeconds(5), Duration.ofMinutes(5));
    }

    public UploadQueueHarness(final int maxConcurrent, final Duration pollInterval, final Duration pollTimeout) {
        this(maxConcurrent, pollInterval, pollTimeout, new InMemoryUploadItemStore());
    }

    /**
     * @param store store to wire in, typically a subclass that interleaves other calls into its operations
     */
    public UploadQueueHarness(final int maxConcurrent, final Duration pollInterval, final Duration pollTimeout,
                              final InMemoryUploadItemStore store) {
        this.store = store;
        properties.setMaxConcurrent(maxConcurrent);
        properties.setPollInterval(pollInterval);
        properties.setPollTimeout(pollTimeout);

        bridge = new NotificationBridge(notifier, scheduler, List.of());
        final UploadTransferExecutor executor = new UploadTransferExecutor(store, ingestion, scheduler);
        poller = new UploadStatusPoller(store, ingestion, bridge, registry, properties, scheduler);
        admission = new UploadAdmissionScheduler(store, executor, poller, registry, bridge, properties);
        lifecycle = new UploadLifecycleManager(store, admission);
        service = new UploadQueueService(store, admission, lifecycle, bridge, scheduler);
    }

    public UploadItem item(final String uploadId) {
        return store.findById(uploadId).orElseThrow();
    }

    public long count(final UploadStatus status) {
        return store.snapshot().stream().filter(item -> item.getStatus() == status).count();
    }

    public void advance(final Duration duration) {
        scheduler.advanceTimeBy(duration);
    }
}
