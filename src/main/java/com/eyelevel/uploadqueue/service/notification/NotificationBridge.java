package com.eyelevel.uploadqueue.service.notification;

import com.eyelevel.uploadqueue.common.time.SchedulerClock;
import com.eyelevel.uploadqueue.model.UploadItem;
import com.eyelevel.uploadqueue.service.notification.impl.LoggingNotifier;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Sinks;
import reactor.core.scheduler.Scheduler;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Turns terminal upload transitions into exactly one {@link Notifier} call, the registered
 * {@link UploadQueueListener} callbacks and one {@link UploadEvent} on the event stream.
 * <p>
 * Failures of a notifier or listener are logged and contained: they never reach the component that
 * drove the transition.
 * <p>
 * The host application overrides the notifier by declaring a {@link Notifier} bean (marked
 * {@code @Primary} if it declares several). Without one, notifications go to a {@link LoggingNotifier}.
 */
@Slf4j
@Component
public class NotificationBridge {

    static final String SUCCESS_MESSAGE = "Resource uploaded successfully";
    static final String FAILURE_MESSAGE_PREFIX = "Upload failed: ";

    private final Notifier notifier;
    private final Scheduler scheduler;
    private final List<UploadQueueListener> listeners;
    private final Sinks.Many<UploadEvent> events = Sinks.many().multicast().directBestEffort();

    @Autowired
    public NotificationBridge(final ObjectProvider<Notifier> notifiers,
                              @Qualifier("uploadQueueScheduler") final Scheduler scheduler,
                              final ObjectProvider<UploadQueueListener> listeners) {
        this(resolveNotifier(notifiers), scheduler, listeners.orderedStream().toList());
    }

    public NotificationBridge(final Notifier notifier,
                              final Scheduler scheduler,
                              final List<UploadQueueListener> listeners) {
        this.notifier = notifier;
        this.scheduler = scheduler;
        this.listeners = new CopyOnWriteArrayList<>(listeners);
    }

    static Notifier resolveNotifier(final ObjectProvider<Notifier> notifiers) {
        return notifiers.getIfAvailable(() -> {
            log.info("No Notifier bean supplied, upload notifications will be written to the log.");
            return new LoggingNotifier();
        });
    }

    public void addListener(final UploadQueueListener listener) {
        listeners.add(listener);
    }

    public void removeListener(final UploadQueueListener listener) {
        listeners.remove(listener);
    }

    /**
     * Hot stream of terminal transitions. Subscribers only see events emitted after they subscribed.
     */
    public Flux<UploadEvent> events() {
        return events.asFlux();
    }

    public void completed(final UploadItem item) {
        log.info("Upload {} completed (resource {}).", item.getId(), item.getExternalId());
        safely("notifier", () -> notifier.notify(NotificationKind.SUCCESS, SUCCESS_MESSAGE));
        for (UploadQueueListener listener : listeners) {
            safely("completion listener", () -> listener.onCompleted(item));
        }
        publish(UploadEvent.completed(item, SchedulerClock.now(scheduler)));
    }

    public void failed(final UploadItem item) {
        final String error = item.getError();
        log.info("Upload {} failed: {}", item.getId(), error);
        safely("notifier", () -> notifier.notify(NotificationKind.ERROR, FAILURE_MESSAGE_PREFIX + error));
        for (UploadQueueListener listener : listeners) {
            safely("failure listener", () -> listener.onFailed(item, error));
        }
        publish(UploadEvent.failed(item, error, SchedulerClock.now(scheduler)));
    }

    private synchronized void publish(final UploadEvent event) {
        final Sinks.EmitResult result = events.tryEmitNext(event);
        if (result.isFailure() && result != Sinks.EmitResult.FAIL_ZERO_SUBSCRIBER) {
            log.warn("Could not publish {} event for upload {}: {}", event.type(), event.item().getId(), result);
        }
    }

    private void safely(final String target, final Runnable call) {
        try {
            call.run();
        } catch (RuntimeException e) {
            log.error("Upload {} threw while handling a terminal upload transition.", target, e);
        }
    }
}
