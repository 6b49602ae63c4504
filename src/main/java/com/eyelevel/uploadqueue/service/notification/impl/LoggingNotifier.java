package com.eyelevel.uploadqueue.service.notification.impl;

import com.eyelevel.uploadqueue.service.notification.NotificationKind;
import com.eyelevel.uploadqueue.service.notification.Notifier;
import lombok.extern.slf4j.Slf4j;

/**
 * Default {@link Notifier} that writes notifications to the application log.
 */
@Slf4j
public class LoggingNotifier implements Notifier {

    @Override
    public void notify(NotificationKind kind, String message) {
        if (kind == NotificationKind.ERROR) {
            log.warn("[upload-notification] {}", message);
        } else {
            log.info("[upload-notification] {}", message);
        }
    }
}
