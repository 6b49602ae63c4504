package com.eyelevel.uploadqueue.service.notification;

/**
 * Sink for human-readable messages about finished uploads (a toast, a chat message, a log line).
 * Hosts register their own bean to replace the logging default.
 */
public interface Notifier {

    void notify(NotificationKind kind, String message);
}
