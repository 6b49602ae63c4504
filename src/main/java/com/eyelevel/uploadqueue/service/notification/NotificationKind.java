package com.eyelevel.uploadqueue.service.notification;

public enum NotificationKind {
    SUCCESS,
    ERROR
}
