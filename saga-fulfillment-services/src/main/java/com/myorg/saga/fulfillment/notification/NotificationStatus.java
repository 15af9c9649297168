package com.myorg.saga.fulfillment.notification;

public enum NotificationStatus {
    PENDING,
    SENT,
    FAILED
}
