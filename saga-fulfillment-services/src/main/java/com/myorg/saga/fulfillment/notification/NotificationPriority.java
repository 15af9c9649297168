package com.myorg.saga.fulfillment.notification;

public enum NotificationPriority {
    LOW,
    NORMAL,
    HIGH
}
