package com.myorg.saga.fulfillment.notification;

public enum NotificationType {
    ORDER_CONFIRMED,
    ORDER_CANCELLED,
    GENERAL
}
