package com.myorg.saga.fulfillment.notification;

public enum NotificationChannel {
    EMAIL,
    SMS,
    IN_APP
}
