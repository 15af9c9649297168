package com.myorg.saga.fulfillment.notification;

import lombok.RequiredArgsConstructor;

// exposed as bean "notificationSchedule" for the @Scheduled SpEL on NotificationScheduler
@RequiredArgsConstructor
public class NotificationScheduleValues {
    private final NotificationProperties props;

    public long getPollIntervalMs() {
        return props.getDispatcher().getPollInterval().toMillis();
    }

    public long getInitialDelayMs() {
        return props.getDispatcher().getInitialDelay().toMillis();
    }
}
