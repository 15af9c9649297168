package com.myorg.saga.fulfillment.notification;

import lombok.RequiredArgsConstructor;
import org.springframework.scheduling.annotation.Scheduled;

/** Fixed-delay loop over {@link NotificationDispatcher}; registered when the dispatcher is enabled. */
@RequiredArgsConstructor
public class NotificationScheduler {

    private final NotificationDispatcher dispatcher;
    private final NotificationProperties props;

    @Scheduled(
            initialDelayString = "#{@notificationSchedule.initialDelayMs}",
            fixedDelayString = "#{@notificationSchedule.pollIntervalMs}"
    )
    public void dispatchDue() {
        dispatcher.processBatch(props.getDispatcher().getBatchSize(), 0);
    }
}
