package com.myorg.saga.fulfillment.notification;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.time.ZoneId;

@Data
@ConfigurationProperties(prefix = "saga.notification")
public class NotificationProperties {

    /** Zone quiet hours and the daily cap are evaluated in. */
    private String zone = "UTC";

    /** Failed sends before a notification stops being retried. */
    private int maxRetries = 3;

    /** Also create an SMS for confirmed/cancelled orders when the order carries a phone number. */
    private boolean smsOnTerminalEvents = false;

    /** Deferral under hard do-not-disturb, where there is no window end to wait for. */
    private Duration deferFallback = Duration.ofMinutes(15);

    private Dispatcher dispatcher = new Dispatcher();

    public ZoneId zoneId() {
        return ZoneId.of(zone);
    }

    @Data
    public static class Dispatcher {
        private boolean enabled = true;
        private Duration pollInterval = Duration.ofSeconds(10);
        private Duration initialDelay = Duration.ofSeconds(5);
        private int batchSize = 10;
    }
}
