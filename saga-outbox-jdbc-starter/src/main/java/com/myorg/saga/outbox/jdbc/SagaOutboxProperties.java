package com.myorg.saga.outbox.jdbc;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

@Data
@ConfigurationProperties(prefix = "saga.outbox")
public class SagaOutboxProperties {
    // Enable the outbox writer (insert rows).
    private boolean enabled = false;
    private String table = "saga_outbox";
    private Relay relay = new Relay();
    private Metrics metrics = new Metrics();

    @Data
    public static class Relay {
        // Enable the relay poller (publish NEW/RETRY rows through the SagaPublisher).
        private boolean enabled = false;
        // If false the scheduled loop won't run; runOnce() can still be called manually (tests).
        private boolean schedulingEnabled = true;
        private Duration pollInterval = Duration.ofSeconds(1);
        private Duration initialDelay = Duration.ofSeconds(1);
        private int batchSize = 50;
        private Duration lease = Duration.ofSeconds(10);
        private Duration backoffBase = Duration.ofSeconds(1);
        private Duration backoffMax = Duration.ofSeconds(60);
        // attempts before a row is parked as FAILED
        private int maxRetries = 10;
        private Duration sendTimeout = Duration.ofSeconds(10);
        private ClaimStrategy claimStrategy = ClaimStrategy.UPDATE_CLAIM;
    }

    public enum ClaimStrategy {
        // single UPDATE ... WHERE id IN (subselect); works on MySQL and H2
        UPDATE_CLAIM,
        // SELECT ... FOR UPDATE SKIP LOCKED then UPDATE; MySQL 8+ only
        SKIP_LOCKED
    }

    @Data
    public static class Metrics {
        private boolean enabled = true;
    }
}
