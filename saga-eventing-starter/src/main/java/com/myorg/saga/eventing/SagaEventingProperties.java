package com.myorg.saga.eventing;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

@Data
@ConfigurationProperties(prefix = "saga.eventing")
public class SagaEventingProperties {
    // empty -> spring.application.name
    private String producerName;
    // unknown eventType on a bound queue: true = log and skip, false = dead-letter
    private boolean ignoreUnknownEventType = false;

    private Consumer consumer = new Consumer();
    private Idempotency idempotency = new Idempotency();

    @Data
    public static class Consumer {
        // one listener container per saga.topology.queues entry
        private boolean enabled = true;
        // in-flight records are abandoned on stop; uncommitted offsets are redelivered
        private Duration shutdownTimeout = Duration.ZERO;
    }

    @Data
    public static class Idempotency {
        private boolean enabled = false;
        private Duration ttl = Duration.ofHours(24);

        /**
         * How long a PROCESSING lease lives. Shorter than {@link #ttl}: when the app dies
         * mid-handler the lease expires and the redelivered message is processed again.
         */
        private Duration processingTtl = Duration.ofMinutes(5);
        private int maxEntries = 500_000;
        private Duration cleanupInterval = Duration.ofMinutes(5);

        // auto: redis if a RedisConnectionFactory exists, else jdbc if a JdbcTemplate exists, else memory
        // redis | jdbc | memory: exactly that store
        private String store = "auto";
        private String keyPrefix = "saga:idemp:";
        // jdbc store only; see db/eventing
        private String table = "processed_event";
        // fail startup when auto falls back to memory
        private boolean requireShared = false;

        private Redis redis = new Redis();

        @Data
        public static class Redis {
            private boolean enabled = true;
            private String keyPrefix = "saga:idemp:";
        }
    }
}
