package com.myorg.saga.kafka;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

@Data
@ConfigurationProperties(prefix = "saga.kafka")
public class SagaKafkaProperties {
    private String bootstrapServers = "localhost:9092";
    private final Producer producer = new Producer();
    private final Consumer consumer = new Consumer();
    private final Dlq dlq = new Dlq();

    @Data
    public static class Producer {
        private String acks = "all";
        private boolean idempotence = true;
        private int retries = 10;
        private int maxInFlight = 5;
        private String compression = "snappy";
        private int lingerMs = 5;
        private int batchSize = 65536;
    }

    @Data
    public static class Consumer {
        /**
         * Kafka consumer auto.offset.reset (earliest/latest/none).
         */
        private String autoOffsetReset = "earliest";
        private int maxPollRecords = 100;
        private final Retry retry = new Retry();
    }

    @Data
    public static class Retry {
        // redeliveries after the first failed attempt
        private int attempts = 3;
        private Duration backoff = Duration.ofSeconds(1);
    }

    @Data
    public static class Dlq {
        private boolean enabled = true;
        private String suffix = ".DLQ";
    }
}
