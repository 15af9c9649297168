package com.myorg.saga.kafka.topology;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Exchanges and queues this process needs.
 *
 * <pre>
 * saga.topology:
 *   exchanges:
 *     - name: fulfillment.order
 *       partitions: 6
 *   queues:
 *     - name: orchestrator.order-placed
 *       exchange: fulfillment.order
 *       routing-keys: [order.placed]
 * </pre>
 */
@Data
@ConfigurationProperties(prefix = "saga.topology")
public class TopologyProperties {
    // declare missing topics at startup (off when topics are managed outside the app)
    private boolean declareOnStartup = true;
    private Duration adminTimeout = Duration.ofSeconds(30);
    private List<Exchange> exchanges = new ArrayList<>();
    private List<Queue> queues = new ArrayList<>();

    @Data
    public static class Exchange {
        private String name;
        private int partitions = 3;
        private short replicas = 1;
    }

    @Data
    public static class Queue {
        // also the consumer group id
        private String name;
        private String exchange;
        private List<String> routingKeys = new ArrayList<>();
        private int concurrency = 1;

        public boolean accepts(String routingKey) {
            return routingKey != null && routingKeys.contains(routingKey);
        }
    }

    public Optional<Exchange> exchange(String name) {
        return exchanges.stream().filter(e -> e.getName().equals(name)).findFirst();
    }

    /** Fails on a topology that cannot be declared. */
    public void validate() {
        Set<String> exchangeNames = new HashSet<>();
        for (Exchange e : exchanges) {
            if (e.getName() == null || e.getName().isBlank()) {
                throw new IllegalStateException("saga.topology.exchanges[].name must not be blank");
            }
            if (!exchangeNames.add(e.getName())) {
                throw new IllegalStateException("Exchange declared twice: " + e.getName());
            }
            if (e.getPartitions() < 1 || e.getReplicas() < 1) {
                throw new IllegalStateException("Exchange " + e.getName() + " needs partitions >= 1 and replicas >= 1");
            }
        }

        Set<String> queueNames = new HashSet<>();
        for (Queue q : queues) {
            if (q.getName() == null || q.getName().isBlank()) {
                throw new IllegalStateException("saga.topology.queues[].name must not be blank");
            }
            if (!queueNames.add(q.getName())) {
                throw new IllegalStateException("Queue declared twice: " + q.getName());
            }
            if (!exchangeNames.contains(q.getExchange())) {
                throw new IllegalStateException("Queue " + q.getName() + " is bound to undeclared exchange " + q.getExchange());
            }
            if (q.getRoutingKeys().isEmpty()) {
                throw new IllegalStateException("Queue " + q.getName() + " has no routing keys");
            }
            if (q.getConcurrency() < 1) {
                throw new IllegalStateException("Queue " + q.getName() + " needs concurrency >= 1");
            }
        }
    }
}
