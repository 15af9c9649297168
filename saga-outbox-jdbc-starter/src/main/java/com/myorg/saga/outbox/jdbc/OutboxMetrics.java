package com.myorg.saga.outbox.jdbc;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;

import java.time.Clock;

/**
 * Relay counters plus two backlog gauges: {@code outbox.pending} (rows due now) and
 * {@code outbox.dead} (rows that gave up and wait for an operator).
 */
public class OutboxMetrics {

    private final Counter published;
    private final Counter retried;
    private final Counter failed;

    public OutboxMetrics(MeterRegistry registry, JdbcOutboxRepository repo, Clock clock) {
        this.published = Counter.builder("outbox.published").description("Outbox rows published").register(registry);
        this.retried = Counter.builder("outbox.retried").description("Publish attempts rescheduled").register(registry);
        this.failed = Counter.builder("outbox.failed").description("Rows marked FAILED").register(registry);

        Gauge.builder("outbox.pending", repo, r -> r.countPending(clock.instant())).register(registry);
        Gauge.builder("outbox.dead", repo, JdbcOutboxRepository::countFailed).register(registry);
    }

    void published() {
        published.increment();
    }

    void retried() {
        retried.increment();
    }

    void failed() {
        failed.increment();
    }
}
