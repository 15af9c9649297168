package com.myorg.saga.kafka;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.core.NestedExceptionUtils;
import org.springframework.kafka.listener.RetryListener;

/**
 * Logs and counts redeliveries and dead-lettering of one queue.
 * Base meters are pre-registered at startup; this only increments tagged ones.
 */
@Slf4j
class RetryDlqMetricsListener implements RetryListener {

    private final String service;
    private final String queue;
    private final ObjectProvider<MeterRegistry> registryProvider;

    RetryDlqMetricsListener(String service, String queue, ObjectProvider<MeterRegistry> registryProvider) {
        this.service = service;
        this.queue = queue;
        this.registryProvider = registryProvider;
    }

    @Override
    public void failedDelivery(ConsumerRecord<?, ?> record, Exception ex, int deliveryAttempt) {
        log.warn("Redelivering queue={} topic={} partition={} offset={} attempt={} error={}",
                queue, record.topic(), record.partition(), record.offset(), deliveryAttempt, ex.toString());
        inc("saga.kafka.retry", ex);
    }

    @Override
    public void recovered(ConsumerRecord<?, ?> record, Exception ex) {
        log.error("Dead-lettered queue={} topic={} partition={} offset={} error={}",
                queue, record.topic(), record.partition(), record.offset(), ex.toString());
        inc("saga.kafka.dlq", ex);
    }

    @Override
    public void recoveryFailed(ConsumerRecord<?, ?> record, Exception original, Exception failure) {
        log.error("Dead-lettering FAILED queue={} topic={} partition={} offset={} originalError={}",
                queue, record.topic(), record.partition(), record.offset(), original.toString(), failure);
        inc("saga.kafka.recovery_failed", failure);
    }

    private void inc(String metric, Exception ex) {
        MeterRegistry registry = registryProvider.getIfAvailable();
        if (registry == null) return;

        Throwable root = NestedExceptionUtils.getMostSpecificCause(ex);
        Counter.builder(metric)
                .tag("service", service)
                .tag("queue", queue)
                .tag("exception", root.getClass().getSimpleName())
                .register(registry)
                .increment();
    }
}
