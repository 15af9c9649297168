package com.myorg.saga.kafka;

import lombok.extern.slf4j.Slf4j;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.apache.kafka.common.errors.RetriableException;
import org.springframework.context.SmartLifecycle;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.core.ProducerFactory;
import org.springframework.kafka.support.SendResult;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicLong;

/**
 * The process-wide producer connection. Every publish goes through {@link #send(ProducerRecord)}.
 *
 * <p>Started before any consumer and stopped after all of them. A send that fails with a
 * transient broker error resets the underlying producer, so the next send opens a fresh one.
 * The failed send itself is not replayed; the caller gets the failed future.
 */
@Slf4j
public class KafkaBrokerConnection implements SmartLifecycle {

    public static final int PHASE = Integer.MIN_VALUE + 200;

    private final ProducerFactory<String, Object> producerFactory;
    private final KafkaTemplate<String, Object> template;
    private final AtomicLong reconnects = new AtomicLong();
    private volatile boolean running;

    public KafkaBrokerConnection(ProducerFactory<String, Object> producerFactory, KafkaTemplate<String, Object> template) {
        this.producerFactory = producerFactory;
        this.template = template;
    }

    public CompletableFuture<SendResult<String, Object>> send(ProducerRecord<String, Object> record) {
        if (!running) {
            throw new IllegalStateException("Kafka broker connection is not running; cannot send to " + record.topic());
        }

        CompletableFuture<SendResult<String, Object>> future;
        try {
            future = template.send(record);
        } catch (RuntimeException e) {
            if (isTransient(e)) reconnect(e);
            throw e;
        }

        return future.whenComplete((res, ex) -> {
            if (ex != null && isTransient(ex)) {
                reconnect(ex);
            }
        });
    }

    /** Drop the current producer; the next send creates a new one. */
    public void reconnect(Throwable cause) {
        long n = reconnects.incrementAndGet();
        log.warn("Resetting Kafka producer after transient failure (reconnect #{}): {}", n, cause.toString());
        producerFactory.reset();
    }

    public long reconnectCount() {
        return reconnects.get();
    }

    static boolean isTransient(Throwable ex) {
        Throwable t = ex;
        while (t != null) {
            if (t instanceof RetriableException) return true;
            if (t.getCause() == t) break;
            t = t.getCause();
        }
        return false;
    }

    @Override
    public void start() {
        running = true;
        log.info("Kafka broker connection started");
    }

    @Override
    public void stop() {
        running = false;
        producerFactory.reset();
        log.info("Kafka broker connection stopped");
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    @Override
    public int getPhase() {
        return PHASE;
    }
}
