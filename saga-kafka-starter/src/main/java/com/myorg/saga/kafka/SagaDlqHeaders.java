package com.myorg.saga.kafka;

/**
 * Headers stamped on a dead-lettered record, next to the {@code kafka_dlt-*} headers spring-kafka
 * adds. The record key is the saga's correlation id and is repeated here for searching.
 */
public final class SagaDlqHeaders {
    private SagaDlqHeaders() {}

    public static final String REASON = "saga.dlq.reason";
    public static final String NON_RETRYABLE = "saga.dlq.non_retryable";
    public static final String ATTEMPTS = "saga.dlq.attempts";
    public static final String CORRELATION_ID = "saga.dlq.correlation_id";

    public static final String EXCEPTION_CLASS = "saga.dlq.exception_class";
    public static final String EXCEPTION_MESSAGE = "saga.dlq.exception_message";

    public static final String QUEUE = "saga.dlq.queue";
    public static final String SERVICE = "saga.dlq.service";
    public static final String TS_MS = "saga.dlq.ts_ms";
}
