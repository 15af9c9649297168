package com.myorg.saga.contracts.core.conventions;

/**
 * Kafka record headers mirroring the envelope's identity fields, so brokers tooling and the
 * dead-letter path can read them without deserializing the payload.
 */
public final class CoreHeaders {
    private CoreHeaders() {}

    public static final String EVENT_ID = "saga-event-id";
    public static final String EVENT_TYPE = "saga-event-type";
    public static final String CORRELATION_ID = "saga-correlation-id";
    public static final String CAUSATION_ID = "saga-causation-id";
    public static final String PRODUCER = "saga-producer";
}
