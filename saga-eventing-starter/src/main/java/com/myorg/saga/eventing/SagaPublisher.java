package com.myorg.saga.eventing;

import com.myorg.saga.contracts.core.envelope.EventEnvelope;

import java.util.concurrent.CompletableFuture;

/**
 * Publishes saga events to an exchange. The record key is always the correlation id,
 * so every event of one saga instance lands on the same partition, in order.
 *
 * <p>A failed future carries {@link com.myorg.saga.contracts.core.exception.SagaRetryableException}.
 */
public interface SagaPublisher {

    /** Wrap {@code payload} into a new envelope whose event type is {@code routingKey}. */
    CompletableFuture<?> publish(String exchange, String routingKey, String correlationId, Object payload);

    /** Send an envelope built elsewhere (outbox relay). */
    CompletableFuture<?> publish(String exchange, EventEnvelope envelope);
}
