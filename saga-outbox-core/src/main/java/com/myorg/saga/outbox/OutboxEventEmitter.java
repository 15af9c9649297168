package com.myorg.saga.outbox;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.myorg.saga.contracts.core.envelope.EnvelopeBuilder;
import com.myorg.saga.contracts.core.envelope.EventEnvelope;
import lombok.RequiredArgsConstructor;

/**
 * Builds envelopes and appends them to the outbox keyed by correlation id.
 * Must be called inside the transaction that changes the state the event describes.
 */
@RequiredArgsConstructor
public class OutboxEventEmitter {

    private final ObjectMapper mapper;
    private final OutboxWriter writer;
    private final String producer;

    /** Start a new saga instance: correlation id and aggregate id are both {@code correlationId}. */
    public EventEnvelope emit(String exchange, String eventType, String correlationId, Object payload) {
        if (correlationId == null || correlationId.isBlank()) {
            throw new IllegalArgumentException("correlationId must not be blank");
        }
        EventEnvelope env = EnvelopeBuilder.wrap(mapper, eventType, 1,
                correlationId, correlationId, null, producer, payload);
        writer.append(env, exchange, correlationId);
        return env;
    }

    /** Emit the next event of the saga {@code parent} belongs to. */
    public EventEnvelope emitFollowing(EventEnvelope parent, String exchange, String eventType, Object payload) {
        EventEnvelope env = EnvelopeBuilder.derive(mapper, parent, eventType, producer, payload);
        writer.append(env, exchange, env.getCorrelationId());
        return env;
    }
}
