package com.myorg.saga.contracts.core.envelope;

import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.experimental.UtilityClass;

import java.util.UUID;

@UtilityClass
public class EnvelopeBuilder {

    public static EventEnvelope wrap(ObjectMapper mapper,
                                     String eventType,
                                     int version,
                                     String aggregateId,
                                     String correlationId,
                                     String causationId,
                                     String producer,
                                     Object payloadObj) {
        return EventEnvelope.builder()
                .eventId(UUID.randomUUID().toString())
                .eventType(eventType)
                .version(version)
                .aggregateId(aggregateId)
                .correlationId(correlationId)
                .causationId(causationId)
                .occurredAtMs(System.currentTimeMillis())
                .producer(producer)
                .payload(mapper.valueToTree(payloadObj))
                .build();
    }

    /**
     * Build the next event of a saga from the event that caused it.
     * The correlation id is copied as-is and the causation id points at the parent event.
     */
    public static EventEnvelope derive(ObjectMapper mapper,
                                       EventEnvelope parent,
                                       String eventType,
                                       String producer,
                                       Object payloadObj) {
        if (parent == null) throw new IllegalArgumentException("parent envelope must not be null");
        return wrap(mapper,
                eventType,
                1,
                parent.getAggregateId(),
                parent.getCorrelationId(),
                parent.getEventId(),
                producer,
                payloadObj);
    }
}
