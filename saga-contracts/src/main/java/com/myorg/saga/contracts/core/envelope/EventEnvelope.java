package com.myorg.saga.contracts.core.envelope;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.*;

@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class EventEnvelope {
    private String eventId; // UUID
    private String eventType;  // routing key, e.g. "order.placed"
    private int version;  // 1

    private String aggregateId; // orderId for the fulfillment saga
    private String correlationId;   // join key, never rewritten downstream
    private String causationId;  // eventId of the parent event

    private long occurredAtMs; // epoch millis
    private String producer; // service name

    private JsonNode payload;
    private ErrorInfo error; // optional
}
