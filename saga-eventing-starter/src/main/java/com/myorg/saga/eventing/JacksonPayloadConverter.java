package com.myorg.saga.eventing;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.myorg.saga.contracts.core.envelope.EventEnvelope;
import com.myorg.saga.contracts.core.exception.SagaNonRetryableException;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.springframework.kafka.support.KafkaNull;

import java.io.IOException;
import java.util.Map;

/**
 * Reads whatever the deserializer produced into an {@link EventEnvelope}. Unreadable values and
 * envelopes from a newer contract version are rejected as non-retryable: redelivery cannot fix them.
 */
public class JacksonPayloadConverter implements PayloadConverter {

    /** Highest envelope version this consumer understands. */
    public static final int SUPPORTED_VERSION = 1;

    static final String UNREADABLE = "UNREADABLE_ENVELOPE";
    static final String UNSUPPORTED_VERSION = "UNSUPPORTED_ENVELOPE_VERSION";

    private final ObjectMapper mapper;

    public JacksonPayloadConverter(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    @Override
    public EventEnvelope toEnvelope(Object value) {
        if (value == null || value == KafkaNull.INSTANCE) return null;
        if (value instanceof ConsumerRecord<?, ?> rec) return toEnvelope(rec.value());

        EventEnvelope env = read(value);
        if (env.getVersion() > SUPPORTED_VERSION) {
            throw new SagaNonRetryableException(UNSUPPORTED_VERSION, "Envelope " + env.getEventId()
                    + " has version " + env.getVersion() + ", this consumer reads up to " + SUPPORTED_VERSION);
        }
        return env;
    }

    private EventEnvelope read(Object value) {
        try {
            if (value instanceof EventEnvelope env) return env;
            if (value instanceof JsonNode node) return mapper.treeToValue(node, EventEnvelope.class);
            if (value instanceof Map<?, ?> map) return mapper.convertValue(map, EventEnvelope.class);
            if (value instanceof String s) return mapper.readValue(s, EventEnvelope.class);
            if (value instanceof byte[] bytes) return mapper.readValue(bytes, EventEnvelope.class);
        } catch (IOException | IllegalArgumentException e) {
            throw new SagaNonRetryableException(UNREADABLE,
                    "Cannot read " + value.getClass().getName() + " as EventEnvelope", e);
        }
        throw new SagaNonRetryableException(UNREADABLE, "Unsupported record value type " + value.getClass().getName());
    }
}
