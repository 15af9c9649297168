package com.myorg.saga.outbox.jdbc;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.myorg.saga.contracts.core.envelope.EventEnvelope;
import com.myorg.saga.outbox.OutboxWriter;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.support.GeneratedKeyHolder;
import org.springframework.jdbc.support.KeyHolder;
import org.springframework.util.StringUtils;

import java.sql.PreparedStatement;
import java.util.Map;

/**
 * Appends to the outbox table on the caller's connection, so the row commits or rolls back with
 * the state change that produced the event. A missing message key falls back to the correlation
 * id, which keeps every event of one saga on the same partition.
 */
@RequiredArgsConstructor
public class JdbcOutboxWriter implements OutboxWriter {

    private static final String INSERT = """
            INSERT INTO %s (exchange_name, msg_key, event_id, event_type, correlation_id, aggregate_id, envelope_json)
            VALUES (?, ?, ?, ?, ?, ?, ?)
            """;

    private final JdbcTemplate jdbc;
    private final ObjectMapper mapper;
    private final SagaOutboxProperties props;

    @Override
    public long append(EventEnvelope envelope, String exchange, String key) {
        if (envelope == null) throw new IllegalArgumentException("envelope must not be null");
        if (!StringUtils.hasText(exchange)) throw new IllegalArgumentException("exchange must not be blank");
        require(envelope.getEventId(), "eventId");
        require(envelope.getEventType(), "eventType");
        require(envelope.getCorrelationId(), "correlationId");

        String msgKey = StringUtils.hasText(key) ? key : envelope.getCorrelationId();
        String json = toJson(envelope);
        String sql = INSERT.formatted(props.getTable());

        KeyHolder kh = new GeneratedKeyHolder();
        jdbc.update(con -> {
            // ask only for 'id' (H2 otherwise returns every defaulted column)
            PreparedStatement ps = con.prepareStatement(sql, new String[]{"id"});
            ps.setString(1, exchange);
            ps.setString(2, msgKey);
            ps.setString(3, envelope.getEventId());
            ps.setString(4, envelope.getEventType());
            ps.setString(5, envelope.getCorrelationId());
            ps.setString(6, envelope.getAggregateId());
            ps.setString(7, json);
            return ps;
        }, kh);
        return generatedId(kh);
    }

    private long generatedId(KeyHolder kh) {
        Number k = kh.getKey();
        if (k != null) return k.longValue();

        Map<String, Object> keys = kh.getKeys();
        Object id = keys == null ? null : keys.getOrDefault("id", keys.get("ID"));
        if (id instanceof Number n) return n.longValue();
        throw new IllegalStateException("No generated id returned by insert into " + props.getTable());
    }

    private static void require(String value, String field) {
        if (!StringUtils.hasText(value)) {
            throw new IllegalArgumentException("envelope." + field + " must not be blank");
        }
    }

    private String toJson(EventEnvelope env) {
        try {
            return mapper.writeValueAsString(env);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize envelope " + env.getEventId(), e);
        }
    }
}
