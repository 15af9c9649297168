package com.myorg.saga.fulfillment.orchestrator;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.sql.Timestamp;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

@Repository
@RequiredArgsConstructor
public class SagaStateRepository {

    private final JdbcTemplate jdbc;
    private final ObjectMapper mapper;

    /** @return false when a saga for this order already exists */
    public boolean insertIfAbsent(String orderId, String eventId, OrderContext context, Instant now) {
        String sql = """
                INSERT INTO saga_state (order_id, current_step, last_event_id, version, order_context, created_at, updated_at)
                VALUES (?, ?, ?, 0, ?, ?, ?)
                """;
        try {
            jdbc.update(sql, orderId, SagaStep.PLACED.name(), eventId, toJson(context),
                    Timestamp.from(now), Timestamp.from(now));
            return true;
        } catch (DuplicateKeyException e) {
            return false;
        }
    }

    /** Compare-and-swap on the current step. @return false when the saga is not in {@code t.from()} */
    public boolean apply(String orderId, SagaTransition t, String eventId, Instant now) {
        String sql = """
                UPDATE saga_state
                SET current_step=?, last_event_id=?, version=version+1, updated_at=?
                WHERE order_id=? AND current_step=?
                """;
        return jdbc.update(sql, t.to().name(), eventId, Timestamp.from(now), orderId, t.from().name()) == 1;
    }

    public Optional<SagaState> find(String orderId) {
        String sql = """
                SELECT order_id, current_step, last_event_id, version, order_context, created_at, updated_at
                FROM saga_state
                WHERE order_id=?
                """;
        List<SagaState> rows = jdbc.query(sql, rowMapper(), orderId);
        return rows.stream().findFirst();
    }

    private RowMapper<SagaState> rowMapper() {
        return (rs, i) -> new SagaState(
                rs.getString("order_id"),
                SagaStep.valueOf(rs.getString("current_step")),
                rs.getString("last_event_id"),
                rs.getInt("version"),
                fromJson(rs.getString("order_context")),
                rs.getTimestamp("created_at").toInstant(),
                rs.getTimestamp("updated_at").toInstant()
        );
    }

    private String toJson(OrderContext context) {
        try {
            return mapper.writeValueAsString(context);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize order context", e);
        }
    }

    private OrderContext fromJson(String json) {
        try {
            return mapper.readValue(json, OrderContext.class);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Corrupt order context in saga_state", e);
        }
    }
}
