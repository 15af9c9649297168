package com.myorg.saga.fulfillment.inventory;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

import java.sql.Timestamp;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

@Repository
@RequiredArgsConstructor
public class ReservationRepository {

    private final JdbcTemplate jdbc;
    private final ObjectMapper mapper;

    public Optional<ReservationOutcome> findByOrderId(String orderId) {
        List<String> rows = jdbc.queryForList(
                "SELECT outcome_json FROM stock_reservation WHERE order_id=?", String.class, orderId);
        return rows.stream().findFirst().map(this::fromJson);
    }

    public void insert(String orderId, ReservationOutcome outcome, Instant now) {
        jdbc.update("""
                INSERT INTO stock_reservation (order_id, success, reason, outcome_json, created_at)
                VALUES (?, ?, ?, ?, ?)
                """, orderId, outcome.success(), outcome.reason(), toJson(outcome), Timestamp.from(now));
    }

    private String toJson(ReservationOutcome outcome) {
        try {
            return mapper.writeValueAsString(outcome);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize reservation outcome", e);
        }
    }

    private ReservationOutcome fromJson(String json) {
        try {
            return mapper.readValue(json, ReservationOutcome.class);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Corrupt reservation outcome", e);
        }
    }
}
