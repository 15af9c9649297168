package com.myorg.saga.eventing.idempotency;

import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.transaction.support.TransactionSynchronizationManager;

import java.sql.Timestamp;
import java.time.Clock;

/**
 * Store backed by a {@code processed_event} table in the service's own database.
 *
 * <p>The mark is an INSERT made inside the consumer's unit of work, so it commits together with
 * the handler's writes and disappears with them on rollback. A concurrent consumer of the same
 * eventId blocks on the primary key until the first transaction ends, then sees a duplicate.
 */
@Slf4j
public class JdbcIdempotencyStore implements IdempotencyStore {

    private final JdbcTemplate jdbc;
    private final String table;
    private final Clock clock;

    public JdbcIdempotencyStore(JdbcTemplate jdbc, String table, Clock clock) {
        this.jdbc = jdbc;
        this.table = table;
        this.clock = clock;
    }

    @Override
    public Lease tryBeginProcessing(String eventId, String eventType) {
        String sql = """
                INSERT INTO %s (event_id, event_type, processed_at)
                VALUES (?, ?, ?)
                """.formatted(table);
        try {
            jdbc.update(sql, eventId, eventType, Timestamp.from(clock.instant()));
            return Lease.acquired(eventId);
        } catch (DuplicateKeyException e) {
            return Lease.duplicate();
        }
    }

    @Override
    public void markDone(String eventId, String token) {
        // the INSERT already is the mark; it commits with the unit of work
    }

    @Override
    public void releaseProcessing(String eventId, String token) {
        if (TransactionSynchronizationManager.isActualTransactionActive()) {
            return; // rollback removes the row
        }
        // outside a transaction the INSERT was auto-committed
        jdbc.update("DELETE FROM %s WHERE event_id = ?".formatted(table), eventId);
        log.debug("Released idempotency mark eventId={} (no surrounding transaction)", eventId);
    }
}
