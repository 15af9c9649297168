package com.myorg.saga.outbox.jdbc;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.DataSourceTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import javax.sql.DataSource;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class OutboxRelayTest {

    private final ObjectMapper mapper = new ObjectMapper();
    private final MutableClock clock = new MutableClock(Instant.parse("2026-03-01T10:00:00Z"));
    private final RecordingSagaPublisher publisher = new RecordingSagaPublisher();
    private final SimpleMeterRegistry registry = new SimpleMeterRegistry();

    private SagaOutboxProperties props;
    private JdbcOutboxRepository repo;
    private JdbcOutboxWriter writer;
    private TransactionTemplate tx;
    private OutboxMetrics metrics;

    @BeforeEach
    void setUp() {
        DataSource ds = OutboxTestSupport.migratedDataSource();
        JdbcTemplate jdbc = new JdbcTemplate(ds);
        tx = new TransactionTemplate(new DataSourceTransactionManager(ds));

        props = new SagaOutboxProperties();
        props.setEnabled(true);
        props.getRelay().setEnabled(true);
        props.getRelay().setSchedulingEnabled(false);
        props.getRelay().setBatchSize(10);
        props.getRelay().setLease(Duration.ofSeconds(5));
        props.getRelay().setBackoffBase(Duration.ofSeconds(1));
        props.getRelay().setBackoffMax(Duration.ofSeconds(30));
        props.getRelay().setMaxRetries(3);

        repo = new JdbcOutboxRepository(jdbc, props);
        writer = new JdbcOutboxWriter(jdbc, mapper, props);
        metrics = new OutboxMetrics(registry, repo, clock);
    }

    private OutboxRelay relay(OutboxRelayHooks hooks) {
        return new OutboxRelay(props, repo, publisher, mapper, tx, clock, hooks, metrics);
    }

    @Test
    void runOnce_publishesInInsertionOrderAndMarksSent() {
        writer.append(OutboxTestSupport.envelope(mapper, "E1", "order-1"), "fulfillment.order", "order-1");
        writer.append(OutboxTestSupport.envelope(mapper, "E2", "order-2"), "fulfillment.stock", "order-2");

        int published = relay(new OutboxRelayHooks() {}).runOnce();

        assertThat(published).isEqualTo(2);
        assertThat(publisher.sent).extracting(s -> s.envelope().getEventId()).containsExactly("E1", "E2");
        assertThat(publisher.sent).extracting(RecordingSagaPublisher.Sent::exchange)
                .containsExactly("fulfillment.order", "fulfillment.stock");
        assertThat(repo.statusByEventId("E1")).isEqualTo("SENT");
        assertThat(repo.statusByEventId("E2")).isEqualTo("SENT");
        assertThat(registry.counter("outbox.published").count()).isEqualTo(2.0);
        assertThat(registry.get("outbox.pending").gauge().value()).isZero();
    }

    @Test
    void crashAfterClaim_rowIsReclaimedOnceLeaseExpires() {
        writer.append(OutboxTestSupport.envelope(mapper, "E_CRASH", "order-9"), "fulfillment.order", "order-9");
        AtomicBoolean crashOnce = new AtomicBoolean(true);
        OutboxRelay relay = relay(new OutboxRelayHooks() {
            @Override
            public void afterClaim(List<OutboxRow> claimedRows) {
                if (crashOnce.compareAndSet(true, false)) {
                    throw new IllegalStateException("simulated crash after claim");
                }
            }
        });

        assertThatThrownBy(relay::runOnce).isInstanceOf(IllegalStateException.class);
        assertThat(repo.statusByEventId("E_CRASH")).isEqualTo("PROCESSING");

        // still leased: nothing to claim
        assertThat(relay.runOnce()).isZero();

        clock.advance(Duration.ofSeconds(6));
        assertThat(relay.runOnce()).isEqualTo(1);
        assertThat(repo.statusByEventId("E_CRASH")).isEqualTo("SENT");
        assertThat(publisher.sent).hasSize(1);
    }

    @Test
    void publishFailure_isRetriedAfterBackoff() {
        writer.append(OutboxTestSupport.envelope(mapper, "E_RETRY", "order-5"), "fulfillment.order", "order-5");
        publisher.failNext = 1;
        OutboxRelay relay = relay(new OutboxRelayHooks() {});

        assertThat(relay.runOnce()).isZero();
        assertThat(repo.statusByEventId("E_RETRY")).isEqualTo("RETRY");

        // backoff (1s) not elapsed yet
        assertThat(relay.runOnce()).isZero();

        clock.advance(Duration.ofSeconds(2));
        assertThat(relay.runOnce()).isEqualTo(1);
        assertThat(repo.statusByEventId("E_RETRY")).isEqualTo("SENT");
        assertThat(registry.counter("outbox.retried").count()).isEqualTo(1.0);
    }

    @Test
    void rowIsParkedAsFailedAfterMaxRetries() {
        writer.append(OutboxTestSupport.envelope(mapper, "E_DEAD", "order-6"), "fulfillment.order", "order-6");
        publisher.failNext = 10;
        OutboxRelay relay = relay(new OutboxRelayHooks() {});

        for (int i = 0; i < 5; i++) {
            relay.runOnce();
            clock.advance(Duration.ofMinutes(1));
        }

        assertThat(repo.statusByEventId("E_DEAD")).isEqualTo("FAILED");
        assertThat(publisher.sent).isEmpty();
        assertThat(registry.counter("outbox.failed").count()).isEqualTo(1.0);
        assertThat(registry.get("outbox.dead").gauge().value()).isEqualTo(1.0);
        // attempts 1 and 2 retried, attempt 3 parked
        assertThat(publisher.failNext).isEqualTo(7);
    }

    @Test
    void backoff_doublesUpToMax() {
        OutboxRelay relay = relay(new OutboxRelayHooks() {});

        assertThat(relay.backoff(1)).isEqualTo(Duration.ofSeconds(1));
        assertThat(relay.backoff(2)).isEqualTo(Duration.ofSeconds(2));
        assertThat(relay.backoff(4)).isEqualTo(Duration.ofSeconds(8));
        assertThat(relay.backoff(10)).isEqualTo(Duration.ofSeconds(30));
    }
}
