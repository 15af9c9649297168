package com.myorg.saga.outbox.jdbc;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.myorg.saga.contracts.core.envelope.EventEnvelope;
import com.myorg.saga.eventing.SagaPublisher;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;

/**
 * Publishes committed outbox rows through the {@link SagaPublisher}.
 *
 * <p>Rows are leased before sending. A relay that dies mid-batch leaves its rows PROCESSING
 * until the lease expires; the next pass reclaims and republishes them, so delivery is
 * at-least-once and consumers dedupe on event id.
 */
@Slf4j
@RequiredArgsConstructor
public class OutboxRelay {

    private final SagaOutboxProperties props;
    private final JdbcOutboxRepository repo;
    private final SagaPublisher publisher;
    private final ObjectMapper mapper;
    private final TransactionTemplate tx;
    private final Clock clock;
    private final OutboxRelayHooks hooks;
    private final OutboxMetrics metrics; // null when metrics are off

    private final String instanceId = "outbox-relay-" + UUID.randomUUID();

    @Scheduled(
            initialDelayString = "#{@sagaOutboxSchedule.initialDelayMs}",
            fixedDelayString = "#{@sagaOutboxSchedule.pollIntervalMs}"
    )
    public void scheduledLoop() {
        if (!props.getRelay().isSchedulingEnabled()) return;
        try {
            runOnce();
        } catch (RuntimeException e) {
            log.error("Outbox relay pass failed; rows stay leased until {} expires", props.getRelay().getLease(), e);
        }
    }

    /** One claim-and-publish pass. Returns the number of rows published. */
    public int runOnce() {
        SagaOutboxProperties.Relay cfg = props.getRelay();
        Instant now = clock.instant().truncatedTo(ChronoUnit.MILLIS);
        Instant leaseUntil = now.plus(cfg.getLease());

        Integer claimed = tx.execute(status -> cfg.getClaimStrategy() == SagaOutboxProperties.ClaimStrategy.SKIP_LOCKED
                ? repo.claimBatchSkipLocked(instanceId, now, leaseUntil, cfg.getBatchSize())
                : repo.claimBatch(instanceId, now, leaseUntil, cfg.getBatchSize()));
        if (claimed == null || claimed <= 0) return 0;

        List<OutboxRow> rows = repo.findClaimed(instanceId, now, cfg.getBatchSize());
        if (rows.isEmpty()) return 0;

        hooks.afterClaim(rows);

        int published = 0;
        for (OutboxRow row : rows) {
            try {
                hooks.beforeSend(row);

                EventEnvelope env = mapper.readValue(row.envelopeJson(), EventEnvelope.class);
                publisher.publish(row.exchange(), env)
                        .get(cfg.getSendTimeout().toMillis(), TimeUnit.MILLISECONDS);

                Instant sentAt = clock.instant();
                tx.executeWithoutResult(s -> repo.markSent(row.id(), sentAt));
                published++;
                if (metrics != null) metrics.published();

            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                scheduleRetry(row, e);
                return published;
            } catch (Exception e) {
                scheduleRetry(row, e instanceof ExecutionException && e.getCause() != null ? e.getCause() : e);
            }
        }
        return published;
    }

    private void scheduleRetry(OutboxRow row, Throwable e) {
        int nextRetryCount = row.retryCount() + 1;
        if (nextRetryCount >= props.getRelay().getMaxRetries()) {
            tx.executeWithoutResult(s -> repo.markFailed(row.id(), safeErr(e)));
            if (metrics != null) metrics.failed();
            log.error("Outbox FAILED id={} eventId={} exchange={} after retries={}",
                    row.id(), row.eventId(), row.exchange(), nextRetryCount, e);
            return;
        }

        Instant nextAttempt = clock.instant().plus(backoff(nextRetryCount));
        tx.executeWithoutResult(s -> repo.markRetry(row.id(), nextAttempt, safeErr(e)));
        if (metrics != null) metrics.retried();
        log.warn("Outbox RETRY id={} eventId={} retry={} nextAttempt={}: {}",
                row.id(), row.eventId(), nextRetryCount, nextAttempt, e.toString());
    }

    // retryCount=1 -> base, then doubling, capped at backoffMax
    Duration backoff(int retryCount) {
        long baseMs = Math.max(1, props.getRelay().getBackoffBase().toMillis());
        int pow = Math.max(0, retryCount - 1);
        long ms = baseMs * (1L << Math.min(30, pow));
        return Duration.ofMillis(Math.min(ms, props.getRelay().getBackoffMax().toMillis()));
    }

    private static String safeErr(Throwable e) {
        String msg = e.getClass().getSimpleName() + ": " + (e.getMessage() == null ? "" : e.getMessage());
        return msg.length() > 2000 ? msg.substring(0, 2000) : msg;
    }
}
