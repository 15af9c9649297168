package com.myorg.saga.eventing;

import com.myorg.saga.contracts.core.envelope.EventEnvelope;
import com.myorg.saga.eventing.context.SagaDispatchOutcome;
import com.myorg.saga.eventing.idempotency.IdempotencyStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Skips an envelope whose eventId was already handled (or is being handled elsewhere).
 * The lease is released when the handler throws, so a redelivery can run it again.
 */
@Slf4j
@RequiredArgsConstructor
public class IdempotentSagaDispatcher implements SagaDispatcher {

    private final SagaDispatcher delegate;
    private final IdempotencyStore store;

    @Override
    public void dispatch(EventEnvelope env) {
        String eventId = env.getEventId();
        if (eventId == null || eventId.isBlank()) {
            delegate.dispatch(env);
            return;
        }

        IdempotencyStore.Lease lease = store.tryBeginProcessing(eventId, env.getEventType());
        switch (lease.decision()) {
            case DUPLICATE -> {
                log.info("Skip duplicate eventId={} eventType={}", eventId, env.getEventType());
                SagaDispatchOutcome.markDuplicate();
                return;
            }
            case IN_FLIGHT -> {
                log.info("Skip in-flight eventId={} eventType={}", eventId, env.getEventType());
                SagaDispatchOutcome.markInFlight();
                return;
            }
            default -> { }
        }

        try {
            delegate.dispatch(env);
            store.markDone(eventId, lease.token());
        } catch (RuntimeException e) {
            try {
                store.releaseProcessing(eventId, lease.token());
            } catch (RuntimeException releaseFailure) {
                e.addSuppressed(releaseFailure);
            }
            throw e;
        }
    }
}
