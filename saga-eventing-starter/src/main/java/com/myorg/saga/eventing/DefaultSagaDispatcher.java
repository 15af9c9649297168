package com.myorg.saga.eventing;

import com.myorg.saga.contracts.core.envelope.EventEnvelope;
import com.myorg.saga.contracts.core.exception.SagaNonRetryableException;
import com.myorg.saga.eventing.exception.UnknownEventTypeException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.util.StringUtils;

/**
 * Innermost dispatcher: checks the envelope, then hands it to the one handler registered for its
 * event type. An envelope without event id, type or correlation id cannot be deduplicated or joined
 * to a saga, so it is rejected as non-retryable.
 */
@Slf4j
@RequiredArgsConstructor
public class DefaultSagaDispatcher implements SagaDispatcher {

    static final String INVALID_ENVELOPE = "INVALID_ENVELOPE";

    private final HandlerRegistry registry;
    private final boolean ignoreUnknown;

    @Override
    public void dispatch(EventEnvelope env) {
        requireIdentity(env);

        HandlerMethodInvoker invoker = registry.get(env.getEventType());
        if (invoker != null) {
            invoker.invoke(env);
            return;
        }
        if (!ignoreUnknown) {
            throw new UnknownEventTypeException(env.getEventType(), env.getEventId());
        }
        log.warn("Dropping eventType={} eventId={} corrId={}: no handler in this service",
                env.getEventType(), env.getEventId(), env.getCorrelationId());
    }

    private static void requireIdentity(EventEnvelope env) {
        String missing = !StringUtils.hasText(env.getEventId()) ? "eventId"
                : !StringUtils.hasText(env.getEventType()) ? "eventType"
                : !StringUtils.hasText(env.getCorrelationId()) ? "correlationId"
                : null;
        if (missing != null) {
            throw new SagaNonRetryableException(INVALID_ENVELOPE,
                    "Envelope " + env.getEventId() + " (" + env.getEventType() + ") has no " + missing);
        }
    }
}
