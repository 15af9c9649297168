package com.myorg.saga.observability;

import com.myorg.saga.contracts.core.envelope.EventEnvelope;
import com.myorg.saga.eventing.SagaDispatcher;
import com.myorg.saga.eventing.context.SagaDispatchOutcome;
import io.micrometer.core.instrument.Timer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;

/**
 * Outermost dispatch decorator: puts corrId/eventId/eventType into the MDC for the handler's
 * logs and records the outcome (success, fail, duplicate, in_flight).
 */
@Slf4j
@RequiredArgsConstructor
public class ObservingSagaDispatcher implements SagaDispatcher {

    static final String MDC_CORR_ID = "corrId";
    static final String MDC_EVENT_ID = "eventId";
    static final String MDC_EVENT_TYPE = "eventType";

    private final SagaDispatcher delegate;
    private final SagaObservabilityProperties props;
    private final SagaMetrics metrics; // null when no MeterRegistry

    @Override
    public void dispatch(EventEnvelope env) {
        if (props.isMdcEnabled()) {
            putMdc(env);
        }
        boolean measure = metrics != null && props.isMetricsEnabled();
        Timer.Sample sample = measure ? metrics.startTimer() : null;

        try {
            delegate.dispatch(env);

            String outcome = SagaDispatchOutcome.consume();
            if (outcome == null) outcome = "success";
            if (measure) {
                switch (outcome) {
                    case SagaDispatchOutcome.DUPLICATE -> metrics.incDuplicate();
                    case SagaDispatchOutcome.IN_FLIGHT -> metrics.incInFlight();
                    default -> metrics.incHandledSuccess();
                }
                metrics.stopTimer(sample, env, outcome);
            }
        } catch (RuntimeException e) {
            log.warn("Handler failed eventType={} eventId={}: {}", env.getEventType(), env.getEventId(), e.toString());
            if (measure) {
                metrics.incHandledFail();
                metrics.stopTimer(sample, env, "fail");
            }
            throw e;
        } finally {
            SagaDispatchOutcome.clear();
            if (props.isMdcEnabled()) {
                MDC.remove(MDC_CORR_ID);
                MDC.remove(MDC_EVENT_ID);
                MDC.remove(MDC_EVENT_TYPE);
            }
        }
    }

    private static void putMdc(EventEnvelope env) {
        if (env.getCorrelationId() != null) MDC.put(MDC_CORR_ID, env.getCorrelationId());
        if (env.getEventId() != null) MDC.put(MDC_EVENT_ID, env.getEventId());
        if (env.getEventType() != null) MDC.put(MDC_EVENT_TYPE, env.getEventType());
    }
}
