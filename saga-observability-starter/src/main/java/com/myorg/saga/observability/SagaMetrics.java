package com.myorg.saga.observability;

import com.myorg.saga.contracts.core.envelope.EventEnvelope;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.slf4j.MDC;

public class SagaMetrics {

    static final String HANDLED_SUCCESS = "saga.event.handled.success";
    static final String HANDLED_FAIL = "saga.event.handled.fail";
    static final String DUPLICATE = "saga.event.duplicate";
    static final String IN_FLIGHT = "saga.event.in_flight";
    static final String PROCESSING = "saga.event.processing";

    private final MeterRegistry registry;
    private final String serviceName;
    private final SagaObservabilityProperties props;

    private Counter handledSuccess;
    private Counter handledFail;
    private Counter duplicate;
    private Counter inFlight;

    public SagaMetrics(MeterRegistry registry, String serviceName, SagaObservabilityProperties props) {
        this.registry = registry;
        this.serviceName = serviceName;
        this.props = props;
    }

    /** Register the base meters so they are visible before the first event. */
    public void preRegisterBaseMeters() {
        handledSuccess = Counter.builder(HANDLED_SUCCESS).tag("service", serviceName).register(registry);
        handledFail = Counter.builder(HANDLED_FAIL).tag("service", serviceName).register(registry);
        duplicate = Counter.builder(DUPLICATE).tag("service", serviceName).register(registry);
        inFlight = Counter.builder(IN_FLIGHT).tag("service", serviceName).register(registry);
        Timer.builder(PROCESSING).tag("service", serviceName).register(registry);
    }

    public Timer.Sample startTimer() {
        return Timer.start(registry);
    }

    public void stopTimer(Timer.Sample sample, EventEnvelope env, String outcome) {
        if (sample == null) return;

        Timer.Builder b = Timer.builder(PROCESSING).tag("service", serviceName);
        if (props.isTagOutcome()) b.tag("outcome", outcome);
        if (props.isTagEventType() && env != null && env.getEventType() != null) b.tag("eventType", env.getEventType());
        if (props.isTagQueue()) {
            String queue = MDC.get("queue");
            if (queue != null && !queue.isBlank()) b.tag("queue", queue);
        }
        sample.stop(b.register(registry));
    }

    public void incHandledSuccess() { counter(handledSuccess, HANDLED_SUCCESS).increment(); }
    public void incHandledFail()    { counter(handledFail, HANDLED_FAIL).increment(); }
    public void incDuplicate()      { counter(duplicate, DUPLICATE).increment(); }
    public void incInFlight()       { counter(inFlight, IN_FLIGHT).increment(); }

    // before pre-registration ran, fall back to a registry lookup
    private Counter counter(Counter preRegistered, String name) {
        return preRegistered != null ? preRegistered : registry.counter(name, "service", serviceName);
    }
}
