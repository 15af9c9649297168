package com.myorg.saga.fulfillment.orchestrator;

import com.myorg.saga.contracts.fulfillment.FulfillmentEvent;

import java.util.Arrays;
import java.util.Optional;

/**
 * The fulfillment saga's transition table. A transition applies only when the stored step
 * equals {@link #from()}; the update is a compare-and-swap on that step.
 */
public enum SagaTransition {
    START(FulfillmentEvent.ORDER_PLACED, SagaStep.PLACED, SagaStep.RESERVATION_PENDING,
            FulfillmentEvent.STOCK_RESERVATION_REQUESTED),
    CONFIRM(FulfillmentEvent.STOCK_RESERVATION_SUCCEEDED, SagaStep.RESERVATION_PENDING, SagaStep.CONFIRMED,
            FulfillmentEvent.ORDER_CONFIRMED),
    CANCEL(FulfillmentEvent.STOCK_RESERVATION_FAILED, SagaStep.RESERVATION_PENDING, SagaStep.CANCELLED,
            FulfillmentEvent.ORDER_CANCELLED);

    private final FulfillmentEvent trigger;
    private final SagaStep from;
    private final SagaStep to;
    private final FulfillmentEvent emits;

    SagaTransition(FulfillmentEvent trigger, SagaStep from, SagaStep to, FulfillmentEvent emits) {
        this.trigger = trigger;
        this.from = from;
        this.to = to;
        this.emits = emits;
    }

    public FulfillmentEvent trigger() {
        return trigger;
    }

    public SagaStep from() {
        return from;
    }

    public SagaStep to() {
        return to;
    }

    public FulfillmentEvent emits() {
        return emits;
    }

    public static Optional<SagaTransition> triggeredBy(String eventType) {
        return Arrays.stream(values())
                .filter(t -> t.trigger.routingKey().equals(eventType))
                .findFirst();
    }
}
