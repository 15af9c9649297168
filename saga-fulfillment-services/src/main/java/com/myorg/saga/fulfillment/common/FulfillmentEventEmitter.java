package com.myorg.saga.fulfillment.common;

import com.myorg.saga.contracts.core.envelope.EventEnvelope;
import com.myorg.saga.contracts.fulfillment.FulfillmentEvent;
import com.myorg.saga.outbox.OutboxEventEmitter;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Emits catalogue events through the outbox, so exchange and routing key always come from
 * {@link FulfillmentEvent} and never from the call site. Callers must hold the transaction
 * that changes the state the event describes.
 *
 * <p>Imported by the services that emit events; their outbox must be enabled.
 */
@Component
@RequiredArgsConstructor
public class FulfillmentEventEmitter {

    private final OutboxEventEmitter outbox;

    /** First event of a saga instance; the correlation id is the order id. */
    public EventEnvelope emit(FulfillmentEvent event, String orderId, Object payload) {
        checkPayload(event, payload);
        return outbox.emit(event.exchange(), event.routingKey(), orderId, payload);
    }

    /** Next event of the saga {@code cause} belongs to. */
    public EventEnvelope emitFollowing(EventEnvelope cause, FulfillmentEvent event, Object payload) {
        checkPayload(event, payload);
        return outbox.emitFollowing(cause, event.exchange(), event.routingKey(), payload);
    }

    private static void checkPayload(FulfillmentEvent event, Object payload) {
        if (!event.payloadType().isInstance(payload)) {
            throw new IllegalArgumentException(event + " expects payload " + event.payloadType().getSimpleName()
                    + " but got " + (payload == null ? "null" : payload.getClass().getSimpleName()));
        }
    }
}
