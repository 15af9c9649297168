package com.myorg.saga.fulfillment.order;

import com.myorg.saga.contracts.core.envelope.EventEnvelope;
import com.myorg.saga.contracts.fulfillment.FulfillmentEventTypes;
import com.myorg.saga.contracts.fulfillment.events.OrderCancelledEvent;
import com.myorg.saga.contracts.fulfillment.events.OrderConfirmedEvent;
import com.myorg.saga.contracts.fulfillment.events.StockReservationRequestedEvent;
import com.myorg.saga.eventing.SagaEventHandler;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

@Component
@RequiredArgsConstructor
public class OrderSagaHandlers {

    private final OrderOutcomeService outcomes;

    @SagaEventHandler(value = FulfillmentEventTypes.ORDER_CANCELLED, payload = OrderCancelledEvent.class)
    public void onOrderCancelled(EventEnvelope env, OrderCancelledEvent cancelled) {
        String reason = StringUtils.hasText(cancelled.getReason()) ? cancelled.getReason() : OrderCancelledEvent.DEFAULT_REASON;
        outcomes.cancel(env.getCorrelationId(), reason);
    }

    @SagaEventHandler(value = FulfillmentEventTypes.ORDER_CONFIRMED, payload = OrderConfirmedEvent.class)
    public void onOrderConfirmed(EventEnvelope env, OrderConfirmedEvent confirmed) {
        outcomes.confirm(env.getCorrelationId());
    }

    @SagaEventHandler(value = FulfillmentEventTypes.STOCK_RESERVATION_REQUESTED, payload = StockReservationRequestedEvent.class)
    public void onReservationRequested(EventEnvelope env, StockReservationRequestedEvent requested) {
        outcomes.markReservationPending(env.getCorrelationId());
    }
}
