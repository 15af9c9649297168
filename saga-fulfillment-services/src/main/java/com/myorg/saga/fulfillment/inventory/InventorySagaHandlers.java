package com.myorg.saga.fulfillment.inventory;

import com.myorg.saga.contracts.core.envelope.EventEnvelope;
import com.myorg.saga.contracts.fulfillment.FulfillmentEvent;
import com.myorg.saga.contracts.fulfillment.FulfillmentEventTypes;
import com.myorg.saga.contracts.fulfillment.events.StockReservationFailedEvent;
import com.myorg.saga.contracts.fulfillment.events.StockReservationRequestedEvent;
import com.myorg.saga.contracts.fulfillment.events.StockReservationSucceededEvent;
import com.myorg.saga.eventing.SagaEventHandler;
import com.myorg.saga.fulfillment.common.FulfillmentEventEmitter;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class InventorySagaHandlers {

    private final ReservationService reservations;
    private final FulfillmentEventEmitter emitter;

    @SagaEventHandler(value = FulfillmentEventTypes.STOCK_RESERVATION_REQUESTED, payload = StockReservationRequestedEvent.class)
    public void onReservationRequested(EventEnvelope env, StockReservationRequestedEvent requested) {
        String orderId = env.getCorrelationId();
        reservations.reserve(orderId, requested.getItems()).ifPresent(outcome -> {
            if (outcome.success()) {
                emitter.emitFollowing(env, FulfillmentEvent.STOCK_RESERVATION_SUCCEEDED,
                        StockReservationSucceededEvent.builder()
                                .orderId(orderId)
                                .userId(requested.getUserId())
                                .items(requested.getItems())
                                .build());
            } else {
                emitter.emitFollowing(env, FulfillmentEvent.STOCK_RESERVATION_FAILED,
                        StockReservationFailedEvent.builder()
                                .orderId(orderId)
                                .userId(requested.getUserId())
                                .reason(outcome.reason())
                                .failedItems(outcome.failedItems())
                                .build());
            }
        });
    }
}
