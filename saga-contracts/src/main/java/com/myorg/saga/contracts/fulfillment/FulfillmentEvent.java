package com.myorg.saga.contracts.fulfillment;

import com.myorg.saga.contracts.fulfillment.events.OrderCancelledEvent;
import com.myorg.saga.contracts.fulfillment.events.OrderConfirmedEvent;
import com.myorg.saga.contracts.fulfillment.events.OrderPlacedEvent;
import com.myorg.saga.contracts.fulfillment.events.StockReservationFailedEvent;
import com.myorg.saga.contracts.fulfillment.events.StockReservationRequestedEvent;
import com.myorg.saga.contracts.fulfillment.events.StockReservationSucceededEvent;

import java.util.Arrays;
import java.util.Optional;

/**
 * Closed catalogue of the events exchanged by the order fulfillment saga.
 * Every event is published to exactly one exchange under exactly one routing key.
 */
public enum FulfillmentEvent {
    ORDER_PLACED(FulfillmentEventTypes.ORDER_PLACED, FulfillmentExchanges.ORDER, OrderPlacedEvent.class),
    STOCK_RESERVATION_REQUESTED(FulfillmentEventTypes.STOCK_RESERVATION_REQUESTED, FulfillmentExchanges.STOCK, StockReservationRequestedEvent.class),
    STOCK_RESERVATION_SUCCEEDED(FulfillmentEventTypes.STOCK_RESERVED, FulfillmentExchanges.STOCK, StockReservationSucceededEvent.class),
    STOCK_RESERVATION_FAILED(FulfillmentEventTypes.STOCK_RESERVATION_FAILED, FulfillmentExchanges.STOCK, StockReservationFailedEvent.class),
    ORDER_CONFIRMED(FulfillmentEventTypes.ORDER_CONFIRMED, FulfillmentExchanges.ORDER, OrderConfirmedEvent.class),
    ORDER_CANCELLED(FulfillmentEventTypes.ORDER_CANCELLED, FulfillmentExchanges.ORDER, OrderCancelledEvent.class);

    private final String routingKey;
    private final String exchange;
    private final Class<?> payloadType;

    FulfillmentEvent(String routingKey, String exchange, Class<?> payloadType) {
        this.routingKey = routingKey;
        this.exchange = exchange;
        this.payloadType = payloadType;
    }

    public String routingKey() {
        return routingKey;
    }

    public String exchange() {
        return exchange;
    }

    public Class<?> payloadType() {
        return payloadType;
    }

    public static Optional<FulfillmentEvent> fromRoutingKey(String routingKey) {
        return Arrays.stream(values())
                .filter(e -> e.routingKey.equals(routingKey))
                .findFirst();
    }
}
