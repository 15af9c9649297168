package com.myorg.saga.contracts.fulfillment;

import com.myorg.saga.contracts.fulfillment.events.StockReservationFailedEvent;
import org.junit.jupiter.api.Test;

import java.util.Arrays;

import static org.assertj.core.api.Assertions.assertThat;

class FulfillmentEventTest {

    @Test
    void routingKeysAreUnique() {
        long distinct = Arrays.stream(FulfillmentEvent.values()).map(FulfillmentEvent::routingKey).distinct().count();
        assertThat(distinct).isEqualTo(FulfillmentEvent.values().length);
    }

    @Test
    void lookupByRoutingKey() {
        assertThat(FulfillmentEvent.fromRoutingKey("stock.reservation.failed"))
                .contains(FulfillmentEvent.STOCK_RESERVATION_FAILED);
        assertThat(FulfillmentEvent.STOCK_RESERVATION_FAILED.payloadType()).isEqualTo(StockReservationFailedEvent.class);
        assertThat(FulfillmentEvent.STOCK_RESERVATION_FAILED.exchange()).isEqualTo(FulfillmentExchanges.STOCK);
        assertThat(FulfillmentEvent.fromRoutingKey("order.shipped")).isEmpty();
    }

    @Test
    void orderLifecycleEventsGoToOrderExchange() {
        assertThat(FulfillmentEvent.ORDER_PLACED.exchange()).isEqualTo(FulfillmentExchanges.ORDER);
        assertThat(FulfillmentEvent.ORDER_CONFIRMED.exchange()).isEqualTo(FulfillmentExchanges.ORDER);
        assertThat(FulfillmentEvent.ORDER_CANCELLED.exchange()).isEqualTo(FulfillmentExchanges.ORDER);
    }
}
