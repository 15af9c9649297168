package com.myorg.saga.contracts.fulfillment;

// routing keys; the envelope eventType carries the same value
public final class FulfillmentEventTypes {
    private FulfillmentEventTypes() {}

    public static final String ORDER_PLACED = "order.placed";
    public static final String ORDER_CONFIRMED = "order.confirmed";
    public static final String ORDER_CANCELLED = "order.cancelled";

    public static final String STOCK_RESERVATION_REQUESTED = "stock.reservation.requested";
    public static final String STOCK_RESERVED = "stock.reserved";
    public static final String STOCK_RESERVATION_FAILED = "stock.reservation.failed";
}
