package com.myorg.saga.contracts.fulfillment;

public final class FulfillmentExchanges {
    private FulfillmentExchanges() {}

    public static final String ORDER = "fulfillment.order";
    public static final String STOCK = "fulfillment.stock";
}
