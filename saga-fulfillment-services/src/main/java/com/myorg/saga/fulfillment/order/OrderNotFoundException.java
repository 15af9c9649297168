package com.myorg.saga.fulfillment.order;

import com.myorg.saga.fulfillment.common.web.NotFoundException;

public class OrderNotFoundException extends NotFoundException {

    public OrderNotFoundException(String orderId) {
        super("Order not found: " + orderId);
    }
}
