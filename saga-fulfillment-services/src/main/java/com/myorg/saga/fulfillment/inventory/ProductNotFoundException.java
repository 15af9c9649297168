package com.myorg.saga.fulfillment.inventory;

import com.myorg.saga.fulfillment.common.web.NotFoundException;

public class ProductNotFoundException extends NotFoundException {

    public ProductNotFoundException(String productId) {
        super("Product not found: " + productId);
    }
}
