package com.myorg.saga.fulfillment.order;

import com.myorg.saga.fulfillment.common.web.ValidationFailedException;

import java.util.List;

public class OrderValidationException extends ValidationFailedException {

    public OrderValidationException(List<String> errors) {
        super(errors);
    }
}
