package com.myorg.saga.fulfillment.common.web;

/** Maps to 404. */
public abstract class NotFoundException extends RuntimeException {

    protected NotFoundException(String message) {
        super(message);
    }
}
