package com.myorg.saga.fulfillment.common.web;

import java.util.List;

/** Request rejected before anything was written. Maps to 400 with one entry per broken rule. */
public class ValidationFailedException extends RuntimeException {

    private final List<String> errors;

    public ValidationFailedException(List<String> errors) {
        super(String.join(" ", errors));
        this.errors = List.copyOf(errors);
    }

    public List<String> getErrors() {
        return errors;
    }
}
