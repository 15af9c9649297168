package com.myorg.saga.fulfillment.notification;

import com.myorg.saga.fulfillment.common.web.ValidationFailedException;

import java.util.List;

public class NotificationValidationException extends ValidationFailedException {

    public NotificationValidationException(List<String> errors) {
        super(errors);
    }

    public NotificationValidationException(String error) {
        this(List.of(error));
    }
}
