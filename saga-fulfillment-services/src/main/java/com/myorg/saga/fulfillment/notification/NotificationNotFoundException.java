package com.myorg.saga.fulfillment.notification;

import com.myorg.saga.fulfillment.common.web.NotFoundException;

public class NotificationNotFoundException extends NotFoundException {

    public NotificationNotFoundException(String id) {
        super("Notification not found: " + id);
    }
}
