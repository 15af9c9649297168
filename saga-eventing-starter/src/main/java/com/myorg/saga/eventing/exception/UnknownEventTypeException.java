package com.myorg.saga.eventing.exception;

import com.myorg.saga.contracts.core.exception.SagaNonRetryableException;

// no handler will ever appear for this record on redelivery, so it goes straight to the DLQ
public class UnknownEventTypeException extends SagaNonRetryableException {
    public UnknownEventTypeException(String eventType, String eventId) {
        super("UNKNOWN_EVENT_TYPE", "No handler for eventType=" + eventType + ", eventId=" + eventId);
    }
}
