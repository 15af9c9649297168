package com.myorg.saga.fulfillment.notification.channel;

/** Outcome of one send attempt. A business failure is a value, not an exception. */
public record SendResult(boolean success, String providerResponse, String error) {

    public static SendResult sent(String providerResponse) {
        return new SendResult(true, providerResponse, null);
    }

    public static SendResult failed(String error) {
        return new SendResult(false, null, error);
    }
}
