package com.myorg.saga.contracts.core.exception;

/**
 * Failure that redelivery cannot fix. The Kafka error handler sends the record
 * straight to the queue's dead-letter topic, tagged with {@link #getReason()}.
 */
public class SagaNonRetryableException extends RuntimeException {

    private final String reason;

    public SagaNonRetryableException(String message) {
        this("NON_RETRYABLE", message);
    }

    public SagaNonRetryableException(String reason, String message) {
        this(reason, message, null);
    }

    public SagaNonRetryableException(String reason, String message, Throwable cause) {
        super(message, cause);
        this.reason = (reason == null || reason.isBlank()) ? "NON_RETRYABLE" : reason;
    }

    public String getReason() {
        return reason;
    }
}
