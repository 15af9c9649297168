package com.myorg.saga.kafka;

/** Reasons the consumer side assigns itself. Handlers may use their own via {@code SagaNonRetryableException}. */
public enum SagaDlqReason {
    /** Every redelivery failed. */
    RETRY_EXHAUSTED,
    /** The record could not be read as an envelope. */
    DESERIALIZATION,
    /** A non-retryable failure that did not name a reason. */
    NON_RETRYABLE;

    public String code() {
        return name();
    }
}
