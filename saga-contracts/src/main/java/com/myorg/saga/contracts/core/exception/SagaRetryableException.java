package com.myorg.saga.contracts.core.exception;

public class SagaRetryableException extends RuntimeException {
    public SagaRetryableException(String msg) { super(msg); }
    public SagaRetryableException(String msg, Throwable cause) { super(msg, cause); }
}
