package com.myorg.saga.fulfillment.orchestrator;

public enum SagaStep {
    PLACED,
    RESERVATION_PENDING,
    CONFIRMED,
    CANCELLED;

    public boolean isTerminal() {
        return this == CONFIRMED || this == CANCELLED;
    }
}
