package com.myorg.saga.outbox.jdbc;

import lombok.RequiredArgsConstructor;

// exposed as bean "sagaOutboxSchedule" for the @Scheduled SpEL on OutboxRelay
@RequiredArgsConstructor
public class OutboxScheduleValues {
    private final SagaOutboxProperties props;

    public long getPollIntervalMs() {
        return props.getRelay().getPollInterval().toMillis();
    }

    public long getInitialDelayMs() {
        return props.getRelay().getInitialDelay().toMillis();
    }
}
