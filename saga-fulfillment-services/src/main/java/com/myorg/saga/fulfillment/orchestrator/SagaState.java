package com.myorg.saga.fulfillment.orchestrator;

import java.time.Instant;

public record SagaState(
        String orderId,
        SagaStep step,
        String lastEventId,
        int version,
        OrderContext context,
        Instant createdAt,
        Instant updatedAt
) {}
