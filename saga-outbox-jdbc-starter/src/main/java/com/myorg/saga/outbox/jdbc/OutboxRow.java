package com.myorg.saga.outbox.jdbc;

public record OutboxRow(
        long id,
        String exchange,
        String msgKey,
        String eventId,
        String envelopeJson,
        int retryCount
) {}
