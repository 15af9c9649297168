package com.myorg.saga.outbox;

import com.myorg.saga.contracts.core.envelope.EventEnvelope;

/**
 * Appends events to the outbox table within the caller's DB transaction.
 *
 * <p>Usage (inside a transaction):
 * <pre>
 *   outboxWriter.append(envelope, "fulfillment.order", orderId);
 * </pre>
 */
public interface OutboxWriter {

    /**
     * Insert one row into the outbox.
     *
     * @param exchange exchange (topic) the relay will publish to
     * @param key      record key, the saga correlation id
     * @return generated outbox id
     */
    long append(EventEnvelope envelope, String exchange, String key);
}
