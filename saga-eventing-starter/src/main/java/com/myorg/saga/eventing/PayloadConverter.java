package com.myorg.saga.eventing;

import com.myorg.saga.contracts.core.envelope.EventEnvelope;

public interface PayloadConverter {
    /**
     * @return the envelope, or {@code null} for a tombstone
     */
    EventEnvelope toEnvelope(Object value);
}
