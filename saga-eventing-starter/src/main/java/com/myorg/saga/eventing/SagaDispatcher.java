package com.myorg.saga.eventing;

import com.myorg.saga.contracts.core.envelope.EventEnvelope;

// Routes one envelope to its handler. Decorators (idempotency, observability) implement the same interface.
public interface SagaDispatcher {
    void dispatch(EventEnvelope env);
}
