package com.myorg.saga.fulfillment;

import com.myorg.saga.contracts.core.envelope.EventEnvelope;
import com.myorg.saga.eventing.SagaPublisher;
import com.myorg.saga.eventing.runtime.QueueWorker;
import org.apache.kafka.clients.consumer.ConsumerRecord;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Stands in for the broker: every published envelope is fanned out to all workers bound to its
 * exchange, on the caller's thread, when {@link #deliverPending()} runs.
 */
class InProcessBroker implements SagaPublisher {

    record Published(String exchange, EventEnvelope envelope) {}

    private final Map<String, List<QueueWorker>> bindings = new LinkedHashMap<>();
    private final Deque<Published> pending = new ArrayDeque<>();
    final List<Published> history = new ArrayList<>();
    private long offset;

    void bind(String exchange, QueueWorker worker) {
        bindings.computeIfAbsent(exchange, e -> new ArrayList<>()).add(worker);
    }

    @Override
    public CompletableFuture<?> publish(String exchange, String routingKey, String correlationId, Object payload) {
        throw new UnsupportedOperationException("services publish through the outbox");
    }

    @Override
    public CompletableFuture<?> publish(String exchange, EventEnvelope envelope) {
        Published p = new Published(exchange, envelope);
        pending.add(p);
        history.add(p);
        return CompletableFuture.completedFuture(null);
    }

    /** @return records handed to workers */
    int deliverPending() {
        int delivered = 0;
        while (!pending.isEmpty()) {
            Published p = pending.poll();
            deliver(p.exchange(), p.envelope());
            delivered++;
        }
        return delivered;
    }

    /** Delivers again, as a consumer would see after a lost commit. */
    void redeliver(String exchange, EventEnvelope envelope) {
        deliver(exchange, envelope);
    }

    private void deliver(String exchange, EventEnvelope envelope) {
        for (QueueWorker worker : bindings.getOrDefault(exchange, List.of())) {
            worker.onMessage(new ConsumerRecord<String, Object>(exchange, 0, offset++, envelope.getCorrelationId(), envelope));
        }
    }

    List<EventEnvelope> published(String eventType) {
        return history.stream()
                .map(Published::envelope)
                .filter(e -> eventType.equals(e.getEventType()))
                .toList();
    }
}
