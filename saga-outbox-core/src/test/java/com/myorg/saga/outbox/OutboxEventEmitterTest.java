package com.myorg.saga.outbox;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.myorg.saga.contracts.core.envelope.EventEnvelope;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class OutboxEventEmitterTest {

    private final List<Object[]> appended = new ArrayList<>();
    private final OutboxWriter writer = (env, exchange, key) -> {
        appended.add(new Object[]{env, exchange, key});
        return appended.size();
    };
    private final OutboxEventEmitter emitter = new OutboxEventEmitter(new ObjectMapper(), writer, "order-service");

    @Test
    void emit_keysRowByCorrelationId() {
        EventEnvelope env = emitter.emit("fulfillment.order", "order.placed", "o-1", Map.of("orderId", "o-1"));

        assertThat(appended).hasSize(1);
        assertThat(appended.get(0)[1]).isEqualTo("fulfillment.order");
        assertThat(appended.get(0)[2]).isEqualTo("o-1");
        assertThat(env.getCorrelationId()).isEqualTo("o-1");
        assertThat(env.getAggregateId()).isEqualTo("o-1");
        assertThat(env.getCausationId()).isNull();
        assertThat(env.getProducer()).isEqualTo("order-service");
        assertThat(env.getPayload().get("orderId").asText()).isEqualTo("o-1");
    }

    @Test
    void emitFollowing_copiesCorrelationAndPointsCausationAtParent() {
        EventEnvelope parent = emitter.emit("fulfillment.order", "order.placed", "o-2", Map.of());

        EventEnvelope next = emitter.emitFollowing(parent, "fulfillment.stock", "stock.reservation.requested", Map.of());

        assertThat(next.getCorrelationId()).isEqualTo("o-2");
        assertThat(next.getCausationId()).isEqualTo(parent.getEventId());
        assertThat(next.getEventId()).isNotEqualTo(parent.getEventId());
        assertThat(appended.get(1)[2]).isEqualTo("o-2");
    }

    @Test
    void emit_rejectsBlankCorrelationId() {
        assertThatThrownBy(() -> emitter.emit("fulfillment.order", "order.placed", " ", Map.of()))
                .isInstanceOf(IllegalArgumentException.class);
        assertThat(appended).isEmpty();
    }
}
