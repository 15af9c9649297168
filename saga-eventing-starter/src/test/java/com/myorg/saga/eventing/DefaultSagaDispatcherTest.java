package com.myorg.saga.eventing;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.myorg.saga.contracts.core.envelope.EnvelopeBuilder;
import com.myorg.saga.contracts.core.envelope.EventEnvelope;
import com.myorg.saga.contracts.core.exception.SagaNonRetryableException;
import com.myorg.saga.eventing.exception.UnknownEventTypeException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DefaultSagaDispatcherTest {

    private final ObjectMapper mapper = new ObjectMapper();
    private HandlerRegistry registry;
    private Handlers handlers;

    @BeforeEach
    void setUp() {
        registry = new HandlerRegistry();
        handlers = new Handlers();
        new SagaHandlerScanner(null, registry, mapper).register(handlers);
    }

    @Test
    void payloadOnlyHandlerReceivesTypedPayload() {
        new DefaultSagaDispatcher(registry, false).dispatch(envelope("order.placed", Map.of("orderId", "o-7")));

        assertThat(handlers.placed).containsExactly("o-7");
    }

    @Test
    void envelopeHandlerSeesCorrelationId() {
        new DefaultSagaDispatcher(registry, false).dispatch(envelope("order.cancelled", Map.of("orderId", "o-8")));

        assertThat(handlers.cancelledCorrelations).containsExactly("o-8");
    }

    @Test
    void unknownEventTypeIsNonRetryable() {
        DefaultSagaDispatcher dispatcher = new DefaultSagaDispatcher(registry, false);

        assertThatThrownBy(() -> dispatcher.dispatch(envelope("payment.captured", Map.of())))
                .isInstanceOf(UnknownEventTypeException.class)
                .extracting(e -> ((SagaNonRetryableException) e).getReason())
                .isEqualTo("UNKNOWN_EVENT_TYPE");
    }

    @Test
    void unknownEventTypeCanBeIgnored() {
        DefaultSagaDispatcher dispatcher = new DefaultSagaDispatcher(registry, true);

        assertThatCode(() -> dispatcher.dispatch(envelope("payment.captured", Map.of()))).doesNotThrowAnyException();
    }

    @Test
    void envelopeWithoutCorrelationIdIsRejected() {
        DefaultSagaDispatcher dispatcher = new DefaultSagaDispatcher(registry, true);
        EventEnvelope env = envelope("order.placed", Map.of("orderId", "o-7")).toBuilder().correlationId(" ").build();

        assertThatThrownBy(() -> dispatcher.dispatch(env))
                .isInstanceOf(SagaNonRetryableException.class)
                .hasMessageContaining("correlationId")
                .extracting(e -> ((SagaNonRetryableException) e).getReason())
                .isEqualTo(DefaultSagaDispatcher.INVALID_ENVELOPE);
        assertThat(handlers.placed).isEmpty();
    }

    @Test
    void handlerExceptionIsRethrownUnwrapped() {
        DefaultSagaDispatcher dispatcher = new DefaultSagaDispatcher(registry, false);

        assertThatThrownBy(() -> dispatcher.dispatch(envelope("stock.reservation.failed", Map.of("orderId", "o-9"))))
                .isInstanceOf(IllegalStateException.class)
                .hasMessage("db down");
    }

    @Test
    void secondHandlerForSameTypeIsRejected() {
        assertThatThrownBy(() -> new SagaHandlerScanner(null, registry, mapper).register(new DuplicateHandler()))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("order.placed");
    }

    private EventEnvelope envelope(String type, Object payload) {
        return EnvelopeBuilder.wrap(mapper, type, 1, "o-x", "o-8", null, "test", payload);
    }

    static class Handlers {
        final List<String> placed = new ArrayList<>();
        final List<String> cancelledCorrelations = new ArrayList<>();

        @SagaEventHandler(value = "order.placed", payload = OrderRef.class)
        public void onPlaced(OrderRef ref) {
            placed.add(ref.orderId);
        }

        @SagaEventHandler(value = "order.cancelled", payload = OrderRef.class)
        public void onCancelled(EventEnvelope env, OrderRef ref) {
            cancelledCorrelations.add(env.getCorrelationId());
        }

        @SagaEventHandler(value = "stock.reservation.failed", payload = OrderRef.class)
        public void onFailed(OrderRef ref) {
            throw new IllegalStateException("db down");
        }
    }

    static class DuplicateHandler {
        @SagaEventHandler(value = "order.placed", payload = OrderRef.class)
        public void again(OrderRef ref) {
        }
    }

    static class OrderRef {
        public String orderId;
    }
}
