package com.myorg.saga.fulfillment.orchestrator;

import com.myorg.saga.contracts.core.envelope.EventEnvelope;
import com.myorg.saga.contracts.core.exception.SagaNonRetryableException;
import com.myorg.saga.contracts.fulfillment.FulfillmentEventTypes;
import com.myorg.saga.contracts.fulfillment.events.OrderCancelledEvent;
import com.myorg.saga.contracts.fulfillment.events.OrderConfirmedEvent;
import com.myorg.saga.contracts.fulfillment.events.OrderPlacedEvent;
import com.myorg.saga.contracts.fulfillment.events.StockReservationFailedEvent;
import com.myorg.saga.contracts.fulfillment.events.StockReservationRequestedEvent;
import com.myorg.saga.contracts.fulfillment.events.StockReservationSucceededEvent;
import com.myorg.saga.eventing.SagaEventHandler;
import com.myorg.saga.fulfillment.common.FulfillmentEventEmitter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.time.Clock;
import java.time.Instant;

/**
 * Drives one saga per order. Every handler runs inside the consumer's unit of work, so the
 * saga-state change and the emitted event commit together or not at all.
 *
 * <p>A transition whose compare-and-swap misses (duplicate delivery, late outcome, unknown saga)
 * is acknowledged without emitting anything.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SagaOrchestrator {

    private final SagaStateRepository sagas;
    private final FulfillmentEventEmitter emitter;
    private final Clock clock;

    @SagaEventHandler(value = FulfillmentEventTypes.ORDER_PLACED, payload = OrderPlacedEvent.class)
    public void onOrderPlaced(EventEnvelope env, OrderPlacedEvent placed) {
        String orderId = sagaKey(env, placed.getOrderId());
        Instant now = clock.instant();

        if (!sagas.insertIfAbsent(orderId, env.getEventId(), OrderContext.from(placed), now)) {
            log.info("Saga for order {} already started; duplicate OrderPlaced {} ignored", orderId, env.getEventId());
            return;
        }
        if (!advance(env, orderId, now)) return;

        emitter.emitFollowing(env, SagaTransition.START.emits(), StockReservationRequestedEvent.builder()
                .orderId(orderId)
                .userId(placed.getUserId())
                .items(placed.getItems())
                .build());
    }

    @SagaEventHandler(value = FulfillmentEventTypes.STOCK_RESERVED, payload = StockReservationSucceededEvent.class)
    public void onStockReserved(EventEnvelope env, StockReservationSucceededEvent reserved) {
        String orderId = sagaKey(env, reserved.getOrderId());
        Instant now = clock.instant();
        if (!advance(env, orderId, now)) return;

        OrderContext ctx = context(orderId);
        emitter.emitFollowing(env, SagaTransition.CONFIRM.emits(), OrderConfirmedEvent.builder()
                .orderId(orderId)
                .orderNumber(ctx.getOrderNumber())
                .userId(ctx.getUserId())
                .customerName(ctx.getCustomerName())
                .customerEmail(ctx.getCustomerEmail())
                .phoneNumber(ctx.getPhoneNumber())
                .totalAmount(ctx.getTotalAmount())
                .items(ctx.getItems())
                .build());
    }

    @SagaEventHandler(value = FulfillmentEventTypes.STOCK_RESERVATION_FAILED, payload = StockReservationFailedEvent.class)
    public void onStockReservationFailed(EventEnvelope env, StockReservationFailedEvent failed) {
        String orderId = sagaKey(env, failed.getOrderId());
        Instant now = clock.instant();
        if (!advance(env, orderId, now)) return;

        OrderContext ctx = context(orderId);
        String reason = StringUtils.hasText(failed.getReason()) ? failed.getReason() : OrderCancelledEvent.DEFAULT_REASON;
        emitter.emitFollowing(env, SagaTransition.CANCEL.emits(), OrderCancelledEvent.builder()
                .orderId(orderId)
                .orderNumber(ctx.getOrderNumber())
                .userId(ctx.getUserId())
                .customerName(ctx.getCustomerName())
                .customerEmail(ctx.getCustomerEmail())
                .phoneNumber(ctx.getPhoneNumber())
                .totalAmount(ctx.getTotalAmount())
                .items(ctx.getItems())
                .reason(reason)
                .build());
    }

    private boolean advance(EventEnvelope env, String orderId, Instant now) {
        SagaTransition t = SagaTransition.triggeredBy(env.getEventType())
                .orElseThrow(() -> new SagaNonRetryableException("NO_TRANSITION",
                        "No saga transition for eventType=" + env.getEventType()));

        if (sagas.apply(orderId, t, env.getEventId(), now)) {
            log.info("Saga {} {} -> {} on {}", orderId, t.from(), t.to(), env.getEventType());
            return true;
        }
        String current = sagas.find(orderId).map(s -> s.step().name()).orElse("<none>");
        log.info("Saga {} is {} not {}; {} {} ignored (duplicate or out of order)",
                orderId, current, t.from(), env.getEventType(), env.getEventId());
        return false;
    }

    private OrderContext context(String orderId) {
        return sagas.find(orderId)
                .map(SagaState::context)
                .orElseThrow(() -> new IllegalStateException("Saga " + orderId + " vanished inside its own transaction"));
    }

    // the correlation id is the saga key; a payload naming another order is a producer bug
    private static String sagaKey(EventEnvelope env, String payloadOrderId) {
        String orderId = env.getCorrelationId();
        if (!StringUtils.hasText(orderId)) {
            throw new SagaNonRetryableException("MISSING_CORRELATION_ID", "Event " + env.getEventId() + " has no correlationId");
        }
        if (payloadOrderId != null && !payloadOrderId.equals(orderId)) {
            throw new SagaNonRetryableException("CORRELATION_MISMATCH",
                    "Event " + env.getEventId() + " correlationId=" + orderId + " but payload orderId=" + payloadOrderId);
        }
        return orderId;
    }
}
