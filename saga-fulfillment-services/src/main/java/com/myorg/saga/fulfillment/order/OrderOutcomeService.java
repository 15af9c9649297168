package com.myorg.saga.fulfillment.order;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;

/**
 * Applies saga outcomes to the order aggregate. Runs inside the caller's transaction
 * (the consumer unit of work).
 *
 * <p>Read status, decide, then update conditionally on the status read. A missing order or an
 * update that matched no row throws, so the message is redelivered and finally dead-lettered.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class OrderOutcomeService {

    static final String ORCHESTRATOR_ACTOR = "orchestrator";
    static final String ORDER_SERVICE_ACTOR = "order-service";

    private final OrderRepository orders;
    private final Clock clock;

    /** Compensation. @return true when the order moved to CANCELLED now */
    public boolean cancel(String orderId, String reason) {
        return moveTo(orderId, OrderStatus.CANCELLED, reason, ORCHESTRATOR_ACTOR);
    }

    public boolean confirm(String orderId) {
        return moveTo(orderId, OrderStatus.CONFIRMED, null, ORCHESTRATOR_ACTOR);
    }

    public boolean markReservationPending(String orderId) {
        return moveTo(orderId, OrderStatus.RESERVATION_PENDING, null, ORDER_SERVICE_ACTOR);
    }

    private boolean moveTo(String orderId, OrderStatus target, String remarks, String actor) {
        OrderStatus current = orders.findStatus(orderId).orElseThrow(() -> new OrderNotFoundException(orderId));

        if (current == target) {
            log.debug("Order {} already {}", orderId, target);
            return false;
        }
        if (!current.canMoveTo(target)) {
            if (current.isTerminal()) {
                log.warn("Order {} is terminal {}; {} ignored", orderId, current, target);
            } else {
                log.info("Order {} is {}; stale {} ignored", orderId, current, target);
            }
            return false;
        }

        int updated = orders.updateStatus(orderId, current, target, remarks, actor, clock.instant());
        if (updated != 1) {
            throw new IllegalStateException("Order " + orderId + " changed concurrently while moving "
                    + current + " -> " + target);
        }
        log.info("Order {} {} -> {}{}", orderId, current, target, remarks == null ? "" : " (" + remarks + ")");
        return true;
    }
}
