package com.myorg.saga.fulfillment.inventory;

import com.myorg.saga.contracts.core.exception.SagaNonRetryableException;
import com.myorg.saga.contracts.fulfillment.events.FailedLineItem;
import com.myorg.saga.contracts.fulfillment.events.OrderLineItem;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeSet;

/**
 * All-or-nothing stock reservation.
 *
 * <p>The requested products are locked with {@code SELECT ... FOR UPDATE} in ascending id order,
 * checked, and only then decremented, all in one transaction. Two concurrent requests for the same
 * product serialize on the row lock, and the fixed lock order rules out deadlocks between them.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ReservationService {

    private final ProductRepository products;
    private final ReservationRepository reservations;
    private final TransactionTemplate tx;
    private final Clock clock;

    /**
     * Decide and apply the reservation for {@code orderId}. Joins the caller's transaction when
     * there is one.
     *
     * @return the new outcome, or empty when this order was already decided (redelivery)
     */
    public Optional<ReservationOutcome> reserve(String orderId, List<OrderLineItem> items) {
        return tx.execute(status -> {
            Optional<ReservationOutcome> previous = reservations.findByOrderId(orderId);
            if (previous.isPresent()) {
                log.info("Reservation for order {} already decided (success={}); not applied again",
                        orderId, previous.get().success());
                return Optional.empty();
            }

            ReservationOutcome outcome = decide(items);
            reservations.insert(orderId, outcome, clock.instant());
            if (outcome.success()) {
                log.info("Reserved stock for order {}: {} line(s)", orderId, items.size());
            } else {
                log.info("Reservation rejected for order {}: {} {}", orderId, outcome.reason(), outcome.failedItems());
            }
            return Optional.of(outcome);
        });
    }

    private ReservationOutcome decide(List<OrderLineItem> items) {
        if (items == null || items.isEmpty()) {
            return ReservationOutcome.rejected(ReservationOutcome.NO_ITEMS, List.of());
        }

        // same product on several lines counts once, with the summed quantity; first-seen order kept
        Map<String, Integer> requested = new LinkedHashMap<>();
        for (OrderLineItem item : items) {
            if (item.getQuantity() <= 0) {
                throw new SagaNonRetryableException("INVALID_PAYLOAD",
                        "Non-positive quantity " + item.getQuantity() + " for product " + item.getProductId());
            }
            requested.merge(item.getProductId(), item.getQuantity(), Integer::sum);
        }

        Map<String, Integer> available = products.lockStock(new TreeSet<>(requested.keySet()));

        List<FailedLineItem> failed = new ArrayList<>();
        requested.forEach((productId, qty) -> {
            Integer stock = available.get(productId);
            if (stock == null) {
                failed.add(new FailedLineItem(productId, qty, 0, ReservationOutcome.PRODUCT_NOT_FOUND));
            } else if (stock < qty) {
                failed.add(new FailedLineItem(productId, qty, stock, ReservationOutcome.INSUFFICIENT_STOCK));
            }
        });
        if (!failed.isEmpty()) {
            return ReservationOutcome.rejected(failed.get(0).getReason(), failed);
        }

        Instant now = clock.instant();
        for (String productId : new TreeSet<>(requested.keySet())) {
            int qty = requested.get(productId);
            if (products.decrement(productId, qty, now) != 1) {
                // impossible while the row lock is held; roll back everything rather than reserve partially
                throw new IllegalStateException("Stock of " + productId + " changed under lock");
            }
        }
        return ReservationOutcome.reserved();
    }
}
