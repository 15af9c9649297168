package com.myorg.saga.fulfillment.inventory;

import com.myorg.saga.contracts.fulfillment.events.FailedLineItem;

import java.util.List;

/**
 * Result of one all-or-nothing reservation. {@code success} implies no failed items and every
 * line decremented; a failure implies no stock was touched.
 */
public record ReservationOutcome(boolean success, String reason, List<FailedLineItem> failedItems) {

    public static final String NO_ITEMS = "no items provided";
    public static final String PRODUCT_NOT_FOUND = "product not found";
    public static final String INSUFFICIENT_STOCK = "insufficient stock";

    public ReservationOutcome {
        failedItems = failedItems == null ? List.of() : List.copyOf(failedItems);
        if (success && !failedItems.isEmpty()) {
            throw new IllegalArgumentException("successful reservation cannot carry failed items");
        }
    }

    public static ReservationOutcome reserved() {
        return new ReservationOutcome(true, null, List.of());
    }

    public static ReservationOutcome rejected(String reason, List<FailedLineItem> failedItems) {
        return new ReservationOutcome(false, reason, failedItems);
    }
}
