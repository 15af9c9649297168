package com.myorg.saga.fulfillment.order;

/**
 * Order lifecycle. Moves strictly forward by rank; CONFIRMED and CANCELLED are terminal
 * and nothing leaves them.
 */
public enum OrderStatus {
    PLACED(0),
    RESERVATION_PENDING(1),
    CONFIRMED(2),
    CANCELLED(2);

    private final int rank;

    OrderStatus(int rank) {
        this.rank = rank;
    }

    public boolean isTerminal() {
        return this == CONFIRMED || this == CANCELLED;
    }

    public boolean canMoveTo(OrderStatus next) {
        return !isTerminal() && next.rank > rank;
    }
}
