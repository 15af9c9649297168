package com.myorg.saga.eventing.context;

/**
 * Thread-local marker set by the idempotency decorator (duplicate / in-flight) and read by
 * the observability decorator around it.
 */
public final class SagaDispatchOutcome {

    public static final String DUPLICATE = "duplicate";
    public static final String IN_FLIGHT = "in_flight";

    private static final ThreadLocal<String> OUTCOME = new ThreadLocal<>();

    private SagaDispatchOutcome() {}

    public static void markDuplicate() {
        OUTCOME.set(DUPLICATE);
    }

    public static void markInFlight() {
        OUTCOME.set(IN_FLIGHT);
    }

    /** Read and clear. */
    public static String consume() {
        String v = OUTCOME.get();
        OUTCOME.remove();
        return v;
    }

    public static void clear() {
        OUTCOME.remove();
    }
}
