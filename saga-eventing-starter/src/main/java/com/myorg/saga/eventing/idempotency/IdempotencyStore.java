package com.myorg.saga.eventing.idempotency;

/**
 * Remembers which eventIds a service has handled.
 *
 * <p>Protocol: {@link #tryBeginProcessing} before the handler, then {@link #markDone} on success
 * or {@link #releaseProcessing} on failure.
 */
public interface IdempotencyStore extends AutoCloseable {

    enum Decision {
        /** This caller may process the event now. */
        ACQUIRED,
        /** Already handled. */
        DUPLICATE,
        /** Another consumer holds the processing lease. */
        IN_FLIGHT
    }

    record Lease(Decision decision, String token) {
        public static Lease acquired(String token) { return new Lease(Decision.ACQUIRED, token); }
        public static Lease duplicate() { return new Lease(Decision.DUPLICATE, null); }
        public static Lease inFlight() { return new Lease(Decision.IN_FLIGHT, null); }
    }

    Lease tryBeginProcessing(String eventId, String eventType);

    void markDone(String eventId, String token);

    void releaseProcessing(String eventId, String token);

    @Override
    default void close() {
    }
}
