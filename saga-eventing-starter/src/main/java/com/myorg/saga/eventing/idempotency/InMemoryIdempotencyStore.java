package com.myorg.saga.eventing.idempotency;

import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.util.Iterator;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

// Single-instance store for dev and tests. A background cleaner evicts expired entries.
@Slf4j
public class InMemoryIdempotencyStore implements IdempotencyStore {

    private enum State { PROCESSING, DONE }

    private record Entry(State state, long expireAtMs, String token) {}

    private final ConcurrentHashMap<String, Entry> entries = new ConcurrentHashMap<>();
    private final String keyPrefix;
    private final Duration doneTtl;
    private final Duration processingTtl;
    private final int maxEntries;
    private final Clock clock;
    private final ScheduledExecutorService cleaner;

    public InMemoryIdempotencyStore(String keyPrefix,
                                    Duration doneTtl,
                                    Duration processingTtl,
                                    int maxEntries,
                                    Duration cleanupInterval,
                                    Clock clock) {
        this.keyPrefix = KeyPrefixes.normalize(keyPrefix);
        this.doneTtl = requirePositive(doneTtl, "doneTtl");
        this.processingTtl = requirePositive(processingTtl, "processingTtl");
        this.maxEntries = Math.max(1000, maxEntries);
        this.clock = clock;

        this.cleaner = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "saga-idempotency-cleaner");
            t.setDaemon(true);
            return t;
        });
        long periodMs = Math.max(1_000L, cleanupInterval.toMillis());
        cleaner.scheduleAtFixedRate(this::cleanupExpiredSafe, periodMs, periodMs, TimeUnit.MILLISECONDS);
    }

    @Override
    public Lease tryBeginProcessing(String eventId, String eventType) {
        String k = keyPrefix + eventId;
        long now = clock.millis();
        String token = UUID.randomUUID().toString();
        Entry fresh = new Entry(State.PROCESSING, now + processingTtl.toMillis(), token);

        while (true) {
            Entry cur = entries.get(k);
            if (cur == null) {
                if (entries.putIfAbsent(k, fresh) == null) {
                    if (entries.size() > maxEntries) trim();
                    return Lease.acquired(token);
                }
                continue;
            }
            if (now > cur.expireAtMs()) {
                entries.remove(k, cur);
                continue;
            }
            return cur.state() == State.DONE ? Lease.duplicate() : Lease.inFlight();
        }
    }

    @Override
    public void markDone(String eventId, String token) {
        long doneExp = clock.millis() + doneTtl.toMillis();
        entries.computeIfPresent(keyPrefix + eventId, (k, cur) ->
                cur.state() == State.PROCESSING && Objects.equals(cur.token(), token)
                        ? new Entry(State.DONE, doneExp, null)
                        : cur);
    }

    @Override
    public void releaseProcessing(String eventId, String token) {
        entries.computeIfPresent(keyPrefix + eventId, (k, cur) ->
                cur.state() == State.PROCESSING && Objects.equals(cur.token(), token) ? null : cur);
    }

    int size() {
        return entries.size();
    }

    private void cleanupExpiredSafe() {
        try {
            cleanupExpired();
        } catch (RuntimeException e) {
            log.warn("Idempotency cleanup failed", e);
        }
    }

    private void cleanupExpired() {
        long now = clock.millis();
        entries.entrySet().removeIf(e -> now > e.getValue().expireAtMs());
    }

    // expired first, then arbitrary entries until back under the cap
    private void trim() {
        cleanupExpired();
        int over = entries.size() - maxEntries;
        Iterator<String> it = entries.keySet().iterator();
        while (over > 0 && it.hasNext()) {
            it.next();
            it.remove();
            over--;
        }
    }

    @Override
    public void close() {
        cleaner.shutdownNow();
    }

    private static Duration requirePositive(Duration d, String name) {
        if (d == null || d.isZero() || d.isNegative()) {
            throw new IllegalArgumentException(name + " must be positive");
        }
        return d;
    }
}
