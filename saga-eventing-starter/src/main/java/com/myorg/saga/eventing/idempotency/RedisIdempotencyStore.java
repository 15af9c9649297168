package com.myorg.saga.eventing.idempotency;

import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.script.DefaultRedisScript;
import org.springframework.data.redis.core.script.RedisScript;

import java.time.Duration;
import java.util.List;
import java.util.UUID;

/**
 * Idempotency marks shared by every instance of a service.
 *
 * <p>A key {@code <prefix><eventId>} holds {@code P:<token>} while a consumer owns the event
 * (expires after the processing TTL, so a crashed consumer does not block it forever) and
 * {@code D} once it is handled (expires after the done TTL). Every transition is one Lua script.
 */
@Slf4j
public class RedisIdempotencyStore implements IdempotencyStore {

    static final String LEASE_PREFIX = "P:";
    static final String DONE = "D";

    static final long BEGIN_ACQUIRED = 0L;
    static final long BEGIN_DUPLICATE = 1L;

    static final RedisScript<Long> BEGIN = new DefaultRedisScript<>("""
            if redis.call('SET', KEYS[1], ARGV[1], 'NX', 'PX', ARGV[2]) then
              return 0
            end
            if redis.call('GET', KEYS[1]) == ARGV[3] then
              return 1
            end
            return 2
            """, Long.class);

    // only the lease owner may complete or drop it
    static final RedisScript<Long> COMPLETE = new DefaultRedisScript<>("""
            if redis.call('GET', KEYS[1]) ~= ARGV[1] then
              return 0
            end
            redis.call('SET', KEYS[1], ARGV[2], 'PX', ARGV[3])
            return 1
            """, Long.class);

    static final RedisScript<Long> RELEASE = new DefaultRedisScript<>("""
            if redis.call('GET', KEYS[1]) ~= ARGV[1] then
              return 0
            end
            return redis.call('DEL', KEYS[1])
            """, Long.class);

    private final StringRedisTemplate redis;
    private final Duration doneTtl;
    private final Duration processingTtl;
    private final String keyPrefix;

    public RedisIdempotencyStore(StringRedisTemplate redis, Duration doneTtl, Duration processingTtl, String keyPrefix) {
        requirePositive("done TTL", doneTtl);
        requirePositive("processing TTL", processingTtl);
        this.redis = redis;
        this.doneTtl = doneTtl;
        this.processingTtl = processingTtl;
        this.keyPrefix = KeyPrefixes.normalize(keyPrefix);
    }

    @Override
    public Lease tryBeginProcessing(String eventId, String eventType) {
        String token = UUID.randomUUID().toString();
        Long answer = redis.execute(BEGIN, key(eventId),
                LEASE_PREFIX + token, String.valueOf(processingTtl.toMillis()), DONE);

        if (answer == null) {
            // no reply: treat as held elsewhere, the record is redelivered
            log.warn("Redis returned no answer for eventId={} type={}", eventId, eventType);
            return Lease.inFlight();
        }
        if (answer == BEGIN_ACQUIRED) return Lease.acquired(token);
        if (answer == BEGIN_DUPLICATE) return Lease.duplicate();
        return Lease.inFlight();
    }

    @Override
    public void markDone(String eventId, String token) {
        Long changed = redis.execute(COMPLETE, key(eventId),
                LEASE_PREFIX + token, DONE, String.valueOf(doneTtl.toMillis()));
        if (changed == null || changed == 0L) {
            log.warn("Lease for eventId={} was no longer held when marking it done", eventId);
        }
    }

    @Override
    public void releaseProcessing(String eventId, String token) {
        redis.execute(RELEASE, key(eventId), LEASE_PREFIX + token);
    }

    private List<String> key(String eventId) {
        return List.of(keyPrefix + eventId);
    }

    private static void requirePositive(String name, Duration ttl) {
        if (ttl == null || ttl.isNegative() || ttl.isZero()) {
            throw new IllegalArgumentException("Idempotency " + name + " must be positive, got " + ttl);
        }
    }
}
