package com.myorg.saga.eventing.idempotency;

import org.junit.jupiter.api.Test;
import org.springframework.data.redis.core.StringRedisTemplate;

import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class RedisIdempotencyStoreTest {

    private static final List<String> KEY = List.of("saga:idemp:order-service:e-1");

    private final StringRedisTemplate redis = mock(StringRedisTemplate.class);
    private final RedisIdempotencyStore store = new RedisIdempotencyStore(
            redis, Duration.ofHours(24), Duration.ofMinutes(5), "saga:idemp:order-service");

    @Test
    void freshKeyIsAcquiredWithAProcessingLease() {
        beginAnswers(0L);

        IdempotencyStore.Lease lease = store.tryBeginProcessing("e-1", "order.placed");

        assertThat(lease.decision()).isEqualTo(IdempotencyStore.Decision.ACQUIRED);
        assertThat(lease.token()).isNotBlank();
        verify(redis).execute(eq(RedisIdempotencyStore.BEGIN), eq(KEY),
                eq("P:" + lease.token()), eq("300000"), eq("D"));
    }

    @Test
    void doneKeyIsDuplicate() {
        beginAnswers(1L);

        IdempotencyStore.Lease lease = store.tryBeginProcessing("e-1", "order.placed");

        assertThat(lease.decision()).isEqualTo(IdempotencyStore.Decision.DUPLICATE);
        assertThat(lease.token()).isNull();
    }

    @Test
    void leaseHeldElsewhereIsInFlight() {
        beginAnswers(2L);

        assertThat(store.tryBeginProcessing("e-1", "order.placed").decision())
                .isEqualTo(IdempotencyStore.Decision.IN_FLIGHT);
    }

    @Test
    void missingReplyIsTreatedAsInFlight() {
        beginAnswers(null);

        assertThat(store.tryBeginProcessing("e-1", "order.placed").decision())
                .isEqualTo(IdempotencyStore.Decision.IN_FLIGHT);
    }

    @Test
    void markDoneSwapsTheOwnedLeaseForTheDoneMark() {
        store.markDone("e-1", "tok-1");

        verify(redis).execute(eq(RedisIdempotencyStore.COMPLETE), eq(KEY), eq("P:tok-1"), eq("D"), eq("86400000"));
    }

    @Test
    void releaseDropsOnlyTheOwnedLease() {
        store.releaseProcessing("e-1", "tok-1");

        verify(redis).execute(eq(RedisIdempotencyStore.RELEASE), eq(KEY), eq("P:tok-1"));
    }

    @Test
    void nonPositiveTtlIsRejected() {
        assertThatThrownBy(() -> new RedisIdempotencyStore(redis, Duration.ZERO, Duration.ofMinutes(5), "p"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("done TTL");
    }

    private void beginAnswers(Long answer) {
        when(redis.execute(eq(RedisIdempotencyStore.BEGIN), eq(KEY), any(), any(), any())).thenReturn(answer);
    }
}
