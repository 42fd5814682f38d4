package com.rater.storage;

import com.rater.algorithms.GcraRateLimiter;
import com.rater.core.Decision;
import com.rater.core.RateLimitConfig;
import com.rater.core.RealtimeTimeSource;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.EnabledIfEnvironmentVariable;
import redis.clients.jedis.Jedis;

import java.util.OptionalLong;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Runs against a real Redis:
 *   docker run -d -p 6379:6379 redis:alpine
 *
 * Enable with: export REDIS_TESTS=true
 */
@EnabledIfEnvironmentVariable(named = "REDIS_TESTS", matches = "true")
class RedisStateStoreIntegrationTest {

    private static RedisStateStore store;

    private String key;

    @BeforeAll
    static void setup() {
        store = new RedisStateStore("localhost", 6379);
        if (!store.isAvailable()) {
            throw new IllegalStateException("Redis not available. Start with: docker run -p 6379:6379 redis:alpine");
        }
    }

    @AfterAll
    static void teardown() {
        store.close();
    }

    @BeforeEach
    void newKey() {
        key = "rater-test:" + UUID.randomUUID();
    }

    @Test
    void compareAndSetRoundTrip() {
        assertTrue(store.compareAndSet(key, OptionalLong.empty(), 123L, 60_000L));
        assertEquals(OptionalLong.of(123L), store.get(key));
        assertFalse(store.compareAndSet(key, OptionalLong.empty(), 456L, 60_000L));

        try (Jedis jedis = new Jedis("localhost", 6379)) {
            long pttl = jedis.pttl(key);
            assertTrue(pttl > 0 && pttl <= 60_000L);
        }
        store.delete(key);
        assertEquals(OptionalLong.empty(), store.get(key));
    }

    @Test
    void rejectsForeignData() {
        try (Jedis jedis = new Jedis("localhost", 6379)) {
            jedis.set(key, "hello");
            assertThrows(CorruptStateException.class, () -> store.get(key));

            jedis.del(key);
            jedis.hset(key, "field", "value");
            assertThrows(WrongTypeException.class, () -> store.get(key));
            jedis.del(key);
        }
    }

    @Test
    void limiterExhaustsBurst() {
        GcraRateLimiter limiter = new GcraRateLimiter(store, new RealtimeTimeSource(), new SimpleMeterRegistry());
        RateLimitConfig config = RateLimitConfig.of(2, 1, 60);

        for (int i = 0; i < 3; i++) {
            assertFalse(limiter.limit(key, config).isLimited(), "call " + (i + 1));
        }
        Decision limited = limiter.limit(key, config);
        assertTrue(limited.isLimited());
        assertTrue(limited.getRetryAfterSeconds() > 0);

        limiter.reset(key);
    }
}
