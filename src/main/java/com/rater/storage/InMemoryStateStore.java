package com.rater.storage;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Expiry;
import com.github.benmanes.caffeine.cache.RemovalCause;
import com.rater.core.TimeSource;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;

import java.util.OptionalLong;
import java.util.concurrent.TimeUnit;

/**
 * Bucket state held in a Caffeine cache. Suitable for single-instance
 * deployments or development/testing; state is lost on restart.
 *
 * Expiry is per entry and measured on the same {@link TimeSource} the
 * limiter decides with. Conditional writes run inside
 * {@code asMap().compute}, which locks only the key being written.
 */
@Slf4j
public class InMemoryStateStore implements StateStore {

    private final TimeSource timeSource;
    private final Cache<String, StoredArrival> cache;

    public InMemoryStateStore(TimeSource timeSource, long maxKeys) {
        if (maxKeys <= 0) {
            throw new IllegalArgumentException("maxKeys must be > 0");
        }
        this.timeSource = timeSource;
        this.cache = Caffeine.newBuilder()
                .ticker(timeSource::nanoTime)
                .executor(Runnable::run)
                .maximumSize(maxKeys)
                .expireAfter(new UntilDeadline())
                .removalListener((String key, StoredArrival value, RemovalCause cause) -> {
                    if (cause == RemovalCause.SIZE) {
                        log.warn("Evicted live bucket {} at capacity {}", key, maxKeys);
                    }
                })
                .build();
        log.info("In-memory state store initialized: maxKeys={}", maxKeys);
    }

    @Override
    public OptionalLong get(String key) {
        StoredArrival stored = cache.getIfPresent(key);
        return stored == null ? OptionalLong.empty() : OptionalLong.of(stored.getArrival());
    }

    @Override
    public boolean compareAndSet(String key, OptionalLong expected, long arrival, long expiry) {
        long now = timeSource.nanoTime();
        boolean[] written = new boolean[1];

        cache.asMap().compute(key, (k, current) -> {
            OptionalLong currentArrival = current == null
                    ? OptionalLong.empty()
                    : OptionalLong.of(current.getArrival());
            if (!currentArrival.equals(expected)) {
                return current;
            }
            written[0] = true;
            return expiry > 0 ? new StoredArrival(arrival, now + expiry) : null;
        });

        return written[0];
    }

    @Override
    public void delete(String key) {
        cache.invalidate(key);
    }

    @Override
    public TimeUnit expiryUnit() {
        return TimeUnit.NANOSECONDS;
    }

    @Override
    public boolean isAvailable() {
        return true;
    }

    /**
     * Number of live buckets. Useful for monitoring and testing.
     */
    public long size() {
        cache.cleanUp();
        return cache.estimatedSize();
    }

    @Value
    private static class StoredArrival {
        long arrival;
        long deadlineNanos;
    }

    /**
     * Expires each entry at its absolute deadline, so rewriting an entry
     * unchanged keeps its original expiry.
     */
    private static final class UntilDeadline implements Expiry<String, StoredArrival> {

        @Override
        public long expireAfterCreate(String key, StoredArrival value, long currentTime) {
            return Math.max(0L, value.getDeadlineNanos() - currentTime);
        }

        @Override
        public long expireAfterUpdate(String key, StoredArrival value, long currentTime, long currentDuration) {
            return Math.max(0L, value.getDeadlineNanos() - currentTime);
        }

        @Override
        public long expireAfterRead(String key, StoredArrival value, long currentTime, long currentDuration) {
            return currentDuration;
        }
    }
}
