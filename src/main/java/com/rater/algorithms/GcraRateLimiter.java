package com.rater.algorithms;

import com.rater.core.Decision;
import com.rater.core.Expiry;
import com.rater.core.RateLimitConfig;
import com.rater.core.RateLimiter;
import com.rater.core.TimeSource;
import com.rater.storage.StateConflictException;
import com.rater.storage.StateStore;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;

/**
 * GCRA rate limiter over a {@link StateStore}.
 *
 * Each call reads the bucket's arrival time, runs {@link Gcra#decide} and,
 * unless the request was limited, writes the new arrival time back with a
 * compare-and-set against the value it read. A lost race re-reads and
 * decides again, so decisions on one key behave as if serialized while
 * different keys never wait on each other.
 *
 * Limited requests write nothing. If a call is abandoned between the read
 * and the write, the bucket keeps its previous state.
 */
@Slf4j
public class GcraRateLimiter implements RateLimiter {

    public static final int DEFAULT_MAX_ATTEMPTS = 16;

    private final StateStore store;
    private final TimeSource timeSource;
    private final int maxAttempts;

    // Metrics
    private final Counter admittedRequests;
    private final Counter limitedRequests;
    private final Counter probes;
    private final Counter conflicts;

    public GcraRateLimiter(StateStore store, TimeSource timeSource, MeterRegistry meterRegistry) {
        this(store, timeSource, meterRegistry, DEFAULT_MAX_ATTEMPTS);
    }

    public GcraRateLimiter(
            StateStore store,
            TimeSource timeSource,
            MeterRegistry meterRegistry,
            int maxAttempts) {

        if (store == null) {
            throw new IllegalArgumentException("store cannot be null");
        }
        if (timeSource == null) {
            throw new IllegalArgumentException("timeSource cannot be null");
        }
        if (maxAttempts <= 0) {
            throw new IllegalArgumentException("maxAttempts must be > 0");
        }

        this.store = store;
        this.timeSource = timeSource;
        this.maxAttempts = maxAttempts;

        this.admittedRequests = Counter.builder("rater.requests.admitted")
                .description("Requests admitted")
                .register(meterRegistry);

        this.limitedRequests = Counter.builder("rater.requests.limited")
                .description("Requests limited")
                .register(meterRegistry);

        this.probes = Counter.builder("rater.requests.probes")
                .description("Zero-cost requests that only report bucket state")
                .register(meterRegistry);

        this.conflicts = Counter.builder("rater.store.conflicts")
                .description("Conditional writes lost to a concurrent update of the same key")
                .register(meterRegistry);
    }

    @Override
    public Decision limit(String key, RateLimitConfig config) {
        if (key == null || key.isEmpty()) {
            throw new IllegalArgumentException("key cannot be empty");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        config.validate();

        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            var stored = store.get(key);
            long now = timeSource.nanoTime();

            var result = Gcra.decide(stored, config, now);
            var decision = result.getDecision();

            log.trace("GCRA for {}: stored={}, now={}, cost={}, limited={}, remaining={}, ttlNanos={}",
                    key, stored, now, config.getCost(), decision.isLimited(),
                    decision.getRemaining(), result.getTtlNanos());

            if (!result.shouldPersist()) {
                record(config, decision);
                return decision;
            }

            long expiry = Expiry.forStore(result.getTtlNanos(), store.expiryUnit());
            if (store.compareAndSet(key, stored, result.getNewArrivalNanos().getAsLong(), expiry)) {
                record(config, decision);
                return decision;
            }

            conflicts.increment();
            log.debug("Concurrent update of {} (attempt {}/{}), deciding again", key, attempt, maxAttempts);
        }

        throw new StateConflictException(key, maxAttempts);
    }

    @Override
    public Decision probe(String key, RateLimitConfig config) {
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        return limit(key, config.withCost(0));
    }

    @Override
    public void reset(String key) {
        store.delete(key);
        log.debug("Reset rate limit for key: {}", key);
    }

    private void record(RateLimitConfig config, Decision decision) {
        if (config.getCost() == 0) {
            probes.increment();
        } else if (decision.isLimited()) {
            limitedRequests.increment();
        } else {
            admittedRequests.increment();
        }
    }
}
