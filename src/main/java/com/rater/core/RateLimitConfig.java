package com.rater.core;

import lombok.Builder;
import lombok.Value;

import java.time.Duration;

/**
 * Parameters for one rate limit decision.
 * Built fresh for every call and never persisted; only the bucket's
 * theoretical arrival time lives in the store.
 *
 * Preconditions checked by {@link #validate()}: {@code countPerPeriod > 0},
 * {@code period > 0}, {@code burst >= 0}, {@code cost >= 0}, and every derived
 * nanosecond quantity fits in a signed 64-bit long.
 */
@Value
@Builder(toBuilder = true)
public class RateLimitConfig {

    /**
     * Requests allowed in a single instant beyond the steady rate.
     */
    long burst;

    /**
     * Requests admitted per {@link #period} at the steady rate.
     */
    long countPerPeriod;

    /**
     * Span over which {@link #countPerPeriod} applies
     */
    Duration period;

    /**
     * Units this request consumes; zero probes the bucket without consuming.
     */
    @Builder.Default
    long cost = 1;

    public void validate() {
        if (burst < 0) {
            throw new InvalidConfigException("burst must be non-negative");
        }
        if (countPerPeriod <= 0) {
            throw new InvalidConfigException("countPerPeriod must be positive");
        }
        if (period == null || period.isNegative() || period.isZero()) {
            throw new InvalidConfigException("period must be a positive duration");
        }
        if (cost < 0) {
            throw new InvalidConfigException("cost must be non-negative");
        }
        // Derivations throw on overflow or a zero interval
        getToleranceNanos();
        getIncrementNanos();
    }

    /**
     * @return burst + 1, the most units admissible in one instant
     */
    public long getLimit() {
        try {
            return Math.addExact(burst, 1L);
        } catch (ArithmeticException e) {
            throw new InvalidConfigException("burst too large: " + burst, e);
        }
    }

    /**
     * Nominal spacing between single-unit admissions, truncated toward zero.
     */
    public long getEmissionIntervalNanos() {
        long periodNanos;
        try {
            periodNanos = period.toNanos();
        } catch (ArithmeticException e) {
            throw new InvalidConfigException("period too long to represent in nanoseconds: " + period, e);
        }
        long interval = periodNanos / countPerPeriod;
        if (interval <= 0) {
            throw new InvalidConfigException(
                    "rate of " + countPerPeriod + " per " + period + " is finer than one nanosecond");
        }
        return interval;
    }

    /**
     * Maximum backlog a bucket may carry: emissionInterval * (burst + 1).
     */
    public long getToleranceNanos() {
        long interval = getEmissionIntervalNanos();
        try {
            return Math.multiplyExact(interval, getLimit());
        } catch (ArithmeticException e) {
            throw new InvalidConfigException("burst " + burst + " overflows the tolerance window", e);
        }
    }

    /**
     * Time this request adds to the bucket: emissionInterval * cost.
     */
    public long getIncrementNanos() {
        long interval = getEmissionIntervalNanos();
        try {
            return Math.multiplyExact(interval, cost);
        } catch (ArithmeticException e) {
            throw new InvalidConfigException("cost " + cost + " overflows the increment", e);
        }
    }

    public RateLimitConfig withCost(long cost) {
        return toBuilder().cost(cost).build();
    }

    /**
     * Integer-seconds form used by the request surface.
     */
    public static RateLimitConfig of(long burst, long countPerPeriod, long periodSeconds) {
        if (periodSeconds <= 0) {
            throw new InvalidConfigException("periodSeconds must be positive");
        }
        return RateLimitConfig.builder()
                .burst(burst)
                .countPerPeriod(countPerPeriod)
                .period(Duration.ofSeconds(periodSeconds))
                .build();
    }

    public static RateLimitConfig perSecond(long countPerSecond, long burst) {
        return of(burst, countPerSecond, 1);
    }

    public static RateLimitConfig perMinute(long countPerMinute, long burst) {
        return of(burst, countPerMinute, 60);
    }
}
