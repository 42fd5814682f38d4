package com.rater.algorithms;

import com.rater.core.Decision;
import com.rater.core.Expiry;
import com.rater.core.InvalidConfigException;
import com.rater.core.RateLimitConfig;

import java.util.OptionalLong;

/**
 * Generic Cell Rate Algorithm.
 *
 * A bucket is a single timestamp, the theoretical arrival time (TAT): the
 * instant the bucket would be caught up if requests had arrived exactly at
 * the configured rate. Each admitted unit pushes the TAT forward by one
 * emission interval; a request is admitted while the pushed TAT stays
 * within the tolerance of now.
 *
 * If you like leaky buckets, the emission interval is how often the bucket
 * leaks one unit and the tolerance is the size of the bucket.
 *
 * Example: burst=2, 10 per second. Emission interval 100ms, tolerance 300ms.
 * Three calls at t=0 are admitted with remaining 2, 1, 0 and leave the TAT at
 * 300ms; a fourth at t=0 would push it to 400ms, 100ms past the tolerance,
 * so it is limited.
 *
 * Pure and stateless: safe to call from any thread. Callers own the stored
 * TAT and must serialize read-decide-write per key.
 */
public final class Gcra {

    private Gcra() {
        // Utility class, no instantiation
    }

    /**
     * Decide one request.
     *
     * @param storedArrival TAT read from the store; empty or zero for a fresh bucket
     * @param config validated parameters (see {@link RateLimitConfig#validate()})
     * @param now current instant in nanoseconds, same reference as the stored TAT
     * @return verdict plus the TAT to persist, if any
     * @throws InvalidConfigException if an admitted TAT does not fit in a long
     */
    public static GcraResult decide(OptionalLong storedArrival, RateLimitConfig config, long now) {
        long emissionInterval = config.getEmissionIntervalNanos();
        long tolerance = config.getToleranceNanos();
        long increment = config.getIncrementNanos();

        long tat = storedArrival.orElse(0L);
        if (tat == 0L) {
            tat = now;
        }

        // Backlog already queued ahead of now; zero for an idle bucket
        long backlog = Math.max(now, tat) - now;
        long slack = tolerance - increment;

        boolean limited;
        long ttl;
        long retryAfter = Decision.NOT_APPLICABLE;
        OptionalLong persist;

        // Same test as now < newTat - tolerance, without forming a TAT that may not fit
        if (increment > tolerance || backlog > slack) {
            limited = true;
            ttl = backlog;
            if (increment <= tolerance) {
                retryAfter = backlog - slack;
            }
            persist = OptionalLong.empty();
        } else {
            limited = false;
            ttl = backlog + increment;
            try {
                persist = OptionalLong.of(Math.addExact(now, ttl));
            } catch (ArithmeticException e) {
                throw new InvalidConfigException(
                        "arrival time overflows: " + ttl + "ns past " + now, e);
            }
        }

        long headroom = tolerance - ttl;
        long remaining = headroom > -emissionInterval ? headroom / emissionInterval : 0L;

        Decision decision = new Decision(
                limited,
                config.getLimit(),
                remaining,
                retryAfter == Decision.NOT_APPLICABLE ? Decision.NOT_APPLICABLE : Expiry.toSeconds(retryAfter),
                Expiry.toSeconds(ttl));

        return new GcraResult(decision, persist, ttl, retryAfter);
    }
}
