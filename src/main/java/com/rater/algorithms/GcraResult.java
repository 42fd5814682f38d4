package com.rater.algorithms;

import com.rater.core.Decision;
import lombok.Value;

import java.util.OptionalLong;

/**
 * Outcome of one {@link Gcra#decide} call: the verdict to report and, unless
 * the request was limited, the arrival time to persist.
 */
@Value
public class GcraResult {

    Decision decision;

    /**
     * Theoretical arrival time to store with an expiry of {@link #ttlNanos};
     * empty when the request was limited and the stored state must stay as is.
     */
    OptionalLong newArrivalNanos;

    /**
     * Nanoseconds until the bucket is fully idle, never negative.
     */
    long ttlNanos;

    /**
     * Nanoseconds until a retry of the same cost can succeed, or
     * {@link Decision#NOT_APPLICABLE}.
     */
    long retryAfterNanos;

    public boolean shouldPersist() {
        return newArrivalNanos.isPresent();
    }
}
