package com.rater.core;

import lombok.Value;

/**
 * Verdict reported for one rate limit call, in the order the command has
 * always replied: limited, limit, remaining, retry after, ttl.
 */
@Value
public class Decision {

    /**
     * Reported as retry-after when waiting will not help, or was not needed.
     */
    public static final long NOT_APPLICABLE = -1L;

    boolean limited;

    /**
     * burst + 1
     */
    long limit;

    /**
     * Units still admissible right now, in [0, limit].
     */
    long remaining;

    /**
     * Whole seconds until a retry of the same cost can succeed, or
     * {@link #NOT_APPLICABLE}.
     */
    long retryAfterSeconds;

    /**
     * Whole seconds until the bucket is fully idle again.
     */
    long ttlSeconds;

    public boolean isAllowed() {
        return !limited;
    }

    public boolean hasRetryAfter() {
        return retryAfterSeconds != NOT_APPLICABLE;
    }
}
