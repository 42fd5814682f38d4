package com.rater.core;

import java.util.concurrent.TimeUnit;

/**
 * The one conversion from a nanosecond duration to any coarser unit.
 *
 * Both the ttl reported to callers and the expiry handed to a store go
 * through {@link #convert}, so the key expires when the reported ttl says,
 * measured in the store's own unit. Truncates toward zero, except that
 * {@link #forStore} keeps a positive backlog at one store unit at least.
 */
public final class Expiry {

    private Expiry() {
        // Utility class, no instantiation
    }

    public static long convert(long nanos, TimeUnit unit) {
        return unit.convert(nanos, TimeUnit.NANOSECONDS);
    }

    /**
     * Expiry to hand a store for a bucket with {@code nanos} of backlog.
     * Any backlog keeps the key for at least one store unit, so a ttl finer
     * than the store can express never turns into a delete. Zero means no
     * backlog and the key may go.
     */
    public static long forStore(long nanos, TimeUnit unit) {
        if (nanos <= 0) {
            return 0L;
        }
        return Math.max(1L, convert(nanos, unit));
    }

    public static long toSeconds(long nanos) {
        return convert(nanos, TimeUnit.SECONDS);
    }
}
