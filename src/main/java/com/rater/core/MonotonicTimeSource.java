package com.rater.core;

/**
 * Monotonic clock backed by {@link System#nanoTime()}.
 *
 * Immune to wall clock changes. The reference point is per JVM, so state
 * written by another process (or before a restart) is not comparable; only
 * use it with a store whose lifetime matches the process, or accept that
 * limits reset on failover.
 */
public final class MonotonicTimeSource implements TimeSource {

    @Override
    public long nanoTime() {
        return System.nanoTime();
    }
}
