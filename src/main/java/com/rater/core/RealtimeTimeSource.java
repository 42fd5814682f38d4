package com.rater.core;

import java.time.Clock;
import java.time.Instant;

/**
 * Wall clock, nanoseconds since the Unix epoch.
 *
 * Stored arrival times stay meaningful across process restarts and failover
 * to another node, but an operator changing the system time shifts every
 * bucket with it.
 */
public final class RealtimeTimeSource implements TimeSource {

    private static final long NANOS_PER_SECOND = 1_000_000_000L;

    private final Clock clock;

    public RealtimeTimeSource() {
        this(Clock.systemUTC());
    }

    RealtimeTimeSource(Clock clock) {
        this.clock = clock;
    }

    @Override
    public long nanoTime() {
        Instant now = clock.instant();
        return Math.addExact(Math.multiplyExact(now.getEpochSecond(), NANOS_PER_SECOND), now.getNano());
    }
}
