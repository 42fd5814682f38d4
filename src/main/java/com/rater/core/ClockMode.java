package com.rater.core;

import java.util.Locale;

/**
 * Which clock a deployment decides with.
 */
public enum ClockMode {
    /**
     * Wall clock. Limits survive failover; sensitive to clock changes.
     */
    REALTIME,

    /**
     * Monotonic clock. Immune to clock changes; limits reset on failover.
     */
    MONOTONIC;

    public TimeSource timeSource() {
        return this == REALTIME ? new RealtimeTimeSource() : new MonotonicTimeSource();
    }

    public static ClockMode parse(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("clock mode must not be blank");
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException(
                    "Unknown clock mode '" + value + "', expected realtime or monotonic", e);
        }
    }
}
