package com.rater.core;

/**
 * Source of the current instant, in nanoseconds.
 *
 * Injected everywhere a decision needs "now" so tests can drive time
 * deterministically and deployments can pick the clock that fits them.
 */
@FunctionalInterface
public interface TimeSource {

    /**
     * @return current instant as a signed count of nanoseconds since the
     *         source's reference point
     */
    long nanoTime();
}
