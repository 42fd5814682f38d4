package com.rater.storage;

import java.util.OptionalLong;
import java.util.concurrent.TimeUnit;

/**
 * Holds one theoretical arrival time per bucket key, with an expiry.
 * Allows swapping backends without changing rate limiter logic.
 *
 * Writes are conditional on the value read, so two callers racing on the
 * same key serialize: one wins, the other re-reads and decides again.
 * Different keys never contend.
 */
public interface StateStore {

    /**
     * Read a bucket's arrival time.
     *
     * @param key bucket key
     * @return stored nanosecond timestamp, or empty if the key is absent or expired
     * @throws CorruptStateException if the stored value is not a timestamp
     * @throws WrongTypeException if the key holds another kind of value
     * @throws StorageException if the backend is unreachable
     */
    OptionalLong get(String key);

    /**
     * Store {@code arrival} only if the key still holds {@code expected}
     * (empty meaning absent). A non-positive {@code expiry} removes the key
     * instead, which leaves the bucket fresh.
     *
     * @param key bucket key
     * @param expected value previously returned by {@link #get}
     * @param arrival new nanosecond timestamp
     * @param expiry time to live, in {@link #expiryUnit()}
     * @return true if written, false if another writer got there first
     */
    boolean compareAndSet(String key, OptionalLong expected, long arrival, long expiry);

    /**
     * Delete a key
     */
    void delete(String key);

    /**
     * Unit the backend expresses expiries in.
     */
    TimeUnit expiryUnit();

    /**
     * Health check
     */
    boolean isAvailable();
}
