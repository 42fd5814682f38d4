package com.rater.core;

/**
 * Admission control for named buckets.
 * Every bucket is independent; a key is an opaque name such as a user id,
 * API key or client address.
 */
public interface RateLimiter {

    /**
     * Decide whether a request of {@code config.getCost()} units is admitted
     * now, consuming capacity if it is.
     *
     * @param key bucket name
     * @param config parameters for this call
     * @return verdict with remaining capacity, retry-after and ttl
     * @throws InvalidConfigException if the parameters are out of range
     */
    Decision limit(String key, RateLimitConfig config);

    /**
     * Report the bucket's standing without consuming anything. Never limited.
     *
     * @param key bucket name
     * @param config parameters; the cost is ignored
     * @return verdict as if a zero-cost request had been made
     */
    Decision probe(String key, RateLimitConfig config);

    /**
     * Forget a bucket so its next call sees it fresh.
     * Use carefully - mainly for testing or admin overrides.
     *
     * @param key bucket name
     */
    void reset(String key);
}
