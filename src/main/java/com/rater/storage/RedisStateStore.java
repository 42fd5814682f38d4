package com.rater.storage;

import lombok.extern.slf4j.Slf4j;
import redis.clients.jedis.Jedis;
import redis.clients.jedis.JedisPool;
import redis.clients.jedis.JedisPoolConfig;
import redis.clients.jedis.exceptions.JedisDataException;
import redis.clients.jedis.params.SetParams;

import java.time.Duration;
import java.util.OptionalLong;
import java.util.concurrent.TimeUnit;

/**
 * Redis-backed bucket state.
 * Each key is a plain string holding the arrival time in decimal nanoseconds,
 * expiring via PX. Conditional writes use WATCH/MULTI/EXEC.
 */
@Slf4j
public class RedisStateStore implements StateStore {

    private static final int MAX_RETRIES = 3;
    private static final long RETRY_DELAY_MS = 10;

    private final JedisPool jedisPool;

    public RedisStateStore(String host, int port) {
        this(new JedisPool(poolConfig(), host, port));
        log.info("Redis state store initialized: {}:{}", host, port);
    }

    RedisStateStore(JedisPool jedisPool) {
        this.jedisPool = jedisPool;
    }

    private static JedisPoolConfig poolConfig() {
        JedisPoolConfig poolConfig = new JedisPoolConfig();
        poolConfig.setMaxTotal(128);
        poolConfig.setMaxIdle(32);
        poolConfig.setMinIdle(16);
        poolConfig.setTestOnBorrow(true);
        poolConfig.setTestOnReturn(true);
        poolConfig.setTestWhileIdle(true);
        poolConfig.setBlockWhenExhausted(true);
        poolConfig.setMaxWait(Duration.ofMillis(2000));
        return poolConfig;
    }

    @Override
    public OptionalLong get(String key) {
        return executeWithRetry(MAX_RETRIES, () -> {
            try (var jedis = jedisPool.getResource()) {
                return read(jedis, key);
            }
        });
    }

    /**
     * Not retried: if EXEC went through but its reply was lost, a second
     * attempt would see our own write as a conflict and the caller would
     * charge the bucket twice.
     */
    @Override
    public boolean compareAndSet(String key, OptionalLong expected, long arrival, long expiry) {
        return executeWithRetry(1, () -> {
            try (var jedis = jedisPool.getResource()) {
                jedis.watch(key);
                OptionalLong current = read(jedis, key);

                if (!current.equals(expected)) {
                    jedis.unwatch();
                    return false;
                }

                var trans = jedis.multi();
                if (expiry > 0) {
                    trans.set(key, String.valueOf(arrival), new SetParams().px(expiry));
                } else {
                    trans.del(key);
                }
                var result = trans.exec();
                return result != null && !result.isEmpty();
            }
        });
    }

    @Override
    public void delete(String key) {
        executeWithRetry(MAX_RETRIES, () -> {
            try (var jedis = jedisPool.getResource()) {
                jedis.del(key);
                return null;
            }
        });
    }

    @Override
    public TimeUnit expiryUnit() {
        return TimeUnit.MILLISECONDS;
    }

    @Override
    public boolean isAvailable() {
        try (var jedis = jedisPool.getResource()) {
            return "PONG".equals(jedis.ping());
        } catch (Exception e) {
            log.warn("Redis health check failed", e);
            return false;
        }
    }

    private static OptionalLong read(Jedis jedis, String key) {
        String raw;
        try {
            raw = jedis.get(key);
        } catch (JedisDataException e) {
            if (e.getMessage() != null && e.getMessage().startsWith("WRONGTYPE")) {
                throw new WrongTypeException(key, e);
            }
            throw e;
        }
        return parse(key, raw);
    }

    static OptionalLong parse(String key, String raw) {
        if (raw == null) {
            return OptionalLong.empty();
        }
        try {
            return OptionalLong.of(Long.parseLong(raw));
        } catch (NumberFormatException e) {
            log.warn("Key {} holds a value that is not an arrival time: {}", key, raw);
            throw new CorruptStateException(key, raw);
        }
    }

    /**
     * Retry wrapper for transient failures. Errors about the data itself
     * are not transient and surface immediately.
     */
    private <T> T executeWithRetry(int attempts, StorageOperation<T> operation) {
        Exception lastException = null;

        for (int i = 0; i < attempts; i++) {
            try {
                return operation.execute();
            } catch (StorageException e) {
                throw e;
            } catch (JedisDataException e) {
                throw new StorageException("Redis rejected the command: " + e.getMessage(), e);
            } catch (Exception e) {
                lastException = e;
                log.warn("Storage operation failed (attempt {}/{}): {}",
                        i + 1, attempts, e.getMessage());

                if (i < attempts - 1) {
                    try {
                        Thread.sleep(RETRY_DELAY_MS * (i + 1));
                    } catch (InterruptedException ie) {
                        Thread.currentThread().interrupt();
                        break;
                    }
                }
            }
        }

        throw new StorageException("Operation failed after " + attempts + " attempt(s)", lastException);
    }

    @FunctionalInterface
    private interface StorageOperation<T> {
        T execute() throws Exception;
    }

    public void close() {
        if (jedisPool != null && !jedisPool.isClosed()) {
            jedisPool.close();
            log.info("Redis connection pool closed");
        }
    }
}
