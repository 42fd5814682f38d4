package com.rater.config;

import com.rater.algorithms.GcraRateLimiter;
import com.rater.core.ClockMode;
import com.rater.core.RateLimiter;
import com.rater.core.TimeSource;
import com.rater.storage.InMemoryStateStore;
import com.rater.storage.RedisStateStore;
import com.rater.storage.StateStore;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.Locale;

/**
 * Spring configuration for rate limiter components
 */
@Slf4j
@Configuration
public class RateLimiterConfiguration {

    @Value("${rater.store:redis}")
    private String storeType;

    @Value("${rater.clock:realtime}")
    private String clockMode;

    @Value("${rater.max-attempts:16}")
    private int maxAttempts;

    @Value("${rater.memory.max-keys:100000}")
    private long memoryMaxKeys;

    @Value("${redis.host:localhost}")
    private String redisHost;

    @Value("${redis.port:6379}")
    private int redisPort;

    /**
     * Realtime keeps limits correct across failover but follows clock
     * changes; monotonic ignores clock changes but restarts every bucket
     * when the process does.
     */
    @Bean
    public TimeSource timeSource() {
        ClockMode mode = ClockMode.parse(clockMode);
        log.info("Deciding with the {} clock", mode.name().toLowerCase(Locale.ROOT));
        return mode.timeSource();
    }

    @Bean
    public StateStore stateStore(TimeSource timeSource) {
        switch (storeType.trim().toLowerCase(Locale.ROOT)) {
            case "redis":
                log.info("Initializing Redis state store at {}:{}", redisHost, redisPort);
                return new RedisStateStore(redisHost, redisPort);
            case "memory":
                return new InMemoryStateStore(timeSource, memoryMaxKeys);
            default:
                throw new IllegalStateException(
                        "Unknown rater.store '" + storeType + "', expected redis or memory");
        }
    }

    @Bean
    public MeterRegistry meterRegistry() {
        return new SimpleMeterRegistry();
    }

    @Bean
    public RateLimiter rateLimiter(
            StateStore stateStore,
            TimeSource timeSource,
            MeterRegistry meterRegistry) {

        return new GcraRateLimiter(stateStore, timeSource, meterRegistry, maxAttempts);
    }
}
