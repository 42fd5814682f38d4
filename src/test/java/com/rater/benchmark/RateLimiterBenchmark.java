package com.rater.benchmark;

import com.rater.algorithms.GcraRateLimiter;
import com.rater.core.RateLimitConfig;
import com.rater.core.RateLimiter;
import com.rater.core.RealtimeTimeSource;
import com.rater.storage.InMemoryStateStore;
import com.rater.storage.RedisStateStore;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.EnabledIfEnvironmentVariable;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.*;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Performance benchmarks for the GCRA limiter.
 *
 * Run these with Redis running locally:
 *   docker run -d -p 6379:6379 redis:alpine
 *
 * Enable with: export RUN_BENCHMARKS=true
 */
@EnabledIfEnvironmentVariable(named = "RUN_BENCHMARKS", matches = "true")
public class RateLimiterBenchmark {

    private static RedisStateStore redisStore;
    private static SimpleMeterRegistry meterRegistry;

    @BeforeAll
    static void setup() {
        redisStore = new RedisStateStore("localhost", 6379);
        meterRegistry = new SimpleMeterRegistry();

        // Verify Redis is available
        if (!redisStore.isAvailable()) {
            throw new RuntimeException("Redis not available. Start with: docker run -p 6379:6379 redis:alpine");
        }

        System.out.println("=".repeat(80));
        System.out.println("GCRA RATE LIMITER PERFORMANCE BENCHMARKS");
        System.out.println("=".repeat(80));
    }

    @Test
    void benchmarkRedis_SingleKey() throws Exception {
        // High limit so contention, not denial, dominates
        RateLimitConfig config = RateLimitConfig.of(100_000, 100_000, 1);
        RateLimiter limiter = new GcraRateLimiter(redisStore, new RealtimeTimeSource(), meterRegistry, 64);

        printResults(runBenchmark(
                "Redis (Single Key, 10 threads)",
                limiter,
                config,
                "bench:single",
                10,
                2_000
        ));
    }

    @Test
    void benchmarkRedis_MultipleKeys() throws Exception {
        RateLimitConfig config = RateLimitConfig.of(1_000, 1_000, 10);
        RateLimiter limiter = new GcraRateLimiter(redisStore, new RealtimeTimeSource(), meterRegistry);

        printResults(runBenchmark(
                "Redis (Multiple Keys, 20 threads)",
                limiter,
                config,
                null, // Use different key per thread
                20,
                1_000
        ));
    }

    @Test
    void benchmarkInMemory_MultipleKeys() throws Exception {
        RealtimeTimeSource clock = new RealtimeTimeSource();
        RateLimitConfig config = RateLimitConfig.of(1_000, 1_000, 10);
        RateLimiter limiter = new GcraRateLimiter(new InMemoryStateStore(clock, 10_000), clock, meterRegistry);

        printResults(runBenchmark(
                "In-memory (Multiple Keys, 20 threads)",
                limiter,
                config,
                null,
                20,
                50_000
        ));
    }

    private BenchmarkResult runBenchmark(
            String name,
            RateLimiter limiter,
            RateLimitConfig config,
            String sharedKey,
            int numThreads,
            int requestsPerThread) throws Exception {

        ExecutorService executor = Executors.newFixedThreadPool(numThreads);
        CountDownLatch startLatch = new CountDownLatch(1);
        CountDownLatch endLatch = new CountDownLatch(numThreads);

        AtomicLong successCount = new AtomicLong(0);
        AtomicLong totalLatency = new AtomicLong(0);
        List<Long> latencies = new CopyOnWriteArrayList<>();

        List<Future<?>> futures = new ArrayList<>();

        for (int i = 0; i < numThreads; i++) {
            final int threadId = i;
            futures.add(executor.submit(() -> {
                try {
                    startLatch.await(); // Wait for all threads to be ready

                    String key = sharedKey != null ? sharedKey : ("bench:user_" + threadId);

                    for (int j = 0; j < requestsPerThread; j++) {
                        long start = System.nanoTime();
                        boolean allowed = limiter.limit(key, config).isAllowed();
                        long end = System.nanoTime();

                        long latencyNs = end - start;
                        totalLatency.addAndGet(latencyNs);
                        latencies.add(latencyNs);

                        if (allowed) {
                            successCount.incrementAndGet();
                        }
                    }
                    limiter.reset(key);
                } catch (Exception e) {
                    e.printStackTrace();
                } finally {
                    endLatch.countDown();
                }
            }));
        }

        long startTime = System.currentTimeMillis();
        startLatch.countDown();

        endLatch.await();
        long endTime = System.currentTimeMillis();

        executor.shutdown();

        long durationMs = Math.max(1, endTime - startTime);
        long totalRequests = (long) numThreads * requestsPerThread;
        long throughput = (totalRequests * 1000) / durationMs;
        double avgLatencyUs = (totalLatency.get() / (double) totalRequests) / 1000.0;

        // Calculate percentiles
        List<Long> sorted = new ArrayList<>(latencies);
        sorted.sort(Long::compareTo);
        long p50 = sorted.get(sorted.size() / 2) / 1000; // to microseconds
        long p95 = sorted.get((int) (sorted.size() * 0.95)) / 1000;
        long p99 = sorted.get((int) (sorted.size() * 0.99)) / 1000;

        return new BenchmarkResult(name, totalRequests, successCount.get(), durationMs,
                throughput, avgLatencyUs, p50, p95, p99);
    }

    private void printResults(BenchmarkResult result) {
        System.out.println("\n" + "-".repeat(80));
        System.out.println(result.name);
        System.out.println("-".repeat(80));
        System.out.printf("Total Requests:  %,d\n", result.totalRequests);
        System.out.printf("Admitted:        %,d (%.1f%%)\n",
                result.successful,
                100.0 * result.successful / result.totalRequests);
        System.out.printf("Duration:        %,d ms\n", result.durationMs);
        System.out.printf("Throughput:      %,d req/sec\n", result.throughput);
        System.out.printf("Avg Latency:     %.2f μs\n", result.avgLatencyUs);
        System.out.printf("Latency p50:     %,d μs\n", result.p50);
        System.out.printf("Latency p95:     %,d μs\n", result.p95);
        System.out.printf("Latency p99:     %,d μs\n", result.p99);
    }

    private static class BenchmarkResult {
        String name;
        long totalRequests;
        long successful;
        long durationMs;
        long throughput;
        double avgLatencyUs;
        long p50, p95, p99;

        BenchmarkResult(String name, long total, long successful, long durationMs,
                        long throughput, double avgLatencyUs, long p50, long p95, long p99) {
            this.name = name;
            this.totalRequests = total;
            this.successful = successful;
            this.durationMs = durationMs;
            this.throughput = throughput;
            this.avgLatencyUs = avgLatencyUs;
            this.p50 = p50;
            this.p95 = p95;
            this.p99 = p99;
        }
    }
}
