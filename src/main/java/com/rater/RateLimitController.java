package com.rater;

import com.rater.core.Decision;
import com.rater.core.RateLimitConfig;
import com.rater.core.RateLimiter;
import com.rater.storage.CorruptStateException;
import com.rater.storage.StateStore;
import com.rater.storage.StorageException;
import com.rater.storage.WrongTypeException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * HTTP surface for the rate limiter.
 *
 * POST /api/limit/{key}?burst=&count=&period=[&cost=] is the RATER.LIMIT
 * command: it answers limited, limit, remaining, retry_after and ttl, with
 * 429 when the request is limited. GET on the same path probes the bucket
 * without consuming anything.
 */
@Slf4j
@RestController
@RequestMapping("/api")
public class RateLimitController {

    private final RateLimiter rateLimiter;
    private final StateStore stateStore;

    public RateLimitController(RateLimiter rateLimiter, StateStore stateStore) {
        this.rateLimiter = rateLimiter;
        this.stateStore = stateStore;
    }

    @PostMapping("/limit/{key}")
    public ResponseEntity<Map<String, Object>> limit(
            @PathVariable("key") String key,
            @RequestParam("burst") long burst,
            @RequestParam("count") long countPerPeriod,
            @RequestParam("period") long periodSeconds,
            @RequestParam(value = "cost", defaultValue = "1") long cost) {

        RateLimitConfig config = RateLimitConfig.of(burst, countPerPeriod, periodSeconds).withCost(cost);
        Decision decision = rateLimiter.limit(key, config);

        if (decision.isLimited()) {
            log.debug("Rate limit exceeded for {}: retry after {}s", key, decision.getRetryAfterSeconds());
        }
        return reply(decision);
    }

    @GetMapping("/limit/{key}")
    public ResponseEntity<Map<String, Object>> probe(
            @PathVariable("key") String key,
            @RequestParam("burst") long burst,
            @RequestParam("count") long countPerPeriod,
            @RequestParam("period") long periodSeconds) {

        RateLimitConfig config = RateLimitConfig.of(burst, countPerPeriod, periodSeconds);
        return reply(rateLimiter.probe(key, config));
    }

    /**
     * Health check endpoint (not rate limited)
     */
    @GetMapping("/health")
    public ResponseEntity<Map<String, String>> health() {
        boolean up = stateStore.isAvailable();
        Map<String, String> status = new HashMap<>();
        status.put("status", up ? "UP" : "DOWN");
        status.put("timestamp", String.valueOf(System.currentTimeMillis()));
        return ResponseEntity
                .status(up ? HttpStatus.OK : HttpStatus.SERVICE_UNAVAILABLE)
                .body(status);
    }

    /**
     * Admin endpoint to reset a bucket
     */
    @DeleteMapping("/admin/reset/{key}")
    public ResponseEntity<Map<String, String>> reset(@PathVariable("key") String key) {
        rateLimiter.reset(key);

        Map<String, String> response = new HashMap<>();
        response.put("message", "Rate limit reset for key: " + key);
        return ResponseEntity.ok(response);
    }

    @ExceptionHandler({
            IllegalArgumentException.class,
            MethodArgumentTypeMismatchException.class,
            MissingServletRequestParameterException.class
    })
    public ResponseEntity<Map<String, Object>> badRequest(Exception e) {
        return error(HttpStatus.BAD_REQUEST, "Invalid request", e.getMessage());
    }

    @ExceptionHandler(CorruptStateException.class)
    public ResponseEntity<Map<String, Object>> corruptState(CorruptStateException e) {
        log.warn("Refusing to decide on corrupted bucket {}", e.getKey());
        return error(HttpStatus.INTERNAL_SERVER_ERROR, "ERR invalid stored rater", e.getMessage());
    }

    @ExceptionHandler(WrongTypeException.class)
    public ResponseEntity<Map<String, Object>> wrongType(WrongTypeException e) {
        log.warn("Key {} already holds data of another type", e.getKey());
        return error(HttpStatus.CONFLICT, "WRONGTYPE", e.getMessage());
    }

    @ExceptionHandler(StorageException.class)
    public ResponseEntity<Map<String, Object>> storageUnavailable(StorageException e) {
        log.error("State store failure", e);
        return error(HttpStatus.SERVICE_UNAVAILABLE, "State store unavailable", e.getMessage());
    }

    private ResponseEntity<Map<String, Object>> reply(Decision decision) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("limited", decision.isLimited());
        body.put("limit", decision.getLimit());
        body.put("remaining", decision.getRemaining());
        body.put("retry_after", decision.getRetryAfterSeconds());
        body.put("ttl", decision.getTtlSeconds());

        ResponseEntity.BodyBuilder response = ResponseEntity
                .status(decision.isLimited() ? HttpStatus.TOO_MANY_REQUESTS : HttpStatus.OK)
                .header("X-RateLimit-Limit", String.valueOf(decision.getLimit()))
                .header("X-RateLimit-Remaining", String.valueOf(decision.getRemaining()))
                .header("X-RateLimit-Reset", String.valueOf(decision.getTtlSeconds()));
        if (decision.isLimited() && decision.hasRetryAfter()) {
            response.header("Retry-After", String.valueOf(decision.getRetryAfterSeconds()));
        }
        return response.body(body);
    }

    private ResponseEntity<Map<String, Object>> error(HttpStatus status, String error, String message) {
        Map<String, Object> body = new HashMap<>();
        body.put("error", error);
        body.put("message", message);
        return ResponseEntity.status(status).body(body);
    }
}
