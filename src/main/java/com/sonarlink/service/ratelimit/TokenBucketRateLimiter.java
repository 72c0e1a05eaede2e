package com.sonarlink.service.ratelimit;

import com.sonarlink.exception.RateLimitException;
import com.sonarlink.model.dto.RateLimitStatus;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;

import java.time.Duration;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Token bucket shared by every outbound SonarQube call.
 *
 * <p>Tokens refill continuously at {@code refillPerSecond}, computed lazily on each
 * access as {@code min(capacity, tokens + elapsed * rate)}. Waiting is a timed
 * {@link Mono#delay} on the injected scheduler, whose clock is also the time source,
 * so tests can drive the bucket with a virtual-time scheduler.</p>
 *
 * <p>After an upstream 429, {@link #onRateLimited(Duration)} empties the bucket and
 * moves the refill origin into the future, suspending refill until Retry-After.</p>
 */
@Slf4j
public class TokenBucketRateLimiter {

    private static final double EPSILON = 1e-9;
    private static final long NANOS_PER_SECOND = 1_000_000_000L;

    private final long capacity;
    private final double refillPerSecond;
    private final Duration defaultRetryAfter;
    private final Scheduler scheduler;

    private final ReentrantLock lock = new ReentrantLock();

    // guarded by lock
    private double tokens;
    // may lie in the future while refill is suspended after a 429
    private long lastRefillNanos;

    public TokenBucketRateLimiter(long capacity, double refillPerSecond, Duration defaultRetryAfter, Scheduler scheduler) {
        if (capacity < 1) {
            throw new IllegalArgumentException("Rate limit capacity must be at least 1, got " + capacity);
        }
        if (!(refillPerSecond > 0)) {
            throw new IllegalArgumentException("Refill rate must be positive, got " + refillPerSecond);
        }
        this.capacity = capacity;
        this.refillPerSecond = refillPerSecond;
        this.defaultRetryAfter = defaultRetryAfter;
        this.scheduler = scheduler;
        this.tokens = capacity;
        this.lastRefillNanos = now();

        log.info("Rate limiter initialized: capacity={}, refill={}/s", capacity, refillPerSecond);
    }

    /**
     * Wait until {@code permits} tokens can be deducted, or fail with a local
     * {@link RateLimitException} once {@code timeout} has elapsed.
     */
    public Mono<Void> acquire(int permits, Duration timeout) {
        if (permits < 1 || permits > capacity) {
            return Mono.error(new IllegalArgumentException(
                    "Permits must be between 1 and " + capacity + ", got " + permits));
        }
        return Mono.defer(() -> {
            long start = now();
            return acquireBefore(permits, start, start + timeout.toNanos());
        });
    }

    private Mono<Void> acquireBefore(int permits, long start, long deadline) {
        long waitNanos;
        long remainingNanos;

        lock.lock();
        try {
            long now = now();
            refill(now);
            if (tokens + EPSILON >= permits) {
                tokens = Math.max(0.0, tokens - permits);
                log.debug("Rate limit: acquired {} tokens, {} remaining", permits, tokens);
                return Mono.empty();
            }
            waitNanos = nanosUntilAvailable(permits, now);
            remainingNanos = deadline - now;
        } finally {
            lock.unlock();
        }

        if (remainingNanos <= 0) {
            Duration waited = Duration.ofNanos(deadline - start);
            log.warn("Rate limit: no permit after {}ms", waited.toMillis());
            return Mono.error(RateLimitException.localBudgetExhausted(waited, Duration.ofNanos(waitNanos)));
        }

        long sleepNanos = Math.max(1, Math.min(waitNanos, remainingNanos));
        log.debug("Rate limited, waiting {}ms for {} tokens", TimeUnit.NANOSECONDS.toMillis(sleepNanos), permits);
        return Mono.delay(Duration.ofNanos(sleepNanos), scheduler)
                .then(Mono.defer(() -> acquireBefore(permits, start, deadline)));
    }

    /**
     * Upstream answered 429: drop all tokens and hold refill back until {@code retryAfter}
     * (or the configured default when the header was absent).
     */
    public void onRateLimited(Duration retryAfter) {
        Duration pause = retryAfter != null ? retryAfter : defaultRetryAfter;
        lock.lock();
        try {
            long resumeAt = now() + pause.toNanos();
            tokens = 0.0;
            lastRefillNanos = Math.max(lastRefillNanos, resumeAt);
        } finally {
            lock.unlock();
        }
        log.warn("Upstream rate limit hit, refill suspended for {}ms", pause.toMillis());
    }

    public RateLimitStatus status() {
        lock.lock();
        try {
            long now = now();
            refill(now);
            return RateLimitStatus.builder()
                    .available(tokens)
                    .capacity(capacity)
                    .utilizationPercent((capacity - tokens) / capacity * 100.0)
                    .refillRatePerSecond(refillPerSecond)
                    .pausedForMillis(Math.max(0, TimeUnit.NANOSECONDS.toMillis(lastRefillNanos - now)))
                    .build();
        } finally {
            lock.unlock();
        }
    }

    private void refill(long now) {
        if (now <= lastRefillNanos) {
            return;
        }
        double added = (now - lastRefillNanos) * refillPerSecond / NANOS_PER_SECOND;
        tokens = Math.min(capacity, tokens + added);
        lastRefillNanos = now;
    }

    private long nanosUntilAvailable(int permits, long now) {
        double deficit = permits - tokens;
        long refillNanos = (long) Math.ceil(deficit / refillPerSecond * NANOS_PER_SECOND);
        long pausedNanos = Math.max(0, lastRefillNanos - now);
        return pausedNanos + refillNanos;
    }

    private long now() {
        return scheduler.now(TimeUnit.NANOSECONDS);
    }
}
