package com.sonarlink.service.retry;

import com.sonarlink.exception.NetworkException;
import com.sonarlink.exception.RateLimitException;
import com.sonarlink.exception.SonarQubeException;
import com.sonarlink.exception.UpstreamTimeoutException;
import com.sonarlink.service.ratelimit.TokenBucketRateLimiter;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;

import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;
import java.util.function.Supplier;

/**
 * Runs one logical upstream operation (rate-limit permit + call) with
 * classification-driven exponential backoff.
 *
 * <p>The returned {@link RetryResult} always completes normally; the attempt
 * counter is threaded through each step so the state machine can be inspected
 * without real I/O.</p>
 */
@Slf4j
public class RetryOrchestrator {

    private final RetryPolicy policy;
    private final TokenBucketRateLimiter rateLimiter;
    private final Scheduler scheduler;
    private final DoubleSupplier jitterSource;

    public RetryOrchestrator(RetryPolicy policy, TokenBucketRateLimiter rateLimiter, Scheduler scheduler) {
        this(policy, rateLimiter, scheduler, () -> ThreadLocalRandom.current().nextDouble());
    }

    public RetryOrchestrator(
            RetryPolicy policy,
            TokenBucketRateLimiter rateLimiter,
            Scheduler scheduler,
            DoubleSupplier jitterSource) {
        if (policy.getMaxAttempts() < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1");
        }
        this.policy = policy;
        this.rateLimiter = rateLimiter;
        this.scheduler = scheduler;
        this.jitterSource = jitterSource;
    }

    public <T> Mono<RetryResult<T>> execute(Supplier<Mono<T>> loader) {
        return attempt(loader, 1);
    }

    private <T> Mono<RetryResult<T>> attempt(Supplier<Mono<T>> loader, int attempt) {
        return rateLimiter.acquire(1, policy.getAcquireTimeout())
                .then(Mono.defer(loader))
                .switchIfEmpty(Mono.error(() -> new IllegalStateException("Upstream call completed without a response")))
                .map(value -> RetryResult.success(value, attempt))
                .onErrorResume(error -> onFailure(loader, attempt, error));
    }

    private <T> Mono<RetryResult<T>> onFailure(Supplier<Mono<T>> loader, int attempt, Throwable error) {
        if (error instanceof RateLimitException rateLimited && !rateLimited.isLocal()) {
            rateLimiter.onRateLimited(rateLimited.getRetryAfter());
        }

        if (!isRetryable(error)) {
            log.warn("Non-retryable failure on attempt {}: {}", attempt, error.getMessage());
            return Mono.just(failed(error, attempt));
        }

        if (attempt >= policy.getMaxAttempts()) {
            log.error("Giving up after {} attempts: {}", attempt, error.getMessage());
            return Mono.just(failed(error, attempt));
        }

        Duration delay = backoff(attempt);
        log.warn("Attempt {}/{} failed ({}), retrying in {}ms",
                attempt, policy.getMaxAttempts(), error.getMessage(), delay.toMillis());

        return Mono.delay(delay, scheduler)
                .then(Mono.defer(() -> attempt(loader, attempt + 1)));
    }

    /**
     * Network failures, timeouts and the configured HTTP statuses are retried;
     * everything else, including a local permit timeout, is fatal.
     */
    public boolean isRetryable(Throwable error) {
        if (error instanceof NetworkException || error instanceof UpstreamTimeoutException) {
            return true;
        }
        if (error instanceof RateLimitException rateLimited && rateLimited.isLocal()) {
            return false;
        }
        if (error instanceof SonarQubeException classified && classified.hasHttpStatus()) {
            return policy.getRetryableStatusCodes().contains(classified.getStatusCode());
        }
        return false;
    }

    /**
     * {@code min(maxDelay, baseDelay * 2^(attempt-1))} plus up to {@code jitterFraction} of it.
     */
    public Duration backoff(int attempt) {
        double exponential = policy.getBaseDelay().toMillis() * Math.pow(2, attempt - 1);
        double capped = Math.min(policy.getMaxDelay().toMillis(), exponential);
        double jitter = jitterSource.getAsDouble() * capped * policy.getJitterFraction();
        return Duration.ofMillis(Math.round(capped + jitter));
    }

    private static <T> RetryResult<T> failed(Throwable error, int attempts) {
        if (error instanceof SonarQubeException classified) {
            classified.setAttempts(attempts);
        }
        return RetryResult.failure(error, attempts);
    }
}
