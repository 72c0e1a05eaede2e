package com.sonarlink.exception;

import lombok.Getter;

import java.time.Duration;

/**
 * Rate limit hit, either upstream (HTTP 429) or locally when the token bucket
 * could not supply a permit before the acquire timeout.
 */
@Getter
public class RateLimitException extends SonarQubeException {

    /**
     * Hint for when the caller may try again; null when unknown.
     */
    private final Duration retryAfter;

    private final boolean local;

    private RateLimitException(String message, int statusCode, Duration retryAfter, boolean local) {
        super(message, "RATE_LIMIT", statusCode);
        this.retryAfter = retryAfter;
        this.local = local;
    }

    public static RateLimitException upstream(String message, Duration retryAfter) {
        return new RateLimitException(message, 429, retryAfter, false);
    }

    public static RateLimitException localBudgetExhausted(Duration waited, Duration retryAfter) {
        return new RateLimitException(
                "No rate limit permit available after waiting " + waited.toMillis() + "ms",
                429, retryAfter, true);
    }
}
