package com.sonarlink.service.retry;

import lombok.Getter;

/**
 * Outcome of a retried operation: either a value or the classified error that
 * ended it, plus the number of attempts made.
 */
@Getter
public final class RetryResult<T> {

    private final T value;
    private final Throwable error;
    private final int attempts;

    private RetryResult(T value, Throwable error, int attempts) {
        this.value = value;
        this.error = error;
        this.attempts = attempts;
    }

    public static <T> RetryResult<T> success(T value, int attempts) {
        return new RetryResult<>(value, null, attempts);
    }

    public static <T> RetryResult<T> failure(Throwable error, int attempts) {
        return new RetryResult<>(null, error, attempts);
    }

    public boolean isSuccess() {
        return error == null;
    }

    @Override
    public String toString() {
        return isSuccess()
                ? "RetryResult[success after " + attempts + " attempt(s)]"
                : "RetryResult[" + error.getClass().getSimpleName() + " after " + attempts + " attempt(s)]";
    }
}
