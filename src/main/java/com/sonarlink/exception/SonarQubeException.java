package com.sonarlink.exception;

import lombok.Getter;

/**
 * Base class for every classified error raised by the SonarQube data-access layer.
 *
 * <p>Carries the HTTP status (0 for transport-level failures), a stable error code
 * for tool handlers, and the number of upstream attempts consumed before the
 * error was surfaced.</p>
 */
@Getter
public class SonarQubeException extends RuntimeException {

    private final String errorCode;
    private final int statusCode;
    private volatile int attempts;

    public SonarQubeException(String message, String errorCode, int statusCode) {
        this(message, errorCode, statusCode, null);
    }

    public SonarQubeException(String message, String errorCode, int statusCode, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
        this.statusCode = statusCode;
    }

    /**
     * Record how many attempts were made before this error was surfaced.
     * Set once by the retry orchestrator before the error is fanned out.
     */
    public void setAttempts(int attempts) {
        this.attempts = attempts;
    }

    /**
     * Whether this error came from an HTTP response rather than the transport.
     */
    public boolean hasHttpStatus() {
        return statusCode > 0;
    }
}
