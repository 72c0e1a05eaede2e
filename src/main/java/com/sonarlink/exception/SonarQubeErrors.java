package com.sonarlink.exception;

import java.time.Duration;

/**
 * Maps an HTTP error status to the matching {@link SonarQubeException} subtype.
 */
public final class SonarQubeErrors {

    private SonarQubeErrors() {
    }

    public static SonarQubeException fromStatus(int status, String message, Duration retryAfter) {
        return switch (status) {
            case 400, 422 -> new ValidationException(message, status);
            case 401 -> new AuthenticationException(message);
            case 403 -> new AuthorizationException(message);
            case 404 -> new NotFoundException(message);
            case 409 -> new ConflictException(message);
            case 429 -> RateLimitException.upstream(message, retryAfter);
            default -> status >= 500
                    ? new UpstreamServerException(message, status)
                    : new ApiException(message, status);
        };
    }
}
