package com.sonarlink.exception;

/**
 * Request rejected as invalid, either by SonarQube (HTTP 400/422) or by local
 * input validation before any call was made (status 400).
 */
public class ValidationException extends SonarQubeException {

    public ValidationException(String message) {
        this(message, 400);
    }

    public ValidationException(String message, int statusCode) {
        super(message, "VALIDATION_ERROR", statusCode);
    }
}
