package com.sonarlink.exception;

/**
 * The token is valid but lacks permission for the operation (HTTP 403).
 */
public class AuthorizationException extends SonarQubeException {

    public AuthorizationException(String message) {
        super(message, "AUTH_INSUFFICIENT", 403);
    }
}
