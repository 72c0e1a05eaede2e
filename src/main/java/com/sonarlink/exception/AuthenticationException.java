package com.sonarlink.exception;

/**
 * SonarQube rejected the token (HTTP 401).
 */
public class AuthenticationException extends SonarQubeException {

    public AuthenticationException(String message) {
        super(message, "AUTH_FAILED", 401);
    }
}
