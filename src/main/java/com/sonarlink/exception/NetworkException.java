package com.sonarlink.exception;

/**
 * Connection-level failure before a response was received (refused, reset, DNS, TLS).
 */
public class NetworkException extends SonarQubeException {

    public NetworkException(String message, Throwable cause) {
        super(message, "NETWORK_ERROR", 0, cause);
    }
}
