package com.sonarlink.exception;

/**
 * Connect or response timeout while talking to SonarQube, or a caller giving up
 * on a shared in-flight fetch.
 */
public class UpstreamTimeoutException extends SonarQubeException {

    public UpstreamTimeoutException(String message, Throwable cause) {
        super(message, "TIMEOUT", 0, cause);
    }
}
