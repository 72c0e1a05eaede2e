package com.sonarlink.exception;

/**
 * SonarQube answered with a 5xx status.
 */
public class UpstreamServerException extends SonarQubeException {

    public UpstreamServerException(String message, int statusCode) {
        super(message, "SERVER_ERROR", statusCode);
    }
}
