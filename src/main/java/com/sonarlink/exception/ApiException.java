package com.sonarlink.exception;

/**
 * Any other HTTP error status without a dedicated class.
 */
public class ApiException extends SonarQubeException {

    public ApiException(String message, int statusCode) {
        super(message, "API_ERROR", statusCode);
    }
}
