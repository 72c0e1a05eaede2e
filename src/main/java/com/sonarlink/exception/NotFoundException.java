package com.sonarlink.exception;

public class NotFoundException extends SonarQubeException {

    public NotFoundException(String message) {
        super(message, "NOT_FOUND", 404);
    }
}
