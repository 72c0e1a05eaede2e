package com.sonarlink.exception;

public class ConflictException extends SonarQubeException {

    public ConflictException(String message) {
        super(message, "CONFLICT", 409);
    }
}
