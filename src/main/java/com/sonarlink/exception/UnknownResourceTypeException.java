package com.sonarlink.exception;

/**
 * A resource type was used that has no TTL policy or endpoint configured.
 */
public class UnknownResourceTypeException extends IllegalArgumentException {

    public UnknownResourceTypeException(String resourceType) {
        super("Unknown resource type: '" + resourceType + "'");
    }
}
