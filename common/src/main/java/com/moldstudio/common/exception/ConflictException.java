package com.moldstudio.common.exception;

/**
 * Thrown when creating a resource whose identifier (or unique name) is already taken.
 * Mapped to HTTP 409.
 */
public class ConflictException extends BusinessException {
    public ConflictException(String message) {
        super(message, "CONFLICT");
    }

    public ConflictException(String resourceType, Object identifier) {
        super(String.format("%s with identifier %s already exists", resourceType, identifier), "CONFLICT");
    }
}
