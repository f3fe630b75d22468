package com.moldstudio.common.exception;

/**
 * A required field is missing or a value is out of range. Raised before any mutation.
 */
public class InvalidInputException extends BusinessException {
    public InvalidInputException(String message) {
        super(message, "INVALID_INPUT");
    }
}
