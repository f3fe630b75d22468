package com.moldstudio.common.exception;

/**
 * Credentials are missing or wrong. Mapped to HTTP 401.
 */
public class UnauthorizedException extends BusinessException {
    public UnauthorizedException(String message) {
        super(message, "UNAUTHORIZED");
    }
}
