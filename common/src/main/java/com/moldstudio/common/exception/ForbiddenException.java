package com.moldstudio.common.exception;

/**
 * Caller is authenticated but not allowed to perform the operation. Mapped to HTTP 403.
 */
public class ForbiddenException extends BusinessException {
    public ForbiddenException(String message) {
        super(message, "FORBIDDEN");
    }
}
