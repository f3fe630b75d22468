package com.moldstudio.common.exception;

/**
 * Thrown when a required dependency (e.g. the lock service guarding a ledger key) is
 * temporarily unavailable. Client should retry later.
 * Mapped to HTTP 503.
 */
public class ServiceUnavailableException extends RuntimeException {

    public ServiceUnavailableException(String message) {
        super(message);
    }

    public ServiceUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
