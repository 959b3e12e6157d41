package com.concierge.core.exception;

/**
 * Base exception for all orchestration errors.
 */
public class ConciergeException extends RuntimeException {

    private final String errorCode;

    public ConciergeException(String errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    public ConciergeException(String errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    public String getErrorCode() {
        return errorCode;
    }
}
