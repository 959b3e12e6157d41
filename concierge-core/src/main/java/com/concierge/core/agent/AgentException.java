package com.concierge.core.agent;

/**
 * Exception thrown by agents on failure.
 */
public class AgentException extends Exception {

    private final String errorCode;
    private final boolean retryable;

    public AgentException(String errorCode, String message) {
        this(errorCode, message, null, true);
    }

    public AgentException(String errorCode, String message, Throwable cause) {
        this(errorCode, message, cause, true);
    }

    public AgentException(String errorCode, String message, Throwable cause, boolean retryable) {
        super(message, cause);
        this.errorCode = errorCode;
        this.retryable = retryable;
    }

    public String getErrorCode() {
        return errorCode;
    }

    public boolean isRetryable() {
        return retryable;
    }

    /**
     * Create a non-retryable exception (permanent failure).
     */
    public static AgentException permanent(String errorCode, String message) {
        return new AgentException(errorCode, message, null, false);
    }

    /**
     * Create a retryable exception (transient failure).
     */
    public static AgentException transientFailure(String errorCode, String message) {
        return new AgentException(errorCode, message, null, true);
    }
}
