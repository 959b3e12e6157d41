package com.concierge.core.model;

/**
 * Failure categories surfaced by the orchestration core.
 */
public enum ErrorKind {
    /** No agent reached the confidence threshold and arbitration gave no answer. Never retried. */
    ROUTING_FAILURE,
    /** An agent failed while executing. Retried with backoff. */
    TRANSIENT_EXECUTION,
    /** An agent reported a failure that retrying cannot fix. */
    PERMANENT_EXECUTION,
    /** A cron expression could not be parsed. */
    MALFORMED_SCHEDULE,
    /** A (user, name) pair is already taken by another scheduled job. */
    DUPLICATE_SCHEDULE,
    /** An event handler or subscription callback threw. */
    HANDLER_FAULT,
    /** The delivery collaborator could not hand a result to the user. */
    DELIVERY_FAILURE;

    public boolean isRetryable() {
        return this == TRANSIENT_EXECUTION;
    }
}
