package com.concierge.core.exception;

/**
 * Thrown when a task, scheduled job or agent is not found.
 */
public class NotFoundException extends ConciergeException {

    public static final String ERROR_CODE = "NOT_FOUND";

    public NotFoundException(String entityType, String entityId) {
        super(ERROR_CODE, String.format(
            "%s not found: %s",
            entityType, entityId
        ));
    }
}
