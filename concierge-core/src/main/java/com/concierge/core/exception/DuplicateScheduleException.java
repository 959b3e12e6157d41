package com.concierge.core.exception;

/**
 * Thrown when a scheduled job is created with a name the user already uses.
 */
public class DuplicateScheduleException extends ConciergeException {

    public static final String ERROR_CODE = "DUPLICATE_SCHEDULE";

    private final String existingJobId;

    public DuplicateScheduleException(String userId, String name, String existingJobId) {
        super(ERROR_CODE, String.format(
            "Scheduled job '%s' already exists for user %s: %s",
            name, userId, existingJobId
        ));
        this.existingJobId = existingJobId;
    }

    public String getExistingJobId() {
        return existingJobId;
    }
}
