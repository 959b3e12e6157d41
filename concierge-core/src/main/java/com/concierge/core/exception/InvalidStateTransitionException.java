package com.concierge.core.exception;

import com.concierge.core.model.TaskStatus;

/**
 * Thrown when a task status write is rejected because the record already
 * moved on (typically into a terminal state).
 */
public class InvalidStateTransitionException extends ConciergeException {

    public static final String ERROR_CODE = "INVALID_STATE_TRANSITION";

    private final TaskStatus currentStatus;
    private final TaskStatus targetStatus;

    public InvalidStateTransitionException(String taskId, TaskStatus currentStatus, TaskStatus targetStatus) {
        super(ERROR_CODE, String.format(
            "Cannot transition task %s from %s to %s",
            taskId, currentStatus, targetStatus
        ));
        this.currentStatus = currentStatus;
        this.targetStatus = targetStatus;
    }

    public TaskStatus getCurrentStatus() {
        return currentStatus;
    }

    public TaskStatus getTargetStatus() {
        return targetStatus;
    }
}
