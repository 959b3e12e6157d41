package com.concierge.worker;

/**
 * What processing one queue delivery led to.
 */
public enum TaskOutcome {
    /** The agent succeeded and the task is SUCCESS. */
    SUCCEEDED,
    /** The task ended in FAILURE. */
    FAILED,
    /** A transient failure was re-queued with backoff. */
    RETRY_SCHEDULED,
    /** The task was cancelled before its agent ran. */
    CANCELLED,
    /** Nothing to do: the task is gone, already terminal, or moved on while running. */
    DISCARDED
}
