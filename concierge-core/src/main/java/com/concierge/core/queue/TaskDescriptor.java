package com.concierge.core.queue;

import com.concierge.core.model.Task;

import java.time.Instant;

/**
 * Serialized form of a task placed on the execution queue.
 * Workers reload the full task by id; the rest is for logging and routing hints.
 */
public record TaskDescriptor(
    String taskId,
    String title,
    String userId,
    String agentSlug,
    String sourceChannel,
    int retryCount,
    Instant enqueuedAt
) {
    public static TaskDescriptor of(Task task) {
        return new TaskDescriptor(
            task.id(),
            task.title(),
            task.userId(),
            task.agentSlug(),
            task.sourceChannel(),
            task.retryCount(),
            Instant.now()
        );
    }
}
