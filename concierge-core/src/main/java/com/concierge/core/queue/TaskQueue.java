package com.concierge.core.queue;

import java.time.Duration;
import java.util.List;

/**
 * Broker-backed execution queue.
 *
 * Delivery is at-least-once: an entry handed to a worker that is not acknowledged
 * within the visibility timeout becomes deliverable again.
 */
public interface TaskQueue {

    /**
     * Place a descriptor on the queue.
     *
     * @param descriptor The task descriptor
     * @param delay Delay before the entry becomes deliverable (zero for immediate)
     * @return Opaque handle identifying the queue entry
     */
    String enqueue(TaskDescriptor descriptor, Duration delay);

    /**
     * Claim up to {@code maxItems} deliverable entries.
     *
     * @param maxItems Maximum entries to claim
     * @param visibilityTimeout How long the claim hides the entry from other workers
     * @return Claimed deliveries, possibly empty
     */
    List<QueueDelivery> poll(int maxItems, Duration visibilityTimeout);

    /**
     * Remove a delivered entry for good.
     */
    void acknowledge(String handle);

    /**
     * Send an out-of-band cancellation signal for a task.
     *
     * @return true if the signal was newly recorded
     */
    boolean cancel(String taskId);

    /**
     * Check whether a cancellation signal was sent for a task.
     */
    boolean isCancelled(String taskId);

    /**
     * Drop the cancellation signal of a task once the cancelled task has been dropped.
     */
    void clearCancellation(String taskId);

    /**
     * Number of entries not yet acknowledged.
     */
    int size();
}
