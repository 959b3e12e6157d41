package com.concierge.core.repository;

import com.concierge.core.model.Task;
import com.concierge.core.model.TaskStatus;

import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Repository for Task persistence.
 *
 * Status writes go through {@link #compareAndSet} so that writers in different
 * processes coordinate without locks.
 */
public interface TaskRepository {

    /**
     * Save a new task.
     *
     * @param task The task to save
     */
    void save(Task task);

    /**
     * Find a task by ID.
     *
     * @param taskId The task ID
     * @return The task if found
     */
    Optional<Task> findById(String taskId);

    /**
     * Find tasks belonging to a user, newest first.
     *
     * @param userId The user ID
     * @param limit Maximum number of results
     * @return Tasks of the user
     */
    List<Task> findByUser(String userId, int limit);

    /**
     * Find tasks by status, oldest first.
     *
     * @param status The task status
     * @param limit Maximum number of results
     * @return Tasks in the given status
     */
    List<Task> findByStatus(TaskStatus status, int limit);

    /**
     * Replace the stored task with {@code updated}, but only if the stored status is
     * one of {@code expectedStatuses} and is not terminal. The stored queue handle is
     * left untouched; it only changes through {@link #recordQueueHandle}.
     *
     * @param updated The new task state
     * @param expectedStatuses Statuses the stored record must currently have
     * @return true if the write was applied, false if the record moved on or does not exist
     */
    boolean compareAndSet(Task updated, Set<TaskStatus> expectedStatuses);

    /**
     * Record the queue handle of the entry currently carrying the task.
     * Touches nothing else, so it may race freely with status writes.
     *
     * @param taskId The task ID
     * @param queueHandle The handle returned by the queue
     * @return true if the task exists
     */
    boolean recordQueueHandle(String taskId, String queueHandle);

    /**
     * Delete a task.
     *
     * @param taskId The task ID
     * @return true if a task was removed
     */
    boolean delete(String taskId);
}
