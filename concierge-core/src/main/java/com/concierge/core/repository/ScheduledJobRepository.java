package com.concierge.core.repository;

import com.concierge.core.model.ScheduledJob;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Repository for ScheduledJob persistence.
 */
public interface ScheduledJobRepository {

    /**
     * Save a new job.
     *
     * @param job The job to save
     * @throws com.concierge.core.exception.DuplicateScheduleException if (userId, name) is taken
     */
    void save(ScheduledJob job);

    /**
     * Update an existing job's definition, including the fire time of a one-shot job.
     * lastRunAt is left as stored.
     *
     * @param job The job to update
     * @throws com.concierge.core.exception.DuplicateScheduleException if the new name is taken
     * @throws com.concierge.core.exception.NotFoundException if the job does not exist
     */
    void update(ScheduledJob job);

    Optional<ScheduledJob> findById(String jobId);

    Optional<ScheduledJob> findByUserAndName(String userId, String name);

    List<ScheduledJob> findByUser(String userId);

    /**
     * All jobs with enabled = true.
     */
    List<ScheduledJob> findEnabled();

    /**
     * Record a firing.
     *
     * @param jobId The job ID
     * @param lastRunAt When the job fired
     * @param nextRunAt Next fire time, or null if none
     */
    void recordRun(String jobId, Instant lastRunAt, Instant nextRunAt);

    /**
     * Record the next fire time computed when a trigger is registered.
     */
    void updateNextRun(String jobId, Instant nextRunAt);

    boolean delete(String jobId);
}
