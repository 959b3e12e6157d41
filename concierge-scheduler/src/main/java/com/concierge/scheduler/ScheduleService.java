package com.concierge.scheduler;

import com.concierge.core.exception.InvalidCronExpressionException;
import com.concierge.core.exception.NotFoundException;
import com.concierge.core.model.ScheduledJob;
import com.concierge.core.repository.ScheduledJobRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.UUID;

/**
 * User-facing management of scheduled jobs: validation, persistence and
 * keeping the running cron engine informed.
 *
 * All lookups are scoped to the calling user; another user's job reads as not found.
 */
public class ScheduleService {

    private static final Logger log = LoggerFactory.getLogger(ScheduleService.class);

    static final String ENTITY = "ScheduledJob";

    private final ScheduledJobRepository jobRepository;
    private final CronEngine cronEngine;
    private final Clock clock;

    public ScheduleService(ScheduledJobRepository jobRepository, CronEngine cronEngine) {
        this(jobRepository, cronEngine, Clock.systemUTC());
    }

    public ScheduleService(ScheduledJobRepository jobRepository, CronEngine cronEngine, Clock clock) {
        this.jobRepository = jobRepository;
        this.cronEngine = cronEngine;
        this.clock = clock;
    }

    /**
     * Validate and store a new job.
     *
     * @throws IllegalArgumentException if the name is missing or too long
     * @throws InvalidCronExpressionException if the expression or the one-shot fire time is invalid
     * @throws com.concierge.core.exception.DuplicateScheduleException if the user already has a job by that name
     */
    public ScheduledJob create(String userId, ScheduleRequest request) {
        requireName(request.name());
        String expression = request.cronExpression();
        if (expression == null) {
            throw new InvalidCronExpressionException("null", "expression is empty");
        }
        CronSchedule schedule = parse(expression);
        Instant now = clock.instant();

        ScheduledJob job = new ScheduledJob(
            UUID.randomUUID().toString(),
            userId,
            request.name().trim(),
            request.description() != null ? request.description() : schedule.describe(),
            schedule.expression(),
            request.agentSlug(),
            request.taskPayload(),
            request.enabled() == null || request.enabled(),
            null,
            firstRun(schedule, request.nextRunAt(), true, now),
            now,
            now
        );

        jobRepository.save(job);
        log.info("Created scheduled job {} ({}) for user {}: '{}'", job.id(), job.name(), userId, job.cronExpression());
        refreshEngine(job);
        return job;
    }

    /**
     * Apply the non-null fields of the request to a stored job.
     *
     * @throws NotFoundException if the job does not exist for this user
     * @throws InvalidCronExpressionException if the resulting timing is invalid
     * @throws com.concierge.core.exception.DuplicateScheduleException if the new name is taken
     */
    public ScheduledJob update(String userId, String jobId, ScheduleRequest changes) {
        ScheduledJob current = get(userId, jobId);
        if (changes.name() != null) {
            requireName(changes.name());
        }

        String expression = changes.cronExpression() != null ? changes.cronExpression().trim() : current.cronExpression();
        CronSchedule schedule = parse(expression);
        Instant now = clock.instant();

        Instant nextRunAt;
        if (schedule.isOnce()) {
            boolean explicit = changes.nextRunAt() != null;
            nextRunAt = firstRun(schedule, explicit ? changes.nextRunAt() : current.nextRunAt(), explicit, now);
        } else if (changes.cronExpression() != null) {
            nextRunAt = firstRun(schedule, null, false, now);
        } else {
            nextRunAt = current.nextRunAt();
        }

        String description = current.description();
        if (changes.description() != null) {
            description = changes.description();
        } else if (changes.cronExpression() != null) {
            description = schedule.describe();
        }

        ScheduledJob updated = new ScheduledJob(
            current.id(),
            current.userId(),
            changes.name() != null ? changes.name().trim() : current.name(),
            description,
            schedule.expression(),
            changes.agentSlug() != null ? changes.agentSlug() : current.agentSlug(),
            changes.taskPayload() != null ? changes.taskPayload() : current.taskPayload(),
            changes.enabled() != null ? changes.enabled() : current.enabled(),
            current.lastRunAt(),
            nextRunAt,
            current.createdAt(),
            now
        );

        jobRepository.update(updated);
        log.info("Updated scheduled job {} ({})", updated.id(), updated.name());
        refreshEngine(updated);
        return updated;
    }

    public ScheduledJob setEnabled(String userId, String jobId, boolean enabled) {
        return update(userId, jobId, ScheduleRequest.builder().enabled(enabled).build());
    }

    /**
     * Delete a job and cancel its trigger.
     *
     * @throws NotFoundException if the job does not exist for this user
     */
    public void delete(String userId, String jobId) {
        ScheduledJob job = get(userId, jobId);
        jobRepository.delete(job.id());
        if (cronEngine.isRunning()) {
            cronEngine.remove(job.id());
        }
        log.info("Deleted scheduled job {} ({})", job.id(), job.name());
    }

    public ScheduledJob get(String userId, String jobId) {
        return jobRepository.findById(jobId)
            .filter(job -> job.userId().equals(userId))
            .orElseThrow(() -> new NotFoundException(ENTITY, jobId));
    }

    public ScheduledJob getByName(String userId, String name) {
        return jobRepository.findByUserAndName(userId, name)
            .orElseThrow(() -> new NotFoundException(ENTITY, name));
    }

    /**
     * The user's jobs ordered by name.
     */
    public List<ScheduledJob> list(String userId) {
        return jobRepository.findByUser(userId).stream()
            .sorted(Comparator.comparing(ScheduledJob::name))
            .toList();
    }

    /**
     * Human-readable timing of a job, e.g. "Every day at 9:00 UTC".
     */
    public static String describe(ScheduledJob job) {
        try {
            return CronSchedule.parse(job.cronExpression()).describe();
        } catch (InvalidCronExpressionException e) {
            return job.cronExpression();
        }
    }

    // ========== Internal ==========

    private static CronSchedule parse(String expression) {
        if (expression.trim().length() > ScheduleRequest.MAX_EXPRESSION_LENGTH) {
            throw new InvalidCronExpressionException(expression,
                "longer than " + ScheduleRequest.MAX_EXPRESSION_LENGTH + " characters");
        }
        return CronSchedule.parse(expression);
    }

    private static void requireName(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Schedule name is required");
        }
        if (name.trim().length() > ScheduleRequest.MAX_NAME_LENGTH) {
            throw new IllegalArgumentException(
                "Schedule name must be at most " + ScheduleRequest.MAX_NAME_LENGTH + " characters");
        }
    }

    /**
     * First fire time for a new timing. One-shot jobs need a fire time, and a
     * newly supplied one must lie in the future.
     */
    private static Instant firstRun(CronSchedule schedule, Instant requested, boolean mustBeFuture, Instant now) {
        if (!schedule.isOnce()) {
            return schedule.nextFireAfter(now)
                .orElseThrow(() -> new InvalidCronExpressionException(schedule.expression(), "never fires"));
        }
        if (requested == null) {
            throw new InvalidCronExpressionException(ScheduledJob.ONCE,
                "next_run_at is required for @once schedules");
        }
        if (mustBeFuture && !requested.isAfter(now)) {
            throw new InvalidCronExpressionException(ScheduledJob.ONCE,
                "next_run_at must be a future timestamp for @once schedules");
        }
        return requested;
    }

    private void refreshEngine(ScheduledJob job) {
        if (!cronEngine.isRunning()) {
            return;
        }
        if (job.enabled()) {
            cronEngine.register(job);
        } else {
            cronEngine.remove(job.id());
        }
    }
}
