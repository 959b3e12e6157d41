package com.concierge.scheduler;

import com.concierge.core.exception.InvalidCronExpressionException;
import com.concierge.core.exception.NotFoundException;
import com.concierge.core.model.Event;
import com.concierge.core.model.EventKind;
import com.concierge.core.model.ScheduledJob;
import com.concierge.core.repository.ScheduledJobRepository;
import com.concierge.engine.bus.EventBus;
import com.concierge.engine.logging.LoggingContext;
import com.concierge.engine.metrics.ConciergeMetrics;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.scheduling.support.CronTrigger;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.stream.Collectors;

/**
 * Keeps live cron triggers in step with the stored scheduled jobs and turns
 * each firing into a CRON event on the bus.
 *
 * Usage:
 * <pre>
 * CronEngine engine = new CronEngine(jobRepository, eventBus, taskScheduler, metrics);
 * engine.start();   // sync now, then every 60s
 * ...
 * engine.stop();
 * </pre>
 *
 * Every fire time is evaluated in UTC. A firing publishes a CRON event with
 * source channel "cron" and the job's user id, then records the run on the
 * stored job. Jobs whose expression does not parse are logged, counted and
 * listed by {@link #rejectedJobs()}; they never stop the rest of a sync.
 */
public class CronEngine {

    private static final Logger log = LoggerFactory.getLogger(CronEngine.class);

    public static final String CRON_CHANNEL = "cron";
    public static final Duration DEFAULT_SYNC_INTERVAL = Duration.ofSeconds(60);

    private final ScheduledJobRepository jobRepository;
    private final EventBus eventBus;
    private final TaskScheduler taskScheduler;
    private final ConciergeMetrics metrics;
    private final Clock clock;
    private final Duration syncInterval;

    private final Map<String, Registration> live = new ConcurrentHashMap<>();
    private final Map<String, RejectedJob> rejected = new ConcurrentHashMap<>();
    private final AtomicBoolean running = new AtomicBoolean(false);
    private volatile ScheduledFuture<?> syncFuture;

    public CronEngine(ScheduledJobRepository jobRepository, EventBus eventBus,
                      TaskScheduler taskScheduler, ConciergeMetrics metrics) {
        this(jobRepository, eventBus, taskScheduler, metrics, Clock.systemUTC(), DEFAULT_SYNC_INTERVAL);
    }

    public CronEngine(ScheduledJobRepository jobRepository, EventBus eventBus, TaskScheduler taskScheduler,
                      ConciergeMetrics metrics, Clock clock, Duration syncInterval) {
        this.jobRepository = jobRepository;
        this.eventBus = eventBus;
        this.taskScheduler = taskScheduler;
        this.metrics = metrics;
        this.clock = clock;
        this.syncInterval = syncInterval;
        metrics.registerLiveTriggers(live::size);
    }

    // ========== Lifecycle ==========

    /**
     * Sync once, then keep syncing at the configured interval.
     */
    public void start() {
        if (!running.compareAndSet(false, true)) {
            log.warn("Cron engine already running");
            return;
        }

        syncSafely();
        syncFuture = taskScheduler.scheduleWithFixedDelay(
            this::syncSafely,
            taskScheduler.getClock().instant().plus(syncInterval),
            syncInterval
        );

        log.info("Cron engine started with {} live jobs, syncing every {}s",
            live.size(), syncInterval.toSeconds());
    }

    /**
     * Cancel the sync loop and every live trigger. Stored jobs are untouched.
     */
    public void stop() {
        if (!running.compareAndSet(true, false)) {
            return;
        }

        ScheduledFuture<?> sync = syncFuture;
        if (sync != null) {
            sync.cancel(false);
        }
        synchronized (this) {
            live.values().forEach(Registration::cancel);
            live.clear();
        }

        log.info("Cron engine stopped");
    }

    public boolean isRunning() {
        return running.get();
    }

    // ========== Sync ==========

    /**
     * Reconcile live triggers against the enabled jobs in the store.
     *
     * Stored jobs that vanished or were disabled lose their trigger; new jobs and
     * jobs whose expression changed are (re)registered; unchanged jobs keep theirs.
     * Triggers added through {@link #add} are left alone.
     */
    public synchronized void syncFromStore() {
        List<ScheduledJob> enabled = jobRepository.findEnabled();
        Set<String> wanted = enabled.stream()
            .map(ScheduledJob::id)
            .collect(Collectors.toSet());

        for (Registration registration : new ArrayList<>(live.values())) {
            if (registration.persistent && !wanted.contains(registration.jobId)) {
                remove(registration.jobId);
                log.info("Removed stale cron job {}", registration.jobId);
            }
        }
        rejected.keySet().retainAll(wanted);

        for (ScheduledJob job : enabled) {
            try (var ctx = LoggingContext.forJob(job.id())) {
                register(job);
            } catch (InvalidCronExpressionException e) {
                reject(job, e.getMessage());
            } catch (RuntimeException e) {
                log.error("Failed to register cron job {} ({})", job.id(), job.name(), e);
            }
        }

        log.debug("Synced {} enabled jobs; {} live, {} rejected", enabled.size(), live.size(), rejected.size());
    }

    private void syncSafely() {
        try {
            syncFromStore();
        } catch (Exception e) {
            log.error("Cron sync failed", e);
        }
    }

    // ========== Registration ==========

    /**
     * Register (or refresh) the trigger for a stored job.
     *
     * @return true if a trigger was scheduled, false if the live one was kept or the job is spent
     * @throws InvalidCronExpressionException if the expression does not parse or never fires
     */
    public synchronized boolean register(ScheduledJob job) {
        CronSchedule schedule = CronSchedule.parse(job.cronExpression());
        return schedule(job, schedule, true);
    }

    /**
     * Register a trigger that lives only in memory. Adding the same expression
     * under the same id again is a no-op.
     *
     * @return true if a trigger was scheduled
     * @throws InvalidCronExpressionException if the expression does not parse
     */
    public synchronized boolean add(String jobId, String expression, String userId,
                                    String agentSlug, JsonNode payload) {
        CronSchedule schedule = CronSchedule.parse(expression);
        if (schedule.isOnce()) {
            throw new InvalidCronExpressionException(expression, "one-shot jobs must be stored");
        }
        Instant now = clock.instant();
        ScheduledJob job = new ScheduledJob(jobId, userId, jobId, null, schedule.expression(),
            agentSlug, payload, true, null, null, now, now);
        return schedule(job, schedule, false);
    }

    /**
     * Cancel a live trigger. Unknown ids are ignored.
     *
     * @return true if a trigger was cancelled
     */
    public synchronized boolean remove(String jobId) {
        Registration registration = live.remove(jobId);
        if (registration == null) {
            return false;
        }
        registration.cancel();
        log.debug("Cancelled trigger for cron job {}", jobId);
        return true;
    }

    private boolean schedule(ScheduledJob job, CronSchedule schedule, boolean persistent) {
        Registration existing = live.get(job.id());
        if (existing != null && existing.sameTiming(job)) {
            // definition edits that keep the timing apply to the next firing
            live.put(job.id(), existing.withJob(job));
            rejected.remove(job.id());
            return false;
        }

        Instant nextRunAt;
        ScheduledFuture<?> future;
        if (schedule.isOnce()) {
            if (job.nextRunAt() == null) {
                if (job.lastRunAt() != null) {
                    remove(job.id());
                    return false;
                }
                throw new InvalidCronExpressionException(ScheduledJob.ONCE, "no fire time set");
            }
            nextRunAt = job.nextRunAt();
            future = taskScheduler.schedule(() -> fire(job.id()), nextRunAt);
        } else {
            nextRunAt = schedule.nextFireAfter(clock.instant())
                .orElseThrow(() -> new InvalidCronExpressionException(schedule.expression(), "never fires"));
            future = taskScheduler.schedule(() -> fire(job.id()),
                new CronTrigger(schedule.springExpression(), CronSchedule.ZONE));
        }
        if (future == null) {
            throw new InvalidCronExpressionException(schedule.expression(), "never fires");
        }

        if (existing != null) {
            existing.cancel();
        }
        live.put(job.id(), new Registration(job, schedule, future, persistent));
        rejected.remove(job.id());

        if (persistent && !schedule.isOnce()) {
            jobRepository.updateNextRun(job.id(), nextRunAt);
        }

        log.info("Registered cron job {} ({}) '{}', next run at {}",
            job.id(), job.name(), schedule.expression(), nextRunAt);
        return true;
    }

    private void reject(ScheduledJob job, String reason) {
        remove(job.id());
        RejectedJob previous = rejected.put(job.id(),
            new RejectedJob(job.id(), job.name(), job.cronExpression(), reason));
        if (previous == null || !previous.expression().equals(job.cronExpression())) {
            metrics.cronRejected();
            log.error("Rejected cron job {} ({}): {}", job.id(), job.name(), reason);
        }
    }

    // ========== Firing ==========

    /**
     * Publish the CRON event for a live job and record the run.
     */
    void fire(String jobId) {
        Registration registration = live.get(jobId);
        if (registration == null) {
            return;
        }
        ScheduledJob job = registration.job;

        try (var ctx = LoggingContext.forJob(jobId)) {
            Instant firedAt = clock.instant();

            Event event = Event.create(EventKind.CRON, firingPayload(job, registration.persistent),
                CRON_CHANNEL, job.userId());
            eventBus.publish(event);
            metrics.cronFired(job.agentSlug());

            Instant next = registration.schedule.nextFireAfter(firedAt).orElse(null);
            if (registration.persistent) {
                jobRepository.recordRun(jobId, firedAt, next);
            }
            if (registration.schedule.isOnce()) {
                retireOnce(registration);
            }

            log.info("Fired cron job {} ({}) as event {}, next run at {}",
                jobId, job.name(), event.id(), next);
        } catch (Exception e) {
            log.error("Cron job {} failed to fire", jobId, e);
        }
    }

    static ObjectNode firingPayload(ScheduledJob job, boolean named) {
        ObjectNode payload = JsonNodeFactory.instance.objectNode();
        if (named) {
            payload.put("task_name", job.name());
        }
        payload.put("job_id", job.id());
        payload.put("agent_slug", job.agentSlug());
        if (job.taskPayload().isObject()) {
            payload.setAll((ObjectNode) job.taskPayload());
        }
        return payload;
    }

    private synchronized void retireOnce(Registration registration) {
        live.remove(registration.jobId, registration);
        if (!registration.persistent) {
            return;
        }
        try {
            jobRepository.findById(registration.jobId)
                .ifPresent(stored -> jobRepository.update(stored.withEnabled(false)));
        } catch (NotFoundException e) {
            log.debug("One-shot job {} deleted before it could be disabled", registration.jobId);
        }
    }

    // ========== Introspection ==========

    /**
     * Live triggers ordered by next fire time.
     */
    public List<LiveJob> liveJobs() {
        Instant now = clock.instant();
        return live.values().stream()
            .map(r -> new LiveJob(
                r.jobId,
                r.job.name(),
                r.schedule.expression(),
                r.schedule.describe(),
                r.job.agentSlug(),
                r.schedule.isOnce() ? r.job.nextRunAt() : r.schedule.nextFireAfter(now).orElse(null),
                r.persistent))
            .sorted(Comparator.comparing(LiveJob::nextRunAt, Comparator.nullsLast(Comparator.naturalOrder())))
            .toList();
    }

    public List<RejectedJob> rejectedJobs() {
        return rejected.values().stream()
            .sorted(Comparator.comparing(RejectedJob::jobId))
            .toList();
    }

    public boolean isLive(String jobId) {
        return live.containsKey(jobId);
    }

    // ========== Internal ==========

    private static final class Registration {
        final String jobId;
        final ScheduledJob job;
        final CronSchedule schedule;
        final ScheduledFuture<?> future;
        final boolean persistent;

        Registration(ScheduledJob job, CronSchedule schedule, ScheduledFuture<?> future, boolean persistent) {
            this.jobId = job.id();
            this.job = job;
            this.schedule = schedule;
            this.future = future;
            this.persistent = persistent;
        }

        boolean sameTiming(ScheduledJob other) {
            if (!schedule.expression().equals(other.cronExpression().trim())) {
                return false;
            }
            return !schedule.isOnce() || Objects.equals(job.nextRunAt(), other.nextRunAt());
        }

        Registration withJob(ScheduledJob updated) {
            return new Registration(updated, schedule, future, persistent);
        }

        void cancel() {
            future.cancel(false);
        }
    }
}
