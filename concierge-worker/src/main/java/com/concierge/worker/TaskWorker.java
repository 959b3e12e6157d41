package com.concierge.worker;

import com.concierge.core.agent.Agent;
import com.concierge.core.agent.AgentException;
import com.concierge.core.agent.AgentResult;
import com.concierge.core.model.ErrorKind;
import com.concierge.core.model.Event;
import com.concierge.core.model.EventKind;
import com.concierge.core.model.RetryPolicy;
import com.concierge.core.model.Task;
import com.concierge.core.model.TaskStatus;
import com.concierge.core.queue.QueueDelivery;
import com.concierge.core.queue.TaskDescriptor;
import com.concierge.core.queue.TaskQueue;
import com.concierge.core.repository.EventRepository;
import com.concierge.core.repository.TaskRepository;
import com.concierge.engine.agent.AgentCatalog;
import com.concierge.engine.agent.AgentRouter;
import com.concierge.engine.bus.EventBus;
import com.concierge.engine.feedback.FeedbackManager;
import com.concierge.engine.logging.LoggingContext;
import com.concierge.engine.metrics.ConciergeMetrics;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.EnumSet;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Executes one queue delivery through the task state machine.
 *
 * Lifecycle of a delivery:
 * 1. Claim: QUEUED, RETRYING or RUNNING (redelivery) becomes RUNNING
 * 2. Resolve the agent: the task's own slug if known, else the router
 * 3. Execute the agent
 * 4. Write the terminal state, or RETRYING plus a delayed re-enqueue for transient failures
 * 5. Publish the lifecycle event and send feedback
 * 6. Acknowledge the delivery
 *
 * All status writes are compare-and-set; a write that loses a race (for example to a
 * cancellation) discards this worker's outcome rather than overwriting.
 */
public class TaskWorker {

    private static final Logger log = LoggerFactory.getLogger(TaskWorker.class);

    static final Set<TaskStatus> CLAIMABLE = EnumSet.of(TaskStatus.QUEUED, TaskStatus.RETRYING, TaskStatus.RUNNING);
    static final Set<TaskStatus> EXECUTING = EnumSet.of(TaskStatus.RUNNING);

    static final String NO_AGENT_ERROR = "No suitable agent found for this task";

    private final TaskRepository taskRepository;
    private final EventRepository eventRepository;
    private final TaskQueue taskQueue;
    private final AgentCatalog catalog;
    private final AgentRouter router;
    private final EventBus eventBus;
    private final FeedbackManager feedback;
    private final RetryPolicy retryPolicy;
    private final ConciergeMetrics metrics;
    private final Clock clock;

    private TaskWorker(Builder builder) {
        this.taskRepository = Objects.requireNonNull(builder.taskRepository, "taskRepository");
        this.eventRepository = Objects.requireNonNull(builder.eventRepository, "eventRepository");
        this.taskQueue = Objects.requireNonNull(builder.taskQueue, "taskQueue");
        this.catalog = Objects.requireNonNull(builder.catalog, "catalog");
        this.router = Objects.requireNonNull(builder.router, "router");
        this.eventBus = Objects.requireNonNull(builder.eventBus, "eventBus");
        this.feedback = Objects.requireNonNull(builder.feedback, "feedback");
        this.retryPolicy = Objects.requireNonNull(builder.retryPolicy, "retryPolicy");
        this.metrics = Objects.requireNonNull(builder.metrics, "metrics");
        this.clock = Objects.requireNonNull(builder.clock, "clock");
    }

    /**
     * Process one delivery to completion. The delivery is acknowledged unless an
     * unexpected error escapes, in which case the queue redelivers it later.
     *
     * @param delivery The claimed queue entry
     * @return What the delivery led to
     */
    public TaskOutcome process(QueueDelivery delivery) {
        TaskDescriptor descriptor = delivery.descriptor();

        try (var ctx = LoggingContext.forTask(descriptor.taskId(), descriptor.userId(), descriptor.retryCount())) {
            TaskOutcome outcome = run(delivery);
            taskQueue.acknowledge(delivery.handle());
            return outcome;
        }
    }

    private TaskOutcome run(QueueDelivery delivery) {
        Optional<Task> found = taskRepository.findById(delivery.descriptor().taskId());
        if (found.isEmpty()) {
            log.warn("Task of delivery {} no longer exists, dropping", delivery.handle());
            return TaskOutcome.DISCARDED;
        }

        Task task = found.get();
        if (task.isTerminal()) {
            if (task.status() == TaskStatus.CANCELLED) {
                taskQueue.clearCancellation(task.id());
            }
            log.debug("Task already {}, dropping delivery {}", task.status(), delivery.handle());
            return TaskOutcome.DISCARDED;
        }

        if (taskQueue.isCancelled(task.id())) {
            if (taskRepository.compareAndSet(task.withCancelled(), TaskStatus.sourcesOf(TaskStatus.CANCELLED))) {
                metrics.taskCancelled();
                log.info("Task '{}' cancelled before execution", task.title());
            }
            taskQueue.clearCancellation(task.id());
            return TaskOutcome.CANCELLED;
        }

        Task running = task.withRunning();
        if (!taskRepository.compareAndSet(running, CLAIMABLE)) {
            log.debug("Task moved on from {} before it could be claimed", task.status());
            return TaskOutcome.DISCARDED;
        }
        if (delivery.isRedelivery()) {
            log.info("Redelivery {} of task '{}'", delivery.deliveryCount(), task.title());
        }

        Optional<Agent> resolved = router.resolve(running);
        if (resolved.isEmpty()) {
            return failRouting(running);
        }

        Agent agent = resolved.get();
        if (!agent.slug().equals(running.agentSlug())) {
            running = running.toBuilder().agentSlug(agent.slug()).build();
        }

        log.info("Executing task '{}' with agent {} (attempt {})",
            running.title(), agent.slug(), running.retryCount() + 1);

        Instant started = clock.instant();
        AgentResult result = execute(agent, running);
        Duration elapsed = Duration.between(started, clock.instant());

        if (result.isSuccess()) {
            return complete(running, result, elapsed);
        }
        if (result.errorKind().isRetryable()) {
            return retryOrFail(running, result.error());
        }
        return fail(running, result.errorKind(), result.error());
    }

    // ========== Resolution and execution ==========

    private AgentResult execute(Agent agent, Task task) {
        try {
            AgentResult result = agent.execute(task);
            return result != null ? result : AgentResult.transientFailure("Agent returned no result");
        } catch (AgentException e) {
            log.warn("Agent {} failed: {} - {}", agent.slug(), e.getErrorCode(), e.getMessage());
            return e.isRetryable()
                ? AgentResult.transientFailure(e.getMessage())
                : AgentResult.permanentFailure(e.getMessage());
        } catch (Exception e) {
            log.error("Agent {} failed with unexpected error", agent.slug(), e);
            return AgentResult.transientFailure(e.getClass().getSimpleName() + ": " + e.getMessage());
        }
    }

    // ========== Terminal transitions ==========

    private TaskOutcome complete(Task running, AgentResult result, Duration elapsed) {
        Task done = running.withSuccess(result.output());
        if (!taskRepository.compareAndSet(done, EXECUTING)) {
            log.info("Task '{}' changed state while running, discarding its result", running.title());
            return TaskOutcome.DISCARDED;
        }

        markSourceProcessed(done);
        metrics.taskCompleted(done.agentSlug(), elapsed);
        log.info("Task '{}' completed in {} ms", done.title(), elapsed.toMillis());

        String summary = result.summaryText();
        publishLifecycle(EventKind.TASK_COMPLETE, done, "summary", summary);
        feedback.sendSuccess(done, summary);
        return TaskOutcome.SUCCEEDED;
    }

    private void markSourceProcessed(Task done) {
        if (done.sourceEventId() == null) {
            return;
        }
        try {
            eventRepository.markProcessed(done.sourceEventId());
        } catch (RuntimeException e) {
            log.warn("Could not mark event {} processed for task '{}'", done.sourceEventId(), done.title(), e);
        }
    }

    private TaskOutcome retryOrFail(Task running, String error) {
        int retryCount = running.retryCount() + 1;
        if (!retryPolicy.allowsRetry(retryCount)) {
            log.warn("Task '{}' exhausted {} retries", running.title(), retryPolicy.maxRetries());
            return fail(running.toBuilder().retryCount(retryCount).build(), ErrorKind.TRANSIENT_EXECUTION, error);
        }

        Task retrying = running.withRetrying(retryCount, error);
        if (!taskRepository.compareAndSet(retrying, EXECUTING)) {
            log.info("Task '{}' changed state while running, not retrying", running.title());
            return TaskOutcome.DISCARDED;
        }

        Duration backoff = retryPolicy.computeBackoff(retryCount);
        String handle = taskQueue.enqueue(TaskDescriptor.of(retrying), backoff);
        taskRepository.recordQueueHandle(retrying.id(), handle);
        metrics.taskRetried(retrying.agentSlug(), retryCount);
        log.warn("Task '{}' failed transiently ({}), retry {} in {}s",
            retrying.title(), error, retryCount, backoff.toSeconds());
        return TaskOutcome.RETRY_SCHEDULED;
    }

    private TaskOutcome failRouting(Task running) {
        Task failed = running.withFailure(NO_AGENT_ERROR);
        if (!taskRepository.compareAndSet(failed, EXECUTING)) {
            return TaskOutcome.DISCARDED;
        }

        metrics.routingFailure();
        metrics.taskFailed(null, ErrorKind.ROUTING_FAILURE.name());
        log.warn("No agent found for task '{}'", running.title());

        publishLifecycle(EventKind.TASK_FAILED, failed, "error", NO_AGENT_ERROR);
        feedback.sendFailure(failed,
            "I couldn't find a suitable agent for this task. Available agents: "
                + String.join(", ", catalog.slugs()),
            null);
        return TaskOutcome.FAILED;
    }

    private TaskOutcome fail(Task running, ErrorKind kind, String error) {
        Task failed = running.withFailure(error);
        if (!taskRepository.compareAndSet(failed, EXECUTING)) {
            log.info("Task '{}' changed state while running, discarding its failure", running.title());
            return TaskOutcome.DISCARDED;
        }

        metrics.taskFailed(failed.agentSlug(), kind.name());
        log.error("Task '{}' failed: {}", failed.title(), error);

        publishLifecycle(EventKind.TASK_FAILED, failed, "error", error);
        feedback.sendFailure(failed, "Task failed: " + failed.title(), error);
        return TaskOutcome.FAILED;
    }

    private void publishLifecycle(EventKind kind, Task task, String detailField, String detail) {
        ObjectNode payload = JsonNodeFactory.instance.objectNode()
            .put("task_id", task.id())
            .put("title", task.title())
            .put("status", task.status().wireValue())
            .put("agent_slug", task.agentSlug())
            .put(detailField, detail);
        eventBus.publish(Event.create(kind, payload, task.sourceChannel(), task.userId()));
    }

    // ========== Builder ==========

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private TaskRepository taskRepository;
        private EventRepository eventRepository;
        private TaskQueue taskQueue;
        private AgentCatalog catalog;
        private AgentRouter router;
        private EventBus eventBus;
        private FeedbackManager feedback;
        private RetryPolicy retryPolicy = RetryPolicy.defaultPolicy();
        private ConciergeMetrics metrics;
        private Clock clock = Clock.systemUTC();

        public Builder taskRepository(TaskRepository taskRepository) {
            this.taskRepository = taskRepository;
            return this;
        }

        public Builder eventRepository(EventRepository eventRepository) {
            this.eventRepository = eventRepository;
            return this;
        }

        public Builder taskQueue(TaskQueue taskQueue) {
            this.taskQueue = taskQueue;
            return this;
        }

        public Builder catalog(AgentCatalog catalog) {
            this.catalog = catalog;
            return this;
        }

        public Builder router(AgentRouter router) {
            this.router = router;
            return this;
        }

        public Builder eventBus(EventBus eventBus) {
            this.eventBus = eventBus;
            return this;
        }

        public Builder feedback(FeedbackManager feedback) {
            this.feedback = feedback;
            return this;
        }

        public Builder retryPolicy(RetryPolicy retryPolicy) {
            this.retryPolicy = retryPolicy;
            return this;
        }

        public Builder metrics(ConciergeMetrics metrics) {
            this.metrics = metrics;
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        public TaskWorker build() {
            return new TaskWorker(this);
        }
    }
}
