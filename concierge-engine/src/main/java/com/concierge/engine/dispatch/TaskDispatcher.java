package com.concierge.engine.dispatch;

import com.concierge.core.exception.NotFoundException;
import com.concierge.core.model.Event;
import com.concierge.core.model.EventKind;
import com.concierge.core.model.Task;
import com.concierge.core.model.TaskStatus;
import com.concierge.core.queue.TaskDescriptor;
import com.concierge.core.queue.TaskQueue;
import com.concierge.core.repository.TaskRepository;
import com.concierge.engine.logging.LoggingContext;
import com.concierge.engine.metrics.ConciergeMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Set;

/**
 * Turns tasks into queue entries.
 *
 * Dispatch sequence:
 * 1. Persist the task as PENDING
 * 2. Move it to QUEUED
 * 3. Place its descriptor on the queue
 * 4. Record the queue handle on the task
 *
 * Marking the task QUEUED before it is enqueued means a worker can never pick up
 * an entry whose task is still PENDING.
 */
public class TaskDispatcher {

    private static final Logger log = LoggerFactory.getLogger(TaskDispatcher.class);

    /**
     * Longest title derived from message text, in code points.
     */
    public static final int MAX_TITLE_LENGTH = 120;

    private final TaskRepository taskRepository;
    private final TaskQueue taskQueue;
    private final ConciergeMetrics metrics;

    public TaskDispatcher(TaskRepository taskRepository, TaskQueue taskQueue, ConciergeMetrics metrics) {
        this.taskRepository = taskRepository;
        this.taskQueue = taskQueue;
        this.metrics = metrics;
    }

    /**
     * Persist a new task and place it on the execution queue.
     *
     * @param task A task in PENDING state
     * @return The queue handle
     * @throws IllegalArgumentException if the task is not PENDING
     * @throws IllegalStateException if the task changed state while being dispatched
     */
    public String dispatch(Task task) {
        if (task.status() != TaskStatus.PENDING) {
            throw new IllegalArgumentException(
                "Only pending tasks can be dispatched, task " + task.id() + " is " + task.status());
        }

        try (var ctx = LoggingContext.forTask(task.id(), task.userId(), task.retryCount())) {
            taskRepository.save(task);

            if (!taskRepository.compareAndSet(task.withStatus(TaskStatus.QUEUED), Set.of(TaskStatus.PENDING))) {
                throw new IllegalStateException("Task " + task.id() + " left PENDING before it was queued");
            }

            String handle;
            try {
                handle = taskQueue.enqueue(TaskDescriptor.of(task), Duration.ZERO);
            } catch (RuntimeException e) {
                log.error("Failed to enqueue task '{}'", task.title(), e);
                taskRepository.compareAndSet(
                    task.withFailure("Failed to enqueue: " + e.getMessage()), Set.of(TaskStatus.QUEUED));
                throw e;
            }

            taskRepository.recordQueueHandle(task.id(), handle);
            metrics.taskDispatched(task.sourceChannel());
            log.info("Dispatched task '{}' (agent: {}, channel: {}) as {}",
                task.title(), task.agentSlug(), task.sourceChannel(), handle);
            return handle;
        }
    }

    /**
     * Build a task from an event and dispatch it.
     *
     * @param event The originating event
     * @param agentSlug Explicit agent, or null to let the worker route
     * @return The dispatched task, carrying its queue handle
     */
    public Task dispatchFromEvent(Event event, String agentSlug) {
        Task task = Task.create(titleFor(event), event.userId(), event.payloadCopy())
            .toBuilder()
            .agentSlug(agentSlug)
            .sourceEventId(event.id())
            .sourceChannel(event.sourceChannel())
            .build();

        String handle = dispatch(task);
        return task.withQueued(handle);
    }

    /**
     * Cancel a task that has not reached a terminal state.
     * Queued tasks are dropped when a worker picks them up; a running task is
     * signalled and its eventual outcome is discarded.
     *
     * @param taskId The task ID
     * @return true if the task was cancelled by this call
     * @throws NotFoundException if the task does not exist
     */
    public boolean cancel(String taskId) {
        Task task = taskRepository.findById(taskId)
            .orElseThrow(() -> new NotFoundException("Task", taskId));

        if (task.isTerminal()) {
            log.debug("Task {} already {}, not cancelling", taskId, task.status());
            return false;
        }

        boolean cancelled = taskRepository.compareAndSet(
            task.withCancelled(), TaskStatus.sourcesOf(TaskStatus.CANCELLED));
        if (cancelled) {
            taskQueue.cancel(taskId);
            metrics.taskCancelled();
            log.info("Cancelled task {} (was {})", taskId, task.status());
        }
        return cancelled;
    }

    /**
     * Title of a task derived from an event: the message text for channel messages,
     * otherwise a description of the event kind.
     */
    public static String titleFor(Event event) {
        if (event.kind() == EventKind.CHANNEL_MESSAGE) {
            String text = event.payloadText("text");
            if (text == null || text.isBlank()) {
                return "Channel message";
            }
            return Task.truncate(text, MAX_TITLE_LENGTH);
        }
        return "Task from " + event.kind().wireValue() + " event";
    }
}
