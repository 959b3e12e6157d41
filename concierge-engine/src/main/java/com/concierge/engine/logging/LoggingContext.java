package com.concierge.engine.logging;

import org.slf4j.MDC;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * MDC (Mapped Diagnostic Context) helper for structured logging.
 * Ensures all logs include relevant correlation IDs for tracing.
 *
 * Usage:
 * <pre>
 * try (var ctx = LoggingContext.forTask(taskId, userId, retryCount)) {
 *     log.info("Executing task"); // Automatically includes taskId, userId, attempt
 * }
 * </pre>
 *
 * Log output with MDC:
 * 2024-01-15 10:30:45.123 [worker-1] INFO  c.c.w.TaskWorker - Executing task
 *   taskId=abc-123 attempt=1 eventId=evt-456
 *
 * Contexts nest: closing one restores whatever values the keys held before it opened.
 */
public final class LoggingContext implements AutoCloseable {

    public static final String TASK_ID = "taskId";
    public static final String EVENT_ID = "eventId";
    public static final String EVENT_KIND = "eventKind";
    public static final String JOB_ID = "jobId";
    public static final String ATTEMPT = "attempt";
    public static final String USER_ID = "userId";
    public static final String WORKER_ID = "workerId";
    public static final String TRACE_ID = "traceId";

    private final Map<String, String> previous = new LinkedHashMap<>();

    private LoggingContext() {
        // Private constructor - use static factory methods
    }

    /**
     * Create a logging context for event delivery.
     */
    public static LoggingContext forEvent(String eventId, String kind) {
        LoggingContext ctx = new LoggingContext();
        ctx.put(EVENT_ID, eventId);
        ctx.put(EVENT_KIND, kind);
        ensureTraceId();
        return ctx;
    }

    /**
     * Create a logging context for task-level operations.
     */
    public static LoggingContext forTask(String taskId, String userId, int attempt) {
        LoggingContext ctx = new LoggingContext();
        ctx.put(TASK_ID, taskId);
        ctx.put(USER_ID, userId);
        ctx.put(ATTEMPT, String.valueOf(attempt));
        ensureTraceId();
        return ctx;
    }

    /**
     * Create a logging context for a scheduled job.
     */
    public static LoggingContext forJob(String jobId) {
        LoggingContext ctx = new LoggingContext();
        ctx.put(JOB_ID, jobId);
        ensureTraceId();
        return ctx;
    }

    /**
     * Create a logging context for worker operations.
     */
    public static LoggingContext forWorker(String workerId) {
        LoggingContext ctx = new LoggingContext();
        ctx.put(WORKER_ID, workerId);
        ensureTraceId();
        return ctx;
    }

    private void put(String key, String value) {
        if (value == null) {
            return;
        }
        if (!previous.containsKey(key)) {
            previous.put(key, MDC.get(key));
        }
        MDC.put(key, value);
    }

    /**
     * Ensure a trace ID exists in the context.
     */
    private static void ensureTraceId() {
        if (MDC.get(TRACE_ID) == null) {
            MDC.put(TRACE_ID, UUID.randomUUID().toString().substring(0, 8));
        }
    }

    @Override
    public void close() {
        previous.forEach((key, value) -> {
            if (value != null) {
                MDC.put(key, value);
            } else {
                MDC.remove(key);
            }
        });
        // TRACE_ID survives for the enclosing loop
    }
}
