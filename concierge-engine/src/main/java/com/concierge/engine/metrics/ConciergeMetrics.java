package com.concierge.engine.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.binder.MeterBinder;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

import java.time.Duration;
import java.util.function.Supplier;

/**
 * Prometheus metrics for the assistant core.
 *
 * Metrics exposed:
 * - Events published and handler faults by kind
 * - Tasks dispatched, completed, failed, retried and cancelled
 * - Routing failures
 * - Agent execution latency
 * - Cron firings and rejected schedules
 * - Feedback delivery failures
 * - Queue depth and live cron triggers
 */
public class ConciergeMetrics implements MeterBinder {

    // Metric names
    public static final String EVENTS_PUBLISHED = "concierge.events.published";
    public static final String HANDLER_FAULTS = "concierge.events.handler_faults";

    public static final String TASKS_DISPATCHED = "concierge.tasks.dispatched";
    public static final String TASKS_COMPLETED = "concierge.tasks.completed";
    public static final String TASKS_FAILED = "concierge.tasks.failed";
    public static final String TASK_RETRIES = "concierge.task.retries";
    public static final String TASKS_CANCELLED = "concierge.tasks.cancelled";
    public static final String TASK_DURATION = "concierge.task.duration";
    public static final String ROUTING_FAILURES = "concierge.routing.failures";

    public static final String CRON_FIRINGS = "concierge.cron.firings";
    public static final String CRON_REJECTED = "concierge.cron.rejected";
    public static final String CRON_LIVE_TRIGGERS = "concierge.cron.live_triggers";

    public static final String DELIVERY_FAILURES = "concierge.delivery.failures";
    public static final String QUEUE_SIZE = "concierge.queue.size";

    private MeterRegistry registry;

    public ConciergeMetrics(MeterRegistry registry) {
        bindTo(registry);
    }

    /**
     * Metrics recorded into a private registry, for tests and tools.
     */
    public static ConciergeMetrics standalone() {
        return new ConciergeMetrics(new SimpleMeterRegistry());
    }

    @Override
    public void bindTo(MeterRegistry registry) {
        this.registry = registry;
    }

    public MeterRegistry registry() {
        return registry;
    }

    // ========== Event Metrics ==========

    public void eventPublished(String kind) {
        Counter.builder(EVENTS_PUBLISHED)
            .tag("kind", kind)
            .description("Total events published on the bus")
            .register(registry)
            .increment();
    }

    public void handlerFault(String kind) {
        Counter.builder(HANDLER_FAULTS)
            .tag("kind", kind)
            .description("Handler invocations that threw")
            .register(registry)
            .increment();
    }

    // ========== Task Metrics ==========

    public void taskDispatched(String sourceChannel) {
        Counter.builder(TASKS_DISPATCHED)
            .tag("channel", tagValue(sourceChannel))
            .description("Total tasks placed on the queue")
            .register(registry)
            .increment();
    }

    public void taskCompleted(String agentSlug, Duration duration) {
        Counter.builder(TASKS_COMPLETED)
            .tag("agent", tagValue(agentSlug))
            .description("Total tasks completed successfully")
            .register(registry)
            .increment();

        Timer.builder(TASK_DURATION)
            .tag("agent", tagValue(agentSlug))
            .tag("outcome", "success")
            .description("Agent execution duration")
            .register(registry)
            .record(duration);
    }

    public void taskFailed(String agentSlug, String errorKind) {
        Counter.builder(TASKS_FAILED)
            .tag("agent", tagValue(agentSlug))
            .tag("error_kind", errorKind)
            .description("Total tasks that ended in failure")
            .register(registry)
            .increment();
    }

    public void taskRetried(String agentSlug, int retryCount) {
        Counter.builder(TASK_RETRIES)
            .tag("agent", tagValue(agentSlug))
            .tag("attempt", String.valueOf(retryCount))
            .description("Total task retries scheduled")
            .register(registry)
            .increment();
    }

    public void routingFailure() {
        Counter.builder(ROUTING_FAILURES)
            .description("Tasks no agent could be found for")
            .register(registry)
            .increment();
    }

    public void taskCancelled() {
        Counter.builder(TASKS_CANCELLED)
            .description("Total tasks cancelled")
            .register(registry)
            .increment();
    }

    // ========== Scheduler Metrics ==========

    public void cronFired(String agentSlug) {
        Counter.builder(CRON_FIRINGS)
            .tag("agent", tagValue(agentSlug))
            .description("Total cron firings")
            .register(registry)
            .increment();
    }

    public void cronRejected() {
        Counter.builder(CRON_REJECTED)
            .description("Stored schedules rejected as malformed")
            .register(registry)
            .increment();
    }

    // ========== Delivery Metrics ==========

    public void deliveryFailed(String channel) {
        Counter.builder(DELIVERY_FAILURES)
            .tag("channel", tagValue(channel))
            .description("Feedback messages that could not be delivered")
            .register(registry)
            .increment();
    }

    // ========== Gauges ==========

    public void registerQueueSize(Supplier<Number> size) {
        Gauge.builder(QUEUE_SIZE, size)
            .description("Queue entries not yet acknowledged")
            .register(registry);
    }

    public void registerLiveTriggers(Supplier<Number> count) {
        Gauge.builder(CRON_LIVE_TRIGGERS, count)
            .description("Cron triggers currently registered")
            .register(registry);
    }

    private static String tagValue(String value) {
        return value != null ? value : "none";
    }
}
