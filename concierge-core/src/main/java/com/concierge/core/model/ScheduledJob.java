package com.concierge.core.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;

import java.time.Instant;
import java.util.Objects;
import java.util.UUID;

/**
 * Persistent cron definition. The cron engine reconciles live triggers against these rows.
 *
 * Primary Key: id
 * Unique Constraint: (userId, name)
 *
 * Invariants:
 * - cronExpression is five whitespace-separated fields or {@link #ONCE}
 * - a {@link #ONCE} job carries a future nextRunAt when created
 * - only the cron engine writes lastRunAt / nextRunAt after creation
 */
public record ScheduledJob(
    String id,
    String userId,
    String name,
    String description,
    String cronExpression,
    String agentSlug,
    JsonNode taskPayload,
    boolean enabled,
    Instant lastRunAt,
    Instant nextRunAt,
    Instant createdAt,
    Instant updatedAt
) {
    /**
     * Sentinel expression for a single firing at nextRunAt.
     */
    public static final String ONCE = "@once";

    public ScheduledJob {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(userId, "userId");
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(cronExpression, "cronExpression");
        if (taskPayload == null || taskPayload.isNull()) {
            taskPayload = JsonNodeFactory.instance.objectNode();
        }
    }

    /**
     * Create a new enabled job.
     */
    public static ScheduledJob create(String userId, String name, String cronExpression,
                                      String agentSlug, JsonNode taskPayload) {
        Instant now = Instant.now();
        return new ScheduledJob(
            UUID.randomUUID().toString(),
            userId,
            name,
            null,
            cronExpression.trim(),
            agentSlug,
            taskPayload,
            true,
            null,
            null,
            now,
            now
        );
    }

    /**
     * Create a one-shot job firing at the given instant.
     */
    public static ScheduledJob once(String userId, String name, Instant fireAt,
                                    String agentSlug, JsonNode taskPayload) {
        return create(userId, name, ONCE, agentSlug, taskPayload).withNextRunAt(fireAt);
    }

    public boolean isOnce() {
        return ONCE.equals(cronExpression);
    }

    public ScheduledJob withNextRunAt(Instant next) {
        return new ScheduledJob(id, userId, name, description, cronExpression, agentSlug, taskPayload,
            enabled, lastRunAt, next, createdAt, Instant.now());
    }

    public ScheduledJob withRun(Instant lastRun, Instant nextRun) {
        return new ScheduledJob(id, userId, name, description, cronExpression, agentSlug, taskPayload,
            enabled, lastRun, nextRun, createdAt, Instant.now());
    }

    public ScheduledJob withEnabled(boolean isEnabled) {
        return new ScheduledJob(id, userId, name, description, cronExpression, agentSlug, taskPayload,
            isEnabled, lastRunAt, nextRunAt, createdAt, Instant.now());
    }

    public ScheduledJob withExpression(String expression) {
        return new ScheduledJob(id, userId, name, description, expression.trim(), agentSlug, taskPayload,
            enabled, lastRunAt, nextRunAt, createdAt, Instant.now());
    }

    public ScheduledJob withDescription(String text) {
        return new ScheduledJob(id, userId, name, text, cronExpression, agentSlug, taskPayload,
            enabled, lastRunAt, nextRunAt, createdAt, Instant.now());
    }
}
