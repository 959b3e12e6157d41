package com.concierge.scheduler;

import com.fasterxml.jackson.databind.JsonNode;

import java.time.Instant;

/**
 * Fields for creating or editing a scheduled job. On edit, null fields keep
 * their stored value.
 *
 * @param nextRunAt fire time, only meaningful for {@code @once} expressions
 */
public record ScheduleRequest(
    String name,
    String description,
    String cronExpression,
    String agentSlug,
    JsonNode taskPayload,
    Boolean enabled,
    Instant nextRunAt
) {
    public static final int MAX_NAME_LENGTH = 255;
    public static final int MAX_EXPRESSION_LENGTH = 50;

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String name;
        private String description;
        private String cronExpression;
        private String agentSlug;
        private JsonNode taskPayload;
        private Boolean enabled;
        private Instant nextRunAt;

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder cronExpression(String cronExpression) {
            this.cronExpression = cronExpression;
            return this;
        }

        public Builder agentSlug(String agentSlug) {
            this.agentSlug = agentSlug;
            return this;
        }

        public Builder taskPayload(JsonNode taskPayload) {
            this.taskPayload = taskPayload;
            return this;
        }

        public Builder enabled(boolean enabled) {
            this.enabled = enabled;
            return this;
        }

        public Builder nextRunAt(Instant nextRunAt) {
            this.nextRunAt = nextRunAt;
            return this;
        }

        public ScheduleRequest build() {
            return new ScheduleRequest(name, description, cronExpression, agentSlug, taskPayload, enabled, nextRunAt);
        }
    }
}
