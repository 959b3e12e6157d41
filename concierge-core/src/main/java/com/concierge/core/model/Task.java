package com.concierge.core.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;

import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.UUID;

/**
 * A persisted, queueable unit of work derived from routing an event.
 *
 * Primary Key: id
 *
 * Invariants:
 * - once status is terminal it is never written again
 * - sourceEventId is a back-reference only, never an ownership edge
 * - retryCount only grows
 */
public record Task(
    String id,
    String title,
    String userId,
    JsonNode inputData,
    String agentSlug,
    String workflowId,
    String sourceEventId,
    String sourceChannel,
    TaskStatus status,
    int retryCount,
    String error,
    JsonNode outputData,
    String queueHandle,
    Instant createdAt,
    Instant updatedAt
) {
    /**
     * User identity applied when an event carries none.
     */
    public static final String SYSTEM_USER = "system";

    /**
     * Input fields that carry free text, scanned by keyword routing.
     */
    public static final List<String> FREE_TEXT_FIELDS = List.of("text", "message", "prompt", "query");

    /**
     * Longest stored title, in code points.
     */
    public static final int MAX_TITLE_LENGTH = 255;

    public Task {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(status, "status");
        if (inputData == null || inputData.isNull()) {
            inputData = JsonNodeFactory.instance.objectNode();
        }
        title = truncate(title == null ? "" : title, MAX_TITLE_LENGTH);
    }

    /**
     * Cut text to at most {@code maxCodePoints} code points without splitting a surrogate pair.
     */
    public static String truncate(String text, int maxCodePoints) {
        if (text.codePointCount(0, text.length()) <= maxCodePoints) {
            return text;
        }
        return text.substring(0, text.offsetByCodePoints(0, maxCodePoints));
    }

    /**
     * Create a new task in PENDING state.
     */
    public static Task create(String title, String userId, JsonNode inputData) {
        Instant now = Instant.now();
        return builder()
            .id(UUID.randomUUID().toString())
            .title(title)
            .userId(userId != null ? userId : SYSTEM_USER)
            .inputData(inputData)
            .status(TaskStatus.PENDING)
            .createdAt(now)
            .updatedAt(now)
            .build();
    }

    /**
     * Read a text field from the input data, or null if absent.
     */
    public String inputText(String field) {
        JsonNode node = inputData.get(field);
        return node != null && node.isValueNode() && !node.isNull() ? node.asText() : null;
    }

    /**
     * Title plus every free-text input field, joined by spaces.
     * This is the text keyword routing matches against.
     */
    public String searchableText() {
        StringBuilder text = new StringBuilder(title);
        for (String field : FREE_TEXT_FIELDS) {
            String value = inputText(field);
            if (value != null && !value.isBlank()) {
                text.append(' ').append(value);
            }
        }
        return text.toString();
    }

    public boolean hasExplicitAgent() {
        return agentSlug != null && !agentSlug.isBlank();
    }

    public boolean isTerminal() {
        return status.isTerminal();
    }

    // ========== Copies ==========

    public Task withStatus(TaskStatus newStatus) {
        return toBuilder().status(newStatus).updatedAt(Instant.now()).build();
    }

    public Task withQueued(String handle) {
        return toBuilder().status(TaskStatus.QUEUED).queueHandle(handle).updatedAt(Instant.now()).build();
    }

    public Task withRunning() {
        return withStatus(TaskStatus.RUNNING);
    }

    public Task withSuccess(JsonNode output) {
        return toBuilder()
            .status(TaskStatus.SUCCESS)
            .outputData(output)
            .error(null)
            .updatedAt(Instant.now())
            .build();
    }

    public Task withFailure(String errorMessage) {
        return toBuilder()
            .status(TaskStatus.FAILURE)
            .error(errorMessage)
            .updatedAt(Instant.now())
            .build();
    }

    public Task withRetrying(int newRetryCount, String errorMessage) {
        return toBuilder()
            .status(TaskStatus.RETRYING)
            .retryCount(newRetryCount)
            .error(errorMessage)
            .updatedAt(Instant.now())
            .build();
    }

    public Task withCancelled() {
        return withStatus(TaskStatus.CANCELLED);
    }

    // ========== Builder ==========

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder()
            .id(id)
            .title(title)
            .userId(userId)
            .inputData(inputData)
            .agentSlug(agentSlug)
            .workflowId(workflowId)
            .sourceEventId(sourceEventId)
            .sourceChannel(sourceChannel)
            .status(status)
            .retryCount(retryCount)
            .error(error)
            .outputData(outputData)
            .queueHandle(queueHandle)
            .createdAt(createdAt)
            .updatedAt(updatedAt);
    }

    public static class Builder {
        private String id;
        private String title;
        private String userId;
        private JsonNode inputData;
        private String agentSlug;
        private String workflowId;
        private String sourceEventId;
        private String sourceChannel;
        private TaskStatus status = TaskStatus.PENDING;
        private int retryCount;
        private String error;
        private JsonNode outputData;
        private String queueHandle;
        private Instant createdAt;
        private Instant updatedAt;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder title(String title) {
            this.title = title;
            return this;
        }

        public Builder userId(String userId) {
            this.userId = userId;
            return this;
        }

        public Builder inputData(JsonNode inputData) {
            this.inputData = inputData;
            return this;
        }

        public Builder agentSlug(String agentSlug) {
            this.agentSlug = agentSlug;
            return this;
        }

        public Builder workflowId(String workflowId) {
            this.workflowId = workflowId;
            return this;
        }

        public Builder sourceEventId(String sourceEventId) {
            this.sourceEventId = sourceEventId;
            return this;
        }

        public Builder sourceChannel(String sourceChannel) {
            this.sourceChannel = sourceChannel;
            return this;
        }

        public Builder status(TaskStatus status) {
            this.status = status;
            return this;
        }

        public Builder retryCount(int retryCount) {
            this.retryCount = retryCount;
            return this;
        }

        public Builder error(String error) {
            this.error = error;
            return this;
        }

        public Builder outputData(JsonNode outputData) {
            this.outputData = outputData;
            return this;
        }

        public Builder queueHandle(String queueHandle) {
            this.queueHandle = queueHandle;
            return this;
        }

        public Builder createdAt(Instant createdAt) {
            this.createdAt = createdAt;
            return this;
        }

        public Builder updatedAt(Instant updatedAt) {
            this.updatedAt = updatedAt;
            return this;
        }

        public Task build() {
            Instant now = Instant.now();
            return new Task(
                id != null ? id : UUID.randomUUID().toString(),
                title,
                userId != null ? userId : SYSTEM_USER,
                inputData,
                agentSlug,
                workflowId,
                sourceEventId,
                sourceChannel,
                status,
                retryCount,
                error,
                outputData,
                queueHandle,
                createdAt != null ? createdAt : now,
                updatedAt != null ? updatedAt : now
            );
        }
    }
}
