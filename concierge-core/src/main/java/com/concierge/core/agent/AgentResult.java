package com.concierge.core.agent;

import com.concierge.core.model.ErrorKind;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.Objects;

/**
 * Outcome of one agent execution: either an output payload or a classified error.
 */
public record AgentResult(
    JsonNode output,
    ErrorKind errorKind,
    String error
) {
    private static final String[] SUMMARY_FIELDS = {"summary", "message", "result", "error"};

    public static AgentResult success(JsonNode output) {
        return new AgentResult(output != null ? output : JsonNodeFactory.instance.objectNode(), null, null);
    }

    /**
     * Success carrying only a user-facing summary.
     */
    public static AgentResult summary(String text) {
        ObjectNode output = JsonNodeFactory.instance.objectNode();
        output.put("summary", text);
        return success(output);
    }

    public static AgentResult failure(ErrorKind kind, String error) {
        Objects.requireNonNull(kind, "kind");
        return new AgentResult(null, kind, error);
    }

    /**
     * Failure worth retrying.
     */
    public static AgentResult transientFailure(String error) {
        return failure(ErrorKind.TRANSIENT_EXECUTION, error);
    }

    /**
     * Failure that retrying cannot fix.
     */
    public static AgentResult permanentFailure(String error) {
        return failure(ErrorKind.PERMANENT_EXECUTION, error);
    }

    public boolean isSuccess() {
        return errorKind == null;
    }

    /**
     * The text to show the user: the first of summary, message, result or error
     * found in the output, falling back to a generic line.
     */
    public String summaryText() {
        if (!isSuccess()) {
            return error != null ? error : errorKind.name();
        }
        if (output != null && output.isObject()) {
            for (String field : SUMMARY_FIELDS) {
                JsonNode node = output.get(field);
                if (node != null && node.isTextual() && !node.asText().isBlank()) {
                    return node.asText();
                }
            }
        }
        return "Task complete.";
    }
}
