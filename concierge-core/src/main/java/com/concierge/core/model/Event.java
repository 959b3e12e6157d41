package com.concierge.core.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.time.Instant;
import java.util.Objects;
import java.util.UUID;

/**
 * Immutable fact entering the system: an inbound message, webhook, cron firing
 * or internal lifecycle signal.
 *
 * Invariants:
 * - id is unique per event
 * - kind never changes after construction
 * - payload is always a JSON object (never null)
 */
public record Event(
    String id,
    EventKind kind,
    JsonNode payload,
    String sourceChannel,
    String userId,
    Instant createdAt
) {
    public Event {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(createdAt, "createdAt");
        if (payload == null || payload.isNull() || payload.isMissingNode()) {
            payload = JsonNodeFactory.instance.objectNode();
        } else if (payload.isObject()) {
            payload = payload.deepCopy();
        }
    }

    /**
     * Create a new event stamped with a fresh id and the current time.
     */
    public static Event create(EventKind kind, JsonNode payload, String sourceChannel, String userId) {
        return new Event(
            UUID.randomUUID().toString(),
            kind,
            payload,
            sourceChannel,
            userId,
            Instant.now()
        );
    }

    /**
     * Create a new event with an empty payload.
     */
    public static Event of(EventKind kind) {
        return create(kind, null, null, null);
    }

    /**
     * Read a text field from the payload, or null if absent or not textual.
     */
    public String payloadText(String field) {
        JsonNode node = payload.get(field);
        return node != null && node.isValueNode() && !node.isNull() ? node.asText() : null;
    }

    /**
     * Copy of the payload that callers may mutate freely.
     */
    public ObjectNode payloadCopy() {
        if (payload.isObject()) {
            return (ObjectNode) payload.deepCopy();
        }
        ObjectNode wrapped = JsonNodeFactory.instance.objectNode();
        wrapped.set("value", payload.deepCopy());
        return wrapped;
    }
}
