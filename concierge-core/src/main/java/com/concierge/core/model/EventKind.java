package com.concierge.core.model;

/**
 * Kinds of events that can enter the system.
 * Each kind has a stable snake_case wire value used in persisted records.
 */
public enum EventKind {
    USER_MESSAGE("user_message"),
    CRON("cron"),
    WEBHOOK("webhook"),
    TASK_COMPLETE("task_complete"),
    TASK_FAILED("task_failed"),
    SYSTEM("system"),
    CHANNEL_MESSAGE("channel_message"),
    API_CALL("api_call");

    private final String wireValue;

    EventKind(String wireValue) {
        this.wireValue = wireValue;
    }

    public String wireValue() {
        return wireValue;
    }

    /**
     * Check if events of this kind are turned into tasks by the default handler.
     */
    public boolean isDispatchable() {
        return this == USER_MESSAGE || this == CHANNEL_MESSAGE || this == CRON || this == WEBHOOK;
    }

    /**
     * Check if this kind reports a task outcome.
     */
    public boolean isLifecycle() {
        return this == TASK_COMPLETE || this == TASK_FAILED;
    }

    /**
     * Resolve a kind from its wire value.
     *
     * @throws IllegalArgumentException if the value is unknown
     */
    public static EventKind fromWireValue(String value) {
        for (EventKind kind : values()) {
            if (kind.wireValue.equals(value)) {
                return kind;
            }
        }
        throw new IllegalArgumentException("Unknown event kind: " + value);
    }
}
