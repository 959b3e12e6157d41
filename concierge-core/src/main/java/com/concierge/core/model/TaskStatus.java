package com.concierge.core.model;

import java.util.EnumSet;
import java.util.Set;

/**
 * Lifecycle states for a task.
 */
public enum TaskStatus {
    /**
     * Task is persisted but not yet on the queue.
     * Transitions: -> QUEUED, CANCELLED, FAILURE
     */
    PENDING("pending"),

    /**
     * Task is on the execution queue, waiting for a worker.
     * Transitions: -> RUNNING, CANCELLED, FAILURE
     */
    QUEUED("queued"),

    /**
     * Task is claimed by a worker.
     * Transitions: -> SUCCESS, FAILURE, RETRYING, CANCELLED, RUNNING (redelivery)
     */
    RUNNING("running"),

    /**
     * Attempt failed and a delayed re-delivery is scheduled.
     * Transitions: -> QUEUED, RUNNING, CANCELLED, FAILURE
     */
    RETRYING("retrying"),

    /**
     * Task completed successfully. Terminal state.
     */
    SUCCESS("success"),

    /**
     * Task failed permanently. Terminal state.
     */
    FAILURE("failure"),

    /**
     * Task was cancelled before completion. Terminal state.
     */
    CANCELLED("cancelled");

    private final String wireValue;

    TaskStatus(String wireValue) {
        this.wireValue = wireValue;
    }

    public String wireValue() {
        return wireValue;
    }

    /**
     * Check if this state is terminal (no further transitions).
     */
    public boolean isTerminal() {
        return this == SUCCESS || this == FAILURE || this == CANCELLED;
    }

    /**
     * Check if this state means the task is waiting for or holding a worker.
     */
    public boolean isActive() {
        return this == QUEUED || this == RUNNING || this == RETRYING;
    }

    /**
     * States a task may move to from this one.
     */
    public Set<TaskStatus> allowedTargets() {
        return switch (this) {
            case PENDING -> EnumSet.of(QUEUED, CANCELLED, FAILURE);
            case QUEUED -> EnumSet.of(RUNNING, CANCELLED, FAILURE);
            case RUNNING -> EnumSet.of(RUNNING, SUCCESS, FAILURE, RETRYING, CANCELLED);
            case RETRYING -> EnumSet.of(QUEUED, RUNNING, CANCELLED, FAILURE);
            case SUCCESS, FAILURE, CANCELLED -> EnumSet.noneOf(TaskStatus.class);
        };
    }

    public boolean canTransitionTo(TaskStatus target) {
        return allowedTargets().contains(target);
    }

    /**
     * All states from which {@code target} is reachable in one step.
     */
    public static Set<TaskStatus> sourcesOf(TaskStatus target) {
        Set<TaskStatus> sources = EnumSet.noneOf(TaskStatus.class);
        for (TaskStatus status : values()) {
            if (status.canTransitionTo(target)) {
                sources.add(status);
            }
        }
        return sources;
    }

    public static TaskStatus fromWireValue(String value) {
        for (TaskStatus status : values()) {
            if (status.wireValue.equals(value)) {
                return status;
            }
        }
        throw new IllegalArgumentException("Unknown task status: " + value);
    }
}
