package com.agentrelay.core.model;

import java.util.EnumSet;
import java.util.Set;

/**
 * Task lifecycle: PENDING, then WORKING, then exactly one terminal status.
 * UNKNOWN is only produced by recovery paths, never by normal transitions.
 */
public enum TaskStatus {
    PENDING("pending"),
    WORKING("working"),
    COMPLETED("completed"),
    COMPLETED_WITH_WARNINGS("completed_with_warnings"),
    COMPLETED_WITH_ERRORS("completed_with_errors"),
    FAILED("failed"),
    CANCELED("canceled"),
    UNKNOWN("unknown");

    private static final Set<TaskStatus> TERMINAL = EnumSet.of(
            COMPLETED, COMPLETED_WITH_WARNINGS, COMPLETED_WITH_ERRORS, FAILED, CANCELED);

    private final String value;

    TaskStatus(String value) {
        this.value = value;
    }

    /** Persisted value. */
    public String value() {
        return value;
    }

    public boolean isTerminal() {
        return TERMINAL.contains(this);
    }

    public boolean isActive() {
        return this == PENDING || this == WORKING;
    }

    /**
     * Whether a caller may move a task from this status to {@code target}.
     * Same-status writes are allowed so callers can update other fields.
     */
    public boolean canTransitionTo(TaskStatus target) {
        if (target == UNKNOWN) {
            return false;
        }
        return switch (this) {
            case PENDING -> true;
            case WORKING -> target != PENDING;
            default -> false;
        };
    }

    public static TaskStatus fromValue(String value) {
        for (TaskStatus status : values()) {
            if (status.value.equalsIgnoreCase(value) || status.name().equalsIgnoreCase(value)) {
                return status;
            }
        }
        throw new IllegalArgumentException("Unknown task status: " + value);
    }
}
