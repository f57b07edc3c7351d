package com.agentrelay.core.model;

/**
 * Where a task executes.
 */
public enum TaskOrigin {
    LOCAL("local"),
    CLOUD("cloud");

    private final String value;

    TaskOrigin(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }

    public static TaskOrigin fromValue(String value) {
        for (TaskOrigin origin : values()) {
            if (origin.value.equalsIgnoreCase(value) || origin.name().equalsIgnoreCase(value)) {
                return origin;
            }
        }
        throw new IllegalArgumentException("Unknown task origin: " + value);
    }
}
