package com.agentrelay.core.process;

/**
 * File-system access granted to the worker.
 */
public enum SandboxMode {
    READ_ONLY("read-only"),
    WORKSPACE_WRITE("workspace-write"),
    DANGER_FULL_ACCESS("danger-full-access");

    private final String value;

    SandboxMode(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }

    public static SandboxMode fromValue(String value) {
        for (SandboxMode mode : values()) {
            if (mode.value.equalsIgnoreCase(value) || mode.name().equalsIgnoreCase(value)) {
                return mode;
            }
        }
        throw new IllegalArgumentException("Unknown sandbox mode: " + value);
    }
}
