package com.agentrelay.core.process;

/**
 * Which environment variables the worker process receives.
 */
public enum EnvPolicy {
    /** Only the configured pass-through variables (PATH, HOME, credentials). */
    INHERIT_NONE("inherit-none"),
    /** The orchestrator's full environment. */
    INHERIT_ALL("inherit-all"),
    /** Pass-through variables plus an explicit list of names. */
    ALLOW_LIST("allow-list");

    private final String value;

    EnvPolicy(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }

    public static EnvPolicy fromValue(String value) {
        for (EnvPolicy policy : values()) {
            if (policy.value.equalsIgnoreCase(value) || policy.name().equalsIgnoreCase(value)) {
                return policy;
            }
        }
        throw new IllegalArgumentException("Unknown env policy: " + value);
    }
}
