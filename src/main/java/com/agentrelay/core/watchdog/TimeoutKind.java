package com.agentrelay.core.watchdog;

/**
 * The two independent ways a monitored unit can time out.
 */
public enum TimeoutKind {
    /** No output or events for the idle window. */
    INACTIVITY("inactivity", "EIDLE"),
    /** Total wall-clock time exceeded, regardless of activity. */
    HARD("hard", "ETIMEDOUT");

    private final String label;
    private final String code;

    TimeoutKind(String label, String code) {
        this.label = label;
        this.code = code;
    }

    public String label() {
        return label;
    }

    /** errno-style code reported in timeout messages. */
    public String code() {
        return code;
    }
}
