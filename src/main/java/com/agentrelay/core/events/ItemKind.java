package com.agentrelay.core.events;

/**
 * Kind of work item reported by the worker inside {@code item.*} events.
 */
public enum ItemKind {
    FILE_CHANGE("file_change"),
    COMMAND_EXECUTION("command_execution"),
    AGENT_MESSAGE("agent_message"),
    REASONING("reasoning"),
    ERROR("error"),
    OTHER("other");

    private final String wireName;

    ItemKind(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    /**
     * Whether an item of this kind counts as observable evidence that the worker did something.
     */
    public boolean isObservableWork() {
        return this == FILE_CHANGE || this == COMMAND_EXECUTION || this == AGENT_MESSAGE;
    }

    public static ItemKind fromWireName(String value) {
        if (value == null) {
            return OTHER;
        }
        for (ItemKind kind : values()) {
            if (kind.wireName.equalsIgnoreCase(value)) {
                return kind;
            }
        }
        return OTHER;
    }
}
