package com.agentrelay.core.errors;

/**
 * Stable error codes surfaced to callers and persisted with failed tasks.
 */
public enum ErrorCode {
    TIMEOUT(false),
    SPAWN_ERROR(false),
    PROCESS_KILLED(true),
    SILENT_FAILURE(false),
    TURN_FAILED(false),
    AUTH_ERROR(false),
    UNTRUSTED_DIRECTORY(false),
    NETWORK_ERROR(true),
    RATE_LIMITED(true),
    PERMISSION_DENIED(false),
    UPSTREAM_TIMEOUT(true),
    EXIT_ERROR(false),
    UNKNOWN_ERROR(true),
    STORAGE_ERROR(true),
    VALIDATION(false),
    NOT_FOUND(false);

    private final boolean retryable;

    ErrorCode(boolean retryable) {
        this.retryable = retryable;
    }

    /** Default retryability; individual classifications may override it. */
    public boolean retryable() {
        return retryable;
    }
}
