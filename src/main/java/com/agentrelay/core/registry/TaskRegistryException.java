package com.agentrelay.core.registry;

import com.agentrelay.core.errors.ErrorCode;

/**
 * Raised for caller mistakes ({@link ErrorCode#VALIDATION}) and for storage failures
 * the registry cannot absorb, such as failing to register a task.
 */
public class TaskRegistryException extends RuntimeException {

    private final ErrorCode code;

    public TaskRegistryException(ErrorCode code, String message) {
        super(message);
        this.code = code;
    }

    public TaskRegistryException(ErrorCode code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
    }

    public static TaskRegistryException validation(String message) {
        return new TaskRegistryException(ErrorCode.VALIDATION, message);
    }

    public ErrorCode getCode() {
        return code;
    }
}
