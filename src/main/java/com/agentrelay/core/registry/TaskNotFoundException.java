package com.agentrelay.core.registry;

import com.agentrelay.core.errors.ErrorCode;

public class TaskNotFoundException extends TaskRegistryException {

    private final String taskId;

    public TaskNotFoundException(String taskId) {
        super(ErrorCode.NOT_FOUND, "Task not found: " + taskId);
        this.taskId = taskId;
    }

    public String getTaskId() {
        return taskId;
    }
}
