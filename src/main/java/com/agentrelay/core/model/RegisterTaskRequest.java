package com.agentrelay.core.model;

import java.util.Map;

/**
 * Parameters for registering a new task.
 */
public record RegisterTaskRequest(
        TaskOrigin origin,
        String instruction,
        String workingDir,
        String envId,
        String mode,
        String model,
        String threadId,
        String userId,
        String alias,
        String externalId,
        Long pollFrequencyMs,
        Map<String, Object> metadata
) {

    public static RegisterTaskRequest local(String instruction, String workingDir) {
        return new RegisterTaskRequest(TaskOrigin.LOCAL, instruction, workingDir, null, null, null,
                null, null, null, null, null, null);
    }
}
