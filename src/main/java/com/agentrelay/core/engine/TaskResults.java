package com.agentrelay.core.engine;

import com.agentrelay.core.model.TaskStatus;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;

/**
 * Outcome of a finished task as stored in the registry.
 *
 * @param taskId      task id
 * @param status      task status
 * @param summary     final summary line
 * @param fileChanges files the worker changed
 * @param commands    commands the worker ran
 * @param error       error message for failed or canceled tasks
 * @param errorCode   classified error code, if any
 * @param failure     classification details for failed tasks, null otherwise
 */
public record TaskResults(
        String taskId,
        TaskStatus status,
        String summary,
        List<ResultExtractor.FileChange> fileChanges,
        List<ResultExtractor.CommandRun> commands,
        String error,
        String errorCode,
        JsonNode failure
) {

    public TaskResults {
        fileChanges = fileChanges == null ? List.of() : List.copyOf(fileChanges);
        commands = commands == null ? List.of() : List.copyOf(commands);
    }
}
