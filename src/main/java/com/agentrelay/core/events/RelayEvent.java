package com.agentrelay.core.events;

import java.io.Serializable;
import java.time.Instant;
import java.util.Map;

/**
 * A task lifecycle event published on the {@link EventBus}, used by the CLI to render live progress.
 *
 * @param eventType event type (e.g. "task.started", "task.progress", "task.warning", "task.completed")
 * @param taskId    the registry id of the task
 * @param processId the worker process id (nullable before spawn)
 * @param payload   arbitrary key-value data associated with the event
 * @param timestamp when the event occurred
 */
public record RelayEvent(
    String eventType,
    String taskId,
    String processId,
    Map<String, Object> payload,
    Instant timestamp
) implements Serializable {

    public static RelayEvent of(String eventType, String taskId, String processId, Map<String, Object> payload) {
        return new RelayEvent(eventType, taskId, processId, payload, Instant.now());
    }
}
