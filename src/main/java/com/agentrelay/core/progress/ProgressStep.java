package com.agentrelay.core.progress;

import com.agentrelay.core.events.ItemKind;

import java.time.Instant;
import java.util.Map;

/**
 * Snapshot of one turn or item tracked by the {@link ProgressInferenceEngine}.
 *
 * @param id          turn or item id
 * @param type        whether this step is a turn or an item
 * @param kind        item kind, null for turns
 * @param description human-readable description, e.g. "Editing src/App.java"
 * @param status      current step status
 * @param startedAt   when the step was first seen
 * @param completedAt when the step completed or failed, null while in flight
 * @param details     payload fields merged from started/updated/completed events
 */
public record ProgressStep(
        String id,
        StepType type,
        ItemKind kind,
        String description,
        StepStatus status,
        Instant startedAt,
        Instant completedAt,
        Map<String, Object> details
) {

    public enum StepType { TURN, ITEM }

    public enum StepStatus { STARTED, COMPLETED, FAILED }
}
