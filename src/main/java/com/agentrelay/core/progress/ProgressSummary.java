package com.agentrelay.core.progress;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Immutable progress snapshot derived from the worker's event stream.
 *
 * @param currentAction      description of the most recently started step still in flight, or null
 * @param completedSteps     steps that reached a terminal step status
 * @param totalSteps         distinct turns and items seen so far
 * @param progressPercentage 0..100; exactly 100 once {@code isComplete}
 * @param filesChanged       completed file-change items
 * @param commandsExecuted   completed command-execution items
 * @param isComplete         a turn completed or failed
 * @param hasFailed          a turn failed
 * @param steps              the most recent steps, oldest first
 */
public record ProgressSummary(
        String currentAction,
        int completedSteps,
        int totalSteps,
        int progressPercentage,
        int filesChanged,
        int commandsExecuted,
        @JsonProperty("isComplete") boolean isComplete,
        @JsonProperty("hasFailed") boolean hasFailed,
        List<ProgressStep> steps
) {

    public ProgressSummary {
        steps = steps == null ? List.of() : List.copyOf(steps);
    }

    public static ProgressSummary empty() {
        return new ProgressSummary(null, 0, 0, 0, 0, 0, false, false, List.of());
    }
}
