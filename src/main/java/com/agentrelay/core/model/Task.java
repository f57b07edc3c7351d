package com.agentrelay.core.model;

import java.time.Instant;

/**
 * A durable record of one delegated unit of work.
 *
 * @param id              generated identifier, {@code T-<origin>-<suffix>}
 * @param externalId      identifier assigned by a remote execution environment, if any
 * @param alias           user-supplied short name
 * @param origin          local or remote-hosted execution
 * @param status          lifecycle status
 * @param instruction     the free-text instruction given to the worker
 * @param workingDir      working directory the task runs in
 * @param envId           remote environment id for cloud tasks
 * @param mode            sandbox mode the worker runs with
 * @param model           model selector
 * @param createdAt       creation time
 * @param updatedAt       last modification time, never decreases
 * @param completedAt     set exactly when the status is terminal
 * @param lastEventAt     time of the last worker event seen
 * @param progressSteps   JSON of the latest progress summary
 * @param pollFrequencyMs suggested poll interval for callers
 * @param keepAliveUntil  deadline before which the task must not be reclaimed
 * @param threadId        conversation/session identifier
 * @param userId          owning user
 * @param result          JSON result payload
 * @param error           human-readable error message for unsuccessful tasks
 * @param errorCode       classified error code name
 * @param metadata        arbitrary JSON metadata
 */
public record Task(
        String id,
        String externalId,
        String alias,
        TaskOrigin origin,
        TaskStatus status,
        String instruction,
        String workingDir,
        String envId,
        String mode,
        String model,
        Instant createdAt,
        Instant updatedAt,
        Instant completedAt,
        Instant lastEventAt,
        String progressSteps,
        Long pollFrequencyMs,
        Instant keepAliveUntil,
        String threadId,
        String userId,
        String result,
        String error,
        String errorCode,
        String metadata
) {

    public boolean isTerminal() {
        return status.isTerminal();
    }
}
