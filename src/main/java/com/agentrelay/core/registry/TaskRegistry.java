package com.agentrelay.core.registry;

import com.agentrelay.core.model.RegisterTaskRequest;
import com.agentrelay.core.model.RegistryStats;
import com.agentrelay.core.model.Task;
import com.agentrelay.core.model.TaskStatus;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

/**
 * Durable store of task records.
 * <p>
 * Terminal statuses are sticky: an update that tries to move a terminal task to another status
 * is ignored and the current record is returned. Storage errors on updates are retried once and
 * then logged; they never propagate to the caller.
 */
public interface TaskRegistry {

    /**
     * Creates a task in {@link TaskStatus#PENDING}.
     *
     * @throws TaskRegistryException with VALIDATION for bad input, or if the row cannot be written
     */
    Task register(RegisterTaskRequest request);

    Optional<Task> get(String id);

    /**
     * @return the updated task, the unchanged task if the transition was ignored or the write failed,
     * or empty if no such task exists
     * @throws TaskRegistryException with VALIDATION for a backwards transition, or STORAGE_ERROR if the
     * current row cannot be read even after a retry
     */
    Optional<Task> updateStatus(String id, TaskStatus status);

    /**
     * Applies the non-null fields of {@code update}. Same return contract as {@link #updateStatus}.
     */
    Optional<Task> updateTask(String id, TaskUpdate update);

    List<Task> query(TaskFilter filter);

    boolean delete(String id);

    /**
     * Fails every pending or working task created more than {@code maxAgeSeconds} ago.
     *
     * @return number of tasks reclaimed
     */
    int reclaimStuck(long maxAgeSeconds);

    /**
     * Deletes terminal tasks completed more than {@code maxAge} ago.
     *
     * @return number of tasks deleted
     */
    int pruneOld(Duration maxAge);

    /** Tasks {@link #reclaimStuck(long)} would reclaim. */
    List<Task> previewStuck(long maxAgeSeconds);

    /** Tasks {@link #pruneOld(Duration)} would delete. */
    List<Task> previewPrune(Duration maxAge);

    RegistryStats stats();
}
