package com.agentrelay.core.process;

import com.agentrelay.core.events.WorkerEvent;
import com.agentrelay.core.watchdog.TimeoutEnvelope;

import java.util.List;

/**
 * Terminal outcome of one worker execution. Exactly one of the following holds:
 * the process exited ({@code exitCode} or {@code signal} set), it never started
 * ({@code spawnError} set), it timed out ({@code timeout} set), or it was canceled
 * before it was spawned.
 *
 * @param processId  orchestrator-assigned process id
 * @param events     parsed events in arrival order
 * @param stdout     captured standard output (bounded)
 * @param stderr     captured standard error (bounded)
 * @param exitCode   exit code, null when killed by a signal or not exited
 * @param signal     terminating signal name (e.g. "SIGTERM"), null otherwise
 * @param spawnError why the process could not be started, null otherwise
 * @param timeout    timeout envelope, null unless the watchdog fired
 * @param canceled   the run was canceled by request
 * @param durationMs wall-clock duration of the run
 */
public record ExecutionResult(
        String processId,
        List<WorkerEvent> events,
        String stdout,
        String stderr,
        Integer exitCode,
        String signal,
        String spawnError,
        TimeoutEnvelope timeout,
        boolean canceled,
        long durationMs
) {

    public ExecutionResult {
        events = events == null ? List.of() : List.copyOf(events);
        stdout = stdout == null ? "" : stdout;
        stderr = stderr == null ? "" : stderr;
    }

    /** True only for a clean zero exit; silent failures are detected by the classifier. */
    public boolean success() {
        return exitCode != null && exitCode == 0 && signal == null && spawnError == null
                && timeout == null && !canceled;
    }

    public boolean timedOut() {
        return timeout != null;
    }

    public static ExecutionResult exited(String processId, List<WorkerEvent> events, String stdout, String stderr,
                                         Integer exitCode, String signal, boolean canceled, long durationMs) {
        return new ExecutionResult(processId, events, stdout, stderr, exitCode, signal, null, null,
                canceled, durationMs);
    }

    public static ExecutionResult spawnFailed(String processId, String error, String stderr, long durationMs) {
        return new ExecutionResult(processId, List.of(), "", stderr, null, null, error, null, false, durationMs);
    }

    public static ExecutionResult timedOut(String processId, List<WorkerEvent> events, String stdout, String stderr,
                                           TimeoutEnvelope timeout, long durationMs) {
        return new ExecutionResult(processId, events, stdout, stderr, null, null, null, timeout, false, durationMs);
    }

    public static ExecutionResult canceledBeforeStart(String processId) {
        return new ExecutionResult(processId, List.of(), "", "", null, null, null, null, true, 0);
    }
}
