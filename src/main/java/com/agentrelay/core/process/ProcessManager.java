package com.agentrelay.core.process;

import com.agentrelay.config.RelayProperties;
import com.agentrelay.core.events.EventStreamParser;
import com.agentrelay.core.events.WorkerEvent;
import com.agentrelay.core.logging.MdcContext;
import com.agentrelay.core.metrics.RelayMetrics;
import com.agentrelay.core.watchdog.MonitoredProcess;
import com.agentrelay.core.watchdog.ProcessTerminator;
import com.agentrelay.core.watchdog.TimeoutEnvelope;
import com.agentrelay.core.watchdog.TimeoutWatchdog;
import com.agentrelay.core.watchdog.WatchdogConfig;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.Consumer;

/**
 * Runs the external worker through the {@link ProcessQueue}.
 * <p>
 * Each admitted request is spawned with an explicit argument vector, its stdout is decoded
 * through an {@link EventStreamParser}, and both output streams feed a {@link TimeoutWatchdog}.
 * The returned future always completes normally, exactly once, with an {@link ExecutionResult}
 * describing a normal exit, a spawn failure, a timeout or a cancellation.
 */
@Service
public class ProcessManager {

    private static final Logger log = LoggerFactory.getLogger(ProcessManager.class);

    private final RelayProperties properties;
    private final ProcessQueue queue;
    private final ScheduledExecutorService scheduler;
    private final ExecutorService ioExecutor;
    private final RelayMetrics metrics;
    private final ObjectMapper objectMapper;
    private final WorkerCommandBuilder commandBuilder;

    /** Live processes keyed by process id. */
    private final Map<String, RunningProcess> processes = new ConcurrentHashMap<>();
    /** Task ids admitted to the queue but not yet registered as running. */
    private final Set<String> queuedTasks = ConcurrentHashMap.newKeySet();
    /** Task ids canceled while still queued. */
    private final Set<String> canceledTasks = ConcurrentHashMap.newKeySet();
    /** Guards moving a task between queued, canceled and running. */
    private final Object admission = new Object();

    public ProcessManager(RelayProperties properties,
                          ProcessQueue queue,
                          @Qualifier("watchdogScheduler") ScheduledExecutorService scheduler,
                          @Qualifier("workerIoExecutor") ExecutorService ioExecutor,
                          RelayMetrics metrics,
                          ObjectMapper objectMapper) {
        this.properties = properties;
        this.queue = queue;
        this.scheduler = scheduler;
        this.ioExecutor = ioExecutor;
        this.metrics = metrics;
        this.objectMapper = objectMapper;
        this.commandBuilder = new WorkerCommandBuilder(properties.getWorker());
    }

    /**
     * Queues a worker run.
     *
     * @return never completes exceptionally
     */
    public CompletableFuture<ExecutionResult> execute(WorkerRequest request) {
        String processId = newProcessId();
        long enqueuedAt = System.nanoTime();
        if (request.taskId() != null) {
            synchronized (admission) {
                queuedTasks.add(request.taskId());
            }
        }
        return queue.add(() -> {
                    metrics.recordQueueWait(Duration.ofNanos(System.nanoTime() - enqueuedAt).toMillis());
                    return runProcess(processId, request);
                })
                .handle((result, error) -> {
                    if (error == null) {
                        return result;
                    }
                    log.error("Unexpected failure executing {}", processId, error);
                    return ExecutionResult.spawnFailed(processId, String.valueOf(error.getMessage()), "", 0);
                });
    }

    /**
     * Cancels a task's run, whether it is still queued or already running.
     *
     * @return false if this manager knows nothing about the task
     */
    public boolean cancelTask(String taskId) {
        synchronized (admission) {
            for (RunningProcess running : processes.values()) {
                if (taskId.equals(running.taskId)) {
                    return cancel(running.processId);
                }
            }
            if (queuedTasks.contains(taskId)) {
                canceledTasks.add(taskId);
                log.info("Task {} canceled while queued", taskId);
                return true;
            }
            return false;
        }
    }

    /**
     * Terminates a running process with the same graceful-then-forceful escalation as a timeout.
     */
    public boolean cancel(String processId) {
        RunningProcess running = processes.get(processId);
        if (running == null) {
            return false;
        }
        running.canceled = true;
        ProcessTerminator.terminate(processId, running.handle, properties.getWatchdog().getKillGrace(), scheduler);
        return true;
    }

    public boolean isRunning(String taskId) {
        return processes.values().stream().anyMatch(p -> taskId.equals(p.taskId));
    }

    @PreDestroy
    public void killAll() {
        if (processes.isEmpty()) {
            return;
        }
        log.info("Killing {} running worker process(es)", processes.size());
        for (RunningProcess running : processes.values()) {
            running.canceled = true;
            ProcessTerminator.terminate(running.processId, running.handle, properties.getWatchdog().getKillGrace(),
                    scheduler);
        }
    }

    public ProcessStats stats() {
        ProcessQueue.QueueStats queueStats = queue.stats();
        return new ProcessStats(processes.size(), queueStats.running(), queueStats.queued(),
                queueStats.maxConcurrency());
    }

    // ── Execution ────────────────────────────────────────────────────────

    private CompletableFuture<ExecutionResult> runProcess(String processId, WorkerRequest request) {
        String taskId = request.taskId();
        if (taskId != null && takeCancellation(taskId)) {
            log.info("Skipping spawn of {} for canceled task {}", processId, taskId);
            return CompletableFuture.completedFuture(ExecutionResult.canceledBeforeStart(processId));
        }

        long startNanos = System.nanoTime();
        MdcContext.setProcess(taskId, processId);
        try {
            ProcessBuilder builder = new ProcessBuilder(commandBuilder.command(request));
            Map<String, String> env = builder.environment();
            Map<String, String> workerEnv = commandBuilder.environment(request, System.getenv());
            env.clear();
            env.putAll(workerEnv);
            if (request.workingDir() != null) {
                builder.directory(request.workingDir().toFile());
            }

            Process process;
            try {
                process = builder.start();
            } catch (IOException | RuntimeException e) {
                metrics.recordSpawnFailure();
                log.error("Failed to spawn worker {}: {}", processId, e.getMessage());
                if (taskId != null) {
                    takeCancellation(taskId);
                }
                return CompletableFuture.completedFuture(
                        ExecutionResult.spawnFailed(processId, e.getMessage(), "", elapsedMs(startNanos)));
            }

            log.info("Spawned worker {} (pid {}) in {}", processId, process.pid(),
                    request.workingDir() != null ? request.workingDir() : "current directory");
            return supervise(processId, request, process, startNanos);
        } finally {
            MdcContext.clear();
        }
    }

    private CompletableFuture<ExecutionResult> supervise(String processId, WorkerRequest request,
                                                         Process process, long startNanos) {
        CompletableFuture<ExecutionResult> result = new CompletableFuture<>();
        ExecutionListener listener = request.listener();
        EventStreamParser parser = new EventStreamParser(objectMapper, Clock.systemUTC());
        List<WorkerEvent> events = new ArrayList<>();
        int maxCapture = properties.getWorker().getMaxCapturedOutputChars();
        OutputCapture stdout = new OutputCapture(maxCapture);
        OutputCapture stderr = new OutputCapture(maxCapture);
        MonitoredProcess handle = MonitoredProcess.of(process);

        WatchdogConfig watchdogConfig = watchdogConfig(request,
                envelope -> onTimeout(processId, envelope, events, stdout, stderr, startNanos, result));
        TimeoutWatchdog watchdog = new TimeoutWatchdog(processId, handle, watchdogConfig, scheduler);
        RunningProcess running = new RunningProcess(processId, request.taskId(), process, handle, watchdog);
        String taskId = request.taskId();
        synchronized (admission) {
            processes.put(processId, running);
            if (taskId != null && takeCancellation(taskId)) {
                cancel(processId);
            }
        }

        try {
            // the worker never reads stdin
            process.getOutputStream().close();
        } catch (IOException e) {
            log.debug("Could not close stdin of {}: {}", processId, e.getMessage());
        }

        notifySafely(() -> listener.onSpawned(processId, process.pid()));
        watchdog.start();

        CompletableFuture<Void> stdoutDone = CompletableFuture.runAsync(
                () -> pump(taskId, processId, process.getInputStream(), chunk -> {
                    stdout.append(chunk);
                    watchdog.recordStdout(chunk);
                    for (WorkerEvent event : parser.feed(chunk)) {
                        accept(event, events, watchdog, listener);
                    }
                }), ioExecutor);
        CompletableFuture<Void> stderrDone = CompletableFuture.runAsync(
                () -> pump(taskId, processId, process.getErrorStream(), chunk -> {
                    stderr.append(chunk);
                    watchdog.recordStderr(chunk);
                    log.debug("[{} stderr] {}", processId, chunk.stripTrailing());
                }), ioExecutor);

        CompletableFuture.allOf(stdoutDone, stderrDone, process.onExit())
                .whenComplete((ignored, error) -> {
                    parser.flush().ifPresent(event -> accept(event, events, watchdog, listener));
                    if (!watchdog.stop()) {
                        // timeout already resolved this execution
                        return;
                    }
                    processes.remove(processId);
                    result.complete(exited(running, events, stdout, stderr, startNanos));
                });

        return result;
    }

    /**
     * Removes the task from the queued set.
     *
     * @return whether the task was canceled while queued
     */
    private boolean takeCancellation(String taskId) {
        synchronized (admission) {
            queuedTasks.remove(taskId);
            return canceledTasks.remove(taskId);
        }
    }

    private ExecutionResult exited(RunningProcess running, List<WorkerEvent> events, OutputCapture stdout,
                                   OutputCapture stderr, long startNanos) {
        int status = running.process.exitValue();
        String signal = Signals.fromExitStatus(status).orElse(null);
        Integer exitCode = signal == null ? status : null;
        long duration = elapsedMs(startNanos);
        List<WorkerEvent> snapshot = snapshot(events);

        if (signal != null) {
            log.warn("Worker {} terminated by {}{}", running.processId, signal,
                    running.canceled ? " after cancellation" : "");
        } else {
            log.info("Worker {} exited with code {} after {}ms ({} events)", running.processId, exitCode,
                    duration, snapshot.size());
        }
        metrics.recordExecution(signal != null ? "signal" : exitCode == 0 ? "exit_zero" : "exit_nonzero", duration);
        metrics.recordEventsPerExecution(snapshot.size());
        return ExecutionResult.exited(running.processId, snapshot, stdout.toString(), stderr.toString(),
                exitCode, signal, running.canceled, duration);
    }

    private void onTimeout(String processId, TimeoutEnvelope envelope, List<WorkerEvent> events,
                           OutputCapture stdout, OutputCapture stderr, long startNanos,
                           CompletableFuture<ExecutionResult> result) {
        processes.remove(processId);
        long duration = elapsedMs(startNanos);
        metrics.recordTimeout(envelope.kind().label());
        metrics.recordExecution("timeout", duration);
        result.complete(ExecutionResult.timedOut(processId, snapshot(events), stdout.toString(), stderr.toString(),
                envelope, duration));
    }

    private void accept(WorkerEvent event, List<WorkerEvent> events, TimeoutWatchdog watchdog,
                        ExecutionListener listener) {
        synchronized (events) {
            events.add(event);
        }
        watchdog.recordEvent(event);
        notifySafely(() -> listener.onEvent(event));
    }

    private WatchdogConfig watchdogConfig(WorkerRequest request, Consumer<TimeoutEnvelope> onTimeout) {
        RelayProperties.Watchdog settings = properties.getWatchdog();
        ExecutionListener listener = request.listener();
        return WatchdogConfig.builder()
                .idleTimeout(request.idleTimeout() != null ? request.idleTimeout() : settings.getIdleTimeout())
                .hardTimeout(request.hardTimeout() != null ? request.hardTimeout() : settings.getHardTimeout())
                .warnLead(settings.getWarnLead())
                .killGrace(settings.getKillGrace())
                .progressInterval(settings.getProgressInterval())
                .maxEvents(settings.getMaxEvents())
                .maxTailChars(settings.getMaxTailChars())
                .onProgress(listener::onHeartbeat)
                .onWarning(listener::onWarning)
                .onTimeout(onTimeout)
                .build();
    }

    private void pump(String taskId, String processId, InputStream stream, Consumer<String> sink) {
        MdcContext.setProcess(taskId, processId);
        try (Reader reader = new InputStreamReader(stream, StandardCharsets.UTF_8)) {
            char[] buffer = new char[8192];
            int read;
            while ((read = reader.read(buffer)) != -1) {
                sink.accept(new String(buffer, 0, read));
            }
        } catch (IOException e) {
            // streams are closed under us when the process is killed
            log.debug("Output stream of {} closed: {}", processId, e.getMessage());
        } finally {
            MdcContext.clear();
        }
    }

    private void notifySafely(Runnable notification) {
        try {
            notification.run();
        } catch (Exception e) {
            log.warn("Execution listener threw: {}", e.getMessage(), e);
        }
    }

    private static List<WorkerEvent> snapshot(List<WorkerEvent> events) {
        synchronized (events) {
            return List.copyOf(events);
        }
    }

    private static long elapsedMs(long startNanos) {
        return Duration.ofNanos(System.nanoTime() - startNanos).toMillis();
    }

    private static String newProcessId() {
        // six base36 digits
        return "worker-" + System.currentTimeMillis() + "-"
                + Long.toString(ThreadLocalRandom.current().nextLong(60_466_176L, 2_176_782_336L), 36);
    }

    /**
     * Ephemeral handle for one live worker process; never persisted.
     */
    static final class RunningProcess {
        final String processId;
        final String taskId;
        final Process process;
        final MonitoredProcess handle;
        final TimeoutWatchdog watchdog;
        volatile boolean canceled;

        RunningProcess(String processId, String taskId, Process process, MonitoredProcess handle,
                       TimeoutWatchdog watchdog) {
            this.processId = processId;
            this.taskId = taskId;
            this.process = process;
            this.handle = handle;
            this.watchdog = watchdog;
        }
    }

    /**
     * Keeps the first {@code limit} characters of a stream.
     */
    private static final class OutputCapture {
        private final int limit;
        private final StringBuilder content = new StringBuilder();
        private boolean truncated;

        OutputCapture(int limit) {
            this.limit = limit;
        }

        synchronized void append(String chunk) {
            int room = limit - content.length();
            if (room <= 0) {
                truncated = true;
                return;
            }
            if (chunk.length() > room) {
                content.append(chunk, 0, room);
                truncated = true;
            } else {
                content.append(chunk);
            }
        }

        @Override
        public synchronized String toString() {
            return truncated ? content + "\n[output truncated]" : content.toString();
        }
    }

    /**
     * @param activeProcesses live worker processes
     * @param running         queue slots in use
     * @param queued          jobs waiting for a slot
     * @param maxConcurrency  configured limit
     */
    public record ProcessStats(int activeProcesses, int running, int queued, int maxConcurrency) {}
}
