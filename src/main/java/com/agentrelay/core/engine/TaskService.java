package com.agentrelay.core.engine;

import com.agentrelay.config.RelayProperties;
import com.agentrelay.core.errors.ClassifiedError;
import com.agentrelay.core.errors.ErrorCode;
import com.agentrelay.core.errors.FailureClassifier;
import com.agentrelay.core.events.EventBus;
import com.agentrelay.core.events.RelayEvent;
import com.agentrelay.core.events.WorkerEvent;
import com.agentrelay.core.events.WorkerEventDecoder;
import com.agentrelay.core.logging.MdcContext;
import com.agentrelay.core.metrics.RelayMetrics;
import com.agentrelay.core.model.RegisterTaskRequest;
import com.agentrelay.core.model.Task;
import com.agentrelay.core.model.TaskOrigin;
import com.agentrelay.core.model.TaskStatus;
import com.agentrelay.core.process.ExecutionListener;
import com.agentrelay.core.process.ExecutionResult;
import com.agentrelay.core.process.ProcessManager;
import com.agentrelay.core.process.SandboxMode;
import com.agentrelay.core.process.WorkerRequest;
import com.agentrelay.core.progress.ProgressInferenceEngine;
import com.agentrelay.core.progress.ProgressSummary;
import com.agentrelay.core.registry.TaskNotFoundException;
import com.agentrelay.core.registry.TaskRegistry;
import com.agentrelay.core.registry.TaskRegistryException;
import com.agentrelay.core.registry.TaskUpdate;
import com.agentrelay.core.watchdog.Heartbeat;
import com.agentrelay.core.watchdog.TimeoutWarning;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;

/**
 * Runs instructions as tracked tasks: registers the task, executes the worker, keeps the registry
 * record current while it runs, and writes the classified outcome when it finishes.
 * <p>
 * Terminal statuses are sticky in the registry, so a run that finishes after its task was
 * canceled cannot overwrite the cancellation.
 */
@Service
public class TaskService {

    private static final Logger log = LoggerFactory.getLogger(TaskService.class);

    public static final Duration DEFAULT_WAIT_TIMEOUT = Duration.ofSeconds(300);
    public static final Duration DEFAULT_POLL_INTERVAL = Duration.ofSeconds(2);

    private static final TypeReference<List<ResultExtractor.FileChange>> FILE_CHANGES = new TypeReference<>() {};
    private static final TypeReference<List<ResultExtractor.CommandRun>> COMMANDS = new TypeReference<>() {};

    private final TaskRegistry registry;
    private final ProcessManager processManager;
    private final FailureClassifier classifier;
    private final EventBus eventBus;
    private final RelayProperties properties;
    private final RelayMetrics metrics;
    private final ObjectMapper objectMapper;

    /** Progress of tasks running in this process. */
    private final Map<String, ProgressInferenceEngine> liveProgress = new ConcurrentHashMap<>();
    private final Map<String, CompletableFuture<Task>> completions = new ConcurrentHashMap<>();

    public TaskService(TaskRegistry registry,
                       ProcessManager processManager,
                       FailureClassifier classifier,
                       EventBus eventBus,
                       RelayProperties properties,
                       RelayMetrics metrics,
                       ObjectMapper objectMapper) {
        this.registry = registry;
        this.processManager = processManager;
        this.classifier = classifier;
        this.eventBus = eventBus;
        this.properties = properties;
        this.metrics = metrics;
        this.objectMapper = objectMapper;
    }

    /**
     * Registers and queues a task, returning as soon as it is recorded as pending.
     */
    public Task start(StartTaskRequest request) {
        return launch(request, null, null);
    }

    /**
     * Registers and queues a task that continues an earlier worker conversation.
     *
     * @param threadId conversation id captured from an earlier task
     */
    public Task resume(String threadId, StartTaskRequest request) {
        if (threadId == null || threadId.isBlank()) {
            throw new IllegalArgumentException("threadId must not be blank");
        }
        return launch(request, threadId, null);
    }

    private Task launch(StartTaskRequest request, String resumeThreadId, Consumer<RelayEvent> observer) {
        SandboxMode mode = request.mode() != null
                ? request.mode()
                : SandboxMode.fromValue(properties.getWorker().getDefaultMode());
        String model = request.model() != null ? request.model() : properties.getWorker().getDefaultModel();
        Task task = registry.register(new RegisterTaskRequest(
                TaskOrigin.LOCAL,
                request.instruction(),
                request.workingDir() != null ? request.workingDir().toAbsolutePath().toString() : null,
                null,
                mode.value(),
                model,
                resumeThreadId != null ? resumeThreadId : request.threadId(),
                request.userId(),
                request.alias(),
                null,
                DEFAULT_POLL_INTERVAL.toMillis(),
                request.metadata()));

        String taskId = task.id();
        MdcContext.setTask(taskId, TaskOrigin.LOCAL.value());
        EventBus.Subscription subscription = observer != null ? eventBus.subscribe(taskId, observer) : null;
        try {
            ProgressInferenceEngine engine = new ProgressInferenceEngine();
            liveProgress.put(taskId, engine);

            WorkerRequest workerRequest = WorkerRequest.builder(request.instruction())
                    .taskId(taskId)
                    .mode(mode)
                    .model(model)
                    .workingDir(request.workingDir())
                    .outputSchema(request.outputSchema())
                    .envPolicy(request.envPolicy())
                    .envAllowList(request.envAllowList())
                    .skipGitRepoCheck(request.skipGitRepoCheck())
                    .idleTimeout(request.idleTimeout())
                    .hardTimeout(request.hardTimeout())
                    .resumeThreadId(resumeThreadId)
                    .listener(new TaskExecutionListener(taskId, task.threadId(), engine))
                    .build();

            Map<String, Object> queued = new LinkedHashMap<>();
            queued.put("instruction", task.instruction());
            if (resumeThreadId != null) {
                queued.put("resumedThreadId", resumeThreadId);
            }
            publish("task.queued", taskId, null, queued);
            CompletableFuture<Task> completion = processManager.execute(workerRequest)
                    .thenApply(result -> finish(taskId, result, engine));
            completions.put(taskId, completion);
            completion.whenComplete((finished, error) -> {
                liveProgress.remove(taskId, engine);
                completions.remove(taskId, completion);
                if (subscription != null) {
                    subscription.unsubscribe();
                }
                if (error != null) {
                    log.error("Failed to record outcome of task {}", taskId, error);
                }
            });
            log.info("Task {} queued{}", taskId, resumeThreadId != null ? " to resume " + resumeThreadId : "");
            return task;
        } catch (RuntimeException e) {
            liveProgress.remove(taskId);
            if (subscription != null) {
                subscription.unsubscribe();
            }
            throw e;
        } finally {
            MdcContext.clear();
        }
    }

    /**
     * Starts a task and blocks until it reaches a terminal status.
     */
    public Task run(StartTaskRequest request) {
        return run(request, null, null);
    }

    /**
     * Starts a task, or resumes {@code resumeThreadId} when it is non-null, and blocks until it
     * reaches a terminal status. {@code observer}, when given, receives every event of the task
     * from {@code task.queued} through the terminal event.
     */
    public Task run(StartTaskRequest request, String resumeThreadId, Consumer<RelayEvent> observer) {
        if (resumeThreadId != null && resumeThreadId.isBlank()) {
            throw new IllegalArgumentException("threadId must not be blank");
        }
        Task task = launch(request, resumeThreadId, observer);
        CompletableFuture<Task> completion = completions.get(task.id());
        if (completion != null) {
            Task finished = completion.join();
            if (finished != null) {
                return finished;
            }
        }
        return require(task.id());
    }

    public TaskStatusView status(String taskId) {
        Task task = require(taskId);
        ProgressInferenceEngine engine = liveProgress.get(taskId);
        if (engine != null) {
            return new TaskStatusView(task, engine.getProgress(), true);
        }
        return new TaskStatusView(task, storedProgress(task), false);
    }

    public TaskResults results(String taskId) {
        Task task = require(taskId);
        if (!task.isTerminal()) {
            return new TaskResults(task.id(), task.status(), "Task is still " + task.status().value(),
                    List.of(), List.of(), null, null, null);
        }
        JsonNode result = readTree(task.result());
        String summary = result.path("summary").isTextual()
                ? result.path("summary").asText()
                : defaultSummary(task);
        List<ResultExtractor.FileChange> fileChanges = convert(result.path("fileChanges"), FILE_CHANGES);
        List<ResultExtractor.CommandRun> commands = convert(result.path("commands"), COMMANDS);
        JsonNode failure = result.hasNonNull("failure") ? result.get("failure") : null;
        return new TaskResults(task.id(), task.status(), summary, fileChanges, commands,
                task.error(), task.errorCode(), failure);
    }

    /**
     * Marks the task canceled, then stops its worker if one is queued or running here.
     */
    public CancelOutcome cancel(String taskId, String reason) {
        Task task = require(taskId);
        if (task.isTerminal()) {
            return CancelOutcome.ALREADY_TERMINAL;
        }
        String message = reason != null && !reason.isBlank() ? "Canceled: " + reason : "Canceled by user";
        Task updated = registry.updateTask(taskId, TaskUpdate.builder()
                        .status(TaskStatus.CANCELED)
                        .error(message)
                        .build())
                .orElseThrow(() -> new TaskNotFoundException(taskId));
        if (updated.status() != TaskStatus.CANCELED) {
            if (updated.isTerminal()) {
                // finished between the read and the write
                return CancelOutcome.ALREADY_TERMINAL;
            }
            throw new TaskRegistryException(ErrorCode.STORAGE_ERROR, "Could not record cancellation of " + taskId);
        }
        boolean signalled = processManager.cancelTask(taskId);
        log.info("Task {} canceled ({})", taskId, signalled ? "worker stopped" : "no local worker");
        metrics.recordTaskOutcome(TaskStatus.CANCELED.value());
        publish("task.canceled", taskId, null, Map.of("reason", message));
        return CancelOutcome.CANCELED;
    }

    public CancelOutcome cancel(String taskId) {
        return cancel(taskId, null);
    }

    /**
     * Polls the registry until the task is terminal or {@code timeout} elapses.
     *
     * @return the latest record, which is still active if the wait timed out
     */
    public Task waitFor(String taskId, Duration timeout, Duration pollInterval) {
        long deadline = System.nanoTime() + timeout.toNanos();
        Task task = require(taskId);
        while (!task.isTerminal()) {
            long remaining = deadline - System.nanoTime();
            if (remaining <= 0) {
                log.debug("Stopped waiting for task {} after {}", taskId, timeout);
                return task;
            }
            try {
                Thread.sleep(Math.min(pollInterval.toMillis(), Duration.ofNanos(remaining).toMillis() + 1));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return task;
            }
            task = require(taskId);
        }
        return task;
    }

    public Task waitFor(String taskId) {
        return waitFor(taskId, DEFAULT_WAIT_TIMEOUT, DEFAULT_POLL_INTERVAL);
    }

    // ── Completion ───────────────────────────────────────────────────────

    Task finish(String taskId, ExecutionResult result, ProgressInferenceEngine engine) {
        MdcContext.setProcess(taskId, result.processId());
        try {
            Task current = registry.get(taskId).orElse(null);
            if (current != null && current.isTerminal()) {
                log.info("Task {} already {}; discarding late result of {}", taskId, current.status().value(),
                        result.processId());
                return current;
            }

            ProgressSummary progress = engine.getProgress();
            TaskUpdate.Builder update = TaskUpdate.builder()
                    .progressSteps(toJson(progress))
                    .lastEventAt(lastEventAt(result.events()));

            TaskStatus status;
            var classified = classifier.classify(result);
            if (classified.isPresent()) {
                ClassifiedError error = classified.get();
                status = TaskStatus.FAILED;
                update.status(status)
                        .error(error.message())
                        .errorCode(error.code().name())
                        .result(toJson(failureResult(result, error)));
                log.warn("Task {} failed [{}]: {}", taskId, error.code(), error.message());
            } else {
                status = successStatus(result.events());
                update.status(status).result(toJson(successResult(result)));
                log.info("Task {} {} in {}ms", taskId, status.value(), result.durationMs());
            }

            Task finished = registry.updateTask(taskId, update.build()).orElse(current);
            metrics.recordTaskOutcome(status.value());
            Map<String, Object> payload = new LinkedHashMap<>();
            payload.put("status", status.value());
            payload.put("durationMs", result.durationMs());
            classified.ifPresent(error -> payload.put("errorCode", error.code().name()));
            publish(status == TaskStatus.FAILED ? "task.failed" : "task.completed", taskId, result.processId(),
                    payload);
            return finished;
        } finally {
            MdcContext.clear();
        }
    }

    static TaskStatus successStatus(List<WorkerEvent> events) {
        if (ResultExtractor.hasFailedCommand(events)) {
            return TaskStatus.COMPLETED_WITH_ERRORS;
        }
        if (ResultExtractor.hasReportedError(events)) {
            return TaskStatus.COMPLETED_WITH_WARNINGS;
        }
        return TaskStatus.COMPLETED;
    }

    private Map<String, Object> successResult(ExecutionResult result) {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("summary", ResultExtractor.summary(result.events()));
        map.put("fileChanges", ResultExtractor.fileChanges(result.events()));
        map.put("commands", ResultExtractor.commands(result.events()));
        map.put("exitCode", result.exitCode());
        map.put("eventsCount", result.events().size());
        map.put("durationMs", result.durationMs());
        return map;
    }

    private Map<String, Object> failureResult(ExecutionResult result, ClassifiedError error) {
        Map<String, Object> failure = new LinkedHashMap<>();
        failure.put("code", error.code().name());
        failure.put("message", error.message());
        failure.put("retryable", error.retryable());
        failure.put("details", error.details());

        Map<String, Object> map = new LinkedHashMap<>();
        map.put("fileChanges", ResultExtractor.fileChanges(result.events()));
        map.put("commands", ResultExtractor.commands(result.events()));
        map.put("eventsCount", result.events().size());
        map.put("durationMs", result.durationMs());
        map.put("failure", failure);
        return map;
    }

    // ── Helpers ───────────────────────────────────────────────────────────

    private Task require(String taskId) {
        return registry.get(taskId).orElseThrow(() -> new TaskNotFoundException(taskId));
    }

    private ProgressSummary storedProgress(Task task) {
        if (task.progressSteps() == null) {
            return ProgressSummary.empty();
        }
        try {
            return objectMapper.readValue(task.progressSteps(), ProgressSummary.class);
        } catch (JsonProcessingException e) {
            log.warn("Stored progress of task {} is unreadable: {}", task.id(), e.getOriginalMessage());
            return ProgressSummary.empty();
        }
    }

    private static String defaultSummary(Task task) {
        return task.status() == TaskStatus.FAILED || task.status() == TaskStatus.CANCELED
                ? task.error()
                : ResultExtractor.DEFAULT_SUMMARY;
    }

    private static Instant lastEventAt(List<WorkerEvent> events) {
        return events.isEmpty() ? null : events.get(events.size() - 1).timestamp();
    }

    private JsonNode readTree(String json) {
        if (json == null) {
            return objectMapper.createObjectNode();
        }
        try {
            return objectMapper.readTree(json);
        } catch (JsonProcessingException e) {
            log.warn("Stored result is unreadable: {}", e.getOriginalMessage());
            return objectMapper.createObjectNode();
        }
    }

    private <T> List<T> convert(JsonNode node, TypeReference<List<T>> type) {
        if (node == null || !node.isArray()) {
            return List.of();
        }
        return objectMapper.convertValue(node, type);
    }

    private String toJson(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize task data", e);
        }
    }

    private void publish(String type, String taskId, String processId, Map<String, Object> payload) {
        eventBus.publish(RelayEvent.of(type, taskId, processId, payload));
    }

    /**
     * Bridges worker callbacks into registry updates and bus events for one task.
     */
    private final class TaskExecutionListener implements ExecutionListener {

        private final String taskId;
        private final ProgressInferenceEngine engine;
        private final AtomicInteger eventCount = new AtomicInteger();
        private volatile String processId;
        private volatile String threadId;

        TaskExecutionListener(String taskId, String threadId, ProgressInferenceEngine engine) {
            this.taskId = taskId;
            this.threadId = threadId;
            this.engine = engine;
        }

        @Override
        public void onSpawned(String processId, long pid) {
            this.processId = processId;
            registry.updateStatus(taskId, TaskStatus.WORKING);
            publish("task.started", taskId, processId, Map.of("pid", pid));
        }

        @Override
        public void onEvent(WorkerEvent event) {
            WorkerEventDecoder.threadId(event).ifPresent(this::recordThread);
            engine.processEvent(event);
            int count = eventCount.incrementAndGet();
            ProgressSummary progress = engine.getProgress();
            if (count % Math.max(1, properties.getWorker().getProgressPersistEvery()) == 0) {
                registry.updateTask(taskId, TaskUpdate.builder()
                        .progressSteps(toJson(progress))
                        .lastEventAt(event.timestamp())
                        .build());
            }
            Map<String, Object> payload = new LinkedHashMap<>();
            payload.put("type", event.type());
            payload.put("percentage", progress.progressPercentage());
            payload.put("currentAction", progress.currentAction());
            publish("task.progress", taskId, processId, payload);
        }

        private void recordThread(String announced) {
            if (announced.equals(threadId)) {
                return;
            }
            threadId = announced;
            registry.updateTask(taskId, TaskUpdate.builder().threadId(announced).build());
            log.debug("Task {} runs in worker thread {}", taskId, announced);
        }

        @Override
        public void onWarning(TimeoutWarning warning) {
            log.warn("Task {} will time out ({}) in {}s", taskId, warning.kind().label(),
                    warning.remainingMs() / 1000);
            publish("task.warning", taskId, processId, Map.of(
                    "kind", warning.kind().label(),
                    "remainingMs", warning.remainingMs()));
        }

        @Override
        public void onHeartbeat(Heartbeat heartbeat) {
            publish("task.heartbeat", taskId, processId, Map.of(
                    "elapsedMs", heartbeat.elapsedMs(),
                    "idleMs", heartbeat.idleMs(),
                    "eventsCount", heartbeat.eventsCount()));
        }
    }
}
