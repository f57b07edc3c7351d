package com.agentrelay.dispatch.cli;

import com.agentrelay.config.RelayProperties;
import com.agentrelay.core.engine.CancelOutcome;
import com.agentrelay.core.engine.ResultExtractor;
import com.agentrelay.core.engine.StartTaskRequest;
import com.agentrelay.core.engine.TaskResults;
import com.agentrelay.core.engine.TaskService;
import com.agentrelay.core.engine.TaskStatusView;
import com.agentrelay.core.events.RelayEvent;
import com.agentrelay.core.health.HealthCheckService;
import com.agentrelay.core.health.HealthStatus;
import com.agentrelay.core.model.RegistryStats;
import com.agentrelay.core.model.Task;
import com.agentrelay.core.model.TaskOrigin;
import com.agentrelay.core.model.TaskStatus;
import com.agentrelay.core.progress.ProgressSummary;
import com.agentrelay.core.registry.TaskFilter;
import com.agentrelay.core.registry.TaskNotFoundException;
import com.agentrelay.core.registry.TaskRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import picocli.CommandLine;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.function.Consumer;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

/**
 * Tests for the Agent Relay CLI command structure.
 * These tests exercise picocli directly without Spring context,
 * validating command parsing, help output, and execution behavior.
 */
class CliTest {

    private record CliResult(int exitCode, String output) {}

    private TaskService taskService;
    private TaskRegistry registry;
    private HealthCheckService healthCheckService;
    private RelayProperties properties;

    @BeforeEach
    void setUp() {
        taskService = mock(TaskService.class);
        registry = mock(TaskRegistry.class);
        healthCheckService = mock(HealthCheckService.class);
        properties = new RelayProperties();
        when(registry.query(any())).thenReturn(List.of());
        when(registry.stats()).thenReturn(new RegistryStats(0, Map.of(), Map.of(), 0));
    }

    private static Task task(String id, TaskStatus status, String instruction) {
        Instant created = Instant.parse("2025-03-01T09:30:00Z");
        return new Task(id, null, null, TaskOrigin.LOCAL, status, instruction, "/work", null, "read-only", null,
                created, created.plusSeconds(90), status.isTerminal() ? created.plusSeconds(90) : null, null,
                null, 2000L, null, null, null, null, null, null, null);
    }

    private static Task withThread(Task t, String threadId) {
        return new Task(t.id(), null, null, t.origin(), t.status(), t.instruction(), t.workingDir(), null, t.mode(),
                null, t.createdAt(), t.updatedAt(), t.completedAt(), null, null, t.pollFrequencyMs(), null, threadId,
                null, null, null, null, null);
    }

    /**
     * Custom picocli IFactory that provides mock dependencies for commands.
     */
    private CommandLine.IFactory createFactory() {
        return new CommandLine.IFactory() {
            @Override
            @SuppressWarnings("unchecked")
            public <K> K create(Class<K> cls) throws Exception {
                if (cls == RunCommand.class) {
                    return (K) new RunCommand(taskService);
                }
                if (cls == StatusCommand.class) {
                    return (K) new StatusCommand(taskService);
                }
                if (cls == ResultsCommand.class) {
                    return (K) new ResultsCommand(taskService);
                }
                if (cls == CancelCommand.class) {
                    return (K) new CancelCommand(taskService);
                }
                if (cls == HistoryCommand.class) {
                    return (K) new HistoryCommand(registry);
                }
                if (cls == CleanupCommand.class) {
                    return (K) new CleanupCommand(registry, properties);
                }
                if (cls == HealthCommand.class) {
                    return (K) new HealthCommand(healthCheckService);
                }
                return CommandLine.defaultFactory().create(cls);
            }
        };
    }

    private CliResult execute(String... args) {
        ByteArrayOutputStream capture = new ByteArrayOutputStream();
        PrintStream capturePrintStream = new PrintStream(capture, true);
        PrintStream originalOut = System.out;
        PrintStream originalErr = System.err;
        System.setOut(capturePrintStream);
        System.setErr(capturePrintStream);
        try {
            CommandLine commandLine = new CommandLine(new AgentRelayCommand(), createFactory());
            int exitCode = commandLine.execute(args);
            capturePrintStream.flush();
            return new CliResult(exitCode, capture.toString());
        } finally {
            System.setOut(originalOut);
            System.setErr(originalErr);
        }
    }

    @Nested
    @DisplayName("Help output")
    class HelpTests {

        @Test
        @DisplayName("--help lists every subcommand")
        void helpListsSubcommands() {
            CliResult result = execute("--help");

            assertEquals(0, result.exitCode());
            for (String name : List.of("run", "status", "results", "cancel", "history", "cleanup", "health")) {
                assertTrue(result.output().contains(name), "help should mention " + name);
            }
        }

        @Test
        @DisplayName("--version prints the version")
        void version() {
            CliResult result = execute("--version");

            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("Agent Relay 0.1.0"));
        }

        @Test
        @DisplayName("run --help documents the timeout options")
        void runHelp() {
            CliResult result = execute("run", "--help");

            assertTrue(result.output().contains("--idle-timeout"));
            assertTrue(result.output().contains("--hard-timeout"));
            assertTrue(result.output().contains("--detach"));
        }
    }

    @Nested
    @DisplayName("run")
    class RunTests {

        @Test
        @DisplayName("run without an instruction is a usage error")
        void missingInstruction() {
            CliResult result = execute("run");

            assertEquals(2, result.exitCode());
            verifyNoInteractions(taskService);
        }

        @Test
        @DisplayName("--detach queues the task and prints its id")
        void detach() {
            when(taskService.start(any())).thenReturn(task("T-local-1", TaskStatus.PENDING, "Add logging"));

            CliResult result = execute("run", "Add logging", "--detach", "--mode", "workspace-write",
                    "--idle-timeout", "60");

            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("Queued task T-local-1"));
            ArgumentCaptor<StartTaskRequest> captor = ArgumentCaptor.forClass(StartTaskRequest.class);
            verify(taskService).start(captor.capture());
            assertEquals("Add logging", captor.getValue().instruction());
            assertEquals(Duration.ofSeconds(60), captor.getValue().idleTimeout());
            verify(taskService, never()).run(any(), any(), any());
        }

        @Test
        @DisplayName("an invalid sandbox mode is rejected before anything runs")
        void invalidMode() {
            CliResult result = execute("run", "Add logging", "--mode", "root");

            assertEquals(2, result.exitCode());
            verifyNoInteractions(taskService);
        }

        @Test
        @DisplayName("a completed run prints files and exits 0")
        void completedRun() {
            when(taskService.run(any(), any(), any())).thenReturn(task("T-local-2", TaskStatus.COMPLETED, "Fix the build"));
            when(taskService.results("T-local-2")).thenReturn(new TaskResults("T-local-2", TaskStatus.COMPLETED,
                    "Fixed the build", List.of(new ResultExtractor.FileChange("pom.xml", "update")),
                    List.of(new ResultExtractor.CommandRun("mvn -q verify", 0)), null, null, null));

            CliResult result = execute("run", "Fix the build");

            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("TASK T-local-2"));
            assertTrue(result.output().contains("Fixed the build"));
            assertTrue(result.output().contains("pom.xml"));
            assertTrue(result.output().contains("mvn -q verify"));
        }

        @Test
        @DisplayName("--resume continues the thread and prints the task's events as they arrive")
        @SuppressWarnings("unchecked")
        void resumeRun() {
            when(taskService.run(any(), eq("th-9"), any())).thenAnswer(invocation -> {
                Consumer<RelayEvent> observer = invocation.getArgument(2);
                observer.accept(RelayEvent.of("task.queued", "T-local-9", null, Map.of("instruction", "Add tests")));
                observer.accept(RelayEvent.of("task.progress", "T-local-9", "w-1", Map.of("percentage", 50)));
                return task("T-local-9", TaskStatus.COMPLETED, "Add tests");
            });
            when(taskService.results("T-local-9")).thenReturn(new TaskResults("T-local-9", TaskStatus.COMPLETED,
                    "Added tests", List.of(), List.of(), null, null, null));

            CliResult result = execute("run", "Add tests", "--resume", "th-9");

            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("[QUEUED]"));
            assertFalse(result.output().contains("[PROGRESS]"));
            assertTrue(result.output().contains("Added tests"));
            verify(taskService, never()).start(any());
        }

        @Test
        @DisplayName("--resume with --detach queues a resumed task")
        void resumeDetached() {
            when(taskService.resume(eq("th-9"), any())).thenReturn(task("T-local-10", TaskStatus.PENDING, "More"));

            CliResult result = execute("run", "More", "--resume", "th-9", "--detach");

            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("Queued task T-local-10"));
            verify(taskService, never()).start(any());
        }

        @Test
        @DisplayName("a blank --resume is a usage error")
        void blankResume() {
            CliResult result = execute("run", "More", "--resume", " ");

            assertEquals(2, result.exitCode());
            verifyNoInteractions(taskService);
        }

        @Test
        @DisplayName("a failed run prints the error code and exits 1")
        void failedRun() {
            when(taskService.run(any(), any(), any())).thenReturn(task("T-local-3", TaskStatus.FAILED, "Do it"));
            when(taskService.results("T-local-3")).thenReturn(new TaskResults("T-local-3", TaskStatus.FAILED,
                    "Task failed", List.of(), List.of(), "Worker exited without doing any work",
                    "SILENT_FAILURE", null));

            CliResult result = execute("run", "Do it");

            assertEquals(1, result.exitCode());
            assertTrue(result.output().contains("[SILENT_FAILURE] Worker exited without doing any work"));
        }
    }

    @Nested
    @DisplayName("status, results and cancel")
    class TaskCommandTests {

        @Test
        @DisplayName("status shows the task and its progress")
        void status() {
            Task working = withThread(task("T-local-4", TaskStatus.WORKING, "Write tests"), "th-4");
            ProgressSummary progress = new ProgressSummary("Running: mvn test", 2, 4, 50, 1, 1, false, false,
                    List.of());
            when(taskService.status("T-local-4")).thenReturn(new TaskStatusView(working, progress, true));

            CliResult result = execute("status", "T-local-4");

            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("TASK T-local-4"));
            assertTrue(result.output().contains("working"));
            assertTrue(result.output().contains("Now: Running: mvn test"));
            assertTrue(result.output().contains("Thread: th-4"));
        }

        @Test
        @DisplayName("status --wait polls before printing")
        void statusWait() {
            Task done = task("T-local-5", TaskStatus.COMPLETED, "Write tests");
            when(taskService.waitFor(eq("T-local-5"), any(), any())).thenReturn(done);
            when(taskService.status("T-local-5")).thenReturn(new TaskStatusView(done, ProgressSummary.empty(), false));

            CliResult result = execute("status", "T-local-5", "--wait", "--timeout", "5");

            assertEquals(0, result.exitCode());
            verify(taskService).waitFor(eq("T-local-5"), eq(Duration.ofSeconds(5)), any());
        }

        @Test
        @DisplayName("unknown task ids are reported, not thrown")
        void unknownTask() {
            when(taskService.status(anyString())).thenThrow(new TaskNotFoundException("T-local-x"));

            CliResult result = execute("status", "T-local-x");

            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("Task not found: T-local-x"));
        }

        @Test
        @DisplayName("results prints the outcome of a finished task")
        void results() {
            when(taskService.results("T-local-6")).thenReturn(new TaskResults("T-local-6",
                    TaskStatus.COMPLETED_WITH_ERRORS, "Tests still failing", List.of(),
                    List.of(new ResultExtractor.CommandRun("npm test", 1)), null, null, null));

            CliResult result = execute("results", "T-local-6");

            assertTrue(result.output().contains("completed_with_errors"));
            assertTrue(result.output().contains("Tests still failing"));
            assertTrue(result.output().contains("npm test"));
        }

        @Test
        @DisplayName("cancel passes the reason through")
        void cancel() {
            when(taskService.cancel("T-local-7", "wrong branch")).thenReturn(CancelOutcome.CANCELED);

            CliResult result = execute("cancel", "T-local-7", "--reason", "wrong branch");

            assertTrue(result.output().contains("Canceled T-local-7"));
        }

        @Test
        @DisplayName("cancel of a finished task says there is nothing to do")
        void cancelFinished() {
            when(taskService.cancel("T-local-8", null)).thenReturn(CancelOutcome.ALREADY_TERMINAL);

            CliResult result = execute("cancel", "T-local-8");

            assertTrue(result.output().contains("already finished"));
        }
    }

    @Nested
    @DisplayName("history, cleanup and health")
    class RegistryCommandTests {

        @Test
        @DisplayName("history with no tasks says so")
        void emptyHistory() {
            CliResult result = execute("history");

            assertTrue(result.output().contains("No tasks found."));
        }

        @Test
        @DisplayName("history renders a table and applies filters")
        void history() {
            when(registry.query(any())).thenReturn(List.of(
                    task("T-local-9", TaskStatus.COMPLETED, "Refactor the database layer for pooling")));
            when(registry.stats()).thenReturn(new RegistryStats(1, Map.of(TaskStatus.COMPLETED, 1L),
                    Map.of(TaskOrigin.LOCAL, 1L), 0));

            CliResult result = execute("history", "--status", "completed", "--limit", "5");

            assertTrue(result.output().contains("T-local-9"));
            assertTrue(result.output().contains("2025-03-01 09:30:00"));
            assertTrue(result.output().contains("Refactor the database layer..."));
            ArgumentCaptor<TaskFilter> captor = ArgumentCaptor.forClass(TaskFilter.class);
            verify(registry).query(captor.capture());
            assertEquals(TaskStatus.COMPLETED, captor.getValue().status());
            assertEquals(5, captor.getValue().limit());
        }

        @Test
        @DisplayName("history rejects an unknown status")
        void historyBadStatus() {
            CliResult result = execute("history", "--status", "sleeping");

            verify(registry, never()).query(any());
            assertFalse(result.output().contains("No tasks found."));
        }

        @Test
        @DisplayName("cleanup --dry-run previews without changing anything")
        void cleanupDryRun() {
            when(registry.previewStuck(anyLong())).thenReturn(List.of(
                    task("T-local-10", TaskStatus.WORKING, "Stuck")));
            when(registry.previewPrune(any())).thenReturn(List.of());

            CliResult result = execute("cleanup", "--dry-run", "--stuck-max-age", "60");

            assertTrue(result.output().contains("1 stuck task(s) would be failed"));
            assertTrue(result.output().contains("T-local-10"));
            verify(registry).previewStuck(60);
            verify(registry, never()).reclaimStuck(anyLong());
            verify(registry, never()).pruneOld(any());
        }

        @Test
        @DisplayName("cleanup reclaims and prunes")
        void cleanup() {
            when(registry.reclaimStuck(anyLong())).thenReturn(2);
            when(registry.pruneOld(any())).thenReturn(3);

            CliResult result = execute("cleanup", "--max-age-hours", "24");

            assertTrue(result.output().contains("Reclaimed 2 stuck task(s)"));
            assertTrue(result.output().contains("Deleted 3 finished task(s) older than 24h"));
            verify(registry).pruneOld(Duration.ofHours(24));
        }

        @Test
        @DisplayName("health reports each component and the overall state")
        void health() {
            when(healthCheckService.checkAll()).thenReturn(List.of(
                    new HealthStatus("database", HealthStatus.Status.UP, "Task registry reachable", Map.of()),
                    new HealthStatus("worker", HealthStatus.Status.DOWN, "Worker CLI 'codex' not found on PATH",
                            Map.of())));

            CliResult result = execute("health");

            assertTrue(result.output().contains("database: Task registry reachable"));
            assertTrue(result.output().contains("worker: Worker CLI 'codex' not found on PATH"));
            assertTrue(result.output().contains("one or more components degraded or down"));
        }
    }
}
