package com.agentrelay.dispatch.cli;

import com.agentrelay.core.engine.TaskService;
import com.agentrelay.core.engine.TaskStatusView;
import com.agentrelay.core.model.Task;
import com.agentrelay.core.registry.TaskNotFoundException;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.time.Duration;
import java.time.Instant;

/**
 * CLI command: agent-relay status &lt;task-id&gt;
 * <p>
 * Shows a task's status and its latest progress. With {@code --wait}, polls until the task
 * finishes or the timeout elapses.
 */
@Command(name = "status", mixinStandardHelpOptions = true, description = "Check task status")
@Component
public class StatusCommand implements Runnable {

    @Parameters(index = "0", description = "Task ID")
    private String taskId;

    @Option(names = {"--wait", "-w"}, description = "Wait for the task to finish")
    private boolean wait;

    @Option(names = "--timeout", description = "Seconds to wait (default: ${DEFAULT-VALUE})", defaultValue = "300")
    private long timeoutSeconds;

    private final TaskService taskService;

    public StatusCommand(TaskService taskService) {
        this.taskService = taskService;
    }

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        try {
            if (wait) {
                ConsoleOutput.info("Waiting up to " + timeoutSeconds + "s for " + taskId + "...");
                taskService.waitFor(taskId, Duration.ofSeconds(timeoutSeconds), TaskService.DEFAULT_POLL_INTERVAL);
            }
            print(taskService.status(taskId));
        } catch (TaskNotFoundException e) {
            ConsoleOutput.error("Task not found: " + taskId);
        }
    }

    private static void print(TaskStatusView view) {
        Task task = view.task();
        System.out.println();
        System.out.println("TASK " + task.id() + (task.alias() != null ? " (" + task.alias() + ")" : ""));
        System.out.println("Instruction: " + ConsoleOutput.truncate(task.instruction(), 70));
        if (task.workingDir() != null) {
            System.out.println("Directory: " + task.workingDir());
        }
        if (task.threadId() != null) {
            System.out.println("Thread: " + task.threadId());
        }
        ConsoleOutput.status(task.status());

        Instant end = task.completedAt() != null ? task.completedAt() : Instant.now();
        ConsoleOutput.info("Elapsed: " + ConsoleOutput.formatDuration(
                Duration.between(task.createdAt(), end).toMillis()));
        if (view.progress().totalSteps() > 0) {
            ConsoleOutput.progress(view.progress());
        }
        if (task.error() != null) {
            ConsoleOutput.error(task.error());
        }
    }
}
