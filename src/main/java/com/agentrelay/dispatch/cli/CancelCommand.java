package com.agentrelay.dispatch.cli;

import com.agentrelay.core.engine.CancelOutcome;
import com.agentrelay.core.engine.TaskService;
import com.agentrelay.core.registry.TaskNotFoundException;
import com.agentrelay.core.registry.TaskRegistryException;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

/**
 * CLI command: agent-relay cancel &lt;task-id&gt;
 * <p>
 * Marks a pending or working task canceled and stops its worker if it runs in this process.
 */
@Command(name = "cancel", mixinStandardHelpOptions = true, description = "Cancel a pending or running task")
@Component
public class CancelCommand implements Runnable {

    @Parameters(index = "0", description = "Task ID")
    private String taskId;

    @Option(names = {"--reason", "-r"}, description = "Why the task is being canceled")
    private String reason;

    private final TaskService taskService;

    public CancelCommand(TaskService taskService) {
        this.taskService = taskService;
    }

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        try {
            CancelOutcome outcome = taskService.cancel(taskId, reason);
            if (outcome == CancelOutcome.CANCELED) {
                ConsoleOutput.success("Canceled " + taskId);
            } else {
                ConsoleOutput.info("Task " + taskId + " already finished; nothing to cancel");
            }
        } catch (TaskNotFoundException e) {
            ConsoleOutput.error("Task not found: " + taskId);
        } catch (TaskRegistryException e) {
            ConsoleOutput.error(e.getMessage());
        }
    }
}
