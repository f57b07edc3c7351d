package com.agentrelay.dispatch.cli;

import com.agentrelay.core.engine.TaskResults;
import com.agentrelay.core.engine.TaskService;
import com.agentrelay.core.registry.TaskNotFoundException;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

/**
 * CLI command: agent-relay results &lt;task-id&gt;
 */
@Command(name = "results", mixinStandardHelpOptions = true, description = "Show the outcome of a task")
@Component
public class ResultsCommand implements Runnable {

    @Parameters(index = "0", description = "Task ID")
    private String taskId;

    private final TaskService taskService;

    public ResultsCommand(TaskService taskService) {
        this.taskService = taskService;
    }

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        TaskResults results;
        try {
            results = taskService.results(taskId);
        } catch (TaskNotFoundException e) {
            ConsoleOutput.error("Task not found: " + taskId);
            return;
        }
        System.out.println();
        System.out.println("TASK " + results.taskId());
        ConsoleOutput.status(results.status());
        RunCommand.printResults(results);
    }
}
