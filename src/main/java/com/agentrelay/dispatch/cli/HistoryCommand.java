package com.agentrelay.dispatch.cli;

import com.agentrelay.core.model.RegistryStats;
import com.agentrelay.core.model.Task;
import com.agentrelay.core.model.TaskStatus;
import com.agentrelay.core.registry.TaskFilter;
import com.agentrelay.core.registry.TaskRegistry;
import com.agentrelay.core.registry.TaskRegistryException;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.util.List;

/**
 * CLI command: agent-relay history
 * <p>
 * Lists tasks newest first as a table: Task ID | Status | Created | Instruction (truncated).
 */
@Command(name = "history", mixinStandardHelpOptions = true, description = "List recent tasks")
@Component
public class HistoryCommand implements Runnable {

    @Option(names = {"--limit", "-n"}, description = "Number of results", defaultValue = "10")
    private int limit;

    @Option(names = {"--status", "-s"}, description = "Only tasks with this status")
    private String status;

    @Option(names = "--dir", description = "Only tasks run in this working directory")
    private String workingDir;

    @Option(names = "--thread", description = "Only tasks in this conversation thread")
    private String threadId;

    @Option(names = "--user", description = "Only tasks owned by this user")
    private String userId;

    private final TaskRegistry registry;

    public HistoryCommand(TaskRegistry registry) {
        this.registry = registry;
    }

    @Override
    public void run() {
        ConsoleOutput.printBanner();

        TaskFilter filter;
        try {
            filter = TaskFilter.builder()
                    .status(status != null ? TaskStatus.fromValue(status) : null)
                    .workingDir(workingDir)
                    .threadId(threadId)
                    .userId(userId)
                    .limit(limit)
                    .build();
        } catch (IllegalArgumentException | TaskRegistryException e) {
            ConsoleOutput.error(e.getMessage());
            return;
        }

        List<Task> tasks = registry.query(filter);
        if (tasks.isEmpty()) {
            ConsoleOutput.info("No tasks found.");
            return;
        }

        RegistryStats stats = registry.stats();
        ConsoleOutput.info("Tasks (" + tasks.size() + " of " + stats.total() + ", " + stats.running() + " active):");
        System.out.println();
        System.out.printf("  %-28s %-24s %-20s %s%n", "TASK ID", "STATUS", "CREATED", "INSTRUCTION");
        System.out.println("  " + "-".repeat(96));

        for (Task task : tasks) {
            System.out.printf("  %-28s %-24s %-20s %s%n",
                    task.id(),
                    task.status().value(),
                    task.createdAt().toString().substring(0, 19).replace('T', ' '),
                    ConsoleOutput.truncate(task.instruction(), 30));
        }
    }
}
