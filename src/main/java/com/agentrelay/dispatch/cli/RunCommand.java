package com.agentrelay.dispatch.cli;

import com.agentrelay.core.engine.StartTaskRequest;
import com.agentrelay.core.engine.TaskResults;
import com.agentrelay.core.engine.TaskService;
import com.agentrelay.core.model.Task;
import com.agentrelay.core.model.TaskStatus;
import com.agentrelay.core.process.EnvPolicy;
import com.agentrelay.core.process.SandboxMode;
import com.agentrelay.core.registry.TaskRegistryException;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * CLI command: agent-relay run "&lt;instruction&gt;"
 * <p>
 * Registers a task, runs the worker on it and prints the outcome. With {@code --detach}
 * the task id is printed as soon as the task is queued. {@code --resume} continues the worker
 * conversation of an earlier task instead of starting a new one.
 */
@Command(name = "run", mixinStandardHelpOptions = true, description = "Run an instruction through the worker")
@Component
public class RunCommand implements Callable<Integer> {

    @Parameters(index = "0", description = "Instruction for the worker")
    private String instruction;

    @Option(names = {"--dir", "-d"}, description = "Working directory (default: current directory)")
    private Path workingDir;

    @Option(names = {"--mode", "-m"}, description = "Sandbox mode: read-only, workspace-write, danger-full-access")
    private String mode;

    @Option(names = "--model", description = "Model to use")
    private String model;

    @Option(names = "--env-policy", description = "inherit-none, inherit-all or allow-list",
            defaultValue = "inherit-none")
    private String envPolicy;

    @Option(names = "--allow-env", split = ",", description = "Variables passed through under allow-list")
    private List<String> allowEnv;

    @Option(names = "--skip-git-repo-check", description = "Allow running outside a git repository")
    private boolean skipGitRepoCheck;

    @Option(names = "--output-schema", description = "JSON schema file for the final message")
    private Path outputSchema;

    @Option(names = "--idle-timeout", description = "Inactivity timeout in seconds")
    private Long idleTimeoutSeconds;

    @Option(names = "--hard-timeout", description = "Wall-clock timeout in seconds")
    private Long hardTimeoutSeconds;

    @Option(names = "--alias", description = "Short name for the task")
    private String alias;

    @Option(names = "--resume", paramLabel = "THREAD_ID",
            description = "Continue an earlier worker conversation (see the thread id in status)")
    private String resumeThreadId;

    @Option(names = "--detach", description = "Return after queuing instead of waiting")
    private boolean detach;

    @Option(names = {"--verbose", "-v"}, description = "Print every progress event")
    private boolean verbose;

    private final TaskService taskService;

    public RunCommand(TaskService taskService) {
        this.taskService = taskService;
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();

        StartTaskRequest request;
        try {
            request = StartTaskRequest.builder(instruction)
                    .workingDir(workingDir)
                    .mode(mode != null ? SandboxMode.fromValue(mode) : null)
                    .model(model)
                    .envPolicy(EnvPolicy.fromValue(envPolicy))
                    .envAllowList(allowEnv)
                    .skipGitRepoCheck(skipGitRepoCheck)
                    .outputSchema(outputSchema)
                    .idleTimeout(idleTimeoutSeconds != null ? Duration.ofSeconds(idleTimeoutSeconds) : null)
                    .hardTimeout(hardTimeoutSeconds != null ? Duration.ofSeconds(hardTimeoutSeconds) : null)
                    .alias(alias)
                    .build();
            if (resumeThreadId != null && resumeThreadId.isBlank()) {
                throw new IllegalArgumentException("--resume needs a thread id");
            }
        } catch (IllegalArgumentException e) {
            ConsoleOutput.error(e.getMessage());
            return 2;
        }

        if (detach) {
            try {
                Task task = resumeThreadId != null
                        ? taskService.resume(resumeThreadId, request)
                        : taskService.start(request);
                ConsoleOutput.success("Queued task " + task.id());
                ConsoleOutput.info("Check on it with: agent-relay status " + task.id());
                return 0;
            } catch (TaskRegistryException e) {
                ConsoleOutput.error(e.getMessage());
                return 2;
            }
        }

        Task task;
        try {
            task = taskService.run(request, resumeThreadId, event -> {
                if (verbose || !"task.progress".equals(event.eventType()) && !"task.heartbeat".equals(event.eventType())) {
                    ConsoleOutput.relayEvent(event);
                }
            });
        } catch (TaskRegistryException e) {
            ConsoleOutput.error(e.getMessage());
            return 2;
        }

        System.out.println();
        System.out.println("TASK " + task.id());
        ConsoleOutput.status(task.status());
        printResults(taskService.results(task.id()));
        return task.status() == TaskStatus.FAILED || task.status() == TaskStatus.CANCELED ? 1 : 0;
    }

    static void printResults(TaskResults results) {
        if (results.summary() != null) {
            System.out.println();
            System.out.println(results.summary());
        }
        if (!results.fileChanges().isEmpty()) {
            System.out.println();
            System.out.println("FILES:");
            results.fileChanges().forEach(ConsoleOutput::fileChange);
        }
        if (!results.commands().isEmpty()) {
            System.out.println();
            System.out.println("COMMANDS:");
            results.commands().forEach(ConsoleOutput::command);
        }
        if (results.error() != null) {
            System.out.println();
            ConsoleOutput.error((results.errorCode() != null ? "[" + results.errorCode() + "] " : "")
                    + results.error());
        }
        if (results.failure() != null) {
            String suggestion = results.failure().path("details").path("suggestion").asText(null);
            if (suggestion != null) {
                ConsoleOutput.info("Suggestion: " + suggestion);
            }
        }
    }
}
