package com.agentrelay.dispatch.cli;

import com.agentrelay.config.RelayProperties;
import com.agentrelay.core.model.Task;
import com.agentrelay.core.registry.TaskRegistry;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.time.Duration;
import java.util.List;

/**
 * CLI command: agent-relay cleanup
 * <p>
 * Fails tasks that have been active too long and deletes old finished tasks.
 * {@code --dry-run} lists what would change without touching the registry.
 */
@Command(name = "cleanup", mixinStandardHelpOptions = true, description = "Reclaim stuck tasks and prune old ones")
@Component
public class CleanupCommand implements Runnable {

    @Option(names = "--dry-run", description = "Show what would be changed")
    private boolean dryRun;

    @Option(names = "--stuck-max-age", description = "Seconds after which an active task counts as stuck")
    private Long stuckMaxAgeSeconds;

    @Option(names = "--max-age-hours", description = "Delete finished tasks older than this many hours")
    private Long maxAgeHours;

    private final TaskRegistry registry;
    private final RelayProperties properties;

    public CleanupCommand(TaskRegistry registry, RelayProperties properties) {
        this.registry = registry;
        this.properties = properties;
    }

    @Override
    public void run() {
        ConsoleOutput.printBanner();

        long stuckAge = stuckMaxAgeSeconds != null
                ? stuckMaxAgeSeconds
                : properties.getRegistry().getStuckMaxAgeSeconds();
        Duration pruneAge = maxAgeHours != null
                ? Duration.ofHours(maxAgeHours)
                : properties.getRegistry().getPruneMaxAge();

        if (dryRun) {
            List<Task> stuck = registry.previewStuck(stuckAge);
            List<Task> prunable = registry.previewPrune(pruneAge);
            ConsoleOutput.info("Dry run: " + stuck.size() + " stuck task(s) would be failed, "
                    + prunable.size() + " finished task(s) would be deleted");
            stuck.forEach(t -> System.out.printf("  stuck  %-28s %s%n", t.id(), t.status().value()));
            prunable.forEach(t -> System.out.printf("  prune  %-28s %s%n", t.id(), t.status().value()));
            return;
        }

        int reclaimed = registry.reclaimStuck(stuckAge);
        int pruned = registry.pruneOld(pruneAge);
        ConsoleOutput.success("Reclaimed " + reclaimed + " stuck task(s) older than " + stuckAge + "s");
        ConsoleOutput.success("Deleted " + pruned + " finished task(s) older than " + pruneAge.toHours() + "h");
    }
}
