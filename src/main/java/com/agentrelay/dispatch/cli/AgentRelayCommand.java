package com.agentrelay.dispatch.cli;

import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

/**
 * Top-level CLI command for Agent Relay.
 * Routes to subcommands: run, status, results, cancel, history, cleanup, health.
 */
@Command(
        name = "agent-relay",
        mixinStandardHelpOptions = true,
        version = "Agent Relay 0.1.0",
        description = "Delegates coding tasks to an external worker CLI and tracks them",
        subcommands = {
                RunCommand.class,
                StatusCommand.class,
                ResultsCommand.class,
                CancelCommand.class,
                HistoryCommand.class,
                CleanupCommand.class,
                HealthCommand.class,
                CommandLine.HelpCommand.class
        }
)
@Component
public class AgentRelayCommand implements Runnable {

    @Spec
    CommandSpec spec;

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        // When no subcommand is given, show usage help
        spec.commandLine().usage(System.out);
    }
}
