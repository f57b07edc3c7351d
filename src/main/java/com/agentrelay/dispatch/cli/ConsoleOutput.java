package com.agentrelay.dispatch.cli;

import com.agentrelay.core.engine.ResultExtractor;
import com.agentrelay.core.events.RelayEvent;
import com.agentrelay.core.model.TaskStatus;
import com.agentrelay.core.progress.ProgressSummary;
import picocli.CommandLine;

/**
 * ANSI-colored terminal output utilities for the Agent Relay CLI.
 */
public class ConsoleOutput {

    private ConsoleOutput() {
        // utility class
    }

    public static void printBanner() {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold,fg(yellow) AGENT RELAY v0.1.0|@"));
        System.out.println("──────────────────────────────────");
    }

    public static void info(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(cyan) [RELAY]|@ " + message));
    }

    public static void success(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(green) +|@ " + message));
    }

    public static void warn(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(yellow) !|@ " + message));
    }

    public static void error(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(red) x|@ " + message));
    }

    public static void status(TaskStatus status) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "Status: @|" + statusStyle(status) + " " + status.value() + "|@"));
    }

    public static void progress(ProgressSummary progress) {
        int filled = progress.progressPercentage() / 5;
        String bar = "#".repeat(filled) + ".".repeat(20 - filled);
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "  [" + bar + "] @|bold " + progress.progressPercentage() + "%|@ ("
                        + progress.completedSteps() + "/" + progress.totalSteps() + " steps)"));
        if (progress.currentAction() != null) {
            System.out.println("  Now: " + progress.currentAction());
        }
        System.out.println("  Files changed: " + progress.filesChanged()
                + " | Commands run: " + progress.commandsExecuted());
    }

    public static void fileChange(ResultExtractor.FileChange change) {
        String symbol = switch (change.operation() == null ? "" : change.operation()) {
            case "add", "create", "created" -> "+";
            case "delete", "remove", "deleted" -> "-";
            default -> "~";
        };
        String color = "-".equals(symbol) ? "fg(red)" : "fg(green)";
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "  @|" + color + " " + symbol + "|@ " + change.path()));
    }

    public static void command(ResultExtractor.CommandRun run) {
        boolean ok = run.exitCode() == null || run.exitCode() == 0;
        String exit = run.exitCode() == null ? "?" : String.valueOf(run.exitCode());
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "  @|" + (ok ? "fg(green)" : "fg(red)") + " [" + exit + "]|@ " + run.command()));
    }

    public static void relayEvent(RelayEvent event) {
        String prefix = switch (event.eventType()) {
            case "task.queued" -> "@|fg(cyan) [QUEUED]|@";
            case "task.started" -> "@|fg(blue) [STARTED]|@";
            case "task.progress" -> "@|fg(white) [PROGRESS]|@";
            case "task.warning" -> "@|fg(yellow),bold [WARNING]|@";
            case "task.completed" -> "@|fg(green),bold [COMPLETE]|@";
            case "task.failed" -> "@|fg(red),bold [FAILED]|@";
            case "task.canceled" -> "@|fg(magenta) [CANCELED]|@";
            default -> "@|fg(white) [" + event.eventType() + "]|@";
        };
        System.out.println(CommandLine.Help.Ansi.AUTO.string(prefix + " " + describe(event)));
    }

    static String formatDuration(long ms) {
        if (ms < 1000) return ms + "ms";
        long seconds = ms / 1000;
        if (seconds < 60) return seconds + "s";
        return (seconds / 60) + "m " + (seconds % 60) + "s";
    }

    static String truncate(String s, int max) {
        if (s == null || s.isEmpty()) return "-";
        String line = s.replace('\n', ' ');
        return line.length() <= max ? line : line.substring(0, max - 3) + "...";
    }

    private static String describe(RelayEvent event) {
        var payload = event.payload();
        return switch (event.eventType()) {
            case "task.progress" -> payload.get("percentage") + "% "
                    + (payload.get("currentAction") != null ? payload.get("currentAction") : "");
            case "task.warning" -> payload.get("kind") + " timeout in "
                    + formatDuration(((Number) payload.get("remainingMs")).longValue());
            case "task.started" -> event.taskId() + " (pid " + payload.get("pid") + ")";
            default -> event.taskId() + (payload.isEmpty() ? "" : " " + payload);
        };
    }

    private static String statusStyle(TaskStatus status) {
        return switch (status) {
            case COMPLETED -> "fg(green),bold";
            case COMPLETED_WITH_WARNINGS, COMPLETED_WITH_ERRORS -> "fg(yellow),bold";
            case FAILED -> "fg(red),bold";
            case CANCELED -> "fg(magenta)";
            default -> "fg(cyan)";
        };
    }
}
