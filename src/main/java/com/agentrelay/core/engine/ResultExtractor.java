package com.agentrelay.core.engine;

import com.agentrelay.core.events.ItemKind;
import com.agentrelay.core.events.ItemPayload;
import com.agentrelay.core.events.WorkerEvent;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Pulls the user-facing outcome of a run out of its event list.
 */
public final class ResultExtractor {

    static final String DEFAULT_SUMMARY = "Task completed successfully";

    private ResultExtractor() {}

    public record FileChange(String path, String operation) {}

    public record CommandRun(String command, Integer exitCode) {}

    /**
     * The last turn summary, else the last agent message, else a generic success line.
     */
    public static String summary(List<WorkerEvent> events) {
        String turnSummary = null;
        String lastMessage = null;
        for (WorkerEvent event : events) {
            if (event instanceof WorkerEvent.TurnCompleted turn && hasText(turn.summary())) {
                turnSummary = turn.summary();
            } else if (event instanceof WorkerEvent.ItemCompleted item
                    && item.item().kind() == ItemKind.AGENT_MESSAGE && hasText(item.item().text())) {
                lastMessage = item.item().text();
            }
        }
        if (turnSummary != null) {
            return turnSummary;
        }
        return lastMessage != null ? lastMessage : DEFAULT_SUMMARY;
    }

    /**
     * Completed file changes, one per item id, in completion order.
     */
    public static List<FileChange> fileChanges(List<WorkerEvent> events) {
        List<FileChange> changes = new ArrayList<>();
        for (ItemPayload item : completedItems(events, ItemKind.FILE_CHANGE).values()) {
            if (item.path() != null) {
                changes.add(new FileChange(item.path(), item.operation()));
            }
        }
        return changes;
    }

    /**
     * Completed command executions, one per item id, in completion order.
     */
    public static List<CommandRun> commands(List<WorkerEvent> events) {
        List<CommandRun> commands = new ArrayList<>();
        for (ItemPayload item : completedItems(events, ItemKind.COMMAND_EXECUTION).values()) {
            commands.add(new CommandRun(item.command(), item.exitCode()));
        }
        return commands;
    }

    public static boolean hasFailedCommand(List<WorkerEvent> events) {
        return commands(events).stream().anyMatch(c -> c.exitCode() != null && c.exitCode() != 0);
    }

    /**
     * Whether the worker reported a non-fatal error, either as an error item or a top-level error event.
     */
    public static boolean hasReportedError(List<WorkerEvent> events) {
        for (WorkerEvent event : events) {
            if (event instanceof WorkerEvent.ItemEvent item && item.item().kind() == ItemKind.ERROR) {
                return true;
            }
            if (event instanceof WorkerEvent.Unknown unknown && "error".equals(unknown.type())) {
                return true;
            }
        }
        return false;
    }

    private static Map<String, ItemPayload> completedItems(List<WorkerEvent> events, ItemKind kind) {
        Map<String, ItemPayload> byId = new LinkedHashMap<>();
        int anonymous = 0;
        for (WorkerEvent event : events) {
            if (event instanceof WorkerEvent.ItemCompleted completed && completed.item().kind() == kind) {
                String id = completed.itemId() != null ? completed.itemId() : "#" + anonymous++;
                byId.putIfAbsent(id, completed.item());
            }
        }
        return byId;
    }

    private static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }
}
