package com.agentrelay.core.engine;

import com.agentrelay.core.events.ItemKind;
import com.agentrelay.core.events.ItemPayload;
import com.agentrelay.core.events.WorkerEvent;
import com.agentrelay.core.model.TaskStatus;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ResultExtractorTest {

    private static final Instant TS = Instant.parse("2025-02-01T10:00:00Z");
    private static final ObjectNode RAW = JsonNodeFactory.instance.objectNode();

    private static WorkerEvent completed(String id, ItemPayload payload) {
        return new WorkerEvent.ItemCompleted(id, payload, TS, RAW);
    }

    private static WorkerEvent turn(String summary) {
        return new WorkerEvent.TurnCompleted("t1", summary, null, TS, RAW);
    }

    @Test
    @DisplayName("summary prefers the last turn summary")
    void summaryFromTurn() {
        List<WorkerEvent> events = List.of(
                turn("first turn"),
                completed("m1", ItemPayload.agentMessage("a message")),
                turn("second turn"));

        assertEquals("second turn", ResultExtractor.summary(events));
    }

    @Test
    @DisplayName("summary falls back to the last agent message, then a default")
    void summaryFallbacks() {
        List<WorkerEvent> messages = List.of(
                completed("m1", ItemPayload.agentMessage("one")),
                completed("m2", ItemPayload.agentMessage("two")),
                turn("  "));

        assertEquals("two", ResultExtractor.summary(messages));
        assertEquals(ResultExtractor.DEFAULT_SUMMARY, ResultExtractor.summary(List.of()));
    }

    @Test
    @DisplayName("file changes are taken once per item id from completed items only")
    void fileChangesDeduplicated() {
        List<WorkerEvent> events = List.of(
                new WorkerEvent.ItemStarted("f1", ItemPayload.fileChange("a.txt", "add"), TS, RAW),
                completed("f1", ItemPayload.fileChange("a.txt", "add")),
                completed("f1", ItemPayload.fileChange("a.txt", "update")),
                completed("f2", ItemPayload.fileChange("b.txt", "delete")));

        assertEquals(List.of(
                new ResultExtractor.FileChange("a.txt", "add"),
                new ResultExtractor.FileChange("b.txt", "delete")), ResultExtractor.fileChanges(events));
    }

    @Test
    @DisplayName("commands keep their exit codes and flag failures")
    void commands() {
        List<WorkerEvent> events = List.of(
                completed("c1", ItemPayload.command("ls", 0)),
                completed("c2", ItemPayload.command("make", 2)));

        List<ResultExtractor.CommandRun> commands = ResultExtractor.commands(events);

        assertEquals(2, commands.size());
        assertEquals(Integer.valueOf(2), commands.get(1).exitCode());
        assertTrue(ResultExtractor.hasFailedCommand(events));
        assertFalse(ResultExtractor.hasFailedCommand(events.subList(0, 1)));
    }

    @Test
    @DisplayName("error items and top-level error events count as reported errors")
    void reportedErrors() {
        ItemPayload errorItem = new ItemPayload(ItemKind.ERROR, "error", null, null, null, null,
                "rate limited", null, null);

        assertTrue(ResultExtractor.hasReportedError(List.of(completed("e1", errorItem))));
        assertTrue(ResultExtractor.hasReportedError(List.of(new WorkerEvent.Unknown("error", TS, RAW))));
        assertFalse(ResultExtractor.hasReportedError(List.of(new WorkerEvent.Unknown("session.created", TS, RAW))));
    }

    @Test
    @DisplayName("success status reflects command failures before reported errors")
    void successStatus() {
        ItemPayload errorItem = new ItemPayload(ItemKind.ERROR, "error", null, null, null, null,
                "warning", null, null);

        assertEquals(TaskStatus.COMPLETED, TaskService.successStatus(List.of(turn("done"))));
        assertEquals(TaskStatus.COMPLETED_WITH_WARNINGS,
                TaskService.successStatus(List.of(completed("e1", errorItem), turn("done"))));
        assertEquals(TaskStatus.COMPLETED_WITH_ERRORS, TaskService.successStatus(List.of(
                completed("e1", errorItem), completed("c1", ItemPayload.command("npm test", 1)))));
    }
}
