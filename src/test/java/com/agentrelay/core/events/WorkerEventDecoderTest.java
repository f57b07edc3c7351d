package com.agentrelay.core.events;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class WorkerEventDecoderTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final Instant RECEIVED = Instant.parse("2025-03-01T12:00:00Z");

    private static WorkerEvent decode(String json) throws Exception {
        JsonNode node = MAPPER.readTree(json);
        return WorkerEventDecoder.decode(node, RECEIVED).orElseThrow();
    }

    @Test
    void decodesFlatFileChange() throws Exception {
        var event = assertInstanceOf(WorkerEvent.ItemCompleted.class, decode(
                "{\"type\":\"item.completed\",\"itemId\":\"i1\",\"data\":{\"type\":\"file_change\",\"path\":\"a.txt\",\"operation\":\"add\"}}"));

        assertEquals("i1", event.itemId());
        assertEquals(ItemKind.FILE_CHANGE, event.item().kind());
        assertEquals("a.txt", event.item().path());
        assertEquals("add", event.item().operation());
    }

    @Test
    void decodesNestedItemLayout() throws Exception {
        var event = assertInstanceOf(WorkerEvent.ItemCompleted.class, decode(
                "{\"type\":\"item.completed\",\"item\":{\"id\":\"item_3\",\"type\":\"file_change\","
                        + "\"changes\":[{\"path\":\"/repo/b.txt\",\"kind\":\"update\"}]}}"));

        assertEquals("item_3", event.itemId());
        assertEquals("/repo/b.txt", event.item().path());
        assertEquals("update", event.item().operation());
    }

    @Test
    void decodesCommandWithArgvAndExitCode() throws Exception {
        var event = assertInstanceOf(WorkerEvent.ItemCompleted.class, decode(
                "{\"type\":\"item.completed\",\"item\":{\"id\":\"c1\",\"type\":\"command_execution\","
                        + "\"command\":[\"bash\",\"-lc\",\"ls\"],\"exit_code\":2}}"));

        assertEquals(ItemKind.COMMAND_EXECUTION, event.item().kind());
        assertEquals("bash -lc ls", event.item().command());
        assertEquals(Integer.valueOf(2), event.item().exitCode());
    }

    @Test
    void decodesTurnFailedMessageFromErrorObject() throws Exception {
        var event = assertInstanceOf(WorkerEvent.TurnFailed.class, decode(
                "{\"type\":\"turn.failed\",\"turnId\":\"t9\",\"error\":{\"message\":\"429 Too Many Requests\"}}"));

        assertEquals("t9", event.turnId());
        assertEquals("429 Too Many Requests", event.errorMessage());
        assertNotNull(event.error());
    }

    @Test
    void unrecognisedItemKindIsOther() throws Exception {
        var event = assertInstanceOf(WorkerEvent.ItemStarted.class, decode(
                "{\"type\":\"item.started\",\"itemId\":\"x\",\"data\":{\"type\":\"web_search\",\"description\":\"Searching\"}}"));

        assertEquals(ItemKind.OTHER, event.item().kind());
        assertEquals("web_search", event.item().kindName());
        assertEquals("Searching", event.item().description());
    }

    @Test
    void rejectsNodesWithoutType() throws Exception {
        assertEquals(Optional.empty(), WorkerEventDecoder.decode(MAPPER.readTree("{\"type\":\"\"}"), RECEIVED));
        assertEquals(Optional.empty(), WorkerEventDecoder.decode(MAPPER.readTree("{\"type\":7}"), RECEIVED));
        assertEquals(Optional.empty(), WorkerEventDecoder.decode(null, RECEIVED));
    }

    @Test
    void numericTimestampIsEpochMillis() throws Exception {
        WorkerEvent event = decode("{\"type\":\"turn.started\",\"timestamp\":1700000000000}");

        assertEquals(Instant.ofEpochMilli(1_700_000_000_000L), event.timestamp());
    }

    @Test
    void threadStartedCarriesThreadId() throws Exception {
        WorkerEvent event = decode("{\"type\":\"thread.started\",\"thread_id\":\"0199a213-81c0\"}");

        assertInstanceOf(WorkerEvent.Unknown.class, event);
        assertEquals(Optional.of("0199a213-81c0"), WorkerEventDecoder.threadId(event));
        assertEquals(Optional.of("th-2"),
                WorkerEventDecoder.threadId(decode("{\"type\":\"thread.started\",\"data\":{\"threadId\":\"th-2\"}}")));
    }

    @Test
    void threadIdIsOnlyReadFromThreadStarted() throws Exception {
        assertTrue(WorkerEventDecoder.threadId(decode("{\"type\":\"turn.started\",\"thread_id\":\"x\"}")).isEmpty());
        assertTrue(WorkerEventDecoder.threadId(decode("{\"type\":\"thread.started\"}")).isEmpty());
    }
}
