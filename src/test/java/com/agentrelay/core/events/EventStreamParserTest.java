package com.agentrelay.core.events;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class EventStreamParserTest {

    private static final Instant NOW = Instant.parse("2025-01-01T00:00:00Z");

    private static final String STREAM = String.join("\n",
            "{\"type\":\"turn.started\",\"turnId\":\"t1\"}",
            "Reading prompt from stdin...",
            "{\"type\":\"item.started\",\"itemId\":\"i1\",\"data\":{\"type\":\"file_change\",\"path\":\"src/App.java\"}}",
            "",
            "{\"type\":\"item.completed\",\"itemId\":\"i1\",\"data\":{\"type\":\"file_change\",\"path\":\"src/App.java\",\"operation\":\"update\"}}",
            "{\"type\":\"thread.started\",\"thread_id\":\"th-9\"}",
            "{\"type\":\"turn.completed\",\"turnId\":\"t1\",\"summary\":\"Done\"}",
            "");

    private EventStreamParser parser;

    @BeforeEach
    void setUp() {
        parser = new EventStreamParser(new ObjectMapper(), Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Nested
    @DisplayName("feed")
    class FeedTests {

        @Test
        @DisplayName("decodes a record split across two chunks")
        void decodesSplitRecord() {
            List<WorkerEvent> first = parser.feed("{\"type\":\"turn.sta");
            assertTrue(first.isEmpty());
            assertTrue(parser.stats().bufferedChars() > 0);

            List<WorkerEvent> second = parser.feed("rted\",\"turnId\":\"t1\"}\n");
            assertEquals(1, second.size());
            var started = assertInstanceOf(WorkerEvent.TurnStarted.class, second.get(0));
            assertEquals("t1", started.turnId());
            assertEquals(0, parser.stats().bufferedChars());
        }

        @Test
        @DisplayName("drops non-JSON lines and keeps going")
        void dropsNoise() {
            List<WorkerEvent> events = parser.feed("hello world\n{\"type\":\"turn.started\"}\nnot { json\n");

            assertEquals(1, events.size());
            assertEquals(WorkerEvent.TURN_STARTED, events.get(0).type());
            assertEquals(3, parser.stats().linesProcessed());
            assertEquals(2, parser.stats().parseErrors());
        }

        @Test
        @DisplayName("drops JSON values without a type tag")
        void dropsUntypedJson() {
            List<WorkerEvent> events = parser.feed("[1,2,3]\n{\"msg\":\"hi\"}\n42\n");

            assertTrue(events.isEmpty());
            assertEquals(3, parser.stats().parseErrors());
        }

        @Test
        @DisplayName("keeps unknown event types as Unknown")
        void keepsUnknownTypes() {
            List<WorkerEvent> events = parser.feed("{\"type\":\"thread.started\",\"thread_id\":\"x\"}\n");

            var unknown = assertInstanceOf(WorkerEvent.Unknown.class, events.get(0));
            assertEquals("thread.started", unknown.type());
            assertEquals("x", unknown.raw().get("thread_id").asText());
        }

        @Test
        @DisplayName("ignores blank lines and CRLF line endings")
        void ignoresBlankLines() {
            List<WorkerEvent> events = parser.feed("\r\n   \n{\"type\":\"turn.started\"}\r\n");

            assertEquals(1, events.size());
            assertEquals(1, parser.stats().linesProcessed());
            assertEquals(0, parser.stats().parseErrors());
        }

        @Test
        @DisplayName("empty and null chunks produce nothing")
        void emptyChunks() {
            assertTrue(parser.feed("").isEmpty());
            assertTrue(parser.feed(null).isEmpty());
        }

        @Test
        @DisplayName("uses the worker timestamp when present, otherwise the receive time")
        void timestamps() {
            List<WorkerEvent> events = parser.feed(
                    "{\"type\":\"turn.started\",\"timestamp\":\"2024-06-01T10:00:00Z\"}\n"
                            + "{\"type\":\"turn.started\"}\n");

            assertEquals(Instant.parse("2024-06-01T10:00:00Z"), events.get(0).timestamp());
            assertEquals(NOW, events.get(1).timestamp());
        }
    }

    @Nested
    @DisplayName("chunking")
    class ChunkingTests {

        @Test
        @DisplayName("any chunk boundaries yield the same events as one chunk")
        void chunkingInvariance() {
            List<String> expected = types(parser.feed(STREAM));
            assertEquals(List.of("turn.started", "item.started", "item.completed", "thread.started", "turn.completed"),
                    expected);

            for (int size : new int[] {1, 2, 3, 7, 16, 64}) {
                EventStreamParser chunked = new EventStreamParser(new ObjectMapper(), Clock.fixed(NOW, ZoneOffset.UTC));
                List<WorkerEvent> events = new ArrayList<>();
                for (int i = 0; i < STREAM.length(); i += size) {
                    events.addAll(chunked.feed(STREAM.substring(i, Math.min(STREAM.length(), i + size))));
                }
                chunked.flush().ifPresent(events::add);
                assertEquals(expected, types(events), "chunk size " + size);
            }
        }

        @Test
        @DisplayName("preserves multi-byte characters split across chunks")
        void multiByteText() {
            parser.feed("{\"type\":\"item.completed\",\"itemId\":\"m\",\"data\":{\"type\":\"agent_message\",\"text\":\"caf");
            List<WorkerEvent> events = parser.feed("é ✓\"}}\n");

            var completed = assertInstanceOf(WorkerEvent.ItemCompleted.class, events.get(0));
            assertEquals("café ✓", completed.item().text());
        }
    }

    @Nested
    @DisplayName("flush")
    class FlushTests {

        @Test
        @DisplayName("emits a complete record left without a trailing newline")
        void emitsCompleteRemainder() {
            assertTrue(parser.feed("{\"type\":\"turn.completed\",\"turnId\":\"t1\"}").isEmpty());

            Optional<WorkerEvent> event = parser.flush();

            assertTrue(event.isPresent());
            assertEquals(WorkerEvent.TURN_COMPLETED, event.get().type());
            assertEquals(0, parser.stats().bufferedChars());
        }

        @Test
        @DisplayName("discards an incomplete remainder")
        void discardsIncompleteRemainder() {
            parser.feed("{\"type\":\"turn.comp");

            assertTrue(parser.flush().isEmpty());
            assertEquals(0, parser.stats().bufferedChars());
            assertTrue(parser.flush().isEmpty());
        }

        @Test
        @DisplayName("reset clears buffer and counters")
        void resetClearsState() {
            parser.feed("noise\n{\"type\":");
            parser.reset();

            assertEquals(new EventStreamParser.ParserStats(0, 0, 0), parser.stats());
        }
    }

    private static List<String> types(List<WorkerEvent> events) {
        return events.stream().map(WorkerEvent::type).toList();
    }
}
