package com.agentrelay.core.events;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectReader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Incremental parser for the worker's newline-delimited JSON output.
 * <p>
 * Chunks may split records anywhere; the incomplete tail is buffered until the next
 * {@link #feed(String)}. Lines that are not JSON objects with a {@code type} are treated as
 * interleaved diagnostic text and dropped. Nothing here ever throws on malformed input.
 * <p>
 * Not shared between streams: use one instance per process.
 */
public class EventStreamParser {

    private static final Logger log = LoggerFactory.getLogger(EventStreamParser.class);

    private final ObjectReader reader;
    private final Clock clock;
    private final StringBuilder buffer = new StringBuilder();
    private long linesProcessed;
    private long parseErrors;

    public EventStreamParser() {
        this(new ObjectMapper(), Clock.systemUTC());
    }

    public EventStreamParser(ObjectMapper objectMapper, Clock clock) {
        this.reader = objectMapper.reader().with(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);
        this.clock = clock;
    }

    /**
     * Appends a chunk and returns every event completed by it, in arrival order.
     */
    public synchronized List<WorkerEvent> feed(String chunk) {
        if (chunk == null || chunk.isEmpty()) {
            return List.of();
        }
        buffer.append(chunk);

        List<WorkerEvent> events = new ArrayList<>();
        int start = 0;
        int newline;
        while ((newline = buffer.indexOf("\n", start)) >= 0) {
            String line = buffer.substring(start, newline);
            start = newline + 1;
            parseLine(line).ifPresent(events::add);
        }
        buffer.delete(0, start);
        return events;
    }

    /**
     * Ends the stream. A buffered remainder is only emitted if it is already a complete record;
     * anything else is discarded.
     */
    public synchronized Optional<WorkerEvent> flush() {
        if (buffer.length() == 0) {
            return Optional.empty();
        }
        String remainder = buffer.toString();
        buffer.setLength(0);
        Optional<WorkerEvent> event = parseLine(remainder);
        if (event.isEmpty() && !remainder.isBlank()) {
            log.debug("Discarded incomplete trailing line ({} chars) at end of stream", remainder.length());
        }
        return event;
    }

    public synchronized ParserStats stats() {
        return new ParserStats(linesProcessed, parseErrors, buffer.length());
    }

    public synchronized void reset() {
        buffer.setLength(0);
        linesProcessed = 0;
        parseErrors = 0;
    }

    private Optional<WorkerEvent> parseLine(String rawLine) {
        String line = rawLine.strip();
        if (line.isEmpty()) {
            return Optional.empty();
        }
        linesProcessed++;
        try {
            JsonNode node = reader.readTree(line);
            Optional<WorkerEvent> event = WorkerEventDecoder.decode(node, clock.instant());
            if (event.isEmpty()) {
                parseErrors++;
                log.trace("Ignoring JSON line without event type: {}", abbreviate(line));
            }
            return event;
        } catch (JsonProcessingException e) {
            parseErrors++;
            log.trace("Ignoring non-JSON line: {}", abbreviate(line));
            return Optional.empty();
        }
    }

    private static String abbreviate(String line) {
        return line.length() <= 120 ? line : line.substring(0, 117) + "...";
    }

    /**
     * Counters for diagnostics.
     *
     * @param linesProcessed non-blank lines seen
     * @param parseErrors    lines dropped as noise
     * @param bufferedChars  size of the incomplete trailing line currently held
     */
    public record ParserStats(long linesProcessed, long parseErrors, int bufferedChars) {}
}
