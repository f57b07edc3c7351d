package com.agentrelay.core.events;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;

import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.Optional;

/**
 * Maps a decoded JSON record onto the {@link WorkerEvent} variants.
 * <p>
 * The payload is read from {@code data}, falling back to {@code item}; identifiers are read
 * from the top-level {@code turnId}/{@code itemId} fields, falling back to the payload's {@code id}.
 */
public final class WorkerEventDecoder {

    private WorkerEventDecoder() {}

    /**
     * @return the event, or empty when the node is not an object with a textual {@code type}
     */
    public static Optional<WorkerEvent> decode(JsonNode node, Instant receivedAt) {
        if (node == null || !node.isObject()) {
            return Optional.empty();
        }
        JsonNode typeNode = node.get("type");
        if (typeNode == null || !typeNode.isTextual() || typeNode.asText().isBlank()) {
            return Optional.empty();
        }
        String type = typeNode.asText();
        Instant timestamp = timestamp(node, receivedAt);
        JsonNode data = payload(node);

        WorkerEvent event = switch (type) {
            case WorkerEvent.TURN_STARTED -> new WorkerEvent.TurnStarted(turnId(node, data), timestamp, node);
            case WorkerEvent.TURN_COMPLETED -> new WorkerEvent.TurnCompleted(
                    turnId(node, data), firstText(data, node, "summary"), usage(node, data), timestamp, node);
            case WorkerEvent.TURN_FAILED -> turnFailed(node, data, timestamp);
            case WorkerEvent.ITEM_STARTED -> new WorkerEvent.ItemStarted(
                    itemId(node, data), ItemPayload.from(data), timestamp, node);
            case WorkerEvent.ITEM_UPDATED -> new WorkerEvent.ItemUpdated(
                    itemId(node, data), ItemPayload.from(data), timestamp, node);
            case WorkerEvent.ITEM_COMPLETED -> new WorkerEvent.ItemCompleted(
                    itemId(node, data), ItemPayload.from(data), timestamp, node);
            default -> new WorkerEvent.Unknown(type, timestamp, node);
        };
        return Optional.of(event);
    }

    /**
     * @return the conversation id announced by a {@code thread.started} event, read from
     *         {@code thread_id} or {@code threadId} at the top level or in the payload
     */
    public static Optional<String> threadId(WorkerEvent event) {
        if (!(event instanceof WorkerEvent.Unknown unknown) || !WorkerEvent.THREAD_STARTED.equals(unknown.type())) {
            return Optional.empty();
        }
        JsonNode node = unknown.raw();
        JsonNode data = payload(node);
        String id = firstText(node, data, "thread_id");
        if (id == null) {
            id = firstText(node, data, "threadId");
        }
        return id == null || id.isBlank() ? Optional.empty() : Optional.of(id);
    }

    private static WorkerEvent.TurnFailed turnFailed(JsonNode node, JsonNode data, Instant timestamp) {
        JsonNode error = data.get("error");
        if (error == null || error.isNull()) {
            error = node.get("error");
        }
        String message = null;
        if (error != null && error.isObject()) {
            JsonNode msg = error.get("message");
            message = msg != null && !msg.isNull() ? msg.asText() : null;
        } else if (error != null && error.isTextual()) {
            message = error.asText();
        }
        if (message == null) {
            message = firstText(data, node, "message");
        }
        return new WorkerEvent.TurnFailed(turnId(node, data), message, error, timestamp, node);
    }

    private static JsonNode payload(JsonNode node) {
        JsonNode data = node.get("data");
        if (data != null && data.isObject()) {
            return data;
        }
        JsonNode item = node.get("item");
        if (item != null && item.isObject()) {
            return item;
        }
        return JsonNodeFactory.instance.objectNode();
    }

    private static String turnId(JsonNode node, JsonNode data) {
        String id = firstText(node, data, "turnId");
        if (id == null) {
            id = firstText(node, data, "turn_id");
        }
        return id != null ? id : firstText(data, data, "id");
    }

    private static String itemId(JsonNode node, JsonNode data) {
        String id = firstText(node, data, "itemId");
        if (id == null) {
            id = firstText(node, data, "item_id");
        }
        return id != null ? id : firstText(data, data, "id");
    }

    private static JsonNode usage(JsonNode node, JsonNode data) {
        JsonNode usage = node.get("usage");
        if (usage == null) {
            usage = data.get("usage");
        }
        return usage;
    }

    private static String firstText(JsonNode primary, JsonNode secondary, String field) {
        JsonNode value = primary.get(field);
        if (value == null || value.isNull()) {
            value = secondary.get(field);
        }
        return value != null && value.isValueNode() && !value.isNull() ? value.asText() : null;
    }

    private static Instant timestamp(JsonNode node, Instant fallback) {
        JsonNode ts = node.get("timestamp");
        if (ts == null || ts.isNull()) {
            return fallback;
        }
        if (ts.isNumber()) {
            return Instant.ofEpochMilli(ts.asLong());
        }
        try {
            return Instant.parse(ts.asText());
        } catch (DateTimeParseException e) {
            return fallback;
        }
    }
}
