package com.agentrelay.core.events;

import com.fasterxml.jackson.databind.JsonNode;

import java.time.Instant;

/**
 * One typed record from the worker's JSONL output stream.
 * <p>
 * Each known {@code type} tag maps to its own record with a typed payload. Tags this
 * version does not know about (for example {@code thread.started}) are kept as
 * {@link Unknown} so that newer workers never break the stream.
 */
public sealed interface WorkerEvent permits
        WorkerEvent.TurnStarted,
        WorkerEvent.TurnCompleted,
        WorkerEvent.TurnFailed,
        WorkerEvent.ItemStarted,
        WorkerEvent.ItemUpdated,
        WorkerEvent.ItemCompleted,
        WorkerEvent.Unknown {

    String TURN_STARTED = "turn.started";
    String TURN_COMPLETED = "turn.completed";
    String TURN_FAILED = "turn.failed";
    String ITEM_STARTED = "item.started";
    String ITEM_UPDATED = "item.updated";
    String ITEM_COMPLETED = "item.completed";
    /** Announces the worker's conversation id; decoded as {@link Unknown}. */
    String THREAD_STARTED = "thread.started";

    /** The wire {@code type} discriminator. */
    String type();

    /** When the event happened, or when it was received if the worker sent no timestamp. */
    Instant timestamp();

    /** The decoded JSON record as received. */
    JsonNode raw();

    /** Events that belong to a turn. */
    interface TurnEvent {
        String turnId();
    }

    /** Events that describe a work item. */
    interface ItemEvent {
        String itemId();

        ItemPayload item();
    }

    record TurnStarted(String turnId, Instant timestamp, JsonNode raw) implements WorkerEvent, TurnEvent {
        @Override
        public String type() {
            return TURN_STARTED;
        }
    }

    /**
     * @param summary optional summary text the worker attached to the completed turn
     * @param usage   token usage block, if reported
     */
    record TurnCompleted(String turnId, String summary, JsonNode usage, Instant timestamp, JsonNode raw)
            implements WorkerEvent, TurnEvent {
        @Override
        public String type() {
            return TURN_COMPLETED;
        }
    }

    /**
     * @param errorMessage the worker's own error message, if any
     * @param error        the full error object as sent
     */
    record TurnFailed(String turnId, String errorMessage, JsonNode error, Instant timestamp, JsonNode raw)
            implements WorkerEvent, TurnEvent {
        @Override
        public String type() {
            return TURN_FAILED;
        }
    }

    record ItemStarted(String itemId, ItemPayload item, Instant timestamp, JsonNode raw)
            implements WorkerEvent, ItemEvent {
        @Override
        public String type() {
            return ITEM_STARTED;
        }
    }

    record ItemUpdated(String itemId, ItemPayload item, Instant timestamp, JsonNode raw)
            implements WorkerEvent, ItemEvent {
        @Override
        public String type() {
            return ITEM_UPDATED;
        }
    }

    record ItemCompleted(String itemId, ItemPayload item, Instant timestamp, JsonNode raw)
            implements WorkerEvent, ItemEvent {
        @Override
        public String type() {
            return ITEM_COMPLETED;
        }
    }

    record Unknown(String type, Instant timestamp, JsonNode raw) implements WorkerEvent {}
}
