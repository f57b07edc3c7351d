package com.agentrelay.core.progress;

import com.agentrelay.core.events.ItemKind;
import com.agentrelay.core.events.ItemPayload;
import com.agentrelay.core.events.WorkerEvent;
import com.agentrelay.core.progress.ProgressStep.StepStatus;
import com.agentrelay.core.progress.ProgressStep.StepType;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Derives a human-meaningful progress summary from the worker's event stream.
 * <p>
 * Total steps is the number of distinct turns and items seen so far, not a known-in-advance
 * total, so the percentage is an approximation while work is in flight. In-flight steps count
 * as half done, and the reported percentage never drops below the highest value reached after
 * any earlier event. Once a turn completes or fails the summary always reads 100%.
 * <p>
 * Thread-safe; one instance per task. Call {@link #reset()} before reusing it for another task.
 */
public class ProgressInferenceEngine {

    static final double IN_FLIGHT_CREDIT = 0.5;
    static final int MAX_REPORTED_STEPS = 25;

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final Map<String, StepRecord> turns = new LinkedHashMap<>();
    private final Map<String, StepRecord> items = new LinkedHashMap<>();
    private long sequence;
    private int filesChanged;
    private int commandsExecuted;
    private boolean complete;
    private boolean failed;
    private int highWater;

    /**
     * Computes the summary for a complete event list in one go.
     */
    public static ProgressSummary infer(List<WorkerEvent> events) {
        ProgressInferenceEngine engine = new ProgressInferenceEngine();
        events.forEach(engine::processEvent);
        return engine.getProgress();
    }

    public synchronized void processEvent(WorkerEvent event) {
        if (event instanceof WorkerEvent.TurnStarted e) {
            startStep(turns, key(e.turnId(), "turn"), StepType.TURN, null,
                    "Processing turn " + key(e.turnId(), "turn"), e.timestamp(), null);
        } else if (event instanceof WorkerEvent.TurnCompleted e) {
            finishStep(turns, key(e.turnId(), "turn"), StepType.TURN, StepStatus.COMPLETED, e.timestamp());
            complete = true;
        } else if (event instanceof WorkerEvent.TurnFailed e) {
            StepRecord step = finishStep(turns, key(e.turnId(), "turn"), StepType.TURN, StepStatus.FAILED, e.timestamp());
            if (e.errorMessage() != null) {
                step.details.put("error", e.errorMessage());
            }
            failed = true;
            complete = true;
        } else if (event instanceof WorkerEvent.ItemStarted e) {
            startStep(items, key(e.itemId(), "item"), StepType.ITEM, e.item().kind(),
                    describe(e.item()), e.timestamp(), e.item().data());
        } else if (event instanceof WorkerEvent.ItemUpdated e) {
            StepRecord step = items.get(key(e.itemId(), "item"));
            if (step != null) {
                mergeDetails(step, e.item().data());
            }
        } else if (event instanceof WorkerEvent.ItemCompleted e) {
            completeItem(e);
        }
        // Unknown events do not affect progress
        highWater = Math.max(highWater, rawPercentage());
    }

    public synchronized ProgressSummary getProgress() {
        List<StepRecord> all = new ArrayList<>(turns.size() + items.size());
        all.addAll(turns.values());
        all.addAll(items.values());
        all.sort(Comparator.comparingLong(s -> s.sequence));

        int total = all.size();
        int completed = 0;
        int inFlight = 0;
        StepRecord current = null;
        for (StepRecord step : all) {
            if (step.status == StepStatus.STARTED) {
                inFlight++;
                if (current == null || !step.startedAt.isBefore(current.startedAt)) {
                    current = step;
                }
            } else {
                completed++;
            }
        }

        int percentage = Math.max(highWater, percentage(completed, inFlight, total));
        String currentAction = current != null ? current.description : null;
        if (complete) {
            completed = total;
            percentage = 100;
            currentAction = null;
        }

        List<ProgressStep> recent = all.subList(Math.max(0, all.size() - MAX_REPORTED_STEPS), all.size())
                .stream()
                .map(StepRecord::snapshot)
                .toList();

        return new ProgressSummary(currentAction, completed, total, Math.min(percentage, 100),
                filesChanged, commandsExecuted, complete, failed, recent);
    }

    public synchronized void reset() {
        turns.clear();
        items.clear();
        sequence = 0;
        filesChanged = 0;
        commandsExecuted = 0;
        complete = false;
        failed = false;
        highWater = 0;
    }

    // ── Helpers ───────────────────────────────────────────────────────────

    private int rawPercentage() {
        int inFlight = 0;
        for (StepRecord step : turns.values()) {
            if (step.status == StepStatus.STARTED) {
                inFlight++;
            }
        }
        for (StepRecord step : items.values()) {
            if (step.status == StepStatus.STARTED) {
                inFlight++;
            }
        }
        int total = turns.size() + items.size();
        return percentage(total - inFlight, inFlight, total);
    }

    private static int percentage(int completed, int inFlight, int total) {
        return (int) Math.round(100.0 * (completed + IN_FLIGHT_CREDIT * inFlight) / Math.max(total, 1));
    }

    private void completeItem(WorkerEvent.ItemCompleted e) {
        String id = key(e.itemId(), "item");
        StepRecord step = items.get(id);
        if (step == null) {
            // Items may complete without a preceding start event
            step = startStep(items, id, StepType.ITEM, e.item().kind(), describe(e.item()), e.timestamp(), null);
        }
        mergeDetails(step, e.item().data());
        if (step.kind == null || step.kind == ItemKind.OTHER) {
            step.kind = e.item().kind();
        }
        if (step.status == StepStatus.STARTED) {
            step.status = StepStatus.COMPLETED;
            step.completedAt = e.timestamp();
            if (step.kind == ItemKind.FILE_CHANGE) {
                filesChanged++;
            } else if (step.kind == ItemKind.COMMAND_EXECUTION) {
                commandsExecuted++;
            }
        }
    }

    private StepRecord startStep(Map<String, StepRecord> map, String id, StepType type, ItemKind kind,
                                 String description, Instant at, JsonNode data) {
        StepRecord existing = map.get(id);
        if (existing != null) {
            mergeDetails(existing, data);
            return existing;
        }
        StepRecord step = new StepRecord(id, type, kind, description, at, sequence++);
        mergeDetails(step, data);
        map.put(id, step);
        return step;
    }

    private StepRecord finishStep(Map<String, StepRecord> map, String id, StepType type,
                                  StepStatus status, Instant at) {
        StepRecord step = map.get(id);
        if (step == null) {
            step = startStep(map, id, type, null, "Processing turn " + id, at, null);
        }
        if (step.status == StepStatus.STARTED) {
            step.status = status;
            step.completedAt = at;
        }
        return step;
    }

    @SuppressWarnings("unchecked")
    private static void mergeDetails(StepRecord step, JsonNode data) {
        if (data != null && data.isObject() && !data.isEmpty()) {
            step.details.putAll(MAPPER.convertValue(data, Map.class));
        }
    }

    static String describe(ItemPayload item) {
        if (item.kind() == ItemKind.FILE_CHANGE && item.path() != null) {
            return "Editing " + item.path();
        }
        if (item.kind() == ItemKind.COMMAND_EXECUTION && item.command() != null) {
            return "Running command: " + item.command();
        }
        if (item.kind() == ItemKind.AGENT_MESSAGE) {
            return "Composing response";
        }
        if (item.description() != null) {
            return item.description();
        }
        String kindName = item.kindName() != null ? item.kindName() : "item";
        return "Started " + kindName;
    }

    private static String key(String id, String fallback) {
        return id != null ? id : fallback;
    }

    private static final class StepRecord {
        final String id;
        final StepType type;
        ItemKind kind;
        final String description;
        final Instant startedAt;
        final long sequence;
        final Map<String, Object> details = new LinkedHashMap<>();
        StepStatus status = StepStatus.STARTED;
        Instant completedAt;

        StepRecord(String id, StepType type, ItemKind kind, String description, Instant startedAt, long sequence) {
            this.id = id;
            this.type = type;
            this.kind = kind;
            this.description = description;
            this.startedAt = startedAt;
            this.sequence = sequence;
        }

        ProgressStep snapshot() {
            return new ProgressStep(id, type, kind, description, status, startedAt, completedAt,
                    Collections.unmodifiableMap(new LinkedHashMap<>(details)));
        }
    }
}
