package com.agentrelay.core.events;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * In-memory bus delivering each task's lifecycle events to the observers of that task.
 * <p>
 * Events are delivered on the publishing thread in publish order. An observer that throws is
 * logged and skipped; the publisher and the other observers are unaffected.
 */
@Service
public class EventBus {

    private static final Logger log = LoggerFactory.getLogger(EventBus.class);

    private final ConcurrentHashMap<String, List<Consumer<RelayEvent>>> observers = new ConcurrentHashMap<>();

    public void publish(RelayEvent event) {
        List<Consumer<RelayEvent>> targets = observers.get(event.taskId());
        if (targets == null) {
            log.trace("No observers for {} of task {}", event.eventType(), event.taskId());
            return;
        }
        for (Consumer<RelayEvent> observer : targets) {
            deliver(observer, event);
        }
    }

    /**
     * Observes the events of one task until the returned handle is released.
     */
    public Subscription subscribe(String taskId, Consumer<RelayEvent> observer) {
        observers.compute(taskId, (k, list) -> {
            List<Consumer<RelayEvent>> targets = list != null ? list : new CopyOnWriteArrayList<>();
            targets.add(observer);
            return targets;
        });
        log.debug("Observing task {}", taskId);
        return () -> observers.computeIfPresent(taskId, (k, list) -> {
            list.remove(observer);
            return list.isEmpty() ? null : list;
        });
    }

    @FunctionalInterface
    public interface Subscription {
        void unsubscribe();
    }

    private void deliver(Consumer<RelayEvent> observer, RelayEvent event) {
        try {
            observer.accept(event);
        } catch (RuntimeException e) {
            log.warn("Observer of task {} failed on {}: {}", event.taskId(), event.eventType(), e.getMessage(), e);
        }
    }
}
