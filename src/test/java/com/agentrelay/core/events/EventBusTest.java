package com.agentrelay.core.events;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for {@link EventBus}.
 */
class EventBusTest {

    private EventBus eventBus;

    @BeforeEach
    void setUp() {
        eventBus = new EventBus();
    }

    private static RelayEvent event(String type, String taskId) {
        return new RelayEvent(type, taskId, null, Map.of(), Instant.now());
    }

    @Nested
    @DisplayName("subscribe and publish")
    class SubscribeAndPublishTests {

        @Test
        @DisplayName("delivers event to task subscriber")
        void deliversEventToTaskSubscriber() {
            List<RelayEvent> received = new ArrayList<>();
            eventBus.subscribe("local-1", received::add);

            var event = event("task.started", "local-1");
            eventBus.publish(event);

            assertEquals(1, received.size());
            assertEquals(event, received.get(0));
        }

        @Test
        @DisplayName("does not deliver event to subscribers of a different task")
        void doesNotDeliverToDifferentTask() {
            List<RelayEvent> received = new ArrayList<>();
            eventBus.subscribe("local-2", received::add);

            eventBus.publish(event("task.started", "local-1"));

            assertTrue(received.isEmpty());
        }

        @Test
        @DisplayName("delivers multiple events in order")
        void deliversMultipleEventsInOrder() {
            List<RelayEvent> received = new ArrayList<>();
            eventBus.subscribe("local-1", received::add);

            eventBus.publish(event("task.queued", "local-1"));
            eventBus.publish(event("task.started", "local-1"));
            eventBus.publish(event("task.completed", "local-1"));

            assertEquals(List.of("task.queued", "task.started", "task.completed"),
                    received.stream().map(RelayEvent::eventType).toList());
        }
    }

    @Nested
    @DisplayName("unsubscribe")
    class UnsubscribeTests {

        @Test
        @DisplayName("unsubscribing stops delivery of future events")
        void unsubscribeStopsDelivery() {
            List<RelayEvent> received = new ArrayList<>();
            EventBus.Subscription subscription = eventBus.subscribe("local-1", received::add);

            eventBus.publish(event("task.started", "local-1"));
            subscription.unsubscribe();
            eventBus.publish(event("task.completed", "local-1"));

            assertEquals(1, received.size());
        }

        @Test
        @DisplayName("other observers of the task keep receiving after one unsubscribes")
        void otherObserversUnaffected() {
            List<RelayEvent> first = new ArrayList<>();
            List<RelayEvent> second = new ArrayList<>();
            EventBus.Subscription subscription = eventBus.subscribe("local-1", first::add);
            eventBus.subscribe("local-1", second::add);

            subscription.unsubscribe();
            subscription.unsubscribe();
            eventBus.publish(event("task.completed", "local-1"));

            assertTrue(first.isEmpty());
            assertEquals(1, second.size());
        }

        @Test
        @DisplayName("a task can be observed again after its last observer left")
        void resubscribeAfterLastObserverLeft() {
            List<RelayEvent> received = new ArrayList<>();
            eventBus.subscribe("local-1", e -> {}).unsubscribe();

            eventBus.subscribe("local-1", received::add);
            eventBus.publish(event("task.started", "local-1"));

            assertEquals(1, received.size());
        }

        @Test
        @DisplayName("publishing to an unobserved task is a no-op")
        void unobservedTask() {
            assertDoesNotThrow(() -> eventBus.publish(event("task.started", "local-9")));
        }
    }

    @Nested
    @DisplayName("robustness")
    class RobustnessTests {

        @Test
        @DisplayName("subscriber exception does not prevent delivery to other subscribers")
        void subscriberExceptionDoesNotPreventOthers() {
            List<RelayEvent> received = new ArrayList<>();
            eventBus.subscribe("local-1", e -> {
                throw new RuntimeException("boom");
            });
            eventBus.subscribe("local-1", received::add);

            assertDoesNotThrow(() -> eventBus.publish(event("task.started", "local-1")));
            assertEquals(1, received.size());
        }

        @Test
        @DisplayName("handles concurrent publishes safely")
        void handlesConcurrentPublishes() throws InterruptedException {
            CopyOnWriteArrayList<RelayEvent> received = new CopyOnWriteArrayList<>();
            eventBus.subscribe("local-1", received::add);

            int threadCount = 8;
            int eventsPerThread = 100;
            CountDownLatch latch = new CountDownLatch(threadCount);
            for (int t = 0; t < threadCount; t++) {
                new Thread(() -> {
                    for (int i = 0; i < eventsPerThread; i++) {
                        eventBus.publish(event("task.progress", "local-1"));
                    }
                    latch.countDown();
                }).start();
            }

            assertTrue(latch.await(10, TimeUnit.SECONDS));
            assertEquals(threadCount * eventsPerThread, received.size());
        }
    }
}
