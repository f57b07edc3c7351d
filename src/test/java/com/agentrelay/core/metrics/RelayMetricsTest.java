package com.agentrelay.core.metrics;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class RelayMetricsTest {

    private SimpleMeterRegistry registry;
    private RelayMetrics metrics;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        metrics = new RelayMetrics(registry);
    }

    @Test
    @DisplayName("recordExecution creates a timer tagged by outcome")
    void recordExecution() {
        metrics.recordExecution("exit_zero", 1500);
        metrics.recordExecution("exit_zero", 500);
        metrics.recordExecution("timeout", 100);

        var ok = registry.find("agentrelay.execution.duration").tag("outcome", "exit_zero").timer();
        assertNotNull(ok);
        assertEquals(2, ok.count());
        assertEquals(2000.0, ok.totalTime(TimeUnit.MILLISECONDS));
        assertEquals(1, registry.find("agentrelay.execution.duration").tag("outcome", "timeout").timer().count());
    }

    @Test
    @DisplayName("recordTimeout increments the counter for its kind")
    void recordTimeout() {
        metrics.recordTimeout("inactivity");
        metrics.recordTimeout("inactivity");
        metrics.recordTimeout("hard");

        assertEquals(2.0, registry.find("agentrelay.watchdog.timeouts").tag("kind", "inactivity").counter().count());
        assertEquals(1.0, registry.find("agentrelay.watchdog.timeouts").tag("kind", "hard").counter().count());
    }

    @Test
    @DisplayName("recordTaskOutcome records by status tag")
    void recordTaskOutcome() {
        metrics.recordTaskOutcome("completed");
        metrics.recordTaskOutcome("failed");
        metrics.recordTaskOutcome("completed");

        assertEquals(2.0, registry.find("agentrelay.tasks.total").tag("status", "completed").counter().count());
        assertEquals(1.0, registry.find("agentrelay.tasks.total").tag("status", "failed").counter().count());
    }

    @Test
    @DisplayName("recordEventsPerExecution feeds a distribution summary")
    void recordEventsPerExecution() {
        metrics.recordEventsPerExecution(12);
        metrics.recordEventsPerExecution(4);

        var summary = registry.find("agentrelay.execution.events").summary();
        assertNotNull(summary);
        assertEquals(2, summary.count());
        assertEquals(12.0, summary.max());
    }

    @Test
    @DisplayName("registry counters accumulate batch sizes")
    void registryCounters() {
        metrics.recordReclaimed(3);
        metrics.recordPruned(5);
        metrics.recordPruned(1);
        metrics.recordRegistryWriteFailure("updateTask");

        assertEquals(3.0, registry.find("agentrelay.registry.reclaimed").counter().count());
        assertEquals(6.0, registry.find("agentrelay.registry.pruned").counter().count());
        assertEquals(1.0, registry.find("agentrelay.registry.write_failures")
                .tag("operation", "updateTask").counter().count());
    }

    @Test
    @DisplayName("spawn failures and queue waits are recorded")
    void spawnAndQueue() {
        metrics.recordSpawnFailure();
        metrics.recordQueueWait(250);

        assertEquals(1.0, registry.find("agentrelay.process.spawn_failures").counter().count());
        assertEquals(1, registry.find("agentrelay.queue.wait").timer().count());
    }
}
