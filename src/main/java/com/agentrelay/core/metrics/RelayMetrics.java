package com.agentrelay.core.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Service;

import java.time.Duration;

/**
 * Centralised Micrometer metrics for worker execution and the task registry.
 */
@Service
public class RelayMetrics {

    private final MeterRegistry registry;

    public RelayMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordExecution(String outcome, long ms) {
        Timer.builder("agentrelay.execution.duration")
                .tag("outcome", outcome)
                .register(registry)
                .record(Duration.ofMillis(ms));
    }

    public void recordQueueWait(long ms) {
        Timer.builder("agentrelay.queue.wait")
                .description("Time a job spent waiting for a free worker slot")
                .register(registry)
                .record(Duration.ofMillis(ms));
    }

    public void recordTimeout(String kind) {
        Counter.builder("agentrelay.watchdog.timeouts")
                .tag("kind", kind)
                .register(registry)
                .increment();
    }

    public void recordSpawnFailure() {
        Counter.builder("agentrelay.process.spawn_failures")
                .register(registry)
                .increment();
    }

    public void recordEventsPerExecution(int events) {
        DistributionSummary.builder("agentrelay.execution.events")
                .description("Parsed worker events per execution")
                .register(registry)
                .record(events);
    }

    public void recordTaskOutcome(String status) {
        Counter.builder("agentrelay.tasks.total")
                .tag("status", status)
                .register(registry)
                .increment();
    }

    // --- Registry health ---

    /**
     * Records a registry write that failed even after its retry.
     *
     * @param operation the registry operation, e.g. "updateTask"
     */
    public void recordRegistryWriteFailure(String operation) {
        Counter.builder("agentrelay.registry.write_failures")
                .description("Registry writes that failed after retry")
                .tag("operation", operation)
                .register(registry)
                .increment();
    }

    public void recordReclaimed(int count) {
        Counter.builder("agentrelay.registry.reclaimed")
                .description("Stuck tasks transitioned to failed by maintenance")
                .register(registry)
                .increment(count);
    }

    public void recordPruned(int count) {
        Counter.builder("agentrelay.registry.pruned")
                .description("Terminal tasks deleted by age")
                .register(registry)
                .increment(count);
    }
}
