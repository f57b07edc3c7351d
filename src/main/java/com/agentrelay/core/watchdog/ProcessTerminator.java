package com.agentrelay.core.watchdog;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Graceful-then-forceful termination shared by timeouts and explicit cancellation.
 */
public final class ProcessTerminator {

    private static final Logger log = LoggerFactory.getLogger(ProcessTerminator.class);

    private ProcessTerminator() {}

    /**
     * Requests a graceful stop and schedules a forced kill if the unit is still alive after {@code grace}.
     */
    public static void terminate(String id, MonitoredProcess process, Duration grace,
                                 ScheduledExecutorService scheduler) {
        if (!process.isAlive()) {
            return;
        }
        log.info("Terminating {} (grace period {}ms)", id, grace.toMillis());
        process.terminate();
        try {
            scheduler.schedule(() -> forceKillIfAlive(id, process), grace.toMillis(), TimeUnit.MILLISECONDS);
        } catch (RejectedExecutionException e) {
            // scheduler already shut down
            forceKillIfAlive(id, process);
        }
    }

    private static void forceKillIfAlive(String id, MonitoredProcess process) {
        if (process.isAlive()) {
            log.warn("{} still alive after graceful termination; sending SIGKILL", id);
            process.forceKill();
        }
    }
}
