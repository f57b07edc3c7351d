package com.agentrelay.core.registry;

import com.agentrelay.config.RelayProperties;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Keeps the registry free of abandoned work: reclaims stuck tasks once at startup, then
 * periodically reclaims and prunes.
 */
@Component
public class RegistryMaintenance {

    private static final Logger log = LoggerFactory.getLogger(RegistryMaintenance.class);

    private final TaskRegistry registry;
    private final RelayProperties.Registry settings;

    private final ScheduledExecutorService scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
        Thread t = new Thread(r, "registry-maintenance");
        t.setDaemon(true);
        return t;
    });

    public RegistryMaintenance(TaskRegistry registry, RelayProperties properties) {
        this.registry = registry;
        this.settings = properties.getRegistry();
    }

    @PostConstruct
    void start() {
        if (!settings.isMaintenanceEnabled()) {
            log.info("Registry maintenance disabled");
            return;
        }
        int reclaimed = registry.reclaimStuck(settings.getStuckMaxAgeSeconds());
        if (reclaimed > 0) {
            log.info("Startup recovery reclaimed {} stuck task(s)", reclaimed);
        }
        long intervalMs = settings.getMaintenanceInterval().toMillis();
        scheduler.scheduleWithFixedDelay(this::runOnce, intervalMs, intervalMs, TimeUnit.MILLISECONDS);
        log.info("Registry maintenance scheduled every {}", settings.getMaintenanceInterval());
    }

    /**
     * One maintenance pass: reclaim, then prune.
     */
    void runOnce() {
        try {
            int reclaimed = registry.reclaimStuck(settings.getStuckMaxAgeSeconds());
            Duration pruneAge = settings.getPruneMaxAge();
            int pruned = registry.pruneOld(pruneAge);
            log.debug("Maintenance pass: reclaimed={}, pruned={}", reclaimed, pruned);
        } catch (RuntimeException e) {
            // a thrown exception would cancel the periodic schedule
            log.error("Registry maintenance pass failed", e);
        }
    }

    @PreDestroy
    void stop() {
        scheduler.shutdown();
        try {
            if (!scheduler.awaitTermination(5, TimeUnit.SECONDS)) {
                scheduler.shutdownNow();
            }
        } catch (InterruptedException e) {
            scheduler.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
