package com.agentrelay.core.model;

import java.util.Map;

/**
 * @param total    all tasks in the registry
 * @param byStatus counts keyed by status
 * @param byOrigin counts keyed by origin
 * @param running  tasks currently pending or working
 */
public record RegistryStats(
        long total,
        Map<TaskStatus, Long> byStatus,
        Map<TaskOrigin, Long> byOrigin,
        long running
) {}
