package com.agentrelay.core.watchdog;

/**
 * Periodic liveness report, independent of the timeout timers.
 *
 * @param id          identifier of the monitored unit
 * @param elapsedMs   wall-clock time since start
 * @param idleMs      time since the last observed activity
 * @param eventsCount events observed so far
 */
public record Heartbeat(String id, long elapsedMs, long idleMs, int eventsCount) {}
