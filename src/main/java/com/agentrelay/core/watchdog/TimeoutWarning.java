package com.agentrelay.core.watchdog;

/**
 * Issued once per deadline, shortly before the watchdog aborts the unit.
 *
 * @param id          identifier of the monitored unit
 * @param kind        the deadline that is approaching
 * @param elapsedMs   wall-clock time since start
 * @param remainingMs time left before the timeout fires, assuming no further activity
 */
public record TimeoutWarning(String id, TimeoutKind kind, long elapsedMs, long remainingMs) {}
