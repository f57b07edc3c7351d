package com.agentrelay.core.process;

import com.agentrelay.core.events.WorkerEvent;
import com.agentrelay.core.watchdog.Heartbeat;
import com.agentrelay.core.watchdog.TimeoutWarning;

/**
 * Observer for a single execution. Called from I/O and timer threads; implementations must not block.
 */
public interface ExecutionListener {

    ExecutionListener NONE = new ExecutionListener() {};

    default void onSpawned(String processId, long pid) {}

    default void onEvent(WorkerEvent event) {}

    default void onWarning(TimeoutWarning warning) {}

    default void onHeartbeat(Heartbeat heartbeat) {}
}
