package com.agentrelay.core.watchdog;

import com.agentrelay.core.events.WorkerEvent;

import java.time.Instant;
import java.util.List;

/**
 * Bounded tail of what a monitored unit produced before it was aborted.
 *
 * @param lastEvents     the most recent events, oldest first
 * @param totalEvents    number of events observed over the whole run
 * @param stdoutTail     tail of standard output
 * @param stderrTail     tail of standard error
 * @param lastActivityAt time of the last observed output or event
 */
public record PartialResults(
        List<WorkerEvent> lastEvents,
        int totalEvents,
        String stdoutTail,
        String stderrTail,
        Instant lastActivityAt
) {

    public PartialResults {
        lastEvents = lastEvents == null ? List.of() : List.copyOf(lastEvents);
        stdoutTail = stdoutTail == null ? "" : stdoutTail;
        stderrTail = stderrTail == null ? "" : stderrTail;
    }
}
