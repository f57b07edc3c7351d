package com.agentrelay.core.watchdog;

/**
 * Structured timeout outcome produced by the {@link TimeoutWatchdog}.
 *
 * @param kind           which timer fired
 * @param message        human-readable explanation including the configured limit
 * @param elapsedMs      wall-clock time since the watchdog started
 * @param idleMs         time since the last observed activity
 * @param partialResults what the unit produced before it was aborted
 */
public record TimeoutEnvelope(
        TimeoutKind kind,
        String message,
        long elapsedMs,
        long idleMs,
        PartialResults partialResults
) {

    public String code() {
        return kind.code();
    }
}
