package com.agentrelay.core.process;

import java.util.Map;
import java.util.Optional;

/**
 * Recovers the terminating signal from a POSIX {@code 128 + n} exit status,
 * since {@link Process#exitValue()} does not report signals directly.
 */
final class Signals {

    private static final Map<Integer, String> NAMES = Map.ofEntries(
            Map.entry(1, "SIGHUP"),
            Map.entry(2, "SIGINT"),
            Map.entry(3, "SIGQUIT"),
            Map.entry(4, "SIGILL"),
            Map.entry(6, "SIGABRT"),
            Map.entry(8, "SIGFPE"),
            Map.entry(9, "SIGKILL"),
            Map.entry(11, "SIGSEGV"),
            Map.entry(13, "SIGPIPE"),
            Map.entry(14, "SIGALRM"),
            Map.entry(15, "SIGTERM"));

    private Signals() {}

    static Optional<String> fromExitStatus(int status) {
        if (status <= 128 || status > 128 + 64) {
            return Optional.empty();
        }
        int signal = status - 128;
        return Optional.of(NAMES.getOrDefault(signal, "SIG" + signal));
    }
}
