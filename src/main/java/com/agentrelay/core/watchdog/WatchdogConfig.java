package com.agentrelay.core.watchdog;

import java.time.Duration;
import java.util.Objects;
import java.util.function.Consumer;

/**
 * Timer settings and callbacks for one {@link TimeoutWatchdog}.
 * <p>
 * Callbacks run on the watchdog scheduler thread and must not block.
 */
public record WatchdogConfig(
        Duration idleTimeout,
        Duration hardTimeout,
        Duration warnLead,
        Duration killGrace,
        Duration progressInterval,
        int maxEvents,
        int maxTailChars,
        Consumer<Heartbeat> onProgress,
        Consumer<TimeoutWarning> onWarning,
        Consumer<TimeoutEnvelope> onTimeout
) {

    public static final Duration DEFAULT_IDLE_TIMEOUT = Duration.ofMinutes(5);
    public static final Duration DEFAULT_HARD_TIMEOUT = Duration.ofMinutes(20);
    public static final Duration DEFAULT_WARN_LEAD = Duration.ofSeconds(30);
    public static final Duration DEFAULT_KILL_GRACE = Duration.ofSeconds(5);
    public static final Duration DEFAULT_PROGRESS_INTERVAL = Duration.ofSeconds(30);
    public static final int DEFAULT_MAX_EVENTS = 50;
    public static final int DEFAULT_MAX_TAIL_CHARS = 64 * 1024;

    public WatchdogConfig {
        requirePositive(idleTimeout, "idleTimeout");
        requirePositive(hardTimeout, "hardTimeout");
        requirePositive(progressInterval, "progressInterval");
        Objects.requireNonNull(warnLead, "warnLead must not be null");
        Objects.requireNonNull(killGrace, "killGrace must not be null");
        if (maxEvents <= 0 || maxTailChars <= 0) {
            throw new IllegalArgumentException("maxEvents and maxTailChars must be positive");
        }
        onProgress = onProgress != null ? onProgress : h -> {};
        onWarning = onWarning != null ? onWarning : w -> {};
        onTimeout = onTimeout != null ? onTimeout : t -> {};
    }

    public static WatchdogConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    private static void requirePositive(Duration value, String name) {
        if (value == null || value.isZero() || value.isNegative()) {
            throw new IllegalArgumentException(name + " must be a positive duration");
        }
    }

    public static final class Builder {
        private Duration idleTimeout = DEFAULT_IDLE_TIMEOUT;
        private Duration hardTimeout = DEFAULT_HARD_TIMEOUT;
        private Duration warnLead = DEFAULT_WARN_LEAD;
        private Duration killGrace = DEFAULT_KILL_GRACE;
        private Duration progressInterval = DEFAULT_PROGRESS_INTERVAL;
        private int maxEvents = DEFAULT_MAX_EVENTS;
        private int maxTailChars = DEFAULT_MAX_TAIL_CHARS;
        private Consumer<Heartbeat> onProgress;
        private Consumer<TimeoutWarning> onWarning;
        private Consumer<TimeoutEnvelope> onTimeout;

        private Builder() {}

        public Builder idleTimeout(Duration idleTimeout) { this.idleTimeout = idleTimeout; return this; }
        public Builder hardTimeout(Duration hardTimeout) { this.hardTimeout = hardTimeout; return this; }
        public Builder warnLead(Duration warnLead) { this.warnLead = warnLead; return this; }
        public Builder killGrace(Duration killGrace) { this.killGrace = killGrace; return this; }
        public Builder progressInterval(Duration progressInterval) { this.progressInterval = progressInterval; return this; }
        public Builder maxEvents(int maxEvents) { this.maxEvents = maxEvents; return this; }
        public Builder maxTailChars(int maxTailChars) { this.maxTailChars = maxTailChars; return this; }
        public Builder onProgress(Consumer<Heartbeat> onProgress) { this.onProgress = onProgress; return this; }
        public Builder onWarning(Consumer<TimeoutWarning> onWarning) { this.onWarning = onWarning; return this; }
        public Builder onTimeout(Consumer<TimeoutEnvelope> onTimeout) { this.onTimeout = onTimeout; return this; }

        public WatchdogConfig build() {
            return new WatchdogConfig(idleTimeout, hardTimeout, warnLead, killGrace, progressInterval,
                    maxEvents, maxTailChars, onProgress, onWarning, onTimeout);
        }
    }
}
