package com.agentrelay.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

@Component
@ConfigurationProperties(prefix = "agentrelay")
public class RelayProperties {

    private Worker worker = new Worker();
    private Queue queue = new Queue();
    private Watchdog watchdog = new Watchdog();
    private Registry registry = new Registry();

    // -- Delegate accessors --
    public String getWorkerBinary() { return worker.binary; }
    public int getMaxConcurrency() { return queue.maxConcurrency; }
    public Path getRegistryPath() { return Path.of(registry.path); }

    public Worker getWorker() { return worker; }
    public void setWorker(Worker worker) { this.worker = worker; }
    public Queue getQueue() { return queue; }
    public void setQueue(Queue queue) { this.queue = queue; }
    public Watchdog getWatchdog() { return watchdog; }
    public void setWatchdog(Watchdog watchdog) { this.watchdog = watchdog; }
    public Registry getRegistry() { return registry; }
    public void setRegistry(Registry registry) { this.registry = registry; }

    public static class Worker {
        private String binary = "codex";
        private String defaultMode = "read-only";
        private String defaultModel;
        private boolean skipGitRepoCheck = false;
        /** Variables every worker receives regardless of env policy. */
        private List<String> passthroughEnv = new ArrayList<>(List.of(
                "PATH", "HOME", "USER", "LANG", "TMPDIR", "CODEX_HOME", "CODEX_API_KEY", "OPENAI_API_KEY"));
        private int maxCapturedOutputChars = 1024 * 1024;
        private int progressPersistEvery = 10;

        public String getBinary() { return binary; }
        public void setBinary(String binary) { this.binary = binary; }
        public String getDefaultMode() { return defaultMode; }
        public void setDefaultMode(String defaultMode) { this.defaultMode = defaultMode; }
        public String getDefaultModel() { return defaultModel; }
        public void setDefaultModel(String defaultModel) { this.defaultModel = defaultModel; }
        public boolean isSkipGitRepoCheck() { return skipGitRepoCheck; }
        public void setSkipGitRepoCheck(boolean skipGitRepoCheck) { this.skipGitRepoCheck = skipGitRepoCheck; }
        public List<String> getPassthroughEnv() { return passthroughEnv; }
        public void setPassthroughEnv(List<String> passthroughEnv) { this.passthroughEnv = passthroughEnv; }
        public int getMaxCapturedOutputChars() { return maxCapturedOutputChars; }
        public void setMaxCapturedOutputChars(int maxCapturedOutputChars) { this.maxCapturedOutputChars = maxCapturedOutputChars; }
        public int getProgressPersistEvery() { return progressPersistEvery; }
        public void setProgressPersistEvery(int progressPersistEvery) { this.progressPersistEvery = progressPersistEvery; }
    }

    public static class Queue {
        private int maxConcurrency = 2;

        public int getMaxConcurrency() { return maxConcurrency; }
        public void setMaxConcurrency(int maxConcurrency) { this.maxConcurrency = maxConcurrency; }
    }

    public static class Watchdog {
        private Duration idleTimeout = Duration.ofMinutes(5);
        private Duration hardTimeout = Duration.ofMinutes(20);
        private Duration warnLead = Duration.ofSeconds(30);
        private Duration killGrace = Duration.ofSeconds(5);
        private Duration progressInterval = Duration.ofSeconds(30);
        private int maxEvents = 50;
        private int maxTailChars = 64 * 1024;

        public Duration getIdleTimeout() { return idleTimeout; }
        public void setIdleTimeout(Duration idleTimeout) { this.idleTimeout = idleTimeout; }
        public Duration getHardTimeout() { return hardTimeout; }
        public void setHardTimeout(Duration hardTimeout) { this.hardTimeout = hardTimeout; }
        public Duration getWarnLead() { return warnLead; }
        public void setWarnLead(Duration warnLead) { this.warnLead = warnLead; }
        public Duration getKillGrace() { return killGrace; }
        public void setKillGrace(Duration killGrace) { this.killGrace = killGrace; }
        public Duration getProgressInterval() { return progressInterval; }
        public void setProgressInterval(Duration progressInterval) { this.progressInterval = progressInterval; }
        public int getMaxEvents() { return maxEvents; }
        public void setMaxEvents(int maxEvents) { this.maxEvents = maxEvents; }
        public int getMaxTailChars() { return maxTailChars; }
        public void setMaxTailChars(int maxTailChars) { this.maxTailChars = maxTailChars; }
    }

    public static class Registry {
        private String path = System.getProperty("user.home") + "/.agent-relay/tasks.db";
        private long stuckMaxAgeSeconds = 3600;
        private Duration pruneMaxAge = Duration.ofHours(24);
        private Duration maintenanceInterval = Duration.ofMinutes(15);
        private boolean maintenanceEnabled = true;
        private Duration writeRetryDelay = Duration.ofMillis(100);
        private int busyTimeoutMs = 5000;

        public String getPath() { return path; }
        public void setPath(String path) { this.path = path; }
        public long getStuckMaxAgeSeconds() { return stuckMaxAgeSeconds; }
        public void setStuckMaxAgeSeconds(long stuckMaxAgeSeconds) { this.stuckMaxAgeSeconds = stuckMaxAgeSeconds; }
        public Duration getPruneMaxAge() { return pruneMaxAge; }
        public void setPruneMaxAge(Duration pruneMaxAge) { this.pruneMaxAge = pruneMaxAge; }
        public Duration getMaintenanceInterval() { return maintenanceInterval; }
        public void setMaintenanceInterval(Duration maintenanceInterval) { this.maintenanceInterval = maintenanceInterval; }
        public boolean isMaintenanceEnabled() { return maintenanceEnabled; }
        public void setMaintenanceEnabled(boolean maintenanceEnabled) { this.maintenanceEnabled = maintenanceEnabled; }
        public Duration getWriteRetryDelay() { return writeRetryDelay; }
        public void setWriteRetryDelay(Duration writeRetryDelay) { this.writeRetryDelay = writeRetryDelay; }
        public int getBusyTimeoutMs() { return busyTimeoutMs; }
        public void setBusyTimeoutMs(int busyTimeoutMs) { this.busyTimeoutMs = busyTimeoutMs; }
    }
}
