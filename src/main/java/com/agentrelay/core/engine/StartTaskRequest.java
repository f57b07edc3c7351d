package com.agentrelay.core.engine;

import com.agentrelay.core.process.EnvPolicy;
import com.agentrelay.core.process.SandboxMode;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;

/**
 * A request to run the worker on an instruction and track it as a task.
 */
public record StartTaskRequest(
        String instruction,
        Path workingDir,
        SandboxMode mode,
        String model,
        EnvPolicy envPolicy,
        List<String> envAllowList,
        boolean skipGitRepoCheck,
        Path outputSchema,
        Duration idleTimeout,
        Duration hardTimeout,
        String alias,
        String threadId,
        String userId,
        Map<String, Object> metadata
) {

    public static Builder builder(String instruction) {
        return new Builder(instruction);
    }

    public static final class Builder {
        private final String instruction;
        private Path workingDir;
        private SandboxMode mode;
        private String model;
        private EnvPolicy envPolicy;
        private List<String> envAllowList;
        private boolean skipGitRepoCheck;
        private Path outputSchema;
        private Duration idleTimeout;
        private Duration hardTimeout;
        private String alias;
        private String threadId;
        private String userId;
        private Map<String, Object> metadata;

        private Builder(String instruction) {
            this.instruction = instruction;
        }

        public Builder workingDir(Path workingDir) { this.workingDir = workingDir; return this; }
        public Builder mode(SandboxMode mode) { this.mode = mode; return this; }
        public Builder model(String model) { this.model = model; return this; }
        public Builder envPolicy(EnvPolicy envPolicy) { this.envPolicy = envPolicy; return this; }
        public Builder envAllowList(List<String> envAllowList) { this.envAllowList = envAllowList; return this; }
        public Builder skipGitRepoCheck(boolean skip) { this.skipGitRepoCheck = skip; return this; }
        public Builder outputSchema(Path outputSchema) { this.outputSchema = outputSchema; return this; }
        public Builder idleTimeout(Duration idleTimeout) { this.idleTimeout = idleTimeout; return this; }
        public Builder hardTimeout(Duration hardTimeout) { this.hardTimeout = hardTimeout; return this; }
        public Builder alias(String alias) { this.alias = alias; return this; }
        public Builder threadId(String threadId) { this.threadId = threadId; return this; }
        public Builder userId(String userId) { this.userId = userId; return this; }
        public Builder metadata(Map<String, Object> metadata) { this.metadata = metadata; return this; }

        public StartTaskRequest build() {
            return new StartTaskRequest(instruction, workingDir, mode, model, envPolicy, envAllowList,
                    skipGitRepoCheck, outputSchema, idleTimeout, hardTimeout, alias, threadId, userId, metadata);
        }
    }
}
