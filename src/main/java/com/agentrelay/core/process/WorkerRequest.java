package com.agentrelay.core.process;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

/**
 * Everything needed to run the worker once.
 *
 * @param taskId           registry id of the task this run belongs to (used for logging)
 * @param instruction      free-text instruction passed to the worker as a single argument
 * @param mode             sandbox mode
 * @param model            model selector, null for the worker's default
 * @param workingDir       working directory, null for the orchestrator's own
 * @param outputSchema     JSON schema file constraining the final message, may be null
 * @param envPolicy        environment policy for the worker process
 * @param envAllowList     variable names passed through under {@link EnvPolicy#ALLOW_LIST}
 * @param skipGitRepoCheck allow running outside a trusted git repository
 * @param idleTimeout      overrides the configured inactivity timeout, may be null
 * @param hardTimeout      overrides the configured hard timeout, may be null
 * @param resumeThreadId   worker conversation to continue, null to start a new one
 * @param listener         execution observer, never null
 */
public record WorkerRequest(
        String taskId,
        String instruction,
        SandboxMode mode,
        String model,
        Path workingDir,
        Path outputSchema,
        EnvPolicy envPolicy,
        List<String> envAllowList,
        boolean skipGitRepoCheck,
        Duration idleTimeout,
        Duration hardTimeout,
        String resumeThreadId,
        ExecutionListener listener
) {

    public WorkerRequest {
        if (instruction == null || instruction.isBlank()) {
            throw new IllegalArgumentException("instruction must not be blank");
        }
        mode = mode != null ? mode : SandboxMode.READ_ONLY;
        envPolicy = envPolicy != null ? envPolicy : EnvPolicy.INHERIT_NONE;
        envAllowList = envAllowList != null ? List.copyOf(envAllowList) : List.of();
        if (resumeThreadId != null && resumeThreadId.isBlank()) {
            throw new IllegalArgumentException("resumeThreadId must not be blank");
        }
        listener = listener != null ? listener : ExecutionListener.NONE;
    }

    public static Builder builder(String instruction) {
        return new Builder(instruction);
    }

    public WorkerRequest withListener(ExecutionListener newListener) {
        return new WorkerRequest(taskId, instruction, mode, model, workingDir, outputSchema, envPolicy,
                envAllowList, skipGitRepoCheck, idleTimeout, hardTimeout, resumeThreadId, newListener);
    }

    public static final class Builder {
        private final String instruction;
        private String taskId;
        private SandboxMode mode;
        private String model;
        private Path workingDir;
        private Path outputSchema;
        private EnvPolicy envPolicy;
        private List<String> envAllowList;
        private boolean skipGitRepoCheck;
        private Duration idleTimeout;
        private Duration hardTimeout;
        private String resumeThreadId;
        private ExecutionListener listener;

        private Builder(String instruction) {
            this.instruction = instruction;
        }

        public Builder taskId(String taskId) { this.taskId = taskId; return this; }
        public Builder mode(SandboxMode mode) { this.mode = mode; return this; }
        public Builder model(String model) { this.model = model; return this; }
        public Builder workingDir(Path workingDir) { this.workingDir = workingDir; return this; }
        public Builder outputSchema(Path outputSchema) { this.outputSchema = outputSchema; return this; }
        public Builder envPolicy(EnvPolicy envPolicy) { this.envPolicy = envPolicy; return this; }
        public Builder envAllowList(List<String> envAllowList) { this.envAllowList = envAllowList; return this; }
        public Builder skipGitRepoCheck(boolean skip) { this.skipGitRepoCheck = skip; return this; }
        public Builder idleTimeout(Duration idleTimeout) { this.idleTimeout = idleTimeout; return this; }
        public Builder hardTimeout(Duration hardTimeout) { this.hardTimeout = hardTimeout; return this; }
        public Builder resumeThreadId(String threadId) { this.resumeThreadId = threadId; return this; }
        public Builder listener(ExecutionListener listener) { this.listener = listener; return this; }

        public WorkerRequest build() {
            return new WorkerRequest(taskId, instruction, mode, model, workingDir, outputSchema, envPolicy,
                    envAllowList, skipGitRepoCheck, idleTimeout, hardTimeout, resumeThreadId, listener);
        }
    }
}
