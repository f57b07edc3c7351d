package com.agentrelay.core.registry;

import com.agentrelay.core.model.TaskStatus;

import java.time.Instant;

/**
 * Partial update for {@link TaskRegistry#updateTask(String, TaskUpdate)}. Only non-null fields are written.
 */
public record TaskUpdate(
        TaskStatus status,
        String externalId,
        String alias,
        String threadId,
        String model,
        String progressSteps,
        Instant lastEventAt,
        Long pollFrequencyMs,
        Instant keepAliveUntil,
        String result,
        String error,
        String errorCode,
        String metadata
) {

    public static TaskUpdate status(TaskStatus status) {
        return builder().status(status).build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private TaskStatus status;
        private String externalId;
        private String alias;
        private String threadId;
        private String model;
        private String progressSteps;
        private Instant lastEventAt;
        private Long pollFrequencyMs;
        private Instant keepAliveUntil;
        private String result;
        private String error;
        private String errorCode;
        private String metadata;

        private Builder() {}

        public Builder status(TaskStatus status) { this.status = status; return this; }
        public Builder externalId(String externalId) { this.externalId = externalId; return this; }
        public Builder alias(String alias) { this.alias = alias; return this; }
        public Builder threadId(String threadId) { this.threadId = threadId; return this; }
        public Builder model(String model) { this.model = model; return this; }
        public Builder progressSteps(String progressSteps) { this.progressSteps = progressSteps; return this; }
        public Builder lastEventAt(Instant lastEventAt) { this.lastEventAt = lastEventAt; return this; }
        public Builder pollFrequencyMs(Long pollFrequencyMs) { this.pollFrequencyMs = pollFrequencyMs; return this; }
        public Builder keepAliveUntil(Instant keepAliveUntil) { this.keepAliveUntil = keepAliveUntil; return this; }
        public Builder result(String result) { this.result = result; return this; }
        public Builder error(String error) { this.error = error; return this; }
        public Builder errorCode(String errorCode) { this.errorCode = errorCode; return this; }
        public Builder metadata(String metadata) { this.metadata = metadata; return this; }

        public TaskUpdate build() {
            return new TaskUpdate(status, externalId, alias, threadId, model, progressSteps, lastEventAt,
                    pollFrequencyMs, keepAliveUntil, result, error, errorCode, metadata);
        }
    }
}
