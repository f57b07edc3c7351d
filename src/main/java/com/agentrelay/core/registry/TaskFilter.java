package com.agentrelay.core.registry;

import com.agentrelay.core.model.TaskOrigin;
import com.agentrelay.core.model.TaskStatus;

import java.time.Instant;

/**
 * Query criteria for {@link TaskRegistry#query(TaskFilter)}. Null fields do not constrain the query.
 * Results are ordered newest first.
 */
public record TaskFilter(
        TaskOrigin origin,
        TaskStatus status,
        String workingDir,
        String threadId,
        String userId,
        Instant createdAfter,
        Instant createdBefore,
        int limit,
        int offset
) {

    public static final int DEFAULT_LIMIT = 50;

    public TaskFilter {
        if (limit <= 0) {
            throw TaskRegistryException.validation("limit must be positive, got " + limit);
        }
        if (offset < 0) {
            throw TaskRegistryException.validation("offset must not be negative, got " + offset);
        }
    }

    public static TaskFilter all() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private TaskOrigin origin;
        private TaskStatus status;
        private String workingDir;
        private String threadId;
        private String userId;
        private Instant createdAfter;
        private Instant createdBefore;
        private int limit = DEFAULT_LIMIT;
        private int offset;

        private Builder() {}

        public Builder origin(TaskOrigin origin) { this.origin = origin; return this; }
        public Builder status(TaskStatus status) { this.status = status; return this; }
        public Builder workingDir(String workingDir) { this.workingDir = workingDir; return this; }
        public Builder threadId(String threadId) { this.threadId = threadId; return this; }
        public Builder userId(String userId) { this.userId = userId; return this; }
        public Builder createdAfter(Instant createdAfter) { this.createdAfter = createdAfter; return this; }
        public Builder createdBefore(Instant createdBefore) { this.createdBefore = createdBefore; return this; }
        public Builder limit(int limit) { this.limit = limit; return this; }
        public Builder offset(int offset) { this.offset = offset; return this; }

        public TaskFilter build() {
            return new TaskFilter(origin, status, workingDir, threadId, userId, createdAfter, createdBefore,
                    limit, offset);
        }
    }
}
