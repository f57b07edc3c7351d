package com.agentrelay.core.registry;

import com.agentrelay.core.errors.ErrorCode;
import com.agentrelay.core.metrics.RelayMetrics;
import com.agentrelay.core.model.RegisterTaskRequest;
import com.agentrelay.core.model.RegistryStats;
import com.agentrelay.core.model.Task;
import com.agentrelay.core.model.TaskOrigin;
import com.agentrelay.core.model.TaskStatus;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Types;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.locks.ReentrantLock;

/**
 * SQLite-backed {@link TaskRegistry}.
 * <p>
 * Timestamps are stored as epoch milliseconds. Writes are serialized by an in-process lock
 * so read-modify-write updates cannot interleave; SQLite's WAL mode lets reads proceed
 * concurrently with them.
 */
public class JdbcTaskRegistry implements TaskRegistry {

    private static final Logger log = LoggerFactory.getLogger(JdbcTaskRegistry.class);

    private static final String TABLE_NAME = SchemaMigrator.TABLE_NAME;

    private static final String ACTIVE_STATUSES = "('pending', 'working')";
    private static final String TERMINAL_STATUSES =
            "('completed', 'completed_with_warnings', 'completed_with_errors', 'failed', 'canceled')";

    private static final String INSERT_SQL = """
            INSERT INTO %s (id, external_id, alias, origin, status, instruction, working_dir, env_id,
                            mode, model, created_at, updated_at, poll_frequency_ms, thread_id, user_id, metadata)
            VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
            """.formatted(TABLE_NAME);

    private static final String UPDATE_SQL = """
            UPDATE %s SET
                external_id = ?,
                alias = ?,
                status = ?,
                model = ?,
                updated_at = ?,
                completed_at = ?,
                last_event_at = ?,
                progress_steps = ?,
                poll_frequency_ms = ?,
                keep_alive_until = ?,
                thread_id = ?,
                result = ?,
                error = ?,
                error_code = ?,
                metadata = ?
            WHERE id = ?
            """.formatted(TABLE_NAME);

    private static final String SELECT_BY_ID_SQL = """
            SELECT * FROM %s WHERE id = ?
            """.formatted(TABLE_NAME);

    private static final String DELETE_BY_ID_SQL = """
            DELETE FROM %s WHERE id = ?
            """.formatted(TABLE_NAME);

    private static final String STUCK_CONDITION = """
            status IN %s
              AND created_at < ?
              AND (keep_alive_until IS NULL OR keep_alive_until < ?)
            """.formatted(ACTIVE_STATUSES);

    private static final String RECLAIM_STUCK_SQL = """
            UPDATE %s SET
                status = 'failed',
                error = ?,
                error_code = ?,
                completed_at = MAX(updated_at, ?),
                updated_at = MAX(updated_at, ?)
            WHERE %s
            """.formatted(TABLE_NAME, STUCK_CONDITION);

    private static final String SELECT_STUCK_SQL = """
            SELECT * FROM %s WHERE %s ORDER BY created_at ASC
            """.formatted(TABLE_NAME, STUCK_CONDITION);

    private static final String PRUNE_CONDITION = """
            status IN %s
              AND completed_at IS NOT NULL
              AND completed_at < ?
            """.formatted(TERMINAL_STATUSES);

    private static final String PRUNE_SQL = """
            DELETE FROM %s WHERE %s
            """.formatted(TABLE_NAME, PRUNE_CONDITION);

    private static final String SELECT_PRUNABLE_SQL = """
            SELECT * FROM %s WHERE %s ORDER BY completed_at ASC
            """.formatted(TABLE_NAME, PRUNE_CONDITION);

    private static final String COUNT_BY_STATUS_SQL = """
            SELECT status, COUNT(*) AS count FROM %s GROUP BY status
            """.formatted(TABLE_NAME);

    private static final String COUNT_BY_ORIGIN_SQL = """
            SELECT origin, COUNT(*) AS count FROM %s GROUP BY origin
            """.formatted(TABLE_NAME);

    static final String RECLAIMED_MESSAGE =
            "Task did not finish within %d seconds and was reclaimed as stuck; the worker likely exited without reporting";

    private final DataSource dataSource;
    private final RelayMetrics metrics;
    private final Duration writeRetryDelay;
    private final Clock clock;
    private final ObjectMapper objectMapper;
    private final ReentrantLock writeLock = new ReentrantLock();

    public JdbcTaskRegistry(DataSource dataSource, RelayMetrics metrics, Duration writeRetryDelay, Clock clock) {
        this.dataSource = Objects.requireNonNull(dataSource, "DataSource must not be null");
        this.metrics = metrics;
        this.writeRetryDelay = writeRetryDelay;
        this.clock = clock;
        this.objectMapper = new ObjectMapper();
    }

    @Override
    public Task register(RegisterTaskRequest request) {
        if (request == null || request.instruction() == null || request.instruction().isBlank()) {
            throw TaskRegistryException.validation("instruction must not be blank");
        }
        if (request.origin() == null) {
            throw TaskRegistryException.validation("origin is required");
        }

        Instant now = now();
        Task task = new Task(
                generateId(request.origin(), now),
                request.externalId(),
                request.alias(),
                request.origin(),
                TaskStatus.PENDING,
                request.instruction(),
                request.workingDir(),
                request.envId(),
                request.mode(),
                request.model(),
                now, now, null, null, null,
                request.pollFrequencyMs(),
                null,
                request.threadId(),
                request.userId(),
                null, null, null,
                toJson(request.metadata()));

        writeLock.lock();
        try {
            withRetry("register", () -> insert(task));
        } catch (SQLException e) {
            throw new TaskRegistryException(ErrorCode.STORAGE_ERROR, "Failed to register task: " + e.getMessage(), e);
        } finally {
            writeLock.unlock();
        }
        log.info("Registered task {} ({})", task.id(), task.origin().value());
        return task;
    }

    @Override
    public Optional<Task> get(String id) {
        try {
            return read(id);
        } catch (SQLException e) {
            log.error("Failed to read task '{}'", id, e);
            return Optional.empty();
        }
    }

    @Override
    public Optional<Task> updateStatus(String id, TaskStatus status) {
        return updateTask(id, TaskUpdate.status(status));
    }

    @Override
    public Optional<Task> updateTask(String id, TaskUpdate update) {
        Objects.requireNonNull(update, "update must not be null");
        writeLock.lock();
        try {
            Optional<Task> current;
            try {
                current = withRetry("updateTask", () -> read(id));
            } catch (SQLException e) {
                log.error("Failed to read task {} for update after retry; update not applied", id, e);
                throw new TaskRegistryException(ErrorCode.STORAGE_ERROR,
                        "Failed to read task " + id + " for update: " + e.getMessage(), e);
            }
            if (current.isEmpty()) {
                return Optional.empty();
            }
            Task existing = current.get();

            TaskStatus target = update.status() != null ? update.status() : existing.status();
            if (target != existing.status()) {
                if (existing.isTerminal()) {
                    log.debug("Ignoring {} -> {} for task {}: terminal status is final",
                            existing.status().value(), target.value(), id);
                    return Optional.of(existing);
                }
                if (!existing.status().canTransitionTo(target)) {
                    throw TaskRegistryException.validation("Invalid status transition for task " + id + ": "
                            + existing.status().value() + " -> " + target.value());
                }
            }

            Task updated = merge(existing, update, target);
            try {
                withRetry("updateTask", () -> write(updated));
                return Optional.of(updated);
            } catch (SQLException e) {
                log.error("Failed to update task {} after retry; keeping last known state", id, e);
                return Optional.of(existing);
            }
        } finally {
            writeLock.unlock();
        }
    }

    @Override
    public List<Task> query(TaskFilter filter) {
        TaskFilter effective = filter != null ? filter : TaskFilter.all();
        StringBuilder sql = new StringBuilder("SELECT * FROM ").append(TABLE_NAME).append(" WHERE 1=1");
        List<Object> params = new ArrayList<>();
        if (effective.origin() != null) {
            sql.append(" AND origin = ?");
            params.add(effective.origin().value());
        }
        if (effective.status() != null) {
            sql.append(" AND status = ?");
            params.add(effective.status().value());
        }
        if (effective.workingDir() != null) {
            sql.append(" AND working_dir = ?");
            params.add(effective.workingDir());
        }
        if (effective.threadId() != null) {
            sql.append(" AND thread_id = ?");
            params.add(effective.threadId());
        }
        if (effective.userId() != null) {
            sql.append(" AND user_id = ?");
            params.add(effective.userId());
        }
        if (effective.createdAfter() != null) {
            sql.append(" AND created_at >= ?");
            params.add(effective.createdAfter().toEpochMilli());
        }
        if (effective.createdBefore() != null) {
            sql.append(" AND created_at <= ?");
            params.add(effective.createdBefore().toEpochMilli());
        }
        sql.append(" ORDER BY created_at DESC, id DESC LIMIT ? OFFSET ?");
        params.add(effective.limit());
        params.add(effective.offset());

        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(sql.toString())) {
            for (int i = 0; i < params.size(); i++) {
                stmt.setObject(i + 1, params.get(i));
            }
            return readAll(stmt);
        } catch (SQLException e) {
            log.error("Failed to query tasks with {}", effective, e);
            return List.of();
        }
    }

    @Override
    public boolean delete(String id) {
        writeLock.lock();
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(DELETE_BY_ID_SQL)) {
            stmt.setString(1, id);
            return stmt.executeUpdate() > 0;
        } catch (SQLException e) {
            log.error("Failed to delete task '{}'", id, e);
            return false;
        } finally {
            writeLock.unlock();
        }
    }

    @Override
    public int reclaimStuck(long maxAgeSeconds) {
        long nowMs = now().toEpochMilli();
        long cutoff = nowMs - maxAgeSeconds * 1000;
        String message = RECLAIMED_MESSAGE.formatted(maxAgeSeconds);

        writeLock.lock();
        try {
            int reclaimed = withRetry("reclaimStuck", () -> {
                try (Connection conn = dataSource.getConnection();
                     PreparedStatement stmt = conn.prepareStatement(RECLAIM_STUCK_SQL)) {
                    stmt.setString(1, message);
                    stmt.setString(2, ErrorCode.TIMEOUT.name());
                    stmt.setLong(3, nowMs);
                    stmt.setLong(4, nowMs);
                    stmt.setLong(5, cutoff);
                    stmt.setLong(6, nowMs);
                    return stmt.executeUpdate();
                }
            });
            if (reclaimed > 0) {
                log.warn("Reclaimed {} stuck task(s) older than {}s", reclaimed, maxAgeSeconds);
                metrics.recordReclaimed(reclaimed);
            }
            return reclaimed;
        } catch (SQLException e) {
            log.error("Failed to reclaim stuck tasks", e);
            return 0;
        } finally {
            writeLock.unlock();
        }
    }

    @Override
    public int pruneOld(Duration maxAge) {
        long cutoff = now().minus(maxAge).toEpochMilli();
        writeLock.lock();
        try {
            int pruned = withRetry("pruneOld", () -> {
                try (Connection conn = dataSource.getConnection();
                     PreparedStatement stmt = conn.prepareStatement(PRUNE_SQL)) {
                    stmt.setLong(1, cutoff);
                    return stmt.executeUpdate();
                }
            });
            if (pruned > 0) {
                log.info("Pruned {} terminal task(s) completed more than {} ago", pruned, maxAge);
                metrics.recordPruned(pruned);
            }
            return pruned;
        } catch (SQLException e) {
            log.error("Failed to prune old tasks", e);
            return 0;
        } finally {
            writeLock.unlock();
        }
    }

    @Override
    public List<Task> previewStuck(long maxAgeSeconds) {
        long nowMs = now().toEpochMilli();
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(SELECT_STUCK_SQL)) {
            stmt.setLong(1, nowMs - maxAgeSeconds * 1000);
            stmt.setLong(2, nowMs);
            return readAll(stmt);
        } catch (SQLException e) {
            log.error("Failed to list stuck tasks", e);
            return List.of();
        }
    }

    @Override
    public List<Task> previewPrune(Duration maxAge) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(SELECT_PRUNABLE_SQL)) {
            stmt.setLong(1, now().minus(maxAge).toEpochMilli());
            return readAll(stmt);
        } catch (SQLException e) {
            log.error("Failed to list prunable tasks", e);
            return List.of();
        }
    }

    @Override
    public RegistryStats stats() {
        Map<TaskStatus, Long> byStatus = new EnumMap<>(TaskStatus.class);
        Map<TaskOrigin, Long> byOrigin = new EnumMap<>(TaskOrigin.class);
        try (Connection conn = dataSource.getConnection()) {
            try (PreparedStatement stmt = conn.prepareStatement(COUNT_BY_STATUS_SQL);
                 ResultSet rs = stmt.executeQuery()) {
                while (rs.next()) {
                    byStatus.merge(parseStatus(rs.getString("status"), null), rs.getLong("count"), Long::sum);
                }
            }
            try (PreparedStatement stmt = conn.prepareStatement(COUNT_BY_ORIGIN_SQL);
                 ResultSet rs = stmt.executeQuery()) {
                while (rs.next()) {
                    byOrigin.merge(TaskOrigin.fromValue(rs.getString("origin")), rs.getLong("count"), Long::sum);
                }
            }
        } catch (SQLException e) {
            log.error("Failed to compute registry stats", e);
        }
        long total = byStatus.values().stream().mapToLong(Long::longValue).sum();
        long running = byStatus.getOrDefault(TaskStatus.PENDING, 0L) + byStatus.getOrDefault(TaskStatus.WORKING, 0L);
        return new RegistryStats(total, byStatus, byOrigin, running);
    }

    // ── Writes ────────────────────────────────────────────────────────────

    @FunctionalInterface
    private interface SqlWork<T> {
        T run() throws SQLException;
    }

    /**
     * Runs {@code work}, retrying once after {@link #writeRetryDelay}. A second failure is counted
     * and rethrown with the first attached as suppressed.
     */
    private <T> T withRetry(String operation, SqlWork<T> work) throws SQLException {
        try {
            return work.run();
        } catch (SQLException first) {
            log.warn("Registry {} failed ({}); retrying in {} ms", operation, first.getMessage(),
                    writeRetryDelay.toMillis());
            pauseBeforeRetry();
            try {
                return work.run();
            } catch (SQLException second) {
                second.addSuppressed(first);
                metrics.recordRegistryWriteFailure(operation);
                throw second;
            }
        }
    }

    private void pauseBeforeRetry() {
        try {
            Thread.sleep(writeRetryDelay.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private Optional<Task> read(String id) throws SQLException {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(SELECT_BY_ID_SQL)) {
            stmt.setString(1, id);
            try (ResultSet rs = stmt.executeQuery()) {
                return rs.next() ? Optional.of(fromResultSet(rs)) : Optional.empty();
            }
        }
    }

    private int insert(Task task) throws SQLException {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(INSERT_SQL)) {
            stmt.setString(1, task.id());
            stmt.setString(2, task.externalId());
            stmt.setString(3, task.alias());
            stmt.setString(4, task.origin().value());
            stmt.setString(5, task.status().value());
            stmt.setString(6, task.instruction());
            stmt.setString(7, task.workingDir());
            stmt.setString(8, task.envId());
            stmt.setString(9, task.mode());
            stmt.setString(10, task.model());
            stmt.setLong(11, task.createdAt().toEpochMilli());
            stmt.setLong(12, task.updatedAt().toEpochMilli());
            setLong(stmt, 13, task.pollFrequencyMs());
            stmt.setString(14, task.threadId());
            stmt.setString(15, task.userId());
            stmt.setString(16, task.metadata());
            return stmt.executeUpdate();
        }
    }

    private int write(Task task) throws SQLException {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(UPDATE_SQL)) {
            stmt.setString(1, task.externalId());
            stmt.setString(2, task.alias());
            stmt.setString(3, task.status().value());
            stmt.setString(4, task.model());
            stmt.setLong(5, task.updatedAt().toEpochMilli());
            setInstant(stmt, 6, task.completedAt());
            setInstant(stmt, 7, task.lastEventAt());
            stmt.setString(8, task.progressSteps());
            setLong(stmt, 9, task.pollFrequencyMs());
            setInstant(stmt, 10, task.keepAliveUntil());
            stmt.setString(11, task.threadId());
            stmt.setString(12, task.result());
            stmt.setString(13, task.error());
            stmt.setString(14, task.errorCode());
            stmt.setString(15, task.metadata());
            stmt.setString(16, task.id());
            return stmt.executeUpdate();
        }
    }

    private Task merge(Task existing, TaskUpdate update, TaskStatus target) {
        Instant now = now();
        Instant updatedAt = now.isAfter(existing.updatedAt()) ? now : existing.updatedAt();
        Instant completedAt = existing.completedAt();
        if (target.isTerminal() && !existing.isTerminal()) {
            completedAt = updatedAt;
        }
        return new Task(
                existing.id(),
                pick(update.externalId(), existing.externalId()),
                pick(update.alias(), existing.alias()),
                existing.origin(),
                target,
                existing.instruction(),
                existing.workingDir(),
                existing.envId(),
                existing.mode(),
                pick(update.model(), existing.model()),
                existing.createdAt(),
                updatedAt,
                completedAt,
                pick(update.lastEventAt(), existing.lastEventAt()),
                pick(update.progressSteps(), existing.progressSteps()),
                pick(update.pollFrequencyMs(), existing.pollFrequencyMs()),
                pick(update.keepAliveUntil(), existing.keepAliveUntil()),
                pick(update.threadId(), existing.threadId()),
                existing.userId(),
                pick(update.result(), existing.result()),
                pick(update.error(), existing.error()),
                pick(update.errorCode(), existing.errorCode()),
                pick(update.metadata(), existing.metadata()));
    }

    // ── Helpers ───────────────────────────────────────────────────────────

    private Instant now() {
        return Instant.ofEpochMilli(clock.millis());
    }

    static String generateId(TaskOrigin origin, Instant now) {
        long suffix = ThreadLocalRandom.current().nextLong(60_466_176L, 2_176_782_336L);
        return "T-" + origin.value() + "-" + Long.toString(now.toEpochMilli(), 36) + Long.toString(suffix, 36);
    }

    private String toJson(Map<String, Object> metadata) {
        if (metadata == null || metadata.isEmpty()) {
            return null;
        }
        try {
            return objectMapper.writeValueAsString(metadata);
        } catch (JsonProcessingException e) {
            throw TaskRegistryException.validation("metadata is not serializable: " + e.getOriginalMessage());
        }
    }

    private List<Task> readAll(PreparedStatement stmt) throws SQLException {
        List<Task> tasks = new ArrayList<>();
        try (ResultSet rs = stmt.executeQuery()) {
            while (rs.next()) {
                tasks.add(fromResultSet(rs));
            }
        }
        return tasks;
    }

    private Task fromResultSet(ResultSet rs) throws SQLException {
        String id = rs.getString("id");
        return new Task(
                id,
                rs.getString("external_id"),
                rs.getString("alias"),
                TaskOrigin.fromValue(rs.getString("origin")),
                parseStatus(rs.getString("status"), id),
                rs.getString("instruction"),
                rs.getString("working_dir"),
                rs.getString("env_id"),
                rs.getString("mode"),
                rs.getString("model"),
                instant(rs, "created_at"),
                instant(rs, "updated_at"),
                instant(rs, "completed_at"),
                instant(rs, "last_event_at"),
                rs.getString("progress_steps"),
                nullableLong(rs, "poll_frequency_ms"),
                instant(rs, "keep_alive_until"),
                rs.getString("thread_id"),
                rs.getString("user_id"),
                rs.getString("result"),
                rs.getString("error"),
                rs.getString("error_code"),
                rs.getString("metadata"));
    }

    private static TaskStatus parseStatus(String value, String taskId) {
        try {
            return TaskStatus.fromValue(value);
        } catch (IllegalArgumentException e) {
            log.warn("Unrecognized status '{}' on task {}; reading it as unknown", value, taskId);
            return TaskStatus.UNKNOWN;
        }
    }

    private static Instant instant(ResultSet rs, String column) throws SQLException {
        Long millis = nullableLong(rs, column);
        return millis != null ? Instant.ofEpochMilli(millis) : null;
    }

    private static Long nullableLong(ResultSet rs, String column) throws SQLException {
        long value = rs.getLong(column);
        return rs.wasNull() ? null : value;
    }

    private static void setInstant(PreparedStatement stmt, int index, Instant value) throws SQLException {
        setLong(stmt, index, value != null ? value.toEpochMilli() : null);
    }

    private static void setLong(PreparedStatement stmt, int index, Long value) throws SQLException {
        if (value != null) {
            stmt.setLong(index, value);
        } else {
            stmt.setNull(index, Types.INTEGER);
        }
    }

    private static <T> T pick(T candidate, T fallback) {
        return candidate != null ? candidate : fallback;
    }
}
