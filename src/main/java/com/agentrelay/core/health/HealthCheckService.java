package com.agentrelay.core.health;

import com.agentrelay.config.RelayProperties;
import com.agentrelay.core.model.Task;
import com.agentrelay.core.registry.TaskRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import javax.sql.DataSource;
import java.io.File;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

@Service
public class HealthCheckService {

    private static final Logger log = LoggerFactory.getLogger(HealthCheckService.class);

    private final DataSource dataSource;
    private final TaskRegistry registry;
    private final RelayProperties properties;

    public HealthCheckService(
            @Autowired(required = false) DataSource dataSource,
            TaskRegistry registry,
            RelayProperties properties) {
        this.dataSource = dataSource;
        this.registry = registry;
        this.properties = properties;
    }

    public List<HealthStatus> checkAll() {
        var results = new ArrayList<HealthStatus>();
        results.add(checkDatabase());
        results.add(checkWorker());
        results.add(checkStuckTasks());
        return results;
    }

    private HealthStatus checkDatabase() {
        if (dataSource == null) {
            return new HealthStatus("database", HealthStatus.Status.DOWN,
                    "No DataSource configured", Map.of());
        }
        try (var conn = dataSource.getConnection()) {
            if (conn.isValid(5)) {
                return new HealthStatus("database", HealthStatus.Status.UP,
                        "Task registry reachable", Map.of("path", properties.getRegistryPath().toString()));
            }
            return new HealthStatus("database", HealthStatus.Status.DOWN,
                    "Task registry connection invalid", Map.of());
        } catch (Exception e) {
            log.warn("Database health check failed: {}", e.getMessage());
            return new HealthStatus("database", HealthStatus.Status.DOWN,
                    "Database error: " + e.getMessage(), Map.of());
        }
    }

    private HealthStatus checkWorker() {
        String binary = properties.getWorkerBinary();
        Optional<Path> resolved = resolveExecutable(binary, System.getenv("PATH"));
        if (resolved.isPresent()) {
            return new HealthStatus("worker", HealthStatus.Status.UP,
                    "Worker CLI found at " + resolved.get(), Map.of("binary", binary));
        }
        return new HealthStatus("worker", HealthStatus.Status.DOWN,
                "Worker CLI '" + binary + "' not found on PATH", Map.of("binary", binary));
    }

    private HealthStatus checkStuckTasks() {
        long maxAge = properties.getRegistry().getStuckMaxAgeSeconds();
        List<Task> stuck = registry.previewStuck(maxAge);
        if (stuck.isEmpty()) {
            return new HealthStatus("tasks", HealthStatus.Status.UP,
                    registry.stats().running() + " active task(s)", Map.of());
        }
        return new HealthStatus("tasks", HealthStatus.Status.DEGRADED,
                stuck.size() + " task(s) active for more than " + maxAge + "s",
                Map.of("oldest", stuck.get(0).id()));
    }

    /**
     * Resolves {@code binary} the way a shell would: paths are checked directly, bare names
     * are searched for on {@code pathEnv}.
     */
    static Optional<Path> resolveExecutable(String binary, String pathEnv) {
        if (binary == null || binary.isBlank()) {
            return Optional.empty();
        }
        if (binary.contains(File.separator)) {
            Path path = Path.of(binary);
            return Files.isExecutable(path) ? Optional.of(path) : Optional.empty();
        }
        if (pathEnv == null) {
            return Optional.empty();
        }
        for (String dir : pathEnv.split(File.pathSeparator)) {
            if (dir.isBlank()) {
                continue;
            }
            Path candidate = Path.of(dir, binary);
            if (Files.isRegularFile(candidate) && Files.isExecutable(candidate)) {
                return Optional.of(candidate);
            }
        }
        return Optional.empty();
    }
}
