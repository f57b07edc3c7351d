package com.agentrelay.config;

import com.agentrelay.core.metrics.RelayMetrics;
import com.agentrelay.core.process.ProcessQueue;
import com.agentrelay.core.registry.JdbcTaskRegistry;
import com.agentrelay.core.registry.SchemaMigrator;
import com.agentrelay.core.registry.TaskRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.sqlite.SQLiteConfig;
import org.sqlite.SQLiteDataSource;

import javax.sql.DataSource;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Wires the task registry, the worker queue and the executors the execution core runs on.
 * <p>
 * The registry lives in a single SQLite file opened in WAL mode, so readers never block the
 * writer; the busy timeout covers the brief write lock held by other processes sharing the file.
 */
@Configuration
public class RelayConfig {

    private static final Logger log = LoggerFactory.getLogger(RelayConfig.class);

    @Bean
    @ConditionalOnMissingBean(DataSource.class)
    public DataSource registryDataSource(RelayProperties properties) throws IOException {
        Path path = properties.getRegistryPath().toAbsolutePath();
        if (path.getParent() != null) {
            Files.createDirectories(path.getParent());
        }
        SQLiteConfig config = new SQLiteConfig();
        config.setJournalMode(SQLiteConfig.JournalMode.WAL);
        config.setBusyTimeout(properties.getRegistry().getBusyTimeoutMs());
        SQLiteDataSource dataSource = new SQLiteDataSource(config);
        dataSource.setUrl("jdbc:sqlite:" + path);
        log.info("Task registry at {}", path);
        return dataSource;
    }

    @Bean
    @ConditionalOnMissingBean(Clock.class)
    public Clock clock() {
        return Clock.systemUTC();
    }

    /**
     * JDBC task registry; migrates the schema before it is handed out.
     */
    @Bean
    public TaskRegistry taskRegistry(DataSource dataSource, RelayProperties properties, RelayMetrics metrics,
                                     Clock clock) throws Exception {
        int from = new SchemaMigrator(dataSource).migrate();
        log.debug("Task schema ready (was v{})", from);
        return new JdbcTaskRegistry(dataSource, metrics, properties.getRegistry().getWriteRetryDelay(), clock);
    }

    @Bean
    public ProcessQueue processQueue(RelayProperties properties) {
        return new ProcessQueue(properties.getMaxConcurrency());
    }

    @Bean(name = "watchdogScheduler", destroyMethod = "shutdownNow")
    public ScheduledExecutorService watchdogScheduler() {
        ScheduledThreadPoolExecutor scheduler = new ScheduledThreadPoolExecutor(2, daemonThreads("watchdog-"));
        scheduler.setRemoveOnCancelPolicy(true);
        return scheduler;
    }

    @Bean(name = "workerIoExecutor", destroyMethod = "shutdownNow")
    public ExecutorService workerIoExecutor() {
        return Executors.newCachedThreadPool(daemonThreads("worker-io-"));
    }

    private static ThreadFactory daemonThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, prefix + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }
}
