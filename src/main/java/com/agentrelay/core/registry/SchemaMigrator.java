package com.agentrelay.core.registry;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Brings the {@code tasks} table up to {@link #CURRENT_VERSION}.
 * <p>
 * The version lives in {@code PRAGMA user_version}. Databases written before versioning existed
 * report 0 and are classified from their table DDL: without the {@code completed_with_*} statuses
 * in the CHECK constraint the table is version 1.
 * <p>
 * Each upgrade runs in a single transaction; a failure leaves the database at its previous version.
 */
public class SchemaMigrator {

    private static final Logger log = LoggerFactory.getLogger(SchemaMigrator.class);

    public static final int CURRENT_VERSION = 3;

    static final String TABLE_NAME = "tasks";
    static final String BACKUP_TABLE_NAME = "tasks_backup";

    /** Column layout shared by v1 and v2; v3 appends {@code error_code}. */
    static final List<String> BASE_COLUMNS = List.of(
            "id", "external_id", "alias", "origin", "status", "instruction", "working_dir", "env_id",
            "mode", "model", "created_at", "updated_at", "completed_at", "last_event_at", "progress_steps",
            "poll_frequency_ms", "keep_alive_until", "thread_id", "user_id", "result", "error", "metadata");

    /** Table as created by the first release; kept so tests can build a legacy database. */
    static final String CREATE_TABLE_V1_SQL = """
            CREATE TABLE IF NOT EXISTS %s (
                id                TEXT PRIMARY KEY,
                external_id       TEXT,
                alias             TEXT,
                origin            TEXT NOT NULL CHECK (origin IN ('local', 'cloud')),
                status            TEXT NOT NULL CHECK (status IN ('pending', 'working', 'completed', 'failed', 'canceled')),
                instruction       TEXT NOT NULL,
                working_dir       TEXT,
                env_id            TEXT,
                mode              TEXT,
                model             TEXT,
                created_at        INTEGER NOT NULL,
                updated_at        INTEGER NOT NULL,
                completed_at      INTEGER,
                last_event_at     INTEGER,
                progress_steps    TEXT,
                poll_frequency_ms INTEGER,
                keep_alive_until  INTEGER,
                thread_id         TEXT,
                user_id           TEXT,
                result            TEXT,
                error             TEXT,
                metadata          TEXT
            )
            """.formatted(TABLE_NAME);

    static final String CREATE_TABLE_V2_SQL = """
            CREATE TABLE IF NOT EXISTS %s (
                id                TEXT PRIMARY KEY,
                external_id       TEXT,
                alias             TEXT,
                origin            TEXT NOT NULL CHECK (origin IN ('local', 'cloud')),
                status            TEXT NOT NULL CHECK (status IN ('pending', 'working', 'completed',
                                      'completed_with_warnings', 'completed_with_errors',
                                      'failed', 'canceled', 'unknown')),
                instruction       TEXT NOT NULL,
                working_dir       TEXT,
                env_id            TEXT,
                mode              TEXT,
                model             TEXT,
                created_at        INTEGER NOT NULL,
                updated_at        INTEGER NOT NULL,
                completed_at      INTEGER,
                last_event_at     INTEGER,
                progress_steps    TEXT,
                poll_frequency_ms INTEGER,
                keep_alive_until  INTEGER,
                thread_id         TEXT,
                user_id           TEXT,
                result            TEXT,
                error             TEXT,
                metadata          TEXT
            )
            """.formatted(TABLE_NAME);

    private static final String ADD_ERROR_CODE_SQL = """
            ALTER TABLE %s ADD COLUMN error_code TEXT
            """.formatted(TABLE_NAME);

    private static final List<String> CREATE_INDEX_SQL = List.of(
            "CREATE INDEX IF NOT EXISTS idx_status_updated ON tasks (status, updated_at DESC)",
            "CREATE INDEX IF NOT EXISTS idx_origin_status ON tasks (origin, status, updated_at DESC)",
            "CREATE INDEX IF NOT EXISTS idx_working_dir ON tasks (working_dir, updated_at DESC)",
            "CREATE INDEX IF NOT EXISTS idx_user_thread ON tasks (user_id, thread_id, updated_at DESC)",
            "CREATE INDEX IF NOT EXISTS idx_created_at ON tasks (created_at DESC)");

    private static final String SELECT_TABLE_DDL_SQL = """
            SELECT sql FROM sqlite_master WHERE type = 'table' AND name = ?
            """;

    private static final String STATUS_RESTORE_EXPR = """
            CASE WHEN status IN ('pending', 'working', 'completed', 'completed_with_warnings',
                                 'completed_with_errors', 'failed', 'canceled', 'unknown')
                 THEN status ELSE 'unknown' END""";

    private final DataSource dataSource;

    public SchemaMigrator(DataSource dataSource) {
        this.dataSource = Objects.requireNonNull(dataSource, "DataSource must not be null");
    }

    /**
     * Creates or upgrades the schema.
     *
     * @return the version the database was at before migrating (0 for a new database)
     */
    public int migrate() throws SQLException {
        try (Connection conn = dataSource.getConnection()) {
            int startVersion = detectVersion(conn);
            if (startVersion > CURRENT_VERSION) {
                throw new SQLException("Task database schema version " + startVersion
                        + " is newer than supported version " + CURRENT_VERSION);
            }
            if (startVersion == CURRENT_VERSION) {
                log.debug("Task schema is current (v{})", CURRENT_VERSION);
                return startVersion;
            }

            boolean autoCommit = conn.getAutoCommit();
            conn.setAutoCommit(false);
            try {
                if (startVersion == 0) {
                    createFresh(conn);
                } else {
                    if (startVersion < 2) {
                        rebuildWithExtendedStatuses(conn);
                    }
                    if (startVersion < 3 && !hasColumn(conn, TABLE_NAME, "error_code")) {
                        execute(conn, ADD_ERROR_CODE_SQL);
                    }
                }
                for (String index : CREATE_INDEX_SQL) {
                    execute(conn, index);
                }
                execute(conn, "PRAGMA user_version = " + CURRENT_VERSION);
                conn.commit();
            } catch (SQLException e) {
                conn.rollback();
                throw e;
            } finally {
                conn.setAutoCommit(autoCommit);
            }

            if (startVersion == 0) {
                log.info("Task table '{}' created at schema v{}", TABLE_NAME, CURRENT_VERSION);
            } else {
                log.info("Task schema migrated from v{} to v{}", startVersion, CURRENT_VERSION);
            }
            return startVersion;
        }
    }

    /**
     * Reads {@code user_version}, falling back to DDL inspection for unversioned databases.
     * Returns 0 when the table does not exist.
     */
    int detectVersion(Connection conn) throws SQLException {
        int userVersion = queryInt(conn, "PRAGMA user_version");
        if (userVersion > 0) {
            return userVersion;
        }
        String ddl = tableDdl(conn, TABLE_NAME);
        if (ddl == null) {
            return 0;
        }
        if (!ddl.contains("completed_with_warnings")) {
            return 1;
        }
        return hasColumn(conn, TABLE_NAME, "error_code") ? 3 : 2;
    }

    // ── Steps ────────────────────────────────────────────────────────────

    private void createFresh(Connection conn) throws SQLException {
        execute(conn, CREATE_TABLE_V2_SQL);
        execute(conn, ADD_ERROR_CODE_SQL);
    }

    /**
     * SQLite cannot alter a CHECK constraint, so the table is copied out and back in.
     */
    private void rebuildWithExtendedStatuses(Connection conn) throws SQLException {
        log.info("Upgrading task table status constraint; backing rows up into '{}'", BACKUP_TABLE_NAME);
        execute(conn, "DROP TABLE IF EXISTS " + BACKUP_TABLE_NAME);
        execute(conn, "CREATE TABLE %s AS SELECT * FROM %s".formatted(BACKUP_TABLE_NAME, TABLE_NAME));
        execute(conn, "DROP TABLE " + TABLE_NAME);
        execute(conn, CREATE_TABLE_V2_SQL);

        Set<String> backupColumns = columns(conn, BACKUP_TABLE_NAME);
        List<String> restored = new ArrayList<>();
        List<String> selected = new ArrayList<>();
        for (String column : BASE_COLUMNS) {
            if (backupColumns.contains(column)) {
                restored.add(column);
                selected.add("status".equals(column) ? STATUS_RESTORE_EXPR : column);
            }
        }
        try (Statement stmt = conn.createStatement()) {
            int rows = stmt.executeUpdate("INSERT INTO %s (%s) SELECT %s FROM %s".formatted(
                    TABLE_NAME, String.join(", ", restored), String.join(", ", selected), BACKUP_TABLE_NAME));
            log.info("Restored {} task rows", rows);
        }
        execute(conn, "DROP TABLE " + BACKUP_TABLE_NAME);
    }

    // ── Helpers ───────────────────────────────────────────────────────────

    private static void execute(Connection conn, String sql) throws SQLException {
        try (Statement stmt = conn.createStatement()) {
            stmt.execute(sql);
        }
    }

    private static int queryInt(Connection conn, String sql) throws SQLException {
        try (Statement stmt = conn.createStatement();
             ResultSet rs = stmt.executeQuery(sql)) {
            return rs.next() ? rs.getInt(1) : 0;
        }
    }

    private static String tableDdl(Connection conn, String table) throws SQLException {
        try (PreparedStatement stmt = conn.prepareStatement(SELECT_TABLE_DDL_SQL)) {
            stmt.setString(1, table);
            try (ResultSet rs = stmt.executeQuery()) {
                return rs.next() ? rs.getString(1) : null;
            }
        }
    }

    private static boolean hasColumn(Connection conn, String table, String column) throws SQLException {
        return columns(conn, table).contains(column);
    }

    private static Set<String> columns(Connection conn, String table) throws SQLException {
        Set<String> names = new LinkedHashSet<>();
        try (Statement stmt = conn.createStatement();
             ResultSet rs = stmt.executeQuery("PRAGMA table_info(" + table + ")")) {
            while (rs.next()) {
                names.add(rs.getString("name"));
            }
        }
        return names;
    }
}
