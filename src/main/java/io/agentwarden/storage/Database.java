package io.agentwarden.storage;

import io.agentwarden.config.AgentWardenConfig;

import java.io.IOException;
import java.nio.file.Files;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Properties;
import java.util.Set;

/**
 * Owns the SQLite file shared by the supervisor, the CLI and every worker.
 * Connections are short-lived; each one waits up to {@link #BUSY_TIMEOUT_MS}
 * for a competing writer and opens write transactions in IMMEDIATE mode.
 */
public final class Database {
    public static final int BUSY_TIMEOUT_MS = 5_000;
    private static final String MIGRATION_SCHEMA_VERSION = "agentwarden.schema.migration.v1";
    private final AgentWardenConfig config;
    private final String jdbcUrl;

    public Database(AgentWardenConfig config) {
        this.config = config;
        this.jdbcUrl = "jdbc:sqlite:" + config.dbFile().toString();
    }

    public void init() {
        initDirectories();
        initSchema();
        applyAndValidatePragmas();
    }

    public Connection openConnection() throws SQLException {
        Properties props = new Properties();
        props.setProperty("busy_timeout", Integer.toString(BUSY_TIMEOUT_MS));
        props.setProperty("transaction_mode", "IMMEDIATE");
        props.setProperty("foreign_keys", "true");
        return DriverManager.getConnection(jdbcUrl, props);
    }

    private void initDirectories() {
        try {
            Files.createDirectories(config.rootDir());
            Files.createDirectories(config.auditRoot());
            Files.createDirectories(config.statusRoot());
            Files.createDirectories(config.logsRoot());
        } catch (IOException e) {
            throw new RuntimeException("Failed to initialize directories", e);
        }
    }

    private void initSchema() {
        try (Connection conn = openConnection(); Statement st = conn.createStatement()) {
            st.execute("""
                    CREATE TABLE IF NOT EXISTS role_locks (
                        role TEXT PRIMARY KEY,
                        holder_pid INTEGER NOT NULL,
                        acquired_at_ms INTEGER NOT NULL
                    )
                    """);
            st.execute("""
                    CREATE TABLE IF NOT EXISTS heartbeats (
                        role TEXT PRIMARY KEY,
                        pid INTEGER NOT NULL,
                        timestamp_ms INTEGER NOT NULL,
                        cpu_percent REAL NOT NULL DEFAULT 0,
                        memory_bytes INTEGER NOT NULL DEFAULT 0
                    )
                    """);
            st.execute("""
                    CREATE TABLE IF NOT EXISTS messages (
                        msg_id TEXT PRIMARY KEY,
                        sender TEXT NOT NULL,
                        recipient TEXT NOT NULL,
                        msg_type TEXT NOT NULL,
                        payload TEXT NOT NULL,
                        priority INTEGER NOT NULL DEFAULT 5,
                        status TEXT NOT NULL,
                        created_at_ms INTEGER NOT NULL
                    )
                    """);
            ensureMessageColumns(conn);
            st.execute("""
                    CREATE TABLE IF NOT EXISTS metrics (
                        id INTEGER PRIMARY KEY AUTOINCREMENT,
                        role TEXT NOT NULL,
                        operation_type TEXT NOT NULL,
                        duration_ms INTEGER NOT NULL,
                        timestamp_ms INTEGER NOT NULL
                    )
                    """);
            st.execute("""
                    CREATE TABLE IF NOT EXISTS worker_status (
                        role TEXT PRIMARY KEY,
                        snapshot_json TEXT NOT NULL,
                        updated_at_ms INTEGER NOT NULL
                    )
                    """);
            st.execute("""
                    CREATE TABLE IF NOT EXISTS alerts (
                        id INTEGER PRIMARY KEY AUTOINCREMENT,
                        role TEXT,
                        kind TEXT NOT NULL,
                        severity TEXT NOT NULL,
                        message TEXT NOT NULL,
                        created_at_ms INTEGER NOT NULL
                    )
                    """);
            ensureSchemaMigrationsTable(conn);
            applyVersionedMigrations(conn);

            st.execute("CREATE INDEX IF NOT EXISTS idx_messages_recipient_status ON messages(recipient, status)");
            st.execute("CREATE INDEX IF NOT EXISTS idx_messages_priority_created ON messages(priority, created_at_ms)");
            st.execute("CREATE INDEX IF NOT EXISTS idx_metrics_role_time ON metrics(role, timestamp_ms)");
            st.execute("CREATE INDEX IF NOT EXISTS idx_alerts_time ON alerts(created_at_ms)");
        } catch (SQLException e) {
            throw new RuntimeException("Failed to initialize SQLite schema", e);
        }
    }

    private void ensureMessageColumns(Connection conn) throws SQLException {
        Set<String> columns = new HashSet<>();
        try (Statement st = conn.createStatement();
             ResultSet rs = st.executeQuery("PRAGMA table_info(messages)")) {
            while (rs.next()) {
                columns.add(rs.getString("name").toLowerCase());
            }
        }
        try (Statement st = conn.createStatement()) {
            if (!columns.contains("claimed_by")) {
                st.execute("ALTER TABLE messages ADD COLUMN claimed_by INTEGER");
            }
            if (!columns.contains("claimed_at_ms")) {
                st.execute("ALTER TABLE messages ADD COLUMN claimed_at_ms INTEGER");
            }
            if (!columns.contains("completed_at_ms")) {
                st.execute("ALTER TABLE messages ADD COLUMN completed_at_ms INTEGER");
            }
            if (!columns.contains("error")) {
                st.execute("ALTER TABLE messages ADD COLUMN error TEXT");
            }
        }
    }

    private void ensureSchemaMigrationsTable(Connection conn) throws SQLException {
        try (Statement st = conn.createStatement()) {
            st.execute("""
                    CREATE TABLE IF NOT EXISTS schema_migrations (
                        version TEXT PRIMARY KEY,
                        description TEXT NOT NULL,
                        checksum TEXT NOT NULL,
                        applied_at_ms INTEGER NOT NULL,
                        success INTEGER NOT NULL
                    )
                    """);
        }
    }

    private void applyVersionedMigrations(Connection conn) throws SQLException {
        List<MigrationStep> steps = new ArrayList<>();
        steps.add(new MigrationStep(
                "20261001_001_finished_message_retention",
                "Index finished messages by completion time for retention purges",
                List.of("CREATE INDEX IF NOT EXISTS idx_messages_status_completed ON messages(status, completed_at_ms)")
        ));
        steps.add(new MigrationStep(
                "20261001_002_inflight_by_consumer",
                "Index in-flight messages by consumer pid",
                List.of("CREATE INDEX IF NOT EXISTS idx_messages_claimed_by ON messages(recipient, claimed_by, status)")
        ));
        for (MigrationStep step : steps) {
            if (isMigrationApplied(conn, step.version())) {
                continue;
            }
            applyMigration(conn, step);
        }
    }

    private boolean isMigrationApplied(Connection conn, String version) throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement(
                "SELECT 1 FROM schema_migrations WHERE version=? AND success=1 LIMIT 1")) {
            ps.setString(1, version);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next();
            }
        }
    }

    private void applyMigration(Connection conn, MigrationStep step) throws SQLException {
        String checksum = checksum(step);
        try (Statement st = conn.createStatement()) {
            for (String sql : step.sql()) {
                st.execute(sql);
            }
        }
        try (PreparedStatement ps = conn.prepareStatement(
                "INSERT OR REPLACE INTO schema_migrations(version,description,checksum,applied_at_ms,success) VALUES(?,?,?,?,1)")) {
            ps.setString(1, step.version());
            ps.setString(2, step.description());
            ps.setString(3, checksum);
            ps.setLong(4, Instant.now().toEpochMilli());
            ps.executeUpdate();
        }
    }

    private String checksum(MigrationStep step) {
        StringBuilder sb = new StringBuilder();
        sb.append(MIGRATION_SCHEMA_VERSION).append('|')
                .append(step.version()).append('|')
                .append(step.description()).append('|');
        for (String sql : step.sql()) {
            sb.append(sql).append(';');
        }
        return Integer.toHexString(sb.toString().hashCode());
    }

    private record MigrationStep(String version, String description, List<String> sql) {
    }

    private void applyAndValidatePragmas() {
        try (Connection conn = openConnection(); Statement st = conn.createStatement()) {
            st.execute("PRAGMA journal_mode=WAL");
            st.execute("PRAGMA synchronous=NORMAL");

            validatePragma(st, "journal_mode", "wal");
            validatePragma(st, "synchronous", "1");
            validatePragma(st, "busy_timeout", Integer.toString(BUSY_TIMEOUT_MS));
        } catch (SQLException e) {
            throw new RuntimeException("Failed to apply SQLite pragmas", e);
        }
    }

    private void validatePragma(Statement st, String pragma, String expected) throws SQLException {
        try (ResultSet rs = st.executeQuery("PRAGMA " + pragma)) {
            if (!rs.next()) {
                throw new IllegalStateException("PRAGMA " + pragma + " did not return a value");
            }
            String actual = rs.getString(1);
            if (actual == null || !actual.equalsIgnoreCase(expected)) {
                throw new IllegalStateException(
                        "PRAGMA " + pragma + " mismatch, expected=" + expected + ", actual=" + actual
                );
            }
        }
    }

    public List<SchemaMigrationRow> listSchemaMigrations() {
        String sql = "SELECT version,description,checksum,applied_at_ms,success FROM schema_migrations ORDER BY version ASC";
        List<SchemaMigrationRow> out = new ArrayList<>();
        try (Connection c = openConnection(); PreparedStatement ps = c.prepareStatement(sql);
             ResultSet rs = ps.executeQuery()) {
            while (rs.next()) {
                out.add(new SchemaMigrationRow(
                        rs.getString("version"),
                        rs.getString("description"),
                        rs.getString("checksum"),
                        rs.getLong("applied_at_ms"),
                        rs.getInt("success") == 1
                ));
            }
            return out;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to list schema migrations", e);
        }
    }

    public record SchemaMigrationRow(String version, String description, String checksum, long appliedAtMs,
                                     boolean success) {
    }
}
