package io.agentmail.storage;

import io.agentmail.config.AgentMailConfig;
import io.agentmail.error.CoordinationException;
import io.agentmail.util.Hashing;

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
import java.util.List;
import java.util.Properties;

/**
 * Owns the SQLite file: schema, versioned migrations, pragmas and transaction demarcation.
 *
 * <p>Connections open their transactions in {@code IMMEDIATE} mode, so a transaction holds the
 * database write lock from its first statement. Check-then-insert sequences (reservation conflict
 * checks, recipient resolution before fan-out) are therefore serialized across threads and
 * processes without an in-process lock manager.
 */
public final class Database {
    private static final String MIGRATION_SCHEMA_VERSION = "agentmail.schema.migration.v1";
    private final AgentMailConfig config;
    private final String jdbcUrl;
    private final int busyTimeoutMs;

    public Database(AgentMailConfig config) {
        this(config, AgentMailConfig.DEFAULT_BUSY_TIMEOUT_MS);
    }

    public Database(AgentMailConfig config, int busyTimeoutMs) {
        this.config = config;
        this.jdbcUrl = "jdbc:sqlite:" + config.dbFile().toString();
        this.busyTimeoutMs = Math.max(0, busyTimeoutMs);
    }

    public void init() {
        initDirectories();
        initSchema();
        applyAndValidatePragmas();
    }

    public Connection openConnection() throws SQLException {
        Properties props = new Properties();
        props.setProperty("transaction_mode", "IMMEDIATE");
        props.setProperty("busy_timeout", String.valueOf(busyTimeoutMs));
        props.setProperty("foreign_keys", "true");
        props.setProperty("synchronous", "NORMAL");
        return DriverManager.getConnection(jdbcUrl, props);
    }

    /**
     * Runs {@code work} in one transaction. Any exception rolls the transaction back;
     * {@link CoordinationException}s reach the caller unchanged, anything else is wrapped with
     * the operation name.
     */
    public <T> T inTransaction(String operation, Work<T> work) {
        try (Connection c = openConnection()) {
            c.setAutoCommit(false);
            try {
                T out = work.run(c);
                c.commit();
                return out;
            } catch (Exception e) {
                c.rollback();
                throw e;
            } finally {
                c.setAutoCommit(true);
            }
        } catch (CoordinationException e) {
            throw e;
        } catch (Exception e) {
            throw new RuntimeException("Failed to " + operation, e);
        }
    }

    /**
     * Runs read-only {@code work} on an auto-commit connection.
     */
    public <T> T read(String operation, Work<T> work) {
        try (Connection c = openConnection()) {
            return work.run(c);
        } catch (CoordinationException e) {
            throw e;
        } catch (Exception e) {
            throw new RuntimeException("Failed to " + operation, e);
        }
    }

    @FunctionalInterface
    public interface Work<T> {
        T run(Connection c) throws SQLException;
    }

    private void initDirectories() {
        try {
            Files.createDirectories(config.rootDir());
            Files.createDirectories(config.auditRoot());
        } catch (IOException e) {
            throw new RuntimeException("Failed to initialize directories", e);
        }
    }

    private void initSchema() {
        try (Connection conn = openConnection(); Statement st = conn.createStatement()) {
            st.execute("""
                    CREATE TABLE IF NOT EXISTS projects (
                        id INTEGER PRIMARY KEY AUTOINCREMENT,
                        slug TEXT NOT NULL UNIQUE,
                        human_key TEXT NOT NULL,
                        created_at INTEGER NOT NULL
                    )
                    """);
            st.execute("""
                    CREATE TABLE IF NOT EXISTS products (
                        id INTEGER PRIMARY KEY AUTOINCREMENT,
                        product_uid TEXT NOT NULL,
                        name TEXT NOT NULL,
                        created_at INTEGER NOT NULL,
                        CONSTRAINT uq_product_uid UNIQUE(product_uid),
                        CONSTRAINT uq_product_name UNIQUE(name)
                    )
                    """);
            st.execute("""
                    CREATE TABLE IF NOT EXISTS product_project_links (
                        id INTEGER PRIMARY KEY AUTOINCREMENT,
                        product_id INTEGER NOT NULL,
                        project_id INTEGER NOT NULL,
                        created_at INTEGER NOT NULL,
                        CONSTRAINT uq_product_project UNIQUE(product_id, project_id),
                        FOREIGN KEY(product_id) REFERENCES products(id),
                        FOREIGN KEY(project_id) REFERENCES projects(id)
                    )
                    """);
            st.execute("""
                    CREATE TABLE IF NOT EXISTS agents (
                        id INTEGER PRIMARY KEY AUTOINCREMENT,
                        project_id INTEGER NOT NULL,
                        name TEXT NOT NULL,
                        program TEXT NOT NULL DEFAULT '',
                        model TEXT NOT NULL DEFAULT '',
                        task_description TEXT NOT NULL DEFAULT '',
                        inception_ts INTEGER NOT NULL,
                        last_active_ts INTEGER NOT NULL,
                        attachments_policy TEXT NOT NULL DEFAULT 'auto',
                        contact_policy TEXT NOT NULL DEFAULT 'auto',
                        deregistered_ts INTEGER,
                        CONSTRAINT uq_agent_project_name UNIQUE(project_id, name),
                        FOREIGN KEY(project_id) REFERENCES projects(id)
                    )
                    """);
            st.execute("""
                    CREATE TABLE IF NOT EXISTS messages (
                        id INTEGER PRIMARY KEY AUTOINCREMENT,
                        project_id INTEGER NOT NULL,
                        sender_id INTEGER NOT NULL,
                        thread_id TEXT,
                        subject TEXT NOT NULL,
                        body_md TEXT NOT NULL,
                        importance TEXT NOT NULL DEFAULT 'normal',
                        ack_required INTEGER NOT NULL DEFAULT 0,
                        created_ts INTEGER NOT NULL,
                        attachments TEXT NOT NULL DEFAULT '[]',
                        FOREIGN KEY(project_id) REFERENCES projects(id),
                        FOREIGN KEY(sender_id) REFERENCES agents(id)
                    )
                    """);
            st.execute("""
                    CREATE TABLE IF NOT EXISTS message_recipients (
                        message_id INTEGER NOT NULL,
                        agent_id INTEGER NOT NULL,
                        kind TEXT NOT NULL DEFAULT 'to',
                        read_ts INTEGER,
                        ack_ts INTEGER,
                        PRIMARY KEY(message_id, agent_id),
                        FOREIGN KEY(message_id) REFERENCES messages(id) ON DELETE CASCADE,
                        FOREIGN KEY(agent_id) REFERENCES agents(id)
                    )
                    """);
            st.execute("""
                    CREATE TABLE IF NOT EXISTS file_reservations (
                        id INTEGER PRIMARY KEY AUTOINCREMENT,
                        project_id INTEGER NOT NULL,
                        agent_id INTEGER NOT NULL,
                        path_pattern TEXT NOT NULL,
                        exclusive INTEGER NOT NULL DEFAULT 1,
                        reason TEXT NOT NULL DEFAULT '',
                        created_ts INTEGER NOT NULL,
                        expires_ts INTEGER NOT NULL,
                        released_ts INTEGER,
                        CHECK (expires_ts > created_ts),
                        FOREIGN KEY(project_id) REFERENCES projects(id),
                        FOREIGN KEY(agent_id) REFERENCES agents(id)
                    )
                    """);
            st.execute("""
                    CREATE TABLE IF NOT EXISTS agent_links (
                        id INTEGER PRIMARY KEY AUTOINCREMENT,
                        a_project_id INTEGER NOT NULL,
                        a_agent_id INTEGER NOT NULL,
                        b_project_id INTEGER NOT NULL,
                        b_agent_id INTEGER NOT NULL,
                        status TEXT NOT NULL DEFAULT 'pending',
                        reason TEXT NOT NULL DEFAULT '',
                        created_ts INTEGER NOT NULL,
                        updated_ts INTEGER NOT NULL,
                        expires_ts INTEGER,
                        CONSTRAINT uq_agentlink_pair UNIQUE(a_project_id, a_agent_id, b_project_id, b_agent_id),
                        FOREIGN KEY(a_agent_id) REFERENCES agents(id),
                        FOREIGN KEY(b_agent_id) REFERENCES agents(id)
                    )
                    """);
            st.execute("""
                    CREATE TABLE IF NOT EXISTS project_sibling_suggestions (
                        id INTEGER PRIMARY KEY AUTOINCREMENT,
                        project_a_id INTEGER NOT NULL,
                        project_b_id INTEGER NOT NULL,
                        score REAL NOT NULL DEFAULT 0.0,
                        status TEXT NOT NULL DEFAULT 'suggested',
                        rationale TEXT NOT NULL DEFAULT '',
                        created_ts INTEGER NOT NULL,
                        evaluated_ts INTEGER NOT NULL,
                        confirmed_ts INTEGER,
                        dismissed_ts INTEGER,
                        CONSTRAINT uq_project_sibling_pair UNIQUE(project_a_id, project_b_id),
                        CHECK (project_a_id < project_b_id),
                        FOREIGN KEY(project_a_id) REFERENCES projects(id),
                        FOREIGN KEY(project_b_id) REFERENCES projects(id)
                    )
                    """);
            ensureSchemaMigrationsTable(conn);
            applyVersionedMigrations(conn);

            st.execute("CREATE INDEX IF NOT EXISTS idx_agents_project ON agents(project_id)");
            st.execute("CREATE INDEX IF NOT EXISTS idx_agents_name ON agents(name)");
            st.execute("CREATE INDEX IF NOT EXISTS idx_messages_project_created ON messages(project_id, created_ts)");
            st.execute("CREATE INDEX IF NOT EXISTS idx_messages_thread ON messages(thread_id)");
            st.execute("CREATE INDEX IF NOT EXISTS idx_messages_sender ON messages(sender_id)");
            st.execute("CREATE INDEX IF NOT EXISTS idx_recipients_agent ON message_recipients(agent_id, message_id)");
            st.execute("CREATE INDEX IF NOT EXISTS idx_reservations_project_released ON file_reservations(project_id, released_ts, expires_ts)");
            st.execute("CREATE INDEX IF NOT EXISTS idx_reservations_agent ON file_reservations(agent_id)");
            st.execute("CREATE INDEX IF NOT EXISTS idx_links_b_agent ON agent_links(b_agent_id)");
            st.execute("CREATE INDEX IF NOT EXISTS idx_product_links_project ON product_project_links(project_id)");
        } catch (SQLException e) {
            throw new RuntimeException("Failed to initialize SQLite schema", e);
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
            st.execute("CREATE INDEX IF NOT EXISTS idx_schema_migrations_applied ON schema_migrations(applied_at_ms)");
        }
    }

    private void applyVersionedMigrations(Connection conn) throws SQLException {
        List<MigrationStep> steps = new ArrayList<>();
        steps.add(new MigrationStep(
                "20261019_001_agent_links_expiry",
                "Index link lookups by status and expiry for contact resolution",
                List.of(
                        "CREATE INDEX IF NOT EXISTS idx_links_pair_status ON agent_links(a_agent_id, b_agent_id, status)",
                        "CREATE INDEX IF NOT EXISTS idx_links_expires ON agent_links(expires_ts)"
                )
        ));
        steps.add(new MigrationStep(
                "20261019_002_pending_acks",
                "Index recipients awaiting acknowledgement",
                List.of("CREATE INDEX IF NOT EXISTS idx_recipients_pending_ack ON message_recipients(agent_id, ack_ts)")
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
        return Hashing.sha256Hex(sb.toString());
    }

    private record MigrationStep(String version, String description, List<String> sql) {
    }

    private void applyAndValidatePragmas() {
        try (Connection conn = openConnection(); Statement st = conn.createStatement()) {
            st.execute("PRAGMA journal_mode=WAL");
            st.execute("PRAGMA synchronous=NORMAL");

            validatePragma(st, "journal_mode", "wal");
            validatePragma(st, "synchronous", "1");
            validatePragma(st, "foreign_keys", "1");
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

    public List<SchemaMigrationRow> listSchemaMigrations(int limit) {
        String sql = """
                SELECT version,description,checksum,applied_at_ms,success
                FROM schema_migrations
                ORDER BY applied_at_ms DESC, version DESC
                LIMIT ?
                """;
        int safeLimit = Math.max(1, limit);
        return read("list schema migrations", c -> {
            List<SchemaMigrationRow> out = new ArrayList<>();
            try (PreparedStatement ps = c.prepareStatement(sql)) {
                ps.setInt(1, safeLimit);
                try (ResultSet rs = ps.executeQuery()) {
                    while (rs.next()) {
                        out.add(new SchemaMigrationRow(
                                rs.getString("version"),
                                rs.getString("description"),
                                rs.getString("checksum"),
                                rs.getLong("applied_at_ms"),
                                rs.getInt("success") == 1
                        ));
                    }
                }
            }
            return out;
        });
    }

    public record SchemaMigrationRow(
            String version,
            String description,
            String checksum,
            long appliedAtMs,
            boolean success
    ) {
    }
}
