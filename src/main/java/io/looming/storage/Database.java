package io.looming.storage;

import io.looming.config.LoomingConfig;

import java.io.IOException;
import java.nio.file.Files;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Clock;
import java.time.Duration;
import java.util.Properties;

/**
 * SQLite access point. Every store opens a short-lived connection per operation
 * through {@link #withConnection} or {@link #inTransaction}, both guarded by the
 * persistence circuit breaker.
 */
public final class Database {
    private final LoomingConfig config;
    private final String jdbcUrl;
    private final PersistenceCircuitBreaker breaker;

    public Database(LoomingConfig config) {
        this(config, new PersistenceCircuitBreaker(
                LoomingConfig.DEFAULT_PERSISTENCE_FAILURE_THRESHOLD,
                Duration.ofMillis(LoomingConfig.DEFAULT_PERSISTENCE_COOLDOWN_MS),
                Clock.systemUTC()
        ));
    }

    public Database(LoomingConfig config, PersistenceCircuitBreaker breaker) {
        this.config = config;
        this.jdbcUrl = "jdbc:sqlite:" + config.dbFile().toString();
        this.breaker = breaker;
    }

    public void init() {
        initDirectories();
        initSchema();
        applyAndValidatePragmas();
    }

    public PersistenceCircuitBreaker breaker() {
        return breaker;
    }

    public Connection openConnection() throws SQLException {
        Properties props = new Properties();
        props.setProperty("busy_timeout", "5000");
        props.setProperty("foreign_keys", "true");
        return DriverManager.getConnection(jdbcUrl, props);
    }

    public <T> T withConnection(String action, SqlWork<T> work) {
        if (breaker.isOpen()) {
            throw PersistenceException.circuitOpen(action);
        }
        try (Connection c = openConnection()) {
            T result = work.apply(c);
            breaker.recordSuccess();
            return result;
        } catch (SQLException e) {
            breaker.recordFailure(e);
            throw new PersistenceException(PersistenceException.Kind.TRANSIENT, "Failed " + action, e);
        }
    }

    public <T> T inTransaction(String action, SqlWork<T> work) {
        return withConnection(action, c -> {
            c.setAutoCommit(false);
            try {
                T result = work.apply(c);
                c.commit();
                return result;
            } catch (SQLException | RuntimeException e) {
                c.rollback();
                throw e;
            } finally {
                c.setAutoCommit(true);
            }
        });
    }

    private void initDirectories() {
        try {
            Files.createDirectories(config.rootDir());
            Files.createDirectories(config.auditRoot());
            Files.createDirectories(config.narrativesRoot());
        } catch (IOException e) {
            throw new RuntimeException("Failed to initialize directories", e);
        }
    }

    private void initSchema() {
        try (Connection conn = openConnection(); Statement st = conn.createStatement()) {
            st.execute("""
                    CREATE TABLE IF NOT EXISTS narrative_executions (
                        execution_id TEXT PRIMARY KEY,
                        narrative_name TEXT NOT NULL,
                        actor_name TEXT,
                        task_id TEXT,
                        status TEXT NOT NULL,
                        failure_reason TEXT,
                        error_detail TEXT,
                        started_at_ms INTEGER NOT NULL,
                        completed_at_ms INTEGER
                    )
                    """);
            st.execute("""
                    CREATE TABLE IF NOT EXISTS act_executions (
                        id INTEGER PRIMARY KEY AUTOINCREMENT,
                        execution_id TEXT NOT NULL,
                        act_name TEXT NOT NULL,
                        sequence_number INTEGER NOT NULL,
                        model TEXT NOT NULL,
                        temperature REAL,
                        max_tokens INTEGER,
                        response TEXT NOT NULL,
                        prompt_tokens INTEGER NOT NULL DEFAULT 0,
                        completion_tokens INTEGER NOT NULL DEFAULT 0,
                        created_at_ms INTEGER NOT NULL,
                        UNIQUE(execution_id, sequence_number),
                        FOREIGN KEY(execution_id) REFERENCES narrative_executions(execution_id)
                    )
                    """);
            st.execute("""
                    CREATE TABLE IF NOT EXISTS act_inputs (
                        id INTEGER PRIMARY KEY AUTOINCREMENT,
                        act_execution_id INTEGER NOT NULL,
                        input_order INTEGER NOT NULL,
                        input_kind TEXT NOT NULL,
                        content TEXT NOT NULL,
                        content_hash TEXT NOT NULL,
                        created_at_ms INTEGER NOT NULL,
                        FOREIGN KEY(act_execution_id) REFERENCES act_executions(id)
                    )
                    """);
            st.execute("""
                    CREATE TABLE IF NOT EXISTS act_processor_results (
                        id INTEGER PRIMARY KEY AUTOINCREMENT,
                        act_execution_id INTEGER NOT NULL,
                        processor TEXT NOT NULL,
                        success INTEGER NOT NULL,
                        row_count INTEGER NOT NULL DEFAULT 0,
                        error_kind TEXT,
                        error_detail TEXT,
                        created_at_ms INTEGER NOT NULL,
                        FOREIGN KEY(act_execution_id) REFERENCES act_executions(id)
                    )
                    """);
            st.execute("""
                    CREATE TABLE IF NOT EXISTS task_state (
                        task_id TEXT PRIMARY KEY,
                        actor_name TEXT NOT NULL,
                        narrative TEXT NOT NULL DEFAULT '',
                        last_run_ms INTEGER,
                        next_run_ms INTEGER NOT NULL,
                        consecutive_failures INTEGER NOT NULL DEFAULT 0 CHECK(consecutive_failures >= 0),
                        is_paused INTEGER NOT NULL DEFAULT 0,
                        paused_at_ms INTEGER,
                        pause_reason TEXT,
                        probe_pending INTEGER NOT NULL DEFAULT 0,
                        lease_owner TEXT,
                        lease_token TEXT,
                        lease_expires_at_ms INTEGER,
                        metadata TEXT NOT NULL DEFAULT '{}',
                        updated_at_ms INTEGER NOT NULL
                    )
                    """);
            st.execute("""
                    CREATE TABLE IF NOT EXISTS actor_executions (
                        id INTEGER PRIMARY KEY AUTOINCREMENT,
                        task_id TEXT NOT NULL,
                        actor_name TEXT NOT NULL,
                        narrative_execution_id TEXT,
                        started_at_ms INTEGER NOT NULL,
                        completed_at_ms INTEGER,
                        success INTEGER NOT NULL DEFAULT 0,
                        error_message TEXT
                    )
                    """);
            st.execute("""
                    CREATE TABLE IF NOT EXISTS state_entries (
                        scope_type TEXT NOT NULL,
                        scope_id TEXT NOT NULL,
                        state_key TEXT NOT NULL,
                        value_kind TEXT NOT NULL,
                        value TEXT NOT NULL,
                        updated_at_ms INTEGER NOT NULL,
                        PRIMARY KEY(scope_type, scope_id, state_key)
                    )
                    """);
            st.execute("""
                    CREATE TABLE IF NOT EXISTS generated_content (
                        id INTEGER PRIMARY KEY AUTOINCREMENT,
                        target_table TEXT NOT NULL,
                        execution_id TEXT,
                        act_name TEXT,
                        row_json TEXT NOT NULL,
                        content_hash TEXT NOT NULL,
                        created_at_ms INTEGER NOT NULL
                    )
                    """);

            st.execute("CREATE INDEX IF NOT EXISTS idx_narrative_executions_name ON narrative_executions(narrative_name)");
            st.execute("CREATE INDEX IF NOT EXISTS idx_narrative_executions_status ON narrative_executions(status)");
            st.execute("CREATE INDEX IF NOT EXISTS idx_act_executions_execution ON act_executions(execution_id, sequence_number)");
            st.execute("CREATE INDEX IF NOT EXISTS idx_act_inputs_act ON act_inputs(act_execution_id, input_order)");
            st.execute("CREATE INDEX IF NOT EXISTS idx_processor_results_act ON act_processor_results(act_execution_id)");
            st.execute("CREATE INDEX IF NOT EXISTS idx_task_state_due ON task_state(is_paused, next_run_ms)");
            st.execute("CREATE INDEX IF NOT EXISTS idx_task_state_actor ON task_state(actor_name)");
            st.execute("CREATE INDEX IF NOT EXISTS idx_actor_executions_task ON actor_executions(task_id, started_at_ms)");
            st.execute("CREATE INDEX IF NOT EXISTS idx_generated_content_target ON generated_content(target_table, created_at_ms)");
            st.execute("CREATE INDEX IF NOT EXISTS idx_generated_content_hash ON generated_content(target_table, content_hash)");
        } catch (SQLException e) {
            throw new RuntimeException("Failed to initialize SQLite schema", e);
        }
    }

    private void applyAndValidatePragmas() {
        try (Connection conn = openConnection(); Statement st = conn.createStatement()) {
            st.execute("PRAGMA journal_mode=WAL");
            st.execute("PRAGMA synchronous=NORMAL");

            validatePragma(st, "journal_mode", "wal");
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

    @FunctionalInterface
    public interface SqlWork<T> {
        T apply(Connection c) throws SQLException;
    }
}
