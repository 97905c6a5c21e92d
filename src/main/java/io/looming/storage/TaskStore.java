package io.looming.storage;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import io.looming.model.ActorExecution;
import io.looming.model.PauseReason;
import io.looming.model.TaskState;
import io.looming.util.Jsons;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.sql.Types;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Durable task scheduling state. Every mutation is a single-row atomic update
 * keyed by task id; the lease columns guarantee at most one in-flight run per task.
 */
public final class TaskStore {
    private static final TypeReference<LinkedHashMap<String, Object>> METADATA_TYPE = new TypeReference<>() {
    };

    private final Database database;

    public TaskStore(Database database) {
        this.database = database;
    }

    /**
     * Inserts a task, or refreshes actor/narrative/metadata of an existing one.
     * Scheduling state (next run, failures, pause) of an existing task is kept.
     *
     * @return true when the task was newly created
     */
    public boolean register(TaskRegistration r) {
        return database.inTransaction("register task", c -> {
            boolean exists;
            try (PreparedStatement read = c.prepareStatement("SELECT 1 FROM task_state WHERE task_id=?")) {
                read.setString(1, r.taskId());
                try (ResultSet rs = read.executeQuery()) {
                    exists = rs.next();
                }
            }
            if (exists) {
                try (PreparedStatement ps = c.prepareStatement(
                        "UPDATE task_state SET actor_name=?,narrative=?,metadata=?,updated_at_ms=? WHERE task_id=?")) {
                    ps.setString(1, r.actorName());
                    ps.setString(2, r.narrative());
                    ps.setString(3, Jsons.toCompactJson(r.metadata()));
                    ps.setLong(4, r.nowMs());
                    ps.setString(5, r.taskId());
                    ps.executeUpdate();
                }
                return false;
            }
            try (PreparedStatement ps = c.prepareStatement(
                    "INSERT INTO task_state(task_id,actor_name,narrative,next_run_ms,metadata,updated_at_ms) VALUES(?,?,?,?,?,?)")) {
                ps.setString(1, r.taskId());
                ps.setString(2, r.actorName());
                ps.setString(3, r.narrative());
                ps.setLong(4, r.firstRunMs());
                ps.setString(5, Jsons.toCompactJson(r.metadata()));
                ps.setLong(6, r.nowMs());
                ps.executeUpdate();
            }
            return true;
        });
    }

    public List<TaskState> dueTasks(long nowMs, int limit) {
        return database.withConnection("poll due tasks", c -> {
            try (PreparedStatement ps = c.prepareStatement("""
                    SELECT * FROM task_state
                    WHERE is_paused=0 AND next_run_ms<=?
                      AND (lease_owner IS NULL OR lease_expires_at_ms IS NULL OR lease_expires_at_ms<=?)
                    ORDER BY next_run_ms ASC, task_id ASC
                    LIMIT ?
                    """)) {
                ps.setLong(1, nowMs);
                ps.setLong(2, nowMs);
                ps.setInt(3, Math.max(1, limit));
                return readTasks(ps);
            }
        });
    }

    /**
     * Takes the lease and advances {@code next_run_ms} in one conditional update.
     * A task that is paused, not yet due, or leased by someone else is left alone.
     *
     * @param nextRunMs next run time, or null to park the task (one-shot schedules)
     * @return true when this caller now owns the lease
     */
    public boolean tryClaim(String taskId, String leaseOwner, String leaseToken, Long nextRunMs, long leaseExpiresAtMs, long nowMs) {
        return database.withConnection("claim task lease", c -> {
            try (PreparedStatement ps = c.prepareStatement("""
                    UPDATE task_state
                    SET lease_owner=?,lease_token=?,lease_expires_at_ms=?,last_run_ms=?,next_run_ms=?,updated_at_ms=?
                    WHERE task_id=? AND is_paused=0 AND next_run_ms<=?
                      AND (lease_owner IS NULL OR lease_expires_at_ms IS NULL OR lease_expires_at_ms<=?)
                    """)) {
                ps.setString(1, leaseOwner);
                ps.setString(2, leaseToken);
                ps.setLong(3, leaseExpiresAtMs);
                ps.setLong(4, nowMs);
                ps.setLong(5, nextRunMs == null ? Long.MAX_VALUE : nextRunMs);
                ps.setLong(6, nowMs);
                ps.setString(7, taskId);
                ps.setLong(8, nowMs);
                ps.setLong(9, nowMs);
                return ps.executeUpdate() == 1;
            }
        });
    }

    /**
     * Extends a lease this holder still owns.
     *
     * @return false when the token no longer matches (the lease was lost)
     */
    public boolean heartbeatLease(String taskId, String leaseToken, long leaseExpiresAtMs, long nowMs) {
        return database.withConnection("heartbeat task lease", c -> {
            try (PreparedStatement ps = c.prepareStatement(
                    "UPDATE task_state SET lease_expires_at_ms=?,updated_at_ms=? WHERE task_id=? AND lease_token=?")) {
                ps.setLong(1, leaseExpiresAtMs);
                ps.setLong(2, nowMs);
                ps.setString(3, taskId);
                ps.setString(4, leaseToken);
                return ps.executeUpdate() == 1;
            }
        });
    }

    public boolean releaseLease(String taskId, String leaseToken, long nowMs) {
        return database.withConnection("release task lease", c -> {
            try (PreparedStatement ps = c.prepareStatement(
                    "UPDATE task_state SET lease_owner=NULL,lease_token=NULL,lease_expires_at_ms=NULL,updated_at_ms=? WHERE task_id=? AND lease_token=?")) {
                ps.setLong(1, nowMs);
                ps.setString(2, taskId);
                ps.setString(3, leaseToken);
                return ps.executeUpdate() == 1;
            }
        });
    }

    /**
     * Any success clears the failure counter and consumes a pending probe.
     */
    public Optional<TaskState> recordSuccess(String taskId, long nowMs) {
        return database.inTransaction("record task success", c -> {
            try (PreparedStatement ps = c.prepareStatement(
                    "UPDATE task_state SET consecutive_failures=0,probe_pending=0,updated_at_ms=? WHERE task_id=?")) {
                ps.setLong(1, nowMs);
                ps.setString(2, taskId);
                ps.executeUpdate();
            }
            return readTask(c, taskId);
        });
    }

    /**
     * Increments the failure counter and trips the pause when the threshold is
     * reached, or immediately when the failed run was a post-cooldown probe.
     */
    public Optional<TaskState> recordFailure(String taskId, int threshold, boolean autoPause, long nowMs) {
        return database.inTransaction("record task failure", c -> {
            Optional<TaskState> current = readTask(c, taskId);
            if (current.isEmpty()) {
                return current;
            }
            TaskState t = current.get();
            int failures = t.consecutiveFailures() + 1;
            boolean trip = autoPause && !t.paused() && (t.probePending() || failures >= threshold);
            try (PreparedStatement ps = c.prepareStatement(trip
                    ? "UPDATE task_state SET consecutive_failures=?,probe_pending=0,is_paused=1,paused_at_ms=?,pause_reason=?,updated_at_ms=? WHERE task_id=?"
                    : "UPDATE task_state SET consecutive_failures=?,probe_pending=0,updated_at_ms=? WHERE task_id=?")) {
                int idx = 1;
                ps.setInt(idx++, failures);
                if (trip) {
                    ps.setLong(idx++, nowMs);
                    ps.setString(idx++, PauseReason.CIRCUIT.name());
                }
                ps.setLong(idx++, nowMs);
                ps.setString(idx, taskId);
                ps.executeUpdate();
            }
            return readTask(c, taskId);
        });
    }

    public boolean pause(String taskId, PauseReason reason, long nowMs) {
        return database.withConnection("pause task", c -> {
            try (PreparedStatement ps = c.prepareStatement(
                    "UPDATE task_state SET is_paused=1,paused_at_ms=?,pause_reason=?,probe_pending=0,updated_at_ms=? WHERE task_id=? AND is_paused=0")) {
                ps.setLong(1, nowMs);
                ps.setString(2, reason.name());
                ps.setLong(3, nowMs);
                ps.setString(4, taskId);
                return ps.executeUpdate() == 1;
            }
        });
    }

    /**
     * Operator resume: clears the pause and the failure counter.
     */
    public boolean resume(String taskId, long nowMs) {
        return database.withConnection("resume task", c -> {
            try (PreparedStatement ps = c.prepareStatement(
                    "UPDATE task_state SET is_paused=0,paused_at_ms=NULL,pause_reason=NULL,probe_pending=0,consecutive_failures=0,updated_at_ms=? WHERE task_id=? AND is_paused=1")) {
                ps.setLong(1, nowMs);
                ps.setString(2, taskId);
                return ps.executeUpdate() == 1;
            }
        });
    }

    /**
     * Resumes circuit-paused tasks whose cooldown has elapsed, granting each a
     * single probe run. Manually paused tasks are never touched.
     *
     * @return ids of the tasks resumed
     */
    public List<String> resumeCooledDown(long cooldownMs, long nowMs) {
        return database.inTransaction("resume cooled down tasks", c -> {
            List<String> ids = new ArrayList<>();
            try (PreparedStatement read = c.prepareStatement(
                    "SELECT task_id FROM task_state WHERE is_paused=1 AND pause_reason=? AND paused_at_ms<=? ORDER BY task_id")) {
                read.setString(1, PauseReason.CIRCUIT.name());
                read.setLong(2, nowMs - cooldownMs);
                try (ResultSet rs = read.executeQuery()) {
                    while (rs.next()) {
                        ids.add(rs.getString(1));
                    }
                }
            }
            try (PreparedStatement ps = c.prepareStatement(
                    "UPDATE task_state SET is_paused=0,paused_at_ms=NULL,pause_reason=NULL,probe_pending=1,consecutive_failures=0,updated_at_ms=? WHERE task_id=? AND is_paused=1")) {
                for (String id : ids) {
                    ps.setLong(1, nowMs);
                    ps.setString(2, id);
                    ps.addBatch();
                }
                ps.executeBatch();
            }
            return ids;
        });
    }

    public Optional<TaskState> get(String taskId) {
        return database.withConnection("get task", c -> readTask(c, taskId));
    }

    public List<TaskState> list(int limit) {
        return database.withConnection("list tasks", c -> {
            try (PreparedStatement ps = c.prepareStatement("SELECT * FROM task_state ORDER BY task_id ASC LIMIT ?")) {
                ps.setInt(1, Math.max(1, limit));
                return readTasks(ps);
            }
        });
    }

    public long startActorExecution(String taskId, String actorName, long nowMs) {
        return database.withConnection("start actor execution", c -> {
            try (PreparedStatement ps = c.prepareStatement(
                    "INSERT INTO actor_executions(task_id,actor_name,started_at_ms) VALUES(?,?,?)",
                    Statement.RETURN_GENERATED_KEYS)) {
                ps.setString(1, taskId);
                ps.setString(2, actorName);
                ps.setLong(3, nowMs);
                ps.executeUpdate();
                try (ResultSet keys = ps.getGeneratedKeys()) {
                    if (!keys.next()) {
                        throw new SQLException("No generated key for actor execution");
                    }
                    return keys.getLong(1);
                }
            }
        });
    }

    public void finishActorExecution(long id, String narrativeExecutionId, boolean success, String errorMessage, long nowMs) {
        database.withConnection("finish actor execution", c -> {
            try (PreparedStatement ps = c.prepareStatement(
                    "UPDATE actor_executions SET narrative_execution_id=?,completed_at_ms=?,success=?,error_message=? WHERE id=? AND completed_at_ms IS NULL")) {
                ps.setString(1, narrativeExecutionId);
                ps.setLong(2, nowMs);
                ps.setInt(3, success ? 1 : 0);
                if (errorMessage == null) {
                    ps.setNull(4, Types.VARCHAR);
                } else {
                    ps.setString(4, errorMessage);
                }
                ps.setLong(5, id);
                ps.executeUpdate();
            }
            return null;
        });
    }

    public List<ActorExecution> listActorExecutions(String taskId, int limit) {
        return database.withConnection("list actor executions", c -> {
            try (PreparedStatement ps = c.prepareStatement(
                    "SELECT * FROM actor_executions WHERE task_id=? ORDER BY started_at_ms DESC, id DESC LIMIT ?")) {
                ps.setString(1, taskId);
                ps.setInt(2, Math.max(1, limit));
                List<ActorExecution> out = new ArrayList<>();
                try (ResultSet rs = ps.executeQuery()) {
                    while (rs.next()) {
                        long completed = rs.getLong("completed_at_ms");
                        Long completedAt = rs.wasNull() ? null : completed;
                        out.add(new ActorExecution(
                                rs.getLong("id"),
                                rs.getString("task_id"),
                                rs.getString("actor_name"),
                                rs.getString("narrative_execution_id"),
                                rs.getLong("started_at_ms"),
                                completedAt,
                                rs.getInt("success") == 1,
                                rs.getString("error_message")
                        ));
                    }
                }
                return out;
            }
        });
    }

    private Optional<TaskState> readTask(Connection c, String taskId) throws SQLException {
        try (PreparedStatement ps = c.prepareStatement("SELECT * FROM task_state WHERE task_id=?")) {
            ps.setString(1, taskId);
            List<TaskState> rows = readTasks(ps);
            return rows.isEmpty() ? Optional.empty() : Optional.of(rows.get(0));
        }
    }

    private List<TaskState> readTasks(PreparedStatement ps) throws SQLException {
        List<TaskState> out = new ArrayList<>();
        try (ResultSet rs = ps.executeQuery()) {
            while (rs.next()) {
                long lastRun = rs.getLong("last_run_ms");
                Long lastRunMs = rs.wasNull() ? null : lastRun;
                long pausedAt = rs.getLong("paused_at_ms");
                Long pausedAtMs = rs.wasNull() ? null : pausedAt;
                long leaseExpires = rs.getLong("lease_expires_at_ms");
                Long leaseExpiresAtMs = rs.wasNull() ? null : leaseExpires;
                String pauseReason = rs.getString("pause_reason");
                out.add(new TaskState(
                        rs.getString("task_id"),
                        rs.getString("actor_name"),
                        rs.getString("narrative"),
                        lastRunMs,
                        rs.getLong("next_run_ms"),
                        rs.getInt("consecutive_failures"),
                        rs.getInt("is_paused") == 1,
                        pausedAtMs,
                        pauseReason == null ? null : PauseReason.valueOf(pauseReason),
                        rs.getInt("probe_pending") == 1,
                        rs.getString("lease_owner"),
                        leaseExpiresAtMs,
                        readMetadata(rs.getString("metadata")),
                        rs.getLong("updated_at_ms")
                ));
            }
        }
        return out;
    }

    private static Map<String, Object> readMetadata(String raw) {
        if (raw == null || raw.isBlank()) {
            return Map.of();
        }
        try {
            return Jsons.mapper().readValue(raw, METADATA_TYPE);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Corrupt task metadata: " + raw, e);
        }
    }

    public record TaskRegistration(
            String taskId,
            String actorName,
            String narrative,
            Map<String, Object> metadata,
            long firstRunMs,
            long nowMs
    ) {
        public TaskRegistration {
            if (taskId == null || taskId.isBlank()) {
                throw new IllegalArgumentException("taskId must not be blank");
            }
            if (actorName == null || actorName.isBlank()) {
                throw new IllegalArgumentException("actorName must not be blank");
            }
            narrative = narrative == null ? "" : narrative;
            metadata = metadata == null ? Map.of() : new LinkedHashMap<>(metadata);
        }
    }
}
