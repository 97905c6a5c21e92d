package io.looming.storage;

import io.looming.model.ActExecution;
import io.looming.model.ActInput;
import io.looming.model.FailureReason;
import io.looming.model.InputKind;
import io.looming.model.NarrativeExecution;
import io.looming.model.NarrativeStatus;
import io.looming.model.ProcessorResult;

import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.sql.Types;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Persistence for narrative runs. Act captures and their inputs are
 * write-once; an execution leaves RUNNING exactly once.
 */
public final class NarrativeStore {
    private final Database database;

    public NarrativeStore(Database database) {
        this.database = database;
    }

    public void createExecution(String executionId, String narrativeName, String actorName, String taskId, long nowMs) {
        database.withConnection("create narrative execution", c -> {
            try (PreparedStatement ps = c.prepareStatement(
                    "INSERT INTO narrative_executions(execution_id,narrative_name,actor_name,task_id,status,started_at_ms) VALUES(?,?,?,?,?,?)")) {
                ps.setString(1, executionId);
                ps.setString(2, narrativeName);
                ps.setString(3, actorName);
                ps.setString(4, taskId);
                ps.setString(5, NarrativeStatus.RUNNING.name());
                ps.setLong(6, nowMs);
                ps.executeUpdate();
            }
            return null;
        });
    }

    /**
     * Writes one act capture and all of its inputs in a single transaction.
     */
    public ActExecution recordAct(ActCapture capture) {
        return database.inTransaction("record act execution", c -> {
            long actId;
            try (PreparedStatement ps = c.prepareStatement(
                    "INSERT INTO act_executions(execution_id,act_name,sequence_number,model,temperature,max_tokens,response,prompt_tokens,completion_tokens,created_at_ms) VALUES(?,?,?,?,?,?,?,?,?,?)",
                    Statement.RETURN_GENERATED_KEYS)) {
                ps.setString(1, capture.executionId());
                ps.setString(2, capture.actName());
                ps.setInt(3, capture.sequenceNumber());
                ps.setString(4, capture.model());
                if (capture.temperature() == null) {
                    ps.setNull(5, Types.REAL);
                } else {
                    ps.setDouble(5, capture.temperature());
                }
                if (capture.maxTokens() == null) {
                    ps.setNull(6, Types.INTEGER);
                } else {
                    ps.setInt(6, capture.maxTokens());
                }
                ps.setString(7, capture.response());
                ps.setInt(8, capture.promptTokens());
                ps.setInt(9, capture.completionTokens());
                ps.setLong(10, capture.nowMs());
                ps.executeUpdate();
                try (ResultSet keys = ps.getGeneratedKeys()) {
                    if (!keys.next()) {
                        throw new SQLException("No generated key for act execution");
                    }
                    actId = keys.getLong(1);
                }
            }
            try (PreparedStatement in = c.prepareStatement(
                    "INSERT INTO act_inputs(act_execution_id,input_order,input_kind,content,content_hash,created_at_ms) VALUES(?,?,?,?,?,?)")) {
                for (ActInput input : capture.inputs()) {
                    in.setLong(1, actId);
                    in.setInt(2, input.inputOrder());
                    in.setString(3, input.kind().name());
                    in.setString(4, input.content());
                    in.setString(5, input.contentHash());
                    in.setLong(6, capture.nowMs());
                    in.addBatch();
                }
                in.executeBatch();
            }
            return new ActExecution(
                    actId,
                    capture.executionId(),
                    capture.actName(),
                    capture.sequenceNumber(),
                    capture.model(),
                    capture.temperature(),
                    capture.maxTokens(),
                    capture.response(),
                    capture.promptTokens(),
                    capture.completionTokens(),
                    capture.nowMs()
            );
        });
    }

    public void recordProcessorResult(ProcessorResult result) {
        database.withConnection("record processor result", c -> {
            try (PreparedStatement ps = c.prepareStatement(
                    "INSERT INTO act_processor_results(act_execution_id,processor,success,row_count,error_kind,error_detail,created_at_ms) VALUES(?,?,?,?,?,?,?)")) {
                ps.setLong(1, result.actExecutionId());
                ps.setString(2, result.processor());
                ps.setInt(3, result.success() ? 1 : 0);
                ps.setInt(4, result.rowCount());
                ps.setString(5, result.errorKind());
                ps.setString(6, result.errorDetail());
                ps.setLong(7, result.createdAtMs());
                ps.executeUpdate();
            }
            return null;
        });
    }

    /**
     * Moves a RUNNING execution to a terminal status.
     *
     * @return false when the execution was not RUNNING (already terminal or unknown)
     */
    public boolean completeExecution(String executionId, NarrativeStatus status, FailureReason reason, String detail, long nowMs) {
        if (!status.terminal()) {
            throw new IllegalArgumentException("Not a terminal status: " + status);
        }
        return database.withConnection("complete narrative execution", c -> {
            try (PreparedStatement ps = c.prepareStatement(
                    "UPDATE narrative_executions SET status=?,failure_reason=?,error_detail=?,completed_at_ms=? WHERE execution_id=? AND status=?")) {
                ps.setString(1, status.name());
                ps.setString(2, reason == null ? null : reason.name());
                ps.setString(3, detail);
                ps.setLong(4, nowMs);
                ps.setString(5, executionId);
                ps.setString(6, NarrativeStatus.RUNNING.name());
                return ps.executeUpdate() == 1;
            }
        });
    }

    /**
     * Fails executions left RUNNING by a process that is gone: started before
     * {@code staleBeforeMs} and not covered by a live lease on their task. Runs
     * of a live scheduler keep their lease renewed and are left alone.
     */
    public int failInterrupted(long staleBeforeMs, long nowMs) {
        return database.withConnection("fail interrupted executions", c -> {
            try (PreparedStatement ps = c.prepareStatement("""
                    UPDATE narrative_executions SET status=?,failure_reason=?,error_detail=?,completed_at_ms=?
                    WHERE status=? AND started_at_ms<=?
                      AND NOT EXISTS (SELECT 1 FROM task_state t
                                      WHERE t.task_id=narrative_executions.task_id
                                        AND t.lease_owner IS NOT NULL AND t.lease_expires_at_ms>?)
                    """)) {
                ps.setString(1, NarrativeStatus.FAILED.name());
                ps.setString(2, FailureReason.CANCELLED.name());
                ps.setString(3, "interrupted by process restart");
                ps.setLong(4, nowMs);
                ps.setString(5, NarrativeStatus.RUNNING.name());
                ps.setLong(6, staleBeforeMs);
                ps.setLong(7, nowMs);
                return ps.executeUpdate();
            }
        });
    }

    public Optional<NarrativeExecution> getExecution(String executionId) {
        return database.withConnection("get narrative execution", c -> {
            try (PreparedStatement ps = c.prepareStatement(
                    "SELECT * FROM narrative_executions WHERE execution_id=?")) {
                ps.setString(1, executionId);
                try (ResultSet rs = ps.executeQuery()) {
                    return rs.next() ? Optional.of(readExecution(rs)) : Optional.<NarrativeExecution>empty();
                }
            }
        });
    }

    public List<NarrativeExecution> listExecutions(String narrativeName, int limit) {
        boolean filtered = narrativeName != null && !narrativeName.isBlank();
        String sql = filtered
                ? "SELECT * FROM narrative_executions WHERE narrative_name=? ORDER BY started_at_ms DESC LIMIT ?"
                : "SELECT * FROM narrative_executions ORDER BY started_at_ms DESC LIMIT ?";
        return database.withConnection("list narrative executions", c -> {
            try (PreparedStatement ps = c.prepareStatement(sql)) {
                int idx = 1;
                if (filtered) {
                    ps.setString(idx++, narrativeName);
                }
                ps.setInt(idx, Math.max(1, limit));
                List<NarrativeExecution> out = new ArrayList<>();
                try (ResultSet rs = ps.executeQuery()) {
                    while (rs.next()) {
                        out.add(readExecution(rs));
                    }
                }
                return out;
            }
        });
    }

    public List<ActExecution> listActs(String executionId) {
        return database.withConnection("list act executions", c -> {
            try (PreparedStatement ps = c.prepareStatement(
                    "SELECT * FROM act_executions WHERE execution_id=? ORDER BY sequence_number ASC")) {
                ps.setString(1, executionId);
                List<ActExecution> out = new ArrayList<>();
                try (ResultSet rs = ps.executeQuery()) {
                    while (rs.next()) {
                        double temperature = rs.getDouble("temperature");
                        Double temp = rs.wasNull() ? null : temperature;
                        int maxTokens = rs.getInt("max_tokens");
                        Integer max = rs.wasNull() ? null : maxTokens;
                        out.add(new ActExecution(
                                rs.getLong("id"),
                                rs.getString("execution_id"),
                                rs.getString("act_name"),
                                rs.getInt("sequence_number"),
                                rs.getString("model"),
                                temp,
                                max,
                                rs.getString("response"),
                                rs.getInt("prompt_tokens"),
                                rs.getInt("completion_tokens"),
                                rs.getLong("created_at_ms")
                        ));
                    }
                }
                return out;
            }
        });
    }

    public List<ActInput> listInputs(long actExecutionId) {
        return database.withConnection("list act inputs", c -> {
            try (PreparedStatement ps = c.prepareStatement(
                    "SELECT * FROM act_inputs WHERE act_execution_id=? ORDER BY input_order ASC")) {
                ps.setLong(1, actExecutionId);
                List<ActInput> out = new ArrayList<>();
                try (ResultSet rs = ps.executeQuery()) {
                    while (rs.next()) {
                        out.add(new ActInput(
                                rs.getLong("act_execution_id"),
                                rs.getInt("input_order"),
                                InputKind.valueOf(rs.getString("input_kind")),
                                rs.getString("content"),
                                rs.getString("content_hash")
                        ));
                    }
                }
                return out;
            }
        });
    }

    public List<ProcessorResult> listProcessorResults(String executionId) {
        return database.withConnection("list processor results", c -> {
            try (PreparedStatement ps = c.prepareStatement("""
                    SELECT r.* FROM act_processor_results r
                    JOIN act_executions a ON a.id = r.act_execution_id
                    WHERE a.execution_id=?
                    ORDER BY a.sequence_number ASC, r.id ASC
                    """)) {
                ps.setString(1, executionId);
                List<ProcessorResult> out = new ArrayList<>();
                try (ResultSet rs = ps.executeQuery()) {
                    while (rs.next()) {
                        out.add(new ProcessorResult(
                                rs.getLong("act_execution_id"),
                                rs.getString("processor"),
                                rs.getInt("success") == 1,
                                rs.getInt("row_count"),
                                rs.getString("error_kind"),
                                rs.getString("error_detail"),
                                rs.getLong("created_at_ms")
                        ));
                    }
                }
                return out;
            }
        });
    }

    private NarrativeExecution readExecution(ResultSet rs) throws SQLException {
        long completed = rs.getLong("completed_at_ms");
        Long completedAt = rs.wasNull() ? null : completed;
        String reason = rs.getString("failure_reason");
        return new NarrativeExecution(
                rs.getString("execution_id"),
                rs.getString("narrative_name"),
                rs.getString("actor_name"),
                rs.getString("task_id"),
                NarrativeStatus.valueOf(rs.getString("status")),
                reason == null ? null : FailureReason.valueOf(reason),
                rs.getString("error_detail"),
                rs.getLong("started_at_ms"),
                completedAt
        );
    }

    public record ActCapture(
            String executionId,
            String actName,
            int sequenceNumber,
            String model,
            Double temperature,
            Integer maxTokens,
            String response,
            int promptTokens,
            int completionTokens,
            List<ActInput> inputs,
            long nowMs
    ) {
        public ActCapture {
            inputs = inputs == null ? List.of() : List.copyOf(inputs);
        }
    }
}
