package io.looming.scheduler;

import io.looming.model.PauseReason;
import io.looming.model.TaskState;
import io.looming.observability.AuditLogger;
import io.looming.storage.TaskStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Per-task circuit breaker over consecutive run failures. Each transition is
 * written to the task store before the call returns.
 */
public final class ExecutionTracker {
    public static final String MAX_FAILURES_KEY = "max_failures";
    private static final Logger log = LoggerFactory.getLogger(ExecutionTracker.class);

    private final TaskStore tasks;
    private final Settings settings;
    private final AuditLogger audit;
    private final Clock clock;

    public ExecutionTracker(TaskStore tasks, Settings settings, AuditLogger audit, Clock clock) {
        this.tasks = tasks;
        this.settings = settings;
        this.audit = audit;
        this.clock = clock;
    }

    public Optional<TaskState> recordSuccess(String taskId) {
        Optional<TaskState> updated = tasks.recordSuccess(taskId, clock.millis());
        updated.ifPresent(t -> log.debug("Task {} succeeded, consecutive_failures={}", taskId, t.consecutiveFailures()));
        return updated;
    }

    public Optional<TaskState> recordFailure(String taskId, String error) {
        Optional<TaskState> before = tasks.get(taskId);
        if (before.isEmpty()) {
            log.warn("Failure reported for unknown task {}", taskId);
            return before;
        }
        int threshold = thresholdFor(before.get());
        Optional<TaskState> updated = tasks.recordFailure(taskId, threshold, settings.autoPause(), clock.millis());
        updated.ifPresent(t -> {
            if (t.paused() && !before.get().paused()) {
                log.warn("Task {} paused after {} consecutive failure(s) (threshold {}): {}",
                        taskId, t.consecutiveFailures(), threshold, error);
                Map<String, Object> details = new LinkedHashMap<>();
                details.put("consecutive_failures", t.consecutiveFailures());
                details.put("threshold", threshold);
                details.put("probe", before.get().probePending());
                details.put("error", error);
                audit("task.paused", t, "circuit_open", details);
            } else {
                log.info("Task {} failed ({}/{}): {}", taskId, t.consecutiveFailures(), threshold, error);
            }
        });
        return updated;
    }

    public boolean pause(String taskId) {
        boolean changed = tasks.pause(taskId, PauseReason.MANUAL, clock.millis());
        if (changed) {
            tasks.get(taskId).ifPresent(t -> audit("task.paused", t, "manual", Map.of()));
        }
        return changed;
    }

    public boolean resume(String taskId) {
        boolean changed = tasks.resume(taskId, clock.millis());
        if (changed) {
            tasks.get(taskId).ifPresent(t -> audit("task.resumed", t, "manual", Map.of()));
        }
        return changed;
    }

    /**
     * Grants a probe run to circuit-paused tasks whose cooldown has elapsed.
     * Disabled when the cooldown is zero.
     */
    public List<String> resumeCooledDown() {
        if (settings.pauseCooldownMs() <= 0) {
            return List.of();
        }
        List<String> resumed = tasks.resumeCooledDown(settings.pauseCooldownMs(), clock.millis());
        for (String taskId : resumed) {
            log.info("Task {} cooldown elapsed, allowing one probe run", taskId);
            tasks.get(taskId).ifPresent(t -> audit("task.resumed", t, "cooldown", Map.of()));
        }
        return resumed;
    }

    int thresholdFor(TaskState task) {
        Object raw = task.metadata().get(MAX_FAILURES_KEY);
        if (raw instanceof Number n && n.intValue() > 0) {
            return n.intValue();
        }
        if (raw instanceof String s) {
            try {
                int parsed = Integer.parseInt(s.trim());
                if (parsed > 0) {
                    return parsed;
                }
            } catch (NumberFormatException e) {
                log.warn("Task {} has non-numeric {}={}, using default", task.taskId(), MAX_FAILURES_KEY, s);
            }
        }
        return settings.maxConsecutiveFailures();
    }

    private void audit(String action, TaskState task, String result, Map<String, Object> details) {
        if (audit == null) {
            return;
        }
        audit.log(AuditLogger.AuditEvent.of(action, task.actorName(), task.narrative(), result, details).withTask(task.taskId()));
    }

    public record Settings(int maxConsecutiveFailures, boolean autoPause, long pauseCooldownMs) {
        public Settings {
            if (maxConsecutiveFailures < 1) {
                throw new IllegalArgumentException("maxConsecutiveFailures must be >= 1");
            }
        }
    }
}
