package io.looming.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Durable scheduling state of one actor task.
 *
 * @param pauseReason why the task is paused, null while running normally
 * @param probePending set when a cooldown auto-resume granted a single probe run
 */
public record TaskState(
        String taskId,
        String actorName,
        String narrative,
        Long lastRunMs,
        long nextRunMs,
        int consecutiveFailures,
        boolean paused,
        Long pausedAtMs,
        PauseReason pauseReason,
        boolean probePending,
        String leaseOwner,
        Long leaseExpiresAtMs,
        Map<String, Object> metadata,
        long updatedAtMs
) {
    public TaskState {
        metadata = metadata == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }

    public boolean leased(long nowMs) {
        return leaseOwner != null && leaseExpiresAtMs != null && leaseExpiresAtMs > nowMs;
    }
}
