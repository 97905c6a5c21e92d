package io.looming.model;

/**
 * Persisted record of one narrative run.
 */
public record NarrativeExecution(
        String executionId,
        String narrativeName,
        String actorName,
        String taskId,
        NarrativeStatus status,
        FailureReason failureReason,
        String errorDetail,
        long startedAtMs,
        Long completedAtMs
) {
    public String reasonText() {
        return failureReason == null ? null : failureReason.description();
    }
}
