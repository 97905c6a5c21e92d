package io.looming.model;

/**
 * History row for one task dispatch.
 */
public record ActorExecution(
        long id,
        String taskId,
        String actorName,
        String narrativeExecutionId,
        long startedAtMs,
        Long completedAtMs,
        boolean success,
        String errorMessage
) {
}
