package io.looming.scheduler;

/**
 * @param narrativeExecutionId execution created by the run, null if none was started
 */
public record TaskOutcome(boolean success, String narrativeExecutionId, String error) {
    public static TaskOutcome ok(String narrativeExecutionId) {
        return new TaskOutcome(true, narrativeExecutionId, null);
    }

    public static TaskOutcome failed(String narrativeExecutionId, String error) {
        return new TaskOutcome(false, narrativeExecutionId, error == null ? "failed" : error);
    }
}
