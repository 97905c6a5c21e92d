package io.looming.narrative;

/**
 * Who runs a narrative and under which task. {@code taskId} is null for ad-hoc runs.
 */
public record RunRequest(String actorName, String taskId, CancellationToken cancellation) {
    public static final String ADHOC_ACTOR = "adhoc";

    public RunRequest {
        actorName = actorName == null || actorName.isBlank() ? ADHOC_ACTOR : actorName;
        cancellation = cancellation == null ? CancellationToken.none() : cancellation;
    }

    public static RunRequest adhoc() {
        return new RunRequest(ADHOC_ACTOR, null, CancellationToken.none());
    }
}
