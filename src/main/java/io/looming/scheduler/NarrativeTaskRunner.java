package io.looming.scheduler;

import io.looming.model.NarrativeDefinition;
import io.looming.model.TaskState;
import io.looming.narrative.CancellationToken;
import io.looming.narrative.NarrativeDefinitionLoader;
import io.looming.narrative.NarrativeExecutor;
import io.looming.narrative.NarrativeRunResult;
import io.looming.narrative.RunRequest;

/**
 * Runs the narrative a task is bound to, as the task's actor.
 */
public final class NarrativeTaskRunner implements TaskRunner {
    private final NarrativeDefinitionLoader loader;
    private final NarrativeExecutor executor;

    public NarrativeTaskRunner(NarrativeDefinitionLoader loader, NarrativeExecutor executor) {
        this.loader = loader;
        this.executor = executor;
    }

    @Override
    public TaskOutcome run(TaskState task, CancellationToken cancellation) {
        NarrativeDefinition definition;
        try {
            definition = loader.load(task.narrative());
        } catch (IllegalArgumentException e) {
            return TaskOutcome.failed(null, "Cannot load narrative " + task.narrative() + ": " + e.getMessage());
        }
        NarrativeRunResult result = executor.run(definition, new RunRequest(task.actorName(), task.taskId(), cancellation));
        if (result.succeeded()) {
            return TaskOutcome.ok(result.executionId());
        }
        return TaskOutcome.failed(result.executionId(), result.reasonText() + ": " + result.errorDetail());
    }
}
