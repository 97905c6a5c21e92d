package io.looming.scheduler;

import io.looming.model.TaskState;
import io.looming.narrative.CancellationToken;

/**
 * Does the work of one dispatched task.
 */
@FunctionalInterface
public interface TaskRunner {
    TaskOutcome run(TaskState task, CancellationToken cancellation);
}
