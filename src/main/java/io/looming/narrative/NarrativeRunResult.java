package io.looming.narrative;

import io.looming.model.ActExecution;
import io.looming.model.FailureReason;
import io.looming.model.NarrativeStatus;

import java.util.List;

public record NarrativeRunResult(
        String executionId,
        NarrativeStatus status,
        FailureReason failureReason,
        String errorDetail,
        List<ActExecution> acts,
        int rowsWritten
) {
    public NarrativeRunResult {
        acts = acts == null ? List.of() : List.copyOf(acts);
    }

    public boolean succeeded() {
        return status == NarrativeStatus.SUCCEEDED;
    }

    public String reasonText() {
        return failureReason == null ? null : failureReason.description();
    }
}
