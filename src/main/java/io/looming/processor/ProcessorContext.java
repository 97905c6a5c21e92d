package io.looming.processor;

import io.looming.model.Act;
import io.looming.model.ActExecution;
import io.looming.model.NarrativeDefinition;

/**
 * What a processor sees: the persisted capture of one act, never a mutable copy.
 *
 * @param finalAct whether this is the narrative's last act
 */
public record ProcessorContext(
        NarrativeDefinition narrative,
        Act act,
        ActExecution capture,
        String actorName,
        boolean finalAct
) {
}
