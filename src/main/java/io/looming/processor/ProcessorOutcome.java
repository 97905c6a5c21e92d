package io.looming.processor;

import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.List;

/**
 * Result of one processor run.
 *
 * @param rows      structured rows produced, empty for processors that produce none
 * @param errorKind machine-readable failure class, null on success
 */
public record ProcessorOutcome(boolean success, List<ObjectNode> rows, String errorKind, String errorDetail) {
    public ProcessorOutcome {
        rows = rows == null ? List.of() : List.copyOf(rows);
    }

    public static ProcessorOutcome ok(List<ObjectNode> rows) {
        return new ProcessorOutcome(true, rows, null, null);
    }

    public static ProcessorOutcome failed(String errorKind, String errorDetail) {
        return new ProcessorOutcome(false, List.of(), errorKind, errorDetail);
    }
}
