package io.looming.model;

/**
 * Outcome of one opted-in processor against one captured act.
 */
public record ProcessorResult(
        long actExecutionId,
        String processor,
        boolean success,
        int rowCount,
        String errorKind,
        String errorDetail,
        long createdAtMs
) {
}
