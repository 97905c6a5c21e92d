package io.looming.model;

public record ActInput(
        long actExecutionId,
        int inputOrder,
        InputKind kind,
        String content,
        String contentHash
) {
}
