package io.looming.model;

/**
 * One captured act. {@code response} holds the backend text exactly as returned.
 */
public record ActExecution(
        long id,
        String executionId,
        String actName,
        int sequenceNumber,
        String model,
        Double temperature,
        Integer maxTokens,
        String response,
        int promptTokens,
        int completionTokens,
        long createdAtMs
) {
}
