package io.looming.backend;

/**
 * @param text raw response text, exactly as produced by the backend
 */
public record GenerationResponse(String text, TokenUsage usage) {
    public GenerationResponse {
        if (text == null) {
            throw new IllegalArgumentException("response text must not be null");
        }
        usage = usage == null ? TokenUsage.NONE : usage;
    }
}
