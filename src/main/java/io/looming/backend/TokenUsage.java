package io.looming.backend;

public record TokenUsage(int promptTokens, int completionTokens) {
    public static final TokenUsage NONE = new TokenUsage(0, 0);

    public int total() {
        return promptTokens + completionTokens;
    }
}
