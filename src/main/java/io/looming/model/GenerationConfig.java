package io.looming.model;

/**
 * Model selection for one act. {@code temperature} and {@code maxTokens} are
 * optional and left to the backend default when absent.
 */
public record GenerationConfig(String model, Double temperature, Integer maxTokens) {
    public GenerationConfig {
        if (model == null || model.isBlank()) {
            throw new IllegalArgumentException("generation config requires a model");
        }
        if (maxTokens != null && maxTokens < 1) {
            throw new IllegalArgumentException("maxTokens must be positive: " + maxTokens);
        }
    }
}
