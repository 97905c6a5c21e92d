package io.looming.backend;

import java.util.List;

/**
 * @param temperature optional; backend default when null
 * @param maxTokens   optional; backend default when null
 */
public record GenerationRequest(List<Message> messages, String model, Double temperature, Integer maxTokens) {
    public GenerationRequest {
        messages = messages == null ? List.of() : List.copyOf(messages);
    }
}
