package io.looming.backend;

import java.util.List;

/**
 * Returns the last user message unchanged. Used for dry runs.
 */
public final class EchoBackend implements GenerationBackend {
    @Override
    public String name() {
        return "echo";
    }

    @Override
    public GenerationResponse generate(GenerationRequest request) {
        List<Message> messages = request.messages();
        String text = "";
        int promptChars = 0;
        for (Message m : messages) {
            promptChars += m.content().length();
            if (m.role() == Role.USER) {
                text = m.content();
            }
        }
        return new GenerationResponse(text, new TokenUsage(promptChars / 4, text.length() / 4));
    }
}
