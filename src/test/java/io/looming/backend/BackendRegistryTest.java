package io.looming.backend;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.List;

final class BackendRegistryTest {

    @Test
    void routesToLongestMatchingPrefix() throws Exception {
        BackendRegistry registry = new BackendRegistry()
                .register("echo", new EchoBackend())
                .register("echo-loud", new FixedBackend("LOUD"));

        GenerationResponse plain = registry.generate(request("echo", "hello"));
        GenerationResponse loud = registry.generate(request("echo-loud-v2", "hello"));

        Assertions.assertEquals("hello", plain.text());
        Assertions.assertEquals("LOUD", loud.text());
        Assertions.assertEquals(List.of("echo", "echo-loud"), registry.prefixes());
    }

    @Test
    void rejectsDuplicateAndBlankPrefixes() {
        BackendRegistry registry = new BackendRegistry().register("echo", new EchoBackend());
        Assertions.assertThrows(IllegalArgumentException.class, () -> registry.register("echo", new EchoBackend()));
        Assertions.assertThrows(IllegalArgumentException.class, () -> registry.register(" ", new EchoBackend()));
    }

    @Test
    void unknownModelIsANonRecoverableError() {
        BackendRegistry registry = new BackendRegistry().register("echo", new EchoBackend());
        BackendException e = Assertions.assertThrows(BackendException.class, () -> registry.generate(request("gpt-x", "hi")));
        Assertions.assertEquals(BackendException.Kind.INVALID, e.kind());
        Assertions.assertFalse(e.recoverable());
    }

    @Test
    void echoReturnsLastUserMessage() {
        GenerationResponse response = new EchoBackend().generate(new GenerationRequest(List.of(
                Message.user("first"),
                Message.assistant("reply"),
                Message.user("second")
        ), "echo", null, null));
        Assertions.assertEquals("second", response.text());
    }

    private static GenerationRequest request(String model, String prompt) {
        return new GenerationRequest(List.of(Message.user(prompt)), model, 0.2d, 100);
    }

    private static final class FixedBackend implements GenerationBackend {
        private final String text;

        private FixedBackend(String text) {
            this.text = text;
        }

        @Override
        public String name() {
            return "fixed";
        }

        @Override
        public GenerationResponse generate(GenerationRequest request) {
            return new GenerationResponse(text, TokenUsage.NONE);
        }
    }
}
