package io.looming.backend;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.List;

final class ScriptBackendTest {

    @Test
    void mapsSysexitsCodesToErrorKinds() {
        Assertions.assertEquals(BackendException.Kind.RATE_LIMITED, ScriptBackend.kindForExit(75));
        Assertions.assertEquals(BackendException.Kind.AUTH, ScriptBackend.kindForExit(77));
        Assertions.assertEquals(BackendException.Kind.NETWORK, ScriptBackend.kindForExit(69));
        Assertions.assertEquals(BackendException.Kind.INVALID, ScriptBackend.kindForExit(1));
    }

    @Test
    void returnsStdoutOfSuccessfulScript() throws Exception {
        ScriptBackend backend = new ScriptBackend("sh", List.of("sh", "-c", "cat > /dev/null; printf 'drafted text'"), 10_000L);
        GenerationResponse response = backend.generate(new GenerationRequest(List.of(Message.user("write")), "sh", null, null));
        Assertions.assertEquals("drafted text", response.text());
    }

    @Test
    void nonZeroExitBecomesTypedFailure() {
        ScriptBackend backend = new ScriptBackend("sh", List.of("sh", "-c", "cat > /dev/null; echo slow down >&2; exit 75"), 10_000L);
        BackendException e = Assertions.assertThrows(BackendException.class,
                () -> backend.generate(new GenerationRequest(List.of(Message.user("write")), "sh", null, null)));
        Assertions.assertEquals(BackendException.Kind.RATE_LIMITED, e.kind());
        Assertions.assertTrue(e.recoverable());
        Assertions.assertTrue(e.getMessage().contains("slow down"));
    }
}
