package io.looming.input;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.looming.state.StatePersistence;
import io.looming.state.StateScope;
import io.looming.state.StateStore;
import io.looming.state.StateValue;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.util.HashMap;
import java.util.Map;

final class TemplateResolverTest {
    private static final StateScope EXECUTION = StateScope.execution("exec-1");
    private static final StateScope ACTOR = StateScope.actor("poster");

    private StateStore state;
    private TemplateResolver resolver;

    @BeforeEach
    void setUp() {
        state = new StateStore(new InMemoryPersistence(), Clock.systemUTC());
        resolver = new TemplateResolver(state);
    }

    @Test
    void substitutesActFieldsAndNestedPaths() throws Exception {
        ObjectNode draft = JsonNodeFactory.instance.objectNode();
        draft.put("response", "hello");
        draft.putObject("meta").put("lang", "en");
        state.mergeObject(EXECUTION, "draft", draft);

        Assertions.assertEquals("say hello in en",
                resolver.resolve("say {{ draft.response }} in {{draft.meta.lang}}", EXECUTION, ACTOR));
        Assertions.assertEquals("{\"lang\":\"en\"}", resolver.resolve("{{draft.meta}}", EXECUTION, ACTOR));
    }

    @Test
    void stateReferencesFallBackToActorScope() throws Exception {
        state.put(ACTOR, "topic", StateValue.text("gardening"));
        Assertions.assertEquals("topic=gardening", resolver.resolve("topic={state:topic}", EXECUTION, ACTOR));

        state.put(EXECUTION, "topic", StateValue.text("cooking"));
        Assertions.assertEquals("topic=cooking", resolver.resolve("topic={state:topic}", EXECUTION, ACTOR));
    }

    @Test
    void missingReferenceFailsWholeSubstitution() {
        UnresolvedReferenceException e = Assertions.assertThrows(UnresolvedReferenceException.class,
                () -> resolver.resolve("a {{missing.response}} b", EXECUTION, ACTOR));
        Assertions.assertEquals("{{missing.response}}", e.reference());
        Assertions.assertThrows(UnresolvedReferenceException.class,
                () -> resolver.resolve("{state:nothing}", EXECUTION, ACTOR));
    }

    @Test
    void textWithoutReferencesIsReturnedUnchanged() throws Exception {
        String json = "{\"literal\": {\"braces\": true}}";
        Assertions.assertSame(json, resolver.resolve(json, EXECUTION, ACTOR));
    }

    private static final class InMemoryPersistence implements StatePersistence {
        private final Map<StateScope, Map<String, StateValue>> data = new HashMap<>();

        @Override
        public void save(StateScope scope, String key, StateValue value, long nowMs) {
            data.computeIfAbsent(scope, s -> new HashMap<>()).put(key, value);
        }

        @Override
        public Map<String, StateValue> loadScope(StateScope scope) {
            return new HashMap<>(data.getOrDefault(scope, Map.of()));
        }
    }
}
