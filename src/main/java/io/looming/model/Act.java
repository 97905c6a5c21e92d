package io.looming.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * One narrative step: inputs, one generation call, and the processors it
 * explicitly opts into. No processor runs unless named here.
 *
 * <p>{@code remember} maps actor state keys to templates. They are resolved
 * after the act's processors and written to the actor scope, where later runs
 * of the same actor can read them as {@code {state:key}}.
 */
public record Act(
        String name,
        List<Input> inputs,
        GenerationConfig generation,
        List<String> processors,
        ExtractionSchema schema,
        Map<String, String> remember
) {
    public Act {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("act requires a name");
        }
        if (generation == null) {
            throw new IllegalArgumentException("act requires a generation config: " + name);
        }
        inputs = inputs == null ? List.of() : List.copyOf(inputs);
        processors = processors == null ? List.of() : List.copyOf(processors);
        schema = schema == null ? ExtractionSchema.permissive() : schema;
        remember = remember == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(remember));
        for (String key : remember.keySet()) {
            if (key == null || key.isBlank()) {
                throw new IllegalArgumentException("act " + name + " remembers a blank state key");
            }
        }
    }

    public Act(String name, List<Input> inputs, GenerationConfig generation, List<String> processors, ExtractionSchema schema) {
        this(name, inputs, generation, processors, schema, Map.of());
    }

    public boolean optsInto(String processorName) {
        return processors.contains(processorName);
    }
}
