package io.looming.processor;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Processors available to narratives, fixed at construction.
 */
public final class ProcessorRegistry {
    private final Map<String, ActProcessor> processors;

    public ProcessorRegistry(List<ActProcessor> processors) {
        Map<String, ActProcessor> byName = new LinkedHashMap<>();
        for (ActProcessor processor : processors) {
            if (byName.putIfAbsent(processor.name(), processor) != null) {
                throw new IllegalArgumentException("Duplicate processor registration: " + processor.name());
            }
        }
        this.processors = Map.copyOf(byName);
    }

    public static ProcessorRegistry withDefaults() {
        return new ProcessorRegistry(List.of(new JsonExtractionProcessor()));
    }

    public Optional<ActProcessor> find(String name) {
        return Optional.ofNullable(processors.get(name));
    }

    public boolean contains(String name) {
        return processors.containsKey(name);
    }
}
