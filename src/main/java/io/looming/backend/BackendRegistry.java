package io.looming.backend;

import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Routes a request to the backend registered under the longest prefix of its
 * model id, e.g. {@code echo} serves {@code echo} and {@code echo-large}.
 * Built once at startup.
 */
public final class BackendRegistry implements GenerationBackend {
    private final Map<String, GenerationBackend> byPrefix = new LinkedHashMap<>();

    public BackendRegistry register(String modelPrefix, GenerationBackend backend) {
        if (modelPrefix == null || modelPrefix.isBlank()) {
            throw new IllegalArgumentException("model prefix must not be blank");
        }
        if (byPrefix.putIfAbsent(modelPrefix, backend) != null) {
            throw new IllegalArgumentException("Duplicate backend registration for model prefix: " + modelPrefix);
        }
        return this;
    }

    public Optional<GenerationBackend> find(String model) {
        if (model == null) {
            return Optional.empty();
        }
        return byPrefix.entrySet().stream()
                .filter(e -> model.startsWith(e.getKey()))
                .max(Comparator.comparingInt(e -> e.getKey().length()))
                .map(Map.Entry::getValue);
    }

    public List<String> prefixes() {
        return List.copyOf(byPrefix.keySet());
    }

    @Override
    public String name() {
        return "registry";
    }

    @Override
    public GenerationResponse generate(GenerationRequest request) throws BackendException {
        GenerationBackend backend = find(request.model()).orElseThrow(() ->
                new BackendException(BackendException.Kind.INVALID, "No backend registered for model: " + request.model()));
        return backend.generate(request);
    }
}
