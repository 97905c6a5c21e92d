package io.looming.state;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.time.Clock;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Scoped key/value state for template resolution. Writes go through to the
 * persistence layer before the in-memory view changes; reads are served from
 * the view, loading a scope lazily the first time it is touched.
 */
public final class StateStore {
    private final StatePersistence persistence;
    private final Clock clock;
    private final Map<StateScope, Map<String, StateValue>> scopes = new ConcurrentHashMap<>();

    public StateStore(StatePersistence persistence, Clock clock) {
        this.persistence = persistence;
        this.clock = clock;
    }

    public void put(StateScope scope, String key, StateValue value) {
        if (key == null || key.isBlank()) {
            throw new IllegalArgumentException("state key must not be blank");
        }
        persistence.save(scope, key, value, clock.millis());
        view(scope).put(key, value);
    }

    /**
     * Merges fields into the JSON object stored under {@code key}, creating it
     * when absent. A non-object value under the key is replaced.
     */
    public StateValue mergeObject(StateScope scope, String key, ObjectNode fields) {
        Map<String, StateValue> view = view(scope);
        synchronized (view) {
            StateValue current = view.get(key);
            ObjectNode merged = current != null && current.kind() == StateValue.Kind.JSON && current.json().isObject()
                    ? (ObjectNode) current.json().deepCopy()
                    : JsonNodeFactory.instance.objectNode();
            merged.setAll(fields);
            StateValue value = StateValue.json(merged);
            put(scope, key, value);
            return value;
        }
    }

    public Optional<StateValue> get(StateScope scope, String key) {
        return Optional.ofNullable(view(scope).get(key));
    }

    /**
     * Looks a key up in the execution scope first, then in the actor scope.
     */
    public Optional<StateValue> lookup(StateScope execution, StateScope actor, String key) {
        Optional<StateValue> hit = get(execution, key);
        if (hit.isPresent() || actor == null) {
            return hit;
        }
        return get(actor, key);
    }

    /**
     * Resolves {@code name.field.sub} against the JSON object stored under {@code name}.
     */
    public Optional<JsonNode> lookupPath(StateScope execution, StateScope actor, String path) {
        int dot = path.indexOf('.');
        String head = dot < 0 ? path : path.substring(0, dot);
        Optional<StateValue> root = lookup(execution, actor, head);
        if (root.isEmpty()) {
            return Optional.empty();
        }
        JsonNode node = root.get().asNode();
        if (dot < 0) {
            return Optional.of(node);
        }
        for (String part : path.substring(dot + 1).split("\\.")) {
            if (node == null || !node.isObject() || !node.has(part)) {
                return Optional.empty();
            }
            node = node.get(part);
        }
        return node == null || node.isNull() || node.isMissingNode() ? Optional.empty() : Optional.of(node);
    }

    public Map<String, StateValue> snapshot(StateScope scope) {
        return Map.copyOf(view(scope));
    }

    /** Drops the in-memory view of a finished execution; persisted entries stay. */
    public void evict(StateScope scope) {
        scopes.remove(scope);
    }

    /** Re-reads a scope from persistence on next access, picking up writes from other processes. */
    public void refresh(StateScope scope) {
        scopes.remove(scope);
    }

    private Map<String, StateValue> view(StateScope scope) {
        return scopes.computeIfAbsent(scope, s -> new ConcurrentHashMap<>(persistence.loadScope(s)));
    }
}
