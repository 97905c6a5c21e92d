package io.looming.state;

import java.util.Map;

/**
 * Durable backing for {@link StateStore}.
 */
public interface StatePersistence {
    void save(StateScope scope, String key, StateValue value, long nowMs);

    Map<String, StateValue> loadScope(StateScope scope);
}
