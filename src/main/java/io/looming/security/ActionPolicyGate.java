package io.looming.security;

import java.util.List;
import java.util.Map;

/**
 * Allow-list gate: an actor may run an action when one of its patterns
 * matches. A pattern is an exact action or a prefix ending in {@code *}.
 * Actors without an entry fall back to the {@code *} entry, if any.
 */
public final class ActionPolicyGate implements SecurityGate {
    private final Map<String, List<String>> allowedByActor;

    public ActionPolicyGate(Map<String, List<String>> allowedByActor) {
        this.allowedByActor = allowedByActor == null ? Map.of() : Map.copyOf(allowedByActor);
    }

    @Override
    public Authorization authorize(String actor, String action) {
        List<String> patterns = allowedByActor.get(actor);
        if (patterns == null) {
            patterns = allowedByActor.get("*");
        }
        if (patterns == null) {
            return Authorization.deny("no policy for actor " + actor);
        }
        for (String pattern : patterns) {
            if (matches(pattern, action)) {
                return Authorization.allow();
            }
        }
        return Authorization.deny("action not allowed: " + action);
    }

    static boolean matches(String pattern, String action) {
        if (pattern == null || action == null) {
            return false;
        }
        if (pattern.endsWith("*")) {
            return action.startsWith(pattern.substring(0, pattern.length() - 1));
        }
        return pattern.equals(action);
    }
}
