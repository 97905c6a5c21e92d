package io.looming.state;

/**
 * Namespace of state entries: one narrative execution, or one actor across runs.
 */
public record StateScope(Type type, String id) {
    public StateScope {
        if (type == null) {
            throw new IllegalArgumentException("scope type is required");
        }
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("scope id must not be blank");
        }
    }

    public static StateScope execution(String executionId) {
        return new StateScope(Type.EXECUTION, executionId);
    }

    public static StateScope actor(String actorName) {
        return new StateScope(Type.ACTOR, actorName);
    }

    public enum Type {
        EXECUTION,
        ACTOR
    }
}
