package io.looming.security;

public final class SecurityDeniedException extends Exception {
    private final String action;

    public SecurityDeniedException(String actor, String action, String reason) {
        super("Actor " + actor + " denied " + action + ": " + reason);
        this.action = action;
    }

    public String action() {
        return action;
    }
}
