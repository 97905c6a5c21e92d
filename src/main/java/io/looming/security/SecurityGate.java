package io.looming.security;

/**
 * Permission check consulted before any action with side effects outside the
 * narrative's own tables, such as a platform command.
 */
@FunctionalInterface
public interface SecurityGate {
    Authorization authorize(String actor, String action);

    static SecurityGate allowAll() {
        return (actor, action) -> Authorization.allow();
    }

    /**
     * Action name checked for a platform command input.
     */
    static String platformAction(String platform, String command) {
        return "platform:" + platform + "." + command;
    }
}
