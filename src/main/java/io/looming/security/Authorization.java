package io.looming.security;

/**
 * Decision returned by a {@link SecurityGate}.
 */
public record Authorization(boolean allowed, String reason) {
    private static final Authorization ALLOW = new Authorization(true, null);

    public static Authorization allow() {
        return ALLOW;
    }

    public static Authorization deny(String reason) {
        return new Authorization(false, reason == null || reason.isBlank() ? "denied" : reason);
    }
}
