package io.looming.input;

/**
 * An input could not be turned into backend-ready content.
 */
public final class InputException extends Exception {
    private final Kind kind;

    public InputException(Kind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public InputException(Kind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public Kind kind() {
        return kind;
    }

    public enum Kind {
        /** Table rows could not be rendered in the requested format. */
        RENDER,
        /** The act's output budget leaves no room relative to its input. */
        BUDGET_TOO_SMALL,
        /** File or table could not be read. */
        SOURCE,
        /** The platform collaborator failed the command. */
        PLATFORM
    }
}
