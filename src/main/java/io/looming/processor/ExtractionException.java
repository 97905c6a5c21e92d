package io.looming.processor;

public final class ExtractionException extends Exception {
    private final Kind kind;

    public ExtractionException(Kind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public ExtractionException(Kind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public Kind kind() {
        return kind;
    }

    public enum Kind {
        /** No JSON object or array anywhere in the text. */
        NOT_FOUND,
        /** Something JSON-shaped was there but did not parse. */
        MALFORMED,
        /** Parsed, but rows do not match the declared fields. */
        SCHEMA_MISMATCH
    }
}
