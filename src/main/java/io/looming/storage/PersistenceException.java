package io.looming.storage;

/**
 * Storage failure. {@link Kind#CIRCUIT_OPEN} means the call was refused without
 * touching the database because the persistence circuit is open.
 */
public final class PersistenceException extends RuntimeException {
    public enum Kind {
        TRANSIENT,
        CIRCUIT_OPEN
    }

    private final Kind kind;

    public PersistenceException(Kind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public static PersistenceException circuitOpen(String action) {
        return new PersistenceException(Kind.CIRCUIT_OPEN, "Persistence circuit open, refused: " + action, null);
    }

    public Kind kind() {
        return kind;
    }
}
