package io.looming.backend;

public final class BackendException extends Exception {
    private final Kind kind;

    public BackendException(Kind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public BackendException(Kind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public Kind kind() {
        return kind;
    }

    public boolean recoverable() {
        return kind.recoverable();
    }

    public enum Kind {
        RATE_LIMITED(true),
        AUTH(false),
        NETWORK(true),
        TIMEOUT(true),
        INVALID(false);

        private final boolean recoverable;

        Kind(boolean recoverable) {
            this.recoverable = recoverable;
        }

        public boolean recoverable() {
            return recoverable;
        }
    }
}
