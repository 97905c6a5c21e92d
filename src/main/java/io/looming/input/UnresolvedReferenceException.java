package io.looming.input;

/**
 * A template referenced a state key or act field that does not exist.
 */
public final class UnresolvedReferenceException extends Exception {
    private final String reference;

    public UnresolvedReferenceException(String reference) {
        super("Unresolved template reference: " + reference);
        this.reference = reference;
    }

    public String reference() {
        return reference;
    }
}
