package io.looming.model;

/**
 * Why a narrative run ended {@link NarrativeStatus#FAILED}. Each reason has a
 * distinct operator-facing description.
 */
public enum FailureReason {
    INPUT_UNRESOLVED("could not resolve inputs"),
    BACKEND_UNAVAILABLE("backend unavailable"),
    BACKEND_REJECTED("backend rejected request"),
    EXTRACTION_FAILED("extraction failed"),
    SECURITY_DENIED("security denied"),
    CANCELLED("cancelled"),
    INVALID_DEFINITION("invalid narrative definition"),
    PERSISTENCE_FAILED("persistence failed");

    private final String description;

    FailureReason(String description) {
        this.description = description;
    }

    public String description() {
        return description;
    }
}
