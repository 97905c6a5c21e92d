package io.looming.model;

public enum NarrativeStatus {
    PENDING,
    RUNNING,
    SUCCEEDED,
    FAILED;

    public boolean terminal() {
        return this == SUCCEEDED || this == FAILED;
    }
}
