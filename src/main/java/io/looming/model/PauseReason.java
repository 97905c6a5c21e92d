package io.looming.model;

public enum PauseReason {
    /** Operator paused the task; only an operator resumes it. */
    MANUAL,
    /** The failure threshold tripped; a configured cooldown may resume it. */
    CIRCUIT
}
