package io.looming.model;

import com.fasterxml.jackson.annotation.JsonCreator;

/**
 * How an input is replayed to later acts as conversation history.
 */
public enum HistoryRetention {
    FULL,
    SUMMARY,
    DROP;

    @JsonCreator
    public static HistoryRetention fromString(String raw) {
        if (raw == null || raw.isBlank()) {
            return FULL;
        }
        for (HistoryRetention value : values()) {
            if (value.name().equalsIgnoreCase(raw.trim())) {
                return value;
            }
        }
        throw new IllegalArgumentException("Unknown history retention: " + raw);
    }
}
