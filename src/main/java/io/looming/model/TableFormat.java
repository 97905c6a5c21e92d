package io.looming.model;

import com.fasterxml.jackson.annotation.JsonCreator;

public enum TableFormat {
    JSON,
    MARKDOWN,
    CSV;

    @JsonCreator
    public static TableFormat fromString(String raw) {
        if (raw == null || raw.isBlank()) {
            return MARKDOWN;
        }
        for (TableFormat value : values()) {
            if (value.name().equalsIgnoreCase(raw.trim())) {
                return value;
            }
        }
        throw new IllegalArgumentException("Unknown table format: " + raw);
    }
}
