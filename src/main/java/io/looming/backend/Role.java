package io.looming.backend;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum Role {
    SYSTEM,
    USER,
    ASSISTANT;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
