package io.looming.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.databind.JsonNode;

public enum FieldType {
    STRING,
    NUMBER,
    INTEGER,
    BOOLEAN,
    OBJECT,
    ARRAY,
    ANY;

    @JsonCreator
    public static FieldType fromString(String raw) {
        if (raw == null || raw.isBlank()) {
            return ANY;
        }
        for (FieldType value : values()) {
            if (value.name().equalsIgnoreCase(raw.trim())) {
                return value;
            }
        }
        throw new IllegalArgumentException("Unknown field type: " + raw);
    }

    public boolean accepts(JsonNode node) {
        if (node == null || node.isMissingNode()) {
            return false;
        }
        return switch (this) {
            case STRING -> node.isTextual();
            case NUMBER -> node.isNumber();
            case INTEGER -> node.isIntegralNumber();
            case BOOLEAN -> node.isBoolean();
            case OBJECT -> node.isObject();
            case ARRAY -> node.isArray();
            case ANY -> true;
        };
    }
}
