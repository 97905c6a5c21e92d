package io.looming.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Required fields of each extracted row.
 *
 * @param fields     required field name to accepted type
 * @param allowEmpty whether an empty JSON array is a valid (zero-row) result
 */
public record ExtractionSchema(Map<String, FieldType> fields, boolean allowEmpty) {
    public ExtractionSchema {
        fields = fields == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(fields));
    }

    public static ExtractionSchema permissive() {
        return new ExtractionSchema(Map.of(), true);
    }
}
