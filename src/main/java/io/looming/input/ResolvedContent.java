package io.looming.input;

import com.fasterxml.jackson.databind.JsonNode;
import io.looming.model.HistoryRetention;
import io.looming.model.InputKind;

/**
 * Backend-ready content for one input.
 *
 * @param payload structured result, e.g. a platform command's returned ids; may be null
 * @param summary short descriptor used when the content is replayed as history
 */
public record ResolvedContent(
        InputKind kind,
        String text,
        JsonNode payload,
        String summary,
        HistoryRetention retention
) {
    public ResolvedContent {
        if (text == null) {
            throw new IllegalArgumentException("resolved text must not be null");
        }
        retention = retention == null ? HistoryRetention.FULL : retention;
    }
}
