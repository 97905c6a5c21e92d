package io.looming.processor;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.looming.model.ExtractionSchema;
import io.looming.model.FieldType;
import io.looming.util.Jsons;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Finds the JSON object or array embedded in generated text and turns it into
 * rows. Fenced code blocks win over bare JSON; bare JSON is located by a
 * bracket scan that respects string literals. Unbalanced or unparsable
 * candidates are reported, never repaired, and the scan never descends into
 * one to pick out a nested structure.
 */
public final class ContentExtractor {
    private static final Pattern FENCE = Pattern.compile("```[A-Za-z0-9_-]*[ \\t]*\\r?\\n(.*?)```", Pattern.DOTALL);

    public List<ObjectNode> extract(String raw, ExtractionSchema schema) throws ExtractionException {
        if (raw == null || raw.isBlank()) {
            throw new ExtractionException(ExtractionException.Kind.NOT_FOUND, "Response is empty");
        }
        JsonNode parsed = locate(raw);
        return toRows(parsed, schema);
    }

    JsonNode locate(String raw) throws ExtractionException {
        String firstError = null;
        Matcher fence = FENCE.matcher(raw);
        while (fence.find()) {
            String body = fence.group(1).strip();
            if (body.startsWith("{") || body.startsWith("[")) {
                try {
                    return parse(body);
                } catch (JsonProcessingException e) {
                    if (firstError == null) {
                        firstError = "fenced block: " + e.getOriginalMessage();
                    }
                }
            }
        }
        int from = 0;
        boolean sawCandidate = false;
        while (true) {
            int start = nextOpening(raw, from);
            if (start < 0) {
                break;
            }
            sawCandidate = true;
            int end = matchingClose(raw, start);
            if (end < 0) {
                if (firstError == null) {
                    firstError = "unbalanced " + raw.charAt(start) + " at offset " + start;
                }
                break;
            }
            try {
                return parse(raw.substring(start, end + 1));
            } catch (JsonProcessingException e) {
                if (firstError == null) {
                    firstError = "offset " + start + ": " + e.getOriginalMessage();
                }
                from = end + 1;
            }
        }
        if (!sawCandidate && firstError == null) {
            throw new ExtractionException(ExtractionException.Kind.NOT_FOUND, "No JSON object or array in response");
        }
        throw new ExtractionException(ExtractionException.Kind.MALFORMED, "Malformed JSON in response: " + firstError);
    }

    private static JsonNode parse(String candidate) throws JsonProcessingException {
        return Jsons.mapper().readTree(candidate);
    }

    private static int nextOpening(String s, int from) {
        for (int i = from; i < s.length(); i++) {
            char c = s.charAt(i);
            if (c == '{' || c == '[') {
                return i;
            }
        }
        return -1;
    }

    static int matchingClose(String s, int start) {
        Deque<Character> stack = new ArrayDeque<>();
        boolean inString = false;
        boolean escaped = false;
        for (int i = start; i < s.length(); i++) {
            char c = s.charAt(i);
            if (inString) {
                if (escaped) {
                    escaped = false;
                } else if (c == '\\') {
                    escaped = true;
                } else if (c == '"') {
                    inString = false;
                }
                continue;
            }
            switch (c) {
                case '"' -> inString = true;
                case '{' -> stack.push('}');
                case '[' -> stack.push(']');
                case '}', ']' -> {
                    if (stack.isEmpty() || stack.pop() != c) {
                        return -1;
                    }
                    if (stack.isEmpty()) {
                        return i;
                    }
                }
                default -> {
                }
            }
        }
        return -1;
    }

    private static List<ObjectNode> toRows(JsonNode parsed, ExtractionSchema schema) throws ExtractionException {
        List<ObjectNode> rows = new ArrayList<>();
        if (parsed.isObject()) {
            rows.add((ObjectNode) parsed);
        } else if (parsed.isArray()) {
            int index = 0;
            for (JsonNode element : parsed) {
                if (!element.isObject()) {
                    throw new ExtractionException(ExtractionException.Kind.SCHEMA_MISMATCH,
                            "Row " + index + " is not an object: " + element.getNodeType());
                }
                rows.add((ObjectNode) element);
                index++;
            }
            if (rows.isEmpty() && !schema.allowEmpty()) {
                throw new ExtractionException(ExtractionException.Kind.SCHEMA_MISMATCH, "Empty result not permitted");
            }
        } else {
            throw new ExtractionException(ExtractionException.Kind.SCHEMA_MISMATCH,
                    "Top-level JSON is neither object nor array: " + parsed.getNodeType());
        }
        for (int i = 0; i < rows.size(); i++) {
            validate(i, rows.get(i), schema);
        }
        return rows;
    }

    private static void validate(int index, ObjectNode row, ExtractionSchema schema) throws ExtractionException {
        for (Map.Entry<String, FieldType> field : schema.fields().entrySet()) {
            JsonNode value = row.get(field.getKey());
            if (value == null || value.isNull()) {
                throw new ExtractionException(ExtractionException.Kind.SCHEMA_MISMATCH,
                        "Row " + index + " missing required field " + field.getKey());
            }
            if (!field.getValue().accepts(value)) {
                throw new ExtractionException(ExtractionException.Kind.SCHEMA_MISMATCH,
                        "Row " + index + " field " + field.getKey() + " expected " + field.getValue()
                                + " but was " + value.getNodeType());
            }
        }
    }
}
