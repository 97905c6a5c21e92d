package io.looming.state;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.TextNode;
import io.looming.util.Jsons;

/**
 * A state value: plain text, or structured JSON.
 */
public record StateValue(Kind kind, String text, JsonNode json) {
    public StateValue {
        if (kind == Kind.TEXT && text == null) {
            throw new IllegalArgumentException("text value must not be null");
        }
        if (kind == Kind.JSON && json == null) {
            throw new IllegalArgumentException("json value must not be null");
        }
    }

    public static StateValue text(String text) {
        return new StateValue(Kind.TEXT, text, null);
    }

    public static StateValue json(JsonNode json) {
        return new StateValue(Kind.JSON, null, json.deepCopy());
    }

    /** Restores a value from its stored form. */
    public static StateValue decode(Kind kind, String stored) {
        return kind == Kind.JSON ? json(Jsons.readTree(stored)) : text(stored);
    }

    public String encode() {
        return kind == Kind.JSON ? Jsons.toCompactJson(json) : text;
    }

    public JsonNode asNode() {
        return kind == Kind.JSON ? json : TextNode.valueOf(text);
    }

    /** Text used when the value is substituted into a template. */
    public String render() {
        if (kind == Kind.TEXT) {
            return text;
        }
        return json.isTextual() ? json.asText() : Jsons.toCompactJson(json);
    }

    public enum Kind {
        TEXT,
        JSON
    }
}
