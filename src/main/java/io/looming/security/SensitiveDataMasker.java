package io.looming.security;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.databind.node.TextNode;
import io.looming.util.Jsons;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Redacts credentials from audit details and platform command arguments.
 *
 * <p>Named fields are redacted whole when their name carries a credential word.
 * Free text (backend and platform error messages end up here) keeps its wording;
 * only embedded {@code key=value} credentials, bearer tokens and provider key
 * literals are replaced.
 */
public final class SensitiveDataMasker {
    public static final String MASK = "***";

    private static final List<String> CREDENTIAL_WORDS = List.of(
            "password", "passwd", "secret", "token", "authorization", "apikey", "api_key", "credential", "cookie"
    );
    private static final Pattern INLINE_ASSIGNMENT = Pattern.compile(
            "(?i)\\b([a-z_]*(?:password|secret|token|api_?key)[a-z_]*)(\\s*[=:]\\s*)(\"?)[^\\s\"&,;]+\\3");
    private static final Pattern BEARER_TOKEN = Pattern.compile("(?i)\\b(bearer)\\s+[A-Za-z0-9._~+/=\\-]+");
    private static final Pattern PROVIDER_KEY = Pattern.compile("\\b(?:sk|pk|rk)-[A-Za-z0-9_\\-]{16,}");

    private SensitiveDataMasker() {
    }

    /**
     * Redacted copy of an audit details tree. Never returns null.
     */
    public static JsonNode masked(JsonNode details) {
        if (details == null || details.isNull()) {
            return Jsons.mapper().nullNode();
        }
        if (details.isObject()) {
            ObjectNode out = Jsons.mapper().createObjectNode();
            details.fields().forEachRemaining(field -> out.set(field.getKey(),
                    isSensitiveKey(field.getKey()) ? TextNode.valueOf(MASK) : masked(field.getValue())));
            return out;
        }
        if (details.isArray()) {
            ArrayNode out = Jsons.mapper().createArrayNode();
            details.forEach(item -> out.add(masked(item)));
            return out;
        }
        if (details.isTextual()) {
            return TextNode.valueOf(maskedText(details.textValue()));
        }
        return details;
    }

    /**
     * Platform arguments, sorted by name. Only names are inspected: argument
     * values are channel names and post ids an operator needs to read back.
     */
    public static Map<String, String> maskedArguments(Map<String, String> arguments) {
        Map<String, String> out = new TreeMap<>();
        arguments.forEach((name, value) -> out.put(name, isSensitiveKey(name) ? MASK : value));
        return out;
    }

    /**
     * Replaces credentials embedded in free text, leaving the rest of the message readable.
     */
    public static String maskedText(String text) {
        if (text == null || text.isEmpty()) {
            return text;
        }
        Matcher assignment = INLINE_ASSIGNMENT.matcher(text);
        StringBuilder sb = new StringBuilder();
        while (assignment.find()) {
            assignment.appendReplacement(sb, Matcher.quoteReplacement(assignment.group(1) + assignment.group(2) + MASK));
        }
        assignment.appendTail(sb);
        String out = BEARER_TOKEN.matcher(sb.toString()).replaceAll("$1 " + Matcher.quoteReplacement(MASK));
        return PROVIDER_KEY.matcher(out).replaceAll(Matcher.quoteReplacement(MASK));
    }

    public static boolean isSensitiveKey(String name) {
        if (name == null || name.isBlank()) {
            return false;
        }
        String lower = name.toLowerCase(Locale.ROOT);
        if (lower.endsWith("key")) {
            return true;
        }
        for (String word : CREDENTIAL_WORDS) {
            if (lower.contains(word)) {
                return true;
            }
        }
        return false;
    }
}
