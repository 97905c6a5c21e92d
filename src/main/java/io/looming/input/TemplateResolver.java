package io.looming.input;

import com.fasterxml.jackson.databind.JsonNode;
import io.looming.state.StateScope;
import io.looming.state.StateStore;
import io.looming.state.StateValue;
import io.looming.util.Jsons;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Substitutes {@code {state:key}} and {@code {{act_name.field}}} references.
 * Any reference that does not resolve fails the whole substitution.
 */
public final class TemplateResolver {
    private static final Pattern REFERENCE = Pattern.compile(
            "\\{state:([A-Za-z0-9_.\\-]+)}|\\{\\{\\s*([A-Za-z0-9_\\-]+(?:\\.[A-Za-z0-9_\\-]+)*)\\s*}}");

    private final StateStore state;

    public TemplateResolver(StateStore state) {
        this.state = state;
    }

    public String resolve(String template, StateScope execution, StateScope actor) throws UnresolvedReferenceException {
        if (template == null || template.indexOf('{') < 0) {
            return template;
        }
        Matcher m = REFERENCE.matcher(template);
        StringBuilder out = new StringBuilder(template.length());
        int last = 0;
        while (m.find()) {
            out.append(template, last, m.start());
            out.append(m.group(1) != null
                    ? stateValue(m.group(1), execution, actor)
                    : actField(m.group(2), execution, actor));
            last = m.end();
        }
        if (last == 0) {
            return template;
        }
        out.append(template, last, template.length());
        return out.toString();
    }

    private String stateValue(String key, StateScope execution, StateScope actor) throws UnresolvedReferenceException {
        Optional<StateValue> value = state.lookup(execution, actor, key);
        if (value.isEmpty()) {
            throw new UnresolvedReferenceException("{state:" + key + "}");
        }
        return value.get().render();
    }

    private String actField(String path, StateScope execution, StateScope actor) throws UnresolvedReferenceException {
        Optional<JsonNode> node = state.lookupPath(execution, actor, path);
        if (node.isEmpty()) {
            throw new UnresolvedReferenceException("{{" + path + "}}");
        }
        JsonNode n = node.get();
        return n.isValueNode() ? n.asText() : Jsons.toCompactJson(n);
    }
}
