package io.looming.narrative;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonMappingException;
import io.looming.model.Act;
import io.looming.model.ExtractionSchema;
import io.looming.model.FieldType;
import io.looming.model.GenerationConfig;
import io.looming.model.Input;
import io.looming.model.NarrativeDefinition;
import io.looming.util.Jsons;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Loads narrative definitions from JSON files.
 *
 * <pre>
 * {
 *   "name": "daily_post",
 *   "target_table": "posts",
 *   "acts": [
 *     {"name": "draft", "model": "echo", "max_tokens": 400,
 *      "inputs": [{"type": "text", "literal": "Write a post"}]},
 *     {"name": "format", "model": "echo", "processors": ["json_extraction"],
 *      "schema": {"fields": {"title": "string"}},
 *      "inputs": [{"type": "text", "literal": "JSON for: {{draft.response}}"}]}
 *   ]
 * }
 * </pre>
 */
public final class NarrativeDefinitionLoader {
    private static final Pattern TABLE_NAME = Pattern.compile("[A-Za-z_][A-Za-z0-9_]{0,63}");

    private final Path narrativesRoot;

    public NarrativeDefinitionLoader(Path narrativesRoot) {
        this.narrativesRoot = narrativesRoot;
    }

    /**
     * Resolves a bare name ({@code daily_post}) against the narratives directory,
     * or loads an explicit path as given.
     */
    public NarrativeDefinition load(String nameOrPath) {
        Path path = Path.of(nameOrPath);
        if (!Files.exists(path) && narrativesRoot != null) {
            String file = nameOrPath.endsWith(".json") ? nameOrPath : nameOrPath + ".json";
            path = narrativesRoot.resolve(file);
        }
        return load(path);
    }

    public NarrativeDefinition load(Path file) {
        if (!Files.isRegularFile(file)) {
            throw new IllegalArgumentException("Narrative definition not found: " + file);
        }
        DefinitionFile raw;
        try {
            raw = Jsons.mapper().readValue(file.toFile(), DefinitionFile.class);
        } catch (JsonMappingException e) {
            throw new IllegalArgumentException("Invalid narrative definition " + file + ": " + e.getOriginalMessage(), e);
        } catch (IOException e) {
            throw new RuntimeException("Failed to read narrative definition: " + file, e);
        }
        return toDefinition(raw);
    }

    public static NarrativeDefinition parse(String json) {
        try {
            return toDefinition(Jsons.mapper().readValue(json, DefinitionFile.class));
        } catch (IOException e) {
            throw new IllegalArgumentException("Invalid narrative definition: " + e.getMessage(), e);
        }
    }

    static NarrativeDefinition toDefinition(DefinitionFile raw) {
        if (raw == null || raw.name() == null || raw.name().isBlank()) {
            throw new IllegalArgumentException("Narrative definition requires a name");
        }
        String target = raw.targetTable() == null || raw.targetTable().isBlank() ? null : raw.targetTable().trim();
        if (target != null && !TABLE_NAME.matcher(target).matches()) {
            throw new IllegalArgumentException("Invalid target_table: " + target);
        }
        Map<String, Act> acts = new LinkedHashMap<>();
        List<String> declared = new ArrayList<>();
        for (ActFile actFile : raw.acts() == null ? List.<ActFile>of() : raw.acts()) {
            Act act = toAct(actFile);
            if (acts.putIfAbsent(act.name(), act) != null) {
                throw new IllegalArgumentException("Duplicate act name: " + act.name());
            }
            declared.add(act.name());
        }
        List<String> order = raw.order() == null || raw.order().isEmpty() ? declared : raw.order();
        for (String actName : order) {
            if (!acts.containsKey(actName)) {
                throw new IllegalArgumentException("Order references undefined act: " + actName);
            }
        }
        return new NarrativeDefinition(
                raw.name(),
                raw.description(),
                target,
                order,
                acts,
                Boolean.TRUE.equals(raw.skipExtraction())
        );
    }

    private static Act toAct(ActFile raw) {
        if (raw == null) {
            throw new IllegalArgumentException("Act entry must not be null");
        }
        ExtractionSchema schema = raw.schema() == null
                ? ExtractionSchema.permissive()
                : new ExtractionSchema(raw.schema().fields(), raw.schema().allowEmpty() == null || raw.schema().allowEmpty());
        return new Act(
                raw.name(),
                raw.inputs(),
                new GenerationConfig(raw.model(), raw.temperature(), raw.maxTokens()),
                raw.processors(),
                schema,
                raw.remember()
        );
    }

    record DefinitionFile(
            String name,
            String description,
            @JsonProperty("target_table") String targetTable,
            @JsonProperty("skip_extraction") Boolean skipExtraction,
            List<String> order,
            List<ActFile> acts
    ) {
    }

    record ActFile(
            String name,
            List<Input> inputs,
            String model,
            Double temperature,
            @JsonProperty("max_tokens") Integer maxTokens,
            List<String> processors,
            SchemaFile schema,
            Map<String, String> remember
    ) {
    }

    record SchemaFile(
            Map<String, FieldType> fields,
            @JsonProperty("allow_empty") Boolean allowEmpty
    ) {
    }
}
