package io.looming.processor;

import com.fasterxml.jackson.databind.node.ObjectNode;
import io.looming.model.ExtractionSchema;
import io.looming.model.FieldType;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

final class ContentExtractorTest {
    private final ContentExtractor extractor = new ContentExtractor();

    @Test
    void extractsBareObjectSurroundedByProse() throws Exception {
        List<ObjectNode> rows = extractor.extract("Sure! Here it is: {\"x\": 1} hope that helps", ExtractionSchema.permissive());
        Assertions.assertEquals(1, rows.size());
        Assertions.assertEquals(1, rows.get(0).get("x").asInt());
    }

    @Test
    void fencedBlockWinsOverEarlierBareJson() throws Exception {
        String raw = "Example {\"ignored\": true}\n```json\n[{\"title\": \"a\"}, {\"title\": \"b\"}]\n```\n";
        List<ObjectNode> rows = extractor.extract(raw, ExtractionSchema.permissive());
        Assertions.assertEquals(2, rows.size());
        Assertions.assertEquals("b", rows.get(1).get("title").asText());
    }

    @Test
    void bracketsInsideStringsDoNotConfuseTheScan() throws Exception {
        List<ObjectNode> rows = extractor.extract("{\"text\": \"a } tricky ] \\\" value\"}", ExtractionSchema.permissive());
        Assertions.assertEquals("a } tricky ] \" value", rows.get(0).get("text").asText());
        Assertions.assertEquals(-1, ContentExtractor.matchingClose("{\"a\": [1, 2}", 0));
    }

    @Test
    void classifiesFailures() {
        Assertions.assertEquals(ExtractionException.Kind.NOT_FOUND, kindOf("   "));
        Assertions.assertEquals(ExtractionException.Kind.NOT_FOUND, kindOf("no structured content here"));
        Assertions.assertEquals(ExtractionException.Kind.MALFORMED, kindOf("{\"title\": "));
        Assertions.assertEquals(ExtractionException.Kind.MALFORMED, kindOf("{'single': 'quotes'}"));
        Assertions.assertEquals(ExtractionException.Kind.SCHEMA_MISMATCH, kindOf("[1, 2, 3]"));
    }

    @Test
    void neverSalvagesNestedStructureFromRejectedCandidate() throws Exception {
        Assertions.assertEquals(ExtractionException.Kind.MALFORMED, kindOf("Result: {\"items\": [{\"x\":1}], }"));
        Assertions.assertEquals(ExtractionException.Kind.MALFORMED, kindOf("Result: {\"items\": [{\"x\":1}]"));

        List<ObjectNode> rows = extractor.extract("Draft {not json} final {\"x\": 2}", ExtractionSchema.permissive());
        Assertions.assertEquals(1, rows.size());
        Assertions.assertEquals(2, rows.get(0).get("x").asInt());
    }

    @Test
    void enforcesRequiredFieldsAndTypes() {
        ExtractionSchema schema = new ExtractionSchema(Map.of("title", FieldType.STRING, "score", FieldType.INTEGER), false);
        ExtractionException missing = Assertions.assertThrows(ExtractionException.class,
                () -> extractor.extract("{\"title\": \"t\"}", schema));
        Assertions.assertEquals(ExtractionException.Kind.SCHEMA_MISMATCH, missing.kind());
        Assertions.assertTrue(missing.getMessage().contains("score"));

        ExtractionException wrongType = Assertions.assertThrows(ExtractionException.class,
                () -> extractor.extract("{\"title\": \"t\", \"score\": 1.5}", schema));
        Assertions.assertEquals(ExtractionException.Kind.SCHEMA_MISMATCH, wrongType.kind());

        ExtractionException empty = Assertions.assertThrows(ExtractionException.class,
                () -> extractor.extract("[]", schema));
        Assertions.assertEquals(ExtractionException.Kind.SCHEMA_MISMATCH, empty.kind());
    }

    @Test
    void emptyArrayIsAllowedWhenSchemaPermitsIt() throws Exception {
        Assertions.assertTrue(extractor.extract("Nothing today: []", ExtractionSchema.permissive()).isEmpty());
    }

    private ExtractionException.Kind kindOf(String raw) {
        return Assertions.assertThrows(ExtractionException.class,
                () -> extractor.extract(raw, ExtractionSchema.permissive())).kind();
    }
}
