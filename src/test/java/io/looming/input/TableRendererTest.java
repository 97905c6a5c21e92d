package io.looming.input;

import io.looming.model.TableFormat;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

final class TableRendererTest {
    private final TableRenderer renderer = new TableRenderer();

    @Test
    void rendersMarkdownWithEscapedCells() throws Exception {
        String text = renderer.render("posts", List.of(row("title", "a|b", "score", 3)), TableFormat.MARKDOWN, List.of());
        Assertions.assertEquals("| title | score |\n| --- | --- |\n| a\\|b | 3 |", text);
    }

    @Test
    void rendersCsvWithQuoting() throws Exception {
        String text = renderer.render("posts", List.of(row("title", "hello, \"world\"", "score", 1)), TableFormat.CSV, List.of());
        Assertions.assertEquals("title,score\n\"hello, \"\"world\"\"\",1", text);
    }

    @Test
    void projectsRequestedColumns() throws Exception {
        String text = renderer.render("posts", List.of(row("title", "t", "score", 1)), TableFormat.CSV, List.of("score"));
        Assertions.assertEquals("score\n1", text);
    }

    @Test
    void emptyTableRendersPlaceholder() throws Exception {
        Assertions.assertEquals("Table posts: no rows", renderer.render("posts", List.of(), TableFormat.MARKDOWN, List.of()));
        Assertions.assertEquals("[ ]", renderer.render("posts", List.of(), TableFormat.JSON, List.of()).replaceAll("\\s+", " ").trim());
    }

    @Test
    void unknownColumnFailsWithoutPartialOutput() {
        InputException e = Assertions.assertThrows(InputException.class,
                () -> renderer.render("posts", List.of(row("title", "t", "score", 1)), TableFormat.MARKDOWN, List.of("author")));
        Assertions.assertEquals(InputException.Kind.RENDER, e.kind());
    }

    private static Map<String, Object> row(String k1, Object v1, String k2, Object v2) {
        Map<String, Object> row = new LinkedHashMap<>();
        row.put(k1, v1);
        row.put(k2, v2);
        return row;
    }
}
