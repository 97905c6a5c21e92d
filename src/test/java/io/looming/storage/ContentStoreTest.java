package io.looming.storage;

import com.fasterxml.jackson.databind.node.ObjectNode;
import io.looming.config.LoomingConfig;
import io.looming.processor.ContentDeduplicator;
import io.looming.util.Jsons;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

final class ContentStoreTest {
    private Path root;
    private ContentStore store;

    @BeforeEach
    void setUp() throws IOException {
        root = Files.createTempDirectory("looming-test-content-");
        Database db = new Database(new LoomingConfig(root));
        db.init();
        store = new ContentStore(db);
    }

    @AfterEach
    void tearDown() throws IOException {
        deleteRecursively(root);
    }

    @Test
    void queryFiltersByFieldAndReturnsNewestFirst() {
        store.insertRows("posts", "exec-1", "final", List.of(row("{\"title\":\"a\",\"lang\":\"en\"}")), 1L);
        store.insertRows("posts", "exec-2", "final", List.of(
                row("{\"title\":\"b\",\"lang\":\"fr\"}"),
                row("{\"title\":\"c\",\"lang\":\"en\",\"score\":3}")
        ), 2L);
        store.insertRows("drafts", "exec-2", "draft", List.of(row("{\"title\":\"z\",\"lang\":\"en\"}")), 2L);

        List<Map<String, Object>> english = store.query("posts", Map.of("lang", "en"), 10);
        Assertions.assertEquals(List.of("c", "a"), english.stream().map(r -> r.get("title")).toList());
        Assertions.assertEquals(1, store.query("posts", Map.of("score", "3"), 10).size());
        Assertions.assertEquals(1, store.query("posts", Map.of(), 1).size());
        Assertions.assertEquals(3, store.countRows("posts"));
    }

    @Test
    void rejectsNonIdentifierNames() {
        Assertions.assertThrows(IllegalArgumentException.class,
                () -> store.query("posts; DROP TABLE task_state", Map.of(), 10));
        Assertions.assertThrows(IllegalArgumentException.class,
                () -> store.query("posts", Map.of("lang') OR 1=1 --", "x"), 10));
        Assertions.assertThrows(IllegalArgumentException.class,
                () -> store.insertRows("bad-name", "e", "a", List.of(row("{}")), 1L));
    }

    @Test
    void deduplicatorSuppressesStoredAndRepeatedRows() {
        store.insertRows("posts", "exec-1", "final", List.of(row("{\"title\":\"a\"}")), 1L);
        ContentDeduplicator dedup = new ContentDeduplicator(store);

        List<ObjectNode> unique = dedup.unique("posts", List.of(
                row("{\"title\":\"a\"}"),
                row("{\"title\":\"b\"}"),
                row("{\"title\":\"b\"}")
        ));

        Assertions.assertEquals(1, unique.size());
        Assertions.assertEquals("b", unique.get(0).get("title").asText());
        Assertions.assertEquals(2, dedup.unique("drafts", List.of(row("{\"title\":\"a\"}"), row("{\"title\":\"c\"}"))).size());
    }

    private static ObjectNode row(String json) {
        return (ObjectNode) Jsons.readTree(json);
    }

    private static void deleteRecursively(Path root) throws IOException {
        if (root == null || !Files.exists(root)) {
            return;
        }
        try (Stream<Path> walk = Files.walk(root)) {
            for (Path path : walk.sorted((a, b) -> Integer.compare(b.getNameCount(), a.getNameCount())).toList()) {
                Files.deleteIfExists(path);
            }
        }
    }
}
