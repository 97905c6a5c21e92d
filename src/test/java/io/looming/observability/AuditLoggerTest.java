package io.looming.observability;

import com.fasterxml.jackson.databind.JsonNode;
import io.looming.util.Jsons;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

final class AuditLoggerTest {
    private Path root;
    private Path auditFile;

    @BeforeEach
    void setUp() throws IOException {
        root = Files.createTempDirectory("looming-test-audit-");
        auditFile = root.resolve("audit").resolve("audit.log");
    }

    @AfterEach
    void tearDown() throws IOException {
        deleteRecursively(root);
    }

    @Test
    void chainIsIntactAndContinuesAcrossInstances() throws IOException {
        AuditLogger first = new AuditLogger(auditFile, Clock.systemUTC());
        first.log(AuditLogger.AuditEvent.of("task.registered", "system", "task:daily", "ok", Map.of("schedule", "interval")));
        String tail = first.currentHash();

        AuditLogger second = new AuditLogger(auditFile, Clock.systemUTC());
        Assertions.assertEquals(tail, second.currentHash());
        second.log(AuditLogger.AuditEvent.of("narrative.completed", "poster", "narrative:daily", "ok", Map.of()).withExecution("exec-1"));

        List<String> lines = Files.readAllLines(auditFile, StandardCharsets.UTF_8);
        Assertions.assertEquals(2, lines.size());
        Assertions.assertEquals(tail, Jsons.readTree(lines.get(1)).path("prev_hash").asText());
        Assertions.assertEquals(-1, second.verifyChain());
    }

    @Test
    void masksSensitiveDetails() throws IOException {
        AuditLogger logger = new AuditLogger(auditFile, Clock.systemUTC());
        logger.log(AuditLogger.AuditEvent.of("platform.command", "poster", "platform:social.post", "ok",
                Map.of("api_token", "abc", "channel", "garden")));

        JsonNode details = Jsons.readTree(Files.readAllLines(auditFile, StandardCharsets.UTF_8).get(0)).path("details");
        Assertions.assertEquals("***", details.path("api_token").asText());
        Assertions.assertEquals("garden", details.path("channel").asText());
    }

    @Test
    void detectsEditedLine() throws IOException {
        AuditLogger logger = new AuditLogger(auditFile, Clock.systemUTC());
        logger.log(AuditLogger.AuditEvent.of("task.paused", "system", "task:a", "ok", Map.of()));
        logger.log(AuditLogger.AuditEvent.of("task.resumed", "operator", "task:a", "ok", Map.of()));

        List<String> lines = Files.readAllLines(auditFile, StandardCharsets.UTF_8);
        Files.write(auditFile, List.of(lines.get(0), lines.get(1).replace("operator", "intruder")), StandardCharsets.UTF_8);

        Assertions.assertEquals(1, logger.verifyChain());
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
