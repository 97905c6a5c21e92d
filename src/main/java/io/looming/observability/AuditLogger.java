package io.looming.observability;

import com.fasterxml.jackson.databind.JsonNode;
import io.looming.security.SensitiveDataMasker;
import io.looming.util.Hashing;
import io.looming.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Append-only, hash-chained JSON-lines log of durable transitions.
 */
public final class AuditLogger {
    private static final Logger log = LoggerFactory.getLogger(AuditLogger.class);

    private final Path auditFile;
    private final Clock clock;
    private String previousHash;

    public AuditLogger(Path auditFile, Clock clock) {
        this.auditFile = auditFile;
        this.clock = clock;
        try {
            Files.createDirectories(auditFile.getParent());
            if (!Files.exists(auditFile)) {
                try {
                    Files.createFile(auditFile);
                } catch (FileAlreadyExistsException ignored) {
                    // Another process created it between exists() and createFile().
                }
            }
        } catch (IOException e) {
            throw new RuntimeException("Failed to initialize audit log file: " + auditFile, e);
        }
        this.previousHash = loadLastHash();
    }

    public synchronized void log(AuditEvent event) {
        Map<String, Object> row = new LinkedHashMap<>();
        row.put("timestamp", clock.instant().toString());
        row.put("action", event.action());
        row.put("actor", event.actor());
        row.put("resource", event.resource());
        row.put("result", event.result());
        row.put("task_id", event.taskId());
        row.put("execution_id", event.executionId());
        row.put("details", SensitiveDataMasker.masked(Jsons.mapper().valueToTree(event.details())));
        row.put("prev_hash", previousHash);
        String rowHash = Hashing.sha256Hex(Jsons.toCompactJson(row));
        row.put("hash", rowHash);
        String line = Jsons.toCompactJson(row) + System.lineSeparator();
        try {
            Files.writeString(auditFile, line, StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE, StandardOpenOption.APPEND, StandardOpenOption.WRITE);
            previousHash = rowHash;
        } catch (IOException e) {
            throw new RuntimeException("Failed to write audit log", e);
        }
    }

    public synchronized String currentHash() {
        return previousHash;
    }

    /**
     * Recomputes the chain from the first line.
     *
     * @return index of the first line whose hash or back-link does not match, or -1 when intact
     */
    public synchronized int verifyChain() {
        List<String> lines;
        try {
            lines = Files.readAllLines(auditFile, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new RuntimeException("Failed to read audit log", e);
        }
        String prev = "";
        int index = 0;
        for (String line : lines) {
            if (line.isBlank()) {
                continue;
            }
            JsonNode node = Jsons.readTree(line);
            String hash = node.path("hash").asText("");
            Map<String, Object> body = Jsons.mapper().convertValue(node, LinkedHashMap.class);
            body.remove("hash");
            if (!prev.equals(node.path("prev_hash").asText("")) || !hash.equals(Hashing.sha256Hex(Jsons.toCompactJson(body)))) {
                return index;
            }
            prev = hash;
            index++;
        }
        return -1;
    }

    private String loadLastHash() {
        try {
            String last = "";
            for (String line : Files.readAllLines(auditFile, StandardCharsets.UTF_8)) {
                if (line != null && !line.isBlank()) {
                    last = line;
                }
            }
            if (last.isBlank()) {
                return "";
            }
            return Jsons.readTree(last).path("hash").asText("");
        } catch (IOException | IllegalArgumentException e) {
            log.warn("Audit log tail unreadable, starting a new chain: {}", e.getMessage());
            return "";
        }
    }

    public record AuditEvent(
            String action,
            String actor,
            String resource,
            String result,
            String taskId,
            String executionId,
            Map<String, Object> details
    ) {
        public AuditEvent {
            details = details == null ? Map.of() : new LinkedHashMap<>(details);
        }

        public static AuditEvent of(String action, String actor, String resource, String result, Map<String, Object> details) {
            return new AuditEvent(action, actor, resource, result, null, null, details);
        }

        public AuditEvent withTask(String id) {
            return new AuditEvent(action, actor, resource, result, id, executionId, details);
        }

        public AuditEvent withExecution(String id) {
            return new AuditEvent(action, actor, resource, result, taskId, id, details);
        }
    }
}
