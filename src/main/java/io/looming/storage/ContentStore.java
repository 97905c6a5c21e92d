package io.looming.storage;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import io.looming.input.TableSource;
import io.looming.util.Hashing;
import io.looming.util.Jsons;

import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Generated content rows, grouped by target table name. Also serves those rows
 * back to table inputs, newest first.
 */
public final class ContentStore implements TableSource {
    private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z_][A-Za-z0-9_]{0,63}");
    private static final TypeReference<LinkedHashMap<String, Object>> ROW_TYPE = new TypeReference<>() {
    };

    private final Database database;

    public ContentStore(Database database) {
        this.database = database;
    }

    public static String rowHash(JsonNode row) {
        return Hashing.sha256Hex(Jsons.toCompactJson(row));
    }

    public int insertRows(String targetTable, String executionId, String actName, List<? extends JsonNode> rows, long nowMs) {
        requireIdentifier(targetTable, "target table");
        if (rows.isEmpty()) {
            return 0;
        }
        return database.inTransaction("insert generated content", c -> {
            try (PreparedStatement ps = c.prepareStatement(
                    "INSERT INTO generated_content(target_table,execution_id,act_name,row_json,content_hash,created_at_ms) VALUES(?,?,?,?,?,?)")) {
                for (JsonNode row : rows) {
                    ps.setString(1, targetTable);
                    ps.setString(2, executionId);
                    ps.setString(3, actName);
                    ps.setString(4, Jsons.toCompactJson(row));
                    ps.setString(5, rowHash(row));
                    ps.setLong(6, nowMs);
                    ps.addBatch();
                }
                ps.executeBatch();
            }
            return rows.size();
        });
    }

    public boolean containsHash(String targetTable, String contentHash) {
        return database.withConnection("check content hash", c -> {
            try (PreparedStatement ps = c.prepareStatement(
                    "SELECT 1 FROM generated_content WHERE target_table=? AND content_hash=? LIMIT 1")) {
                ps.setString(1, targetTable);
                ps.setString(2, contentHash);
                try (ResultSet rs = ps.executeQuery()) {
                    return rs.next();
                }
            }
        });
    }

    public int countRows(String targetTable) {
        return database.withConnection("count generated content", c -> {
            try (PreparedStatement ps = c.prepareStatement("SELECT COUNT(*) FROM generated_content WHERE target_table=?")) {
                ps.setString(1, targetTable);
                try (ResultSet rs = ps.executeQuery()) {
                    return rs.next() ? rs.getInt(1) : 0;
                }
            }
        });
    }

    @Override
    public List<Map<String, Object>> query(String table, Map<String, String> filter, int limit) {
        requireIdentifier(table, "table");
        Map<String, String> safeFilter = filter == null ? Map.of() : filter;
        StringBuilder sql = new StringBuilder("SELECT row_json FROM generated_content WHERE target_table=?");
        for (String key : safeFilter.keySet()) {
            requireIdentifier(key, "filter column");
            sql.append(" AND CAST(json_extract(row_json, '$.").append(key).append("') AS TEXT)=?");
        }
        sql.append(" ORDER BY id DESC LIMIT ?");
        return database.withConnection("query table " + table, c -> {
            try (PreparedStatement ps = c.prepareStatement(sql.toString())) {
                int idx = 1;
                ps.setString(idx++, table);
                for (String value : safeFilter.values()) {
                    ps.setString(idx++, value);
                }
                ps.setInt(idx, Math.max(1, limit));
                List<Map<String, Object>> out = new ArrayList<>();
                try (ResultSet rs = ps.executeQuery()) {
                    while (rs.next()) {
                        out.add(readRow(rs.getString(1)));
                    }
                }
                return out;
            }
        });
    }

    private static Map<String, Object> readRow(String raw) {
        try {
            return Jsons.mapper().readValue(raw, ROW_TYPE);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Corrupt generated content row", e);
        }
    }

    private static void requireIdentifier(String value, String what) {
        if (value == null || !IDENTIFIER.matcher(value).matches()) {
            throw new IllegalArgumentException("Invalid " + what + ": " + value);
        }
    }
}
