package io.looming.model;

import java.util.List;
import java.util.Map;

/**
 * Read-only dump of a content table, rendered as text.
 *
 * <p>Filter values may contain template references.
 */
public record TableInput(
        String table,
        Map<String, String> filter,
        Integer limit,
        TableFormat format,
        List<String> columns,
        HistoryRetention retention
) implements Input {
    public static final int DEFAULT_LIMIT = 10;

    public TableInput {
        if (table == null || table.isBlank()) {
            throw new IllegalArgumentException("table input requires a table name");
        }
        filter = filter == null ? Map.of() : Map.copyOf(filter);
        limit = limit == null || limit < 1 ? DEFAULT_LIMIT : limit;
        format = format == null ? TableFormat.MARKDOWN : format;
        columns = columns == null ? List.of() : List.copyOf(columns);
        retention = retention == null ? HistoryRetention.FULL : retention;
    }

    public static TableInput of(String table, int limit, TableFormat format) {
        return new TableInput(table, Map.of(), limit, format, List.of(), HistoryRetention.FULL);
    }

    @Override
    public InputKind kind() {
        return InputKind.TABLE;
    }
}
