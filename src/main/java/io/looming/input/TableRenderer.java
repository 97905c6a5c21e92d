package io.looming.input;

import io.looming.model.TableFormat;
import io.looming.util.Jsons;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Renders table rows as text. Output is built completely before it is
 * returned; a failure yields no partial content.
 */
public final class TableRenderer {

    public String render(String table, List<Map<String, Object>> rows, TableFormat format, List<String> columns)
            throws InputException {
        List<String> header = columns(rows, columns);
        for (String column : columns) {
            if (!rows.isEmpty() && rows.stream().noneMatch(r -> r.containsKey(column))) {
                throw new InputException(InputException.Kind.RENDER,
                        "Column " + column + " not present in table " + table);
            }
        }
        try {
            return switch (format) {
                case JSON -> renderJson(rows, header);
                case MARKDOWN -> renderMarkdown(table, rows, header);
                case CSV -> renderCsv(rows, header);
            };
        } catch (RuntimeException e) {
            throw new InputException(InputException.Kind.RENDER,
                    "Failed to render table " + table + " as " + format + ": " + e.getMessage(), e);
        }
    }

    private static List<String> columns(List<Map<String, Object>> rows, List<String> requested) {
        if (requested != null && !requested.isEmpty()) {
            return List.copyOf(requested);
        }
        Set<String> seen = new LinkedHashSet<>();
        for (Map<String, Object> row : rows) {
            seen.addAll(row.keySet());
        }
        return new ArrayList<>(seen);
    }

    private static String renderJson(List<Map<String, Object>> rows, List<String> header) {
        List<Map<String, Object>> projected = new ArrayList<>(rows.size());
        for (Map<String, Object> row : rows) {
            Map<String, Object> p = new LinkedHashMap<>();
            for (String column : header) {
                p.put(column, row.get(column));
            }
            projected.add(p);
        }
        return Jsons.toJson(projected);
    }

    private static String renderMarkdown(String table, List<Map<String, Object>> rows, List<String> header) {
        if (rows.isEmpty()) {
            return "Table " + table + ": no rows";
        }
        StringBuilder sb = new StringBuilder();
        sb.append('|');
        for (String column : header) {
            sb.append(' ').append(markdownCell(column)).append(" |");
        }
        sb.append('\n').append('|');
        for (int i = 0; i < header.size(); i++) {
            sb.append(" --- |");
        }
        for (Map<String, Object> row : rows) {
            sb.append('\n').append('|');
            for (String column : header) {
                sb.append(' ').append(markdownCell(cell(row.get(column)))).append(" |");
            }
        }
        return sb.toString();
    }

    private static String renderCsv(List<Map<String, Object>> rows, List<String> header) {
        StringBuilder sb = new StringBuilder();
        appendCsvLine(sb, header);
        for (Map<String, Object> row : rows) {
            List<String> values = new ArrayList<>(header.size());
            for (String column : header) {
                values.add(cell(row.get(column)));
            }
            sb.append('\n');
            appendCsvLine(sb, values);
        }
        return sb.toString();
    }

    private static void appendCsvLine(StringBuilder sb, List<String> values) {
        for (int i = 0; i < values.size(); i++) {
            if (i > 0) {
                sb.append(',');
            }
            String v = values.get(i);
            if (v.contains(",") || v.contains("\"") || v.contains("\n") || v.contains("\r")) {
                sb.append('"').append(v.replace("\"", "\"\"")).append('"');
            } else {
                sb.append(v);
            }
        }
    }

    private static String cell(Object value) {
        if (value == null) {
            return "";
        }
        if (value instanceof Map || value instanceof List) {
            return Jsons.toCompactJson(value);
        }
        return String.valueOf(value);
    }

    private static String markdownCell(String value) {
        return value.replace("|", "\\|").replace("\r\n", " ").replace('\n', ' ');
    }
}
