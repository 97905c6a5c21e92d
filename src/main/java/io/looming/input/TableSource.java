package io.looming.input;

import java.util.List;
import java.util.Map;

/**
 * Read-only relational access used by table inputs.
 */
public interface TableSource {
    /**
     * @return rows as ordered column/value maps, at most {@code limit} of them
     */
    List<Map<String, Object>> query(String table, Map<String, String> filter, int limit);
}
