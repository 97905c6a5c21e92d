package io.looming.processor;

import com.fasterxml.jackson.databind.node.ObjectNode;
import io.looming.storage.ContentStore;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Drops rows whose content hash already exists for the target table, or that
 * repeat earlier in the same batch.
 */
public final class ContentDeduplicator {
    private final ContentStore store;

    public ContentDeduplicator(ContentStore store) {
        this.store = store;
    }

    public List<ObjectNode> unique(String targetTable, List<ObjectNode> rows) {
        Set<String> seen = new HashSet<>();
        List<ObjectNode> out = new ArrayList<>(rows.size());
        for (ObjectNode row : rows) {
            String hash = ContentStore.rowHash(row);
            if (seen.add(hash) && !store.containsHash(targetTable, hash)) {
                out.add(row);
            }
        }
        return out;
    }
}
