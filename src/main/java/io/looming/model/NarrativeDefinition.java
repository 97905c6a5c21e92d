package io.looming.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Declarative, ordered workflow of acts. Immutable once loaded.
 *
 * @param targetTable    where the final act's extracted rows land; may be null
 * @param order          act names in execution order
 * @param skipExtraction disables every extraction processor for the run
 */
public record NarrativeDefinition(
        String name,
        String description,
        String targetTable,
        List<String> order,
        Map<String, Act> acts,
        boolean skipExtraction
) {
    public NarrativeDefinition {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("narrative requires a name");
        }
        order = order == null ? List.of() : List.copyOf(order);
        acts = acts == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(acts));
        description = description == null ? "" : description;
    }

    public static NarrativeDefinition of(String name, String targetTable, List<Act> acts) {
        Map<String, Act> byName = new LinkedHashMap<>();
        List<String> order = new ArrayList<>();
        for (Act act : acts) {
            if (byName.putIfAbsent(act.name(), act) != null) {
                throw new IllegalArgumentException("Duplicate act name: " + act.name());
            }
            order.add(act.name());
        }
        return new NarrativeDefinition(name, "", targetTable, order, byName, false);
    }

    public NarrativeDefinition withSkipExtraction(boolean skip) {
        return new NarrativeDefinition(name, description, targetTable, order, acts, skip);
    }

    /**
     * Acts in declared order.
     *
     * @throws IllegalStateException when the order names an act that is not defined
     */
    public List<Act> orderedActs() {
        List<Act> out = new ArrayList<>(order.size());
        for (String actName : order) {
            Act act = acts.get(actName);
            if (act == null) {
                throw new IllegalStateException("Narrative " + name + " references undefined act: " + actName);
            }
            out.add(act);
        }
        return out;
    }

    public boolean hasTargetTable() {
        return targetTable != null && !targetTable.isBlank();
    }
}
