package com.a2dd.core.inventory;

import java.util.List;
import java.util.Map;

/**
 * Result of an action inventory.
 *
 * @param counts action name to number of uses, most frequent first
 * @param errors tasks or files that could not be read or resolved
 */
public record InventoryReport(Map<String, Long> counts, int errors) {

    public List<String> lines() {
        return counts.entrySet().stream()
                .map(e -> String.format("%-40s  %d", e.getKey(), e.getValue()))
                .toList();
    }
}
