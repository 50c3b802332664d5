package com.stagecraft.engine.plan;

import java.util.List;

/**
 * Item-count range and permitted item labels for one stage kind in one room.
 */
public record CatalogueEntry(int minItems, int maxItems, List<String> items) {

    public CatalogueEntry {
        if (minItems < 0 || minItems > maxItems) {
            throw new IllegalArgumentException("Invalid range [" + minItems + ", " + maxItems + "]");
        }
        items = items == null ? List.of() : List.copyOf(items);
    }

    public static CatalogueEntry of(int minItems, int maxItems, String... items) {
        return new CatalogueEntry(minItems, maxItems, List.of(items));
    }
}
