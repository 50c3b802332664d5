package com.stagecraft.engine.model;

import java.util.Arrays;
import java.util.Optional;

/**
 * Furnishing styles. Each one maps to a style-guidance block that is
 * appended to every stage instruction of a plan.
 */
public enum StyleProfile {
    STANDARD("standard", "standard"),
    MODERN("modern", "modern"),
    SCANDINAVIAN("scandinavian", "Scandinavian"),
    INDUSTRIAL("industrial", "industrial"),
    MIDCENTURY("midcentury", "mid-century modern"),
    LUXURY("luxury", "luxury"),
    COASTAL("coastal", "coastal"),
    FARMHOUSE("farmhouse", "farmhouse");

    private final String wireName;
    private final String label;

    StyleProfile(String wireName, String label) {
        this.wireName = wireName;
        this.label    = label;
    }

    public String wireName() { return wireName; }
    public String label()    { return label; }

    public static Optional<StyleProfile> fromWire(String value) {
        if (value == null) return Optional.empty();
        String v = value.trim();
        return Arrays.stream(values())
                .filter(s -> s.wireName.equalsIgnoreCase(v) || s.name().equalsIgnoreCase(v))
                .findFirst();
    }
}
