package com.stagecraft.engine.model;

import java.util.Arrays;
import java.util.Optional;

/**
 * Room categories a staging run can target.
 *
 * The wire name is what API clients send ("living_room"); the label is the
 * human phrase used inside generation instructions ("living room").
 */
public enum RoomCategory {
    BEDROOM("bedroom", "bedroom"),
    LIVING_ROOM("living_room", "living room"),
    KITCHEN("kitchen", "kitchen"),
    BATHROOM("bathroom", "bathroom"),
    HOME_OFFICE("home_office", "home office"),
    DINING_ROOM("dining_room", "dining room"),
    KIDS_ROOM("kids_room", "kids room"),
    OUTDOOR("outdoor", "outdoor space");

    private final String wireName;
    private final String label;

    RoomCategory(String wireName, String label) {
        this.wireName = wireName;
        this.label    = label;
    }

    public String wireName() { return wireName; }
    public String label()    { return label; }

    /** Case-insensitive lookup by wire name or enum constant name. */
    public static Optional<RoomCategory> fromWire(String value) {
        if (value == null) return Optional.empty();
        String v = value.trim();
        return Arrays.stream(values())
                .filter(c -> c.wireName.equalsIgnoreCase(v) || c.name().equalsIgnoreCase(v))
                .findFirst();
    }
}
