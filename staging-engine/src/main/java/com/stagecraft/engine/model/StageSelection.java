package com.stagecraft.engine.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Which stage kinds a caller wants in the plan. Filtering is applied after
 * the full plan is generated, so retained stages keep their relative order.
 */
public record StageSelection(Set<StageKind> included) {

    public StageSelection {
        included = included == null || included.isEmpty()
                ? Set.of()
                : Set.copyOf(EnumSet.copyOf(included));
    }

    public static StageSelection all() {
        return new StageSelection(EnumSet.allOf(StageKind.class));
    }

    public static StageSelection without(StageKind... excluded) {
        EnumSet<StageKind> kinds = EnumSet.allOf(StageKind.class);
        kinds.removeAll(List.of(excluded));
        return new StageSelection(kinds);
    }

    public static StageSelection of(boolean primaryFurniture, boolean complementary,
                                    boolean windowTreatment, boolean wallDecor) {
        EnumSet<StageKind> kinds = EnumSet.noneOf(StageKind.class);
        if (primaryFurniture) kinds.add(StageKind.PRIMARY_FURNITURE);
        if (complementary)    kinds.add(StageKind.COMPLEMENTARY);
        if (windowTreatment)  kinds.add(StageKind.WINDOW_TREATMENT);
        if (wallDecor)        kinds.add(StageKind.WALL_DECOR);
        return new StageSelection(kinds);
    }

    public boolean includes(StageKind kind) {
        return included.contains(kind);
    }

    @JsonIgnore
    public boolean isEmpty() {
        return included.isEmpty();
    }
}
