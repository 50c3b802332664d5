package com.stagecraft.engine.model;

import java.util.List;

/**
 * One stage of a staging plan.
 *
 * minItems/maxItems are inclusive bounds on how many elements the stage may
 * introduce; allowedCategories are the item labels this stage (and only this
 * stage) may contribute. instruction is passed to the provider verbatim.
 */
public record StageConfig(
        StageKind    stageKind,
        int          minItems,
        int          maxItems,
        List<String> allowedCategories,
        String       instruction
) {
    public StageConfig {
        if (stageKind == null) throw new IllegalArgumentException("stageKind is required");
        if (minItems < 0 || minItems > maxItems) {
            throw new IllegalArgumentException(
                    "Invalid item range [" + minItems + ", " + maxItems + "] for " + stageKind);
        }
        allowedCategories = allowedCategories == null ? List.of() : List.copyOf(allowedCategories);
        if (allowedCategories.isEmpty() && maxItems != 0) {
            throw new IllegalArgumentException(stageKind + " has no allowed categories but maxItems=" + maxItems);
        }
        instruction = instruction == null ? "" : instruction;
    }
}
