package com.stagecraft.engine.api.dto;

import com.stagecraft.engine.model.StageSelection;

/**
 * Per-stage switches in a POST /runs body. A missing switch counts as true.
 */
public record StageSelectionRequest(
        Boolean primaryFurniture,
        Boolean complementary,
        Boolean windowTreatment,
        Boolean wallDecor
) {
    public StageSelection toSelection() {
        return StageSelection.of(
                !Boolean.FALSE.equals(primaryFurniture),
                !Boolean.FALSE.equals(complementary),
                !Boolean.FALSE.equals(windowTreatment),
                !Boolean.FALSE.equals(wallDecor));
    }
}
