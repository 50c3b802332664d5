package com.stagecraft.engine.validation;

import com.stagecraft.engine.model.StageConfig;

/**
 * Everything a check may look at for one before/after pair.
 */
public record ValidationContext(
        ImageSample before,
        ImageSample after,
        StageConfig stage,
        ChangeMap   changes
) {
    public static ValidationContext of(ImageSample before, ImageSample after, StageConfig stage) {
        return new ValidationContext(before, after, stage, new ChangeMap(before, after));
    }

    /** Estimated number of items the stage introduced. */
    public int itemCountEstimate() {
        return changes.regionCount();
    }
}
