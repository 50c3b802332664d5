package com.stagecraft.engine.model;

import java.time.Instant;
import java.util.List;

/**
 * Audit entry for one attempt at one stage.
 *
 * Appended by the workflow after the attempt is judged and never edited:
 * a corrective retry produces a second entry with retryCount = 1.
 * resultImage is non-null exactly when succeeded is true.
 */
public record StageResult(
        int                stageIndex,
        StageKind          stageKind,
        boolean            succeeded,
        int                itemsAdded,
        boolean            validationPassed,
        List<ViolationTag> validationViolations,
        int                retryCount,
        ImageRef           resultImage,
        String             jobHandle,
        Instant            recordedAt
) {
    public StageResult {
        validationViolations = validationViolations == null ? List.of() : List.copyOf(validationViolations);
        if (succeeded != (resultImage != null)) {
            throw new IllegalArgumentException("resultImage must be present iff the attempt succeeded");
        }
    }

    public static StageResult accepted(int stageIndex, StageKind kind, int itemsAdded,
                                       int retryCount, ImageRef image, String jobHandle) {
        return new StageResult(stageIndex, kind, true, itemsAdded, true,
                List.of(), retryCount, image, jobHandle, Instant.now());
    }

    /**
     * A rejected attempt. validationPassed is false for every rejection; for
     * transport failures the validator never ran and itemsAdded is 0.
     */
    public static StageResult rejected(int stageIndex, StageKind kind, int itemsAdded,
                                       List<ViolationTag> violations, int retryCount, String jobHandle) {
        return new StageResult(stageIndex, kind, false, itemsAdded, false,
                violations, retryCount, null, jobHandle, Instant.now());
    }
}
