package com.stagecraft.engine.api.dto;

import com.stagecraft.engine.model.StageKind;
import com.stagecraft.engine.model.StageResult;
import com.stagecraft.engine.model.ViolationTag;

import java.time.Instant;
import java.util.List;

/**
 * One entry of a run's stage audit trail.
 */
public record StageResultResponse(
        int                stageIndex,
        StageKind          stageKind,
        boolean            succeeded,
        int                itemsAdded,
        boolean            validationPassed,
        List<ViolationTag> validationViolations,
        int                retryCount,
        String             resultImageUrl,
        String             jobHandle,
        Instant            recordedAt
) {
    public static StageResultResponse from(StageResult r) {
        return new StageResultResponse(
                r.stageIndex(),
                r.stageKind(),
                r.succeeded(),
                r.itemsAdded(),
                r.validationPassed(),
                r.validationViolations(),
                r.retryCount(),
                r.resultImage() == null ? null : r.resultImage().url(),
                r.jobHandle(),
                r.recordedAt()
        );
    }
}
