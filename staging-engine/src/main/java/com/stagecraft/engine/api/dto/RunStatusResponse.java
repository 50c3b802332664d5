package com.stagecraft.engine.api.dto;

import com.stagecraft.engine.model.ImageRef;
import com.stagecraft.engine.model.StageConfig;
import com.stagecraft.engine.model.StagingRun;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Response body for POST /runs and GET /runs/{id}.
 *
 * finalImageUrl is only set once the run COMPLETED; errorMessage and
 * failedStageIndex only once it FAILED.
 */
public record RunStatusResponse(
        UUID                      id,
        String                    status,
        String                    roomCategory,
        String                    styleProfile,
        String                    provider,
        int                       currentStageIndex,
        String                    currentStageKind,
        int                       totalStages,
        List<StageResultResponse> stageResults,
        String                    finalImageUrl,
        String                    errorMessage,
        Integer                   failedStageIndex,
        Instant                   createdAt,
        Instant                   updatedAt,
        Instant                   finishedAt
) {
    public static RunStatusResponse from(StagingRun run) {
        return new RunStatusResponse(
                run.getId(),
                run.getStatus().name(),
                run.getRoomCategory().wireName(),
                run.getStyleProfile().wireName(),
                run.getProviderName(),
                run.getCurrentStageIndex(),
                run.currentStage().map(StageConfig::stageKind).map(Enum::name).orElse(null),
                run.getPlan().size(),
                run.getStageResults().stream().map(StageResultResponse::from).toList(),
                run.finalImage().map(ImageRef::url).orElse(null),
                run.getErrorMessage(),
                run.getFailedStageIndex(),
                run.getCreatedAt(),
                run.getUpdatedAt(),
                run.getFinishedAt()
        );
    }
}
