package com.stagecraft.engine.api.dto;

import com.stagecraft.engine.model.DispatchState;
import com.stagecraft.engine.model.StageDispatch;
import com.stagecraft.engine.model.StageKind;

import java.time.Instant;
import java.util.UUID;

/**
 * Read-only view of one provider job, returned by GET /runs/{id}/dispatches.
 *
 * instruction is the exact text the provider received, so corrective
 * retries can be compared with the first attempt.
 */
public record DispatchResponse(
        UUID          id,
        int           stageIndex,
        StageKind     stageKind,
        int           attempt,
        String        provider,
        String        jobHandle,
        DispatchState state,
        String        detail,
        String        instruction,
        int           pollCount,
        Instant       dispatchedAt,
        Instant       lastPolledAt,
        Instant       resolvedAt
) {
    public static DispatchResponse from(StageDispatch d) {
        return new DispatchResponse(
                d.getId(),
                d.getStageIndex(),
                d.getStageKind(),
                d.getAttempt(),
                d.getProviderName(),
                d.getJobHandle(),
                d.getState(),
                d.getDetail(),
                d.getInstruction(),
                d.getPollCount(),
                d.getDispatchedAt(),
                d.getLastPolledAt(),
                d.getResolvedAt()
        );
    }
}
