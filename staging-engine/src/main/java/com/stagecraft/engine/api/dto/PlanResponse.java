package com.stagecraft.engine.api.dto;

import com.stagecraft.engine.model.StageConfig;
import com.stagecraft.engine.model.StageKind;
import com.stagecraft.engine.model.StagingPlan;

import java.util.ArrayList;
import java.util.List;

/**
 * Response body for GET /runs/{id}/plan.
 */
public record PlanResponse(
        String            roomCategory,
        String            styleProfile,
        List<StageEntry>  stages
) {
    public record StageEntry(
            int          stageIndex,
            StageKind    stageKind,
            int          minItems,
            int          maxItems,
            List<String> allowedCategories,
            String       instruction
    ) {}

    public static PlanResponse from(StagingPlan plan) {
        List<StageEntry> stages = new ArrayList<>();
        for (int i = 0; i < plan.size(); i++) {
            StageConfig s = plan.stage(i);
            stages.add(new StageEntry(i, s.stageKind(), s.minItems(), s.maxItems(),
                    s.allowedCategories(), s.instruction()));
        }
        return new PlanResponse(plan.roomCategory().wireName(), plan.styleProfile().wireName(), stages);
    }
}
