package com.stagecraft.engine.model;

import java.util.List;
import java.util.Optional;

/**
 * Ordered list of stages for one run. Generated once at run creation and
 * stored with the run; never regenerated mid-run.
 */
public record StagingPlan(RoomCategory roomCategory, StyleProfile styleProfile, List<StageConfig> stages) {

    public StagingPlan {
        stages = stages == null ? List.of() : List.copyOf(stages);
    }

    public int size() {
        return stages.size();
    }

    public StageConfig stage(int index) {
        return stages.get(index);
    }

    public boolean isLast(int index) {
        return index == stages.size() - 1;
    }

    public Optional<StageConfig> find(StageKind kind) {
        return stages.stream().filter(s -> s.stageKind() == kind).findFirst();
    }
}
