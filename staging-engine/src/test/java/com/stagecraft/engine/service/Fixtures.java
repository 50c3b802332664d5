package com.stagecraft.engine.service;

import com.stagecraft.engine.model.*;

import java.lang.reflect.Field;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

/** Entity factories for tests that mock the workflow. */
final class Fixtures {

    private Fixtures() {}

    static StagingRun run() {
        StagingPlan plan = new StagingPlan(RoomCategory.BEDROOM, StyleProfile.MODERN, List.of(
                new StageConfig(StageKind.PRIMARY_FURNITURE, 1, 1, List.of("platform bed"), "Add a bed")));
        return withId(new StagingRun(RoomCategory.BEDROOM, StyleProfile.MODERN, "flux-kontext", plan,
                new ImageRef("https://cdn.example.com/bedroom.jpg", 1200, 900)));
    }

    static StageDispatch dispatch(UUID runId, String handle) {
        StageDispatch d = new StageDispatch(runId, 0, StageKind.PRIMARY_FURNITURE, 0, "flux-kontext", "Add a bed");
        d.setJobHandle(handle);
        return withId(d);
    }

    static StageDispatch dispatch(String handle, Instant dispatchedAt, Instant lastPolledAt) {
        StageDispatch d = dispatch(UUID.randomUUID(), handle);
        // Normally set by the entity on creation / by markPolled()
        set(d, "dispatchedAt", dispatchedAt);
        set(d, "lastPolledAt", lastPolledAt);
        return d;
    }

    /** Assign the id the database would generate on insert. */
    static <T> T withId(T entity) {
        set(entity, "id", UUID.randomUUID());
        return entity;
    }

    private static void set(Object target, String field, Object value) {
        try {
            Field f = target.getClass().getDeclaredField(field);
            f.setAccessible(true);
            f.set(target, value);
        } catch (Exception e) {
            throw new RuntimeException(e);
        }
    }
}
