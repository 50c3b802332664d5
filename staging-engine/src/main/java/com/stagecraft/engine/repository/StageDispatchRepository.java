package com.stagecraft.engine.repository;

import com.stagecraft.engine.model.DispatchState;
import com.stagecraft.engine.model.StageDispatch;
import org.springframework.data.jpa.repository.JpaRepository;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Lookup queries for the stage_dispatches table.
 */
public interface StageDispatchRepository extends JpaRepository<StageDispatch, UUID> {

    /** Resolve an inbound callback's job handle to its dispatch (and so its run). */
    Optional<StageDispatch> findByJobHandle(String jobHandle);

    /** Every provider job issued for a run, oldest first. */
    List<StageDispatch> findByRunIdOrderByDispatchedAtAsc(UUID runId);

    /** Dispatches still waiting for a result that were sent before 'cutoff'. */
    List<StageDispatch> findByStateAndDispatchedAtBefore(DispatchState state, Instant cutoff);
}
