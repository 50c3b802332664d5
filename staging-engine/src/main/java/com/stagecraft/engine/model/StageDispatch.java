package com.stagecraft.engine.model;

import jakarta.persistence.*;

import java.time.Instant;
import java.util.UUID;

/**
 * One provider job issued for one attempt at one stage.
 *
 * Webhooks only carry the provider's job handle, so this row is how an
 * inbound callback finds its run. It is also the audit trail of every
 * instruction actually sent, corrective retries included.
 *
 * DB table: stage_dispatches  (created by Flyway V1 migration)
 */
@Entity
@Table(name = "stage_dispatches")
public class StageDispatch {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "run_id", nullable = false, updatable = false)
    private UUID runId;

    @Column(name = "stage_index", nullable = false, updatable = false)
    private int stageIndex;

    @Enumerated(EnumType.STRING)
    @Column(name = "stage_kind", nullable = false, updatable = false)
    private StageKind stageKind;

    // 0 = first attempt, 1 = corrective retry.
    @Column(nullable = false, updatable = false)
    private int attempt;

    @Column(name = "provider_name", nullable = false, updatable = false)
    private String providerName;

    // Null when the provider answered synchronously or the dispatch failed.
    @Column(name = "job_handle", unique = true)
    private String jobHandle;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private DispatchState state = DispatchState.AWAITING;

    @Column(columnDefinition = "TEXT", nullable = false, updatable = false)
    private String instruction;

    @Column(columnDefinition = "TEXT")
    private String detail;

    @Column(name = "dispatched_at", nullable = false, updatable = false)
    private Instant dispatchedAt = Instant.now();

    @Column(name = "resolved_at")
    private Instant resolvedAt;

    @Column(name = "last_polled_at")
    private Instant lastPolledAt;

    @Column(name = "poll_count", nullable = false)
    private int pollCount = 0;

    protected StageDispatch() {}   // required by JPA

    public StageDispatch(UUID runId, int stageIndex, StageKind stageKind, int attempt,
                         String providerName, String instruction) {
        this.runId        = runId;
        this.stageIndex   = stageIndex;
        this.stageKind    = stageKind;
        this.attempt      = attempt;
        this.providerName = providerName;
        this.instruction  = instruction;
    }

    public UUID          getId()           { return id; }
    public UUID          getRunId()        { return runId; }
    public int           getStageIndex()   { return stageIndex; }
    public StageKind     getStageKind()    { return stageKind; }
    public int           getAttempt()      { return attempt; }
    public String        getProviderName() { return providerName; }
    public String        getJobHandle()    { return jobHandle; }
    public DispatchState getState()        { return state; }
    public String        getInstruction()  { return instruction; }
    public String        getDetail()       { return detail; }
    public Instant       getDispatchedAt() { return dispatchedAt; }
    public Instant       getResolvedAt()   { return resolvedAt; }
    public Instant       getLastPolledAt() { return lastPolledAt; }
    public int           getPollCount()    { return pollCount; }

    public boolean isAwaiting() {
        return state == DispatchState.AWAITING;
    }

    public void setJobHandle(String jobHandle) { this.jobHandle = jobHandle; }

    public void markPolled() {
        this.pollCount++;
        this.lastPolledAt = Instant.now();
    }

    public void resolve(DispatchState outcome, String detail) {
        if (outcome == DispatchState.AWAITING) {
            throw new IllegalArgumentException("Cannot resolve a dispatch to AWAITING");
        }
        this.state      = outcome;
        this.detail     = detail;
        this.resolvedAt = Instant.now();
    }
}
