package com.stagecraft.engine.model;

import jakarta.persistence.*;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * The durable record of one staging request.
 *
 * Everything the workflow needs to process the next provider event lives
 * on this row, so a callback arriving after a restart can be handled from
 * the database alone. Only StagingWorkflowService mutates it, and always
 * while holding the row lock (see StagingRunRepository#findByIdForUpdate).
 *
 * DB table: staging_runs  (created by Flyway V1 migration)
 */
@Entity
@Table(name = "staging_runs")
public class StagingRun {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Version
    private Long version;

    @Enumerated(EnumType.STRING)
    @Column(name = "room_category", nullable = false, updatable = false)
    private RoomCategory roomCategory;

    @Enumerated(EnumType.STRING)
    @Column(name = "style_profile", nullable = false, updatable = false)
    private StyleProfile styleProfile;

    // Adapter chosen from the capability table at creation; every stage of
    // the run goes to the same provider.
    @Column(name = "provider_name", nullable = false, updatable = false)
    private String providerName;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(nullable = false, columnDefinition = "jsonb")
    private StagingPlan plan;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private RunStatus status = RunStatus.PENDING;

    @Column(name = "current_stage_index", nullable = false)
    private int currentStageIndex = -1;

    // One slot per plan stage; holds the handle of the latest dispatch for
    // that stage (null = not dispatched yet, or resolved synchronously).
    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "stage_job_handles", nullable = false, columnDefinition = "jsonb")
    private List<String> stageJobHandles = new ArrayList<>();

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "stage_results", nullable = false, columnDefinition = "jsonb")
    private List<StageResult> stageResults = new ArrayList<>();

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "original_image", nullable = false, updatable = false, columnDefinition = "jsonb")
    private ImageRef originalImage;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "latest_image", nullable = false, columnDefinition = "jsonb")
    private ImageRef latestImage;

    @Column(name = "error_message", columnDefinition = "TEXT")
    private String errorMessage;

    @Column(name = "failed_stage_index")
    private Integer failedStageIndex;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt = Instant.now();

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt = Instant.now();

    @Column(name = "finished_at")
    private Instant finishedAt;

    @PreUpdate
    void onUpdate() {
        this.updatedAt = Instant.now();
    }

    // ------------------------------------------------------------------
    // Constructors
    // ------------------------------------------------------------------

    protected StagingRun() {}   // required by JPA

    public StagingRun(RoomCategory roomCategory, StyleProfile styleProfile,
                      String providerName, StagingPlan plan, ImageRef originalImage) {
        this.roomCategory  = roomCategory;
        this.styleProfile  = styleProfile;
        this.providerName  = providerName;
        this.plan          = plan;
        this.originalImage = originalImage;
        this.latestImage   = originalImage;
        this.stageJobHandles = new ArrayList<>(Collections.nCopies(plan.size(), (String) null));
    }

    // ------------------------------------------------------------------
    // Getters
    // ------------------------------------------------------------------

    public UUID          getId()                { return id; }
    public RoomCategory  getRoomCategory()      { return roomCategory; }
    public StyleProfile  getStyleProfile()      { return styleProfile; }
    public String        getProviderName()      { return providerName; }
    public StagingPlan   getPlan()              { return plan; }
    public RunStatus     getStatus()            { return status; }
    public int           getCurrentStageIndex() { return currentStageIndex; }
    public ImageRef      getOriginalImage()     { return originalImage; }
    public ImageRef      getLatestImage()       { return latestImage; }
    public String        getErrorMessage()      { return errorMessage; }
    public Integer       getFailedStageIndex()  { return failedStageIndex; }
    public Instant       getCreatedAt()         { return createdAt; }
    public Instant       getUpdatedAt()         { return updatedAt; }
    public Instant       getFinishedAt()        { return finishedAt; }

    public List<String>      getStageJobHandles() { return Collections.unmodifiableList(stageJobHandles); }
    public List<StageResult> getStageResults()    { return Collections.unmodifiableList(stageResults); }

    public Optional<StageConfig> currentStage() {
        if (currentStageIndex < 0 || currentStageIndex >= plan.size()) return Optional.empty();
        return Optional.of(plan.stage(currentStageIndex));
    }

    public String jobHandleAt(int stageIndex) {
        return stageIndex >= 0 && stageIndex < stageJobHandles.size() ? stageJobHandles.get(stageIndex) : null;
    }

    /** The accepted image of the last stage, present only once the run completed. */
    public Optional<ImageRef> finalImage() {
        return status == RunStatus.COMPLETED ? Optional.of(latestImage) : Optional.empty();
    }

    // ------------------------------------------------------------------
    // Mutations (workflow only)
    // ------------------------------------------------------------------

    /** Point the run at a stage; the index never moves backwards. */
    public void enterStage(int stageIndex) {
        if (stageIndex < currentStageIndex) {
            throw new IllegalStateException("Stage index cannot move backwards: "
                    + currentStageIndex + " -> " + stageIndex);
        }
        this.currentStageIndex = stageIndex;
        if (status == RunStatus.PENDING) {
            this.status = RunStatus.RUNNING;
        }
    }

    // JSON columns are replaced rather than mutated in place so dirty
    // checking always sees a new value.

    public void recordJobHandle(int stageIndex, String jobHandle) {
        List<String> handles = new ArrayList<>(stageJobHandles);
        handles.set(stageIndex, jobHandle);
        this.stageJobHandles = handles;
    }

    public void appendResult(StageResult result) {
        List<StageResult> results = new ArrayList<>(stageResults);
        results.add(result);
        this.stageResults = results;
    }

    public void acceptImage(ImageRef image) {
        this.latestImage = image;
    }

    public void complete() {
        this.status     = RunStatus.COMPLETED;
        this.finishedAt = Instant.now();
    }

    public void fail(int stageIndex, String message) {
        this.status           = RunStatus.FAILED;
        this.failedStageIndex = stageIndex;
        this.errorMessage     = message;
        this.finishedAt       = Instant.now();
    }
}
