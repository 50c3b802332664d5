package com.stagecraft.engine.service;

import com.stagecraft.engine.model.*;
import com.stagecraft.engine.plan.StagingPlanBuilder;
import com.stagecraft.engine.provider.*;
import com.stagecraft.engine.repository.StageDispatchRepository;
import com.stagecraft.engine.repository.StagingRunRepository;
import com.stagecraft.engine.storage.ImageStore;
import com.stagecraft.engine.storage.ImageStoreException;
import com.stagecraft.engine.validation.ImageLoadException;
import com.stagecraft.engine.validation.StageValidator;
import com.stagecraft.engine.validation.ValidationVerdict;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * The staging state machine.
 *
 * Every provider event, whether it comes from the blocking poll loop, a
 * webhook or the background sweeper, ends up in {@link #onJobStatus} or
 * {@link #onDispatchTimeout}. Both:
 * <ol>
 *   <li>resolve the job handle to its dispatch row,</li>
 *   <li>lock the run row (SELECT ... FOR UPDATE),</li>
 *   <li>drop the event unless the handle is the current one of a running run,</li>
 *   <li>judge the attempt, append a StageResult, and either dispatch the next
 *       attempt or finish the run.</li>
 * </ol>
 * Nothing is kept in memory between events; a restart loses nothing.
 *
 * Retry policy: each stage gets one corrective retry. Validation failures,
 * provider errors and timeouts all count the same.
 */
@Service
public class StagingWorkflowService {

    private static final Logger log = LoggerFactory.getLogger(StagingWorkflowService.class);

    /** 0 = first attempt, 1 = corrective retry. */
    static final int MAX_ATTEMPT = 1;

    private final StagingRunRepository    runRepo;
    private final StageDispatchRepository dispatchRepo;
    private final StagingPlanBuilder      planBuilder;
    private final ProviderCapabilityTable providers;
    private final StageExecutor           executor;
    private final StageValidator          validator;
    private final ImageStore              imageStore;
    private final CorrectionInstructions  corrections;
    private final MeterRegistry           meterRegistry;

    public StagingWorkflowService(StagingRunRepository runRepo,
                                  StageDispatchRepository dispatchRepo,
                                  StagingPlanBuilder planBuilder,
                                  ProviderCapabilityTable providers,
                                  StageExecutor executor,
                                  StageValidator validator,
                                  ImageStore imageStore,
                                  CorrectionInstructions corrections,
                                  MeterRegistry meterRegistry) {
        this.runRepo       = runRepo;
        this.dispatchRepo  = dispatchRepo;
        this.planBuilder   = planBuilder;
        this.providers     = providers;
        this.executor      = executor;
        this.validator     = validator;
        this.imageStore    = imageStore;
        this.corrections   = corrections;
        this.meterRegistry = meterRegistry;
    }

    // ------------------------------------------------------------------
    // Run creation
    // ------------------------------------------------------------------

    /**
     * Validate the request, fix the plan, and dispatch stage 0.
     *
     * Steps:
     *  1. Reject bad input before anything is stored
     *  2. Pick the provider for the (room, style) pair
     *  3. Build the plan and save the run (status = PENDING)
     *  4. Dispatch stage 0 (status = RUNNING); synchronous outcomes are
     *     applied right away, so the returned run may already be terminal
     *
     * @throws InvalidRunRequestException  on malformed input
     * @throws UnsupportedStagingException if no provider serves the pair
     */
    @Transactional
    public StagingRun startRun(StartRunCommand cmd) {
        if (cmd.imageUrl() == null || cmd.imageUrl().isBlank()) {
            throw new InvalidRunRequestException("imageUrl is required");
        }
        // 0 = unknown; the provider then picks its default output size.
        if (cmd.width() < 0 || cmd.height() < 0) {
            throw new InvalidRunRequestException("width and height must not be negative");
        }
        if ((cmd.width() == 0) != (cmd.height() == 0)) {
            throw new InvalidRunRequestException("width and height must be given together");
        }
        RoomCategory room = RoomCategory.fromWire(cmd.roomCategory())
                .orElseThrow(() -> new InvalidRunRequestException(
                        "Unknown room category: " + cmd.roomCategory()));
        StyleProfile style = StyleProfile.fromWire(cmd.styleProfile())
                .orElseThrow(() -> new InvalidRunRequestException(
                        "Unknown style profile: " + cmd.styleProfile()));
        StageSelection selection = cmd.stageSelection() == null ? StageSelection.all() : cmd.stageSelection();
        if (selection.isEmpty()) {
            throw new InvalidRunRequestException("stageSelection excludes every stage");
        }

        ImageProvider provider = providers.resolve(room, style);
        StagingPlan plan = planBuilder.buildPlan(room, style, selection);
        ImageRef original = new ImageRef(cmd.imageUrl(), cmd.width(), cmd.height());

        StagingRun run = runRepo.save(new StagingRun(room, style, provider.name(), plan, original));
        MDC.put("runId", run.getId().toString());
        try {
            log.info("Run {} created: {} / {} via '{}', {} stages",
                    run.getId(), room.wireName(), style.wireName(), provider.name(), plan.size());
            dispatchFrom(run, new Attempt(0, 0, plan.stage(0).instruction()));
            return runRepo.save(run);
        } finally {
            clearMdc();
        }
    }

    // ------------------------------------------------------------------
    // Queries
    // ------------------------------------------------------------------

    @Transactional(readOnly = true)
    public Optional<StagingRun> findRun(UUID runId) {
        return runRepo.findById(runId);
    }

    /** Every provider job issued for a run, oldest first. */
    @Transactional(readOnly = true)
    public List<StageDispatch> dispatches(UUID runId) {
        return dispatchRepo.findByRunIdOrderByDispatchedAtAsc(runId);
    }

    /**
     * The dispatch the run is currently waiting on, if any. Empty once the
     * run is terminal.
     */
    @Transactional(readOnly = true)
    public Optional<StageDispatch> currentDispatch(UUID runId) {
        return runRepo.findById(runId)
                .filter(run -> run.getStatus() == RunStatus.RUNNING)
                .map(run -> run.jobHandleAt(run.getCurrentStageIndex()))
                .flatMap(dispatchRepo::findByJobHandle)
                .filter(StageDispatch::isAwaiting);
    }

    /** Dispatches still waiting for a result that went out before 'cutoff'. */
    @Transactional(readOnly = true)
    public List<StageDispatch> awaitingDispatchesBefore(Instant cutoff) {
        return dispatchRepo.findByStateAndDispatchedAtBefore(DispatchState.AWAITING, cutoff);
    }

    // ------------------------------------------------------------------
    // Provider events
    // ------------------------------------------------------------------

    /**
     * Apply a job status learned by polling.
     */
    @Transactional
    public TransitionResult onJobStatus(String jobHandle, JobStatus status) {
        return apply(jobHandle, null, status);
    }

    /**
     * Apply a webhook. The callback must come through the endpoint of the
     * provider that issued the job; anything else is treated as unknown.
     */
    @Transactional
    public TransitionResult onProviderCallback(String providerName, ProviderCallback callback) {
        return apply(callback.jobHandle(), providerName, callback.status());
    }

    /**
     * The wait budget for a job ran out: count it as a failed attempt.
     */
    @Transactional
    public TransitionResult onDispatchTimeout(String jobHandle) {
        return apply(jobHandle, null, null);
    }

    // ------------------------------------------------------------------
    // Transition function
    // ------------------------------------------------------------------

    /** status == null means the wait budget ran out. */
    private TransitionResult apply(String jobHandle, String viaProvider, JobStatus status) {
        Optional<StageDispatch> found = dispatchRepo.findByJobHandle(jobHandle);
        if (found.isEmpty()
                || (viaProvider != null && !viaProvider.equals(found.get().getProviderName()))) {
            log.warn("No dispatch known for job handle {}", jobHandle);
            return TransitionResult.UNKNOWN_HANDLE;
        }
        StageDispatch dispatch = found.get();

        // Serialize with every other event for this run.
        StagingRun run = runRepo.findByIdForUpdate(dispatch.getRunId())
                .orElseThrow(() -> new IllegalStateException(
                        "Dispatch " + dispatch.getId() + " points at missing run " + dispatch.getRunId()));

        MDC.put("runId",      run.getId().toString());
        MDC.put("stageIndex", String.valueOf(dispatch.getStageIndex()));
        MDC.put("jobHandle",  jobHandle);
        try {
            if (!isCurrent(run, dispatch, jobHandle)) {
                log.warn("Ignoring event for job {}: run {} is {} at stage {} (dispatch state {})",
                        jobHandle, run.getId(), run.getStatus(), run.getCurrentStageIndex(), dispatch.getState());
                return TransitionResult.DUPLICATE;
            }

            Outcome outcome;
            if (status == null) {
                outcome = Outcome.transport(ViolationTag.PROVIDER_TIMEOUT, DispatchState.TIMED_OUT,
                        "No result within the wait budget");
            } else {
                switch (status.state()) {
                    case PENDING -> {
                        dispatch.markPolled();
                        dispatchRepo.save(dispatch);
                        return TransitionResult.IGNORED_PENDING;
                    }
                    case FAILED -> outcome = Outcome.transport(ViolationTag.PROVIDER_ERROR,
                            DispatchState.FAILED, status.reason());
                    default -> outcome = judge(run, dispatch, status.image());   // SUCCEEDED
                }
            }

            Attempt next = applyOutcome(run, dispatch, outcome);
            dispatchFrom(run, next);
            runRepo.save(run);
            return TransitionResult.APPLIED;
        } finally {
            clearMdc();
        }
    }

    /**
     * An event is current when it is for the latest dispatch of the stage a
     * running run is on, and that dispatch has not been resolved yet.
     */
    private static boolean isCurrent(StagingRun run, StageDispatch dispatch, String jobHandle) {
        return run.getStatus() == RunStatus.RUNNING
                && dispatch.getStageIndex() == run.getCurrentStageIndex()
                && jobHandle.equals(run.jobHandleAt(dispatch.getStageIndex()))
                && dispatch.isAwaiting();
    }

    /**
     * Validate a returned image against the stage rules. Images that cannot
     * be read or stored count as provider errors.
     */
    private Outcome judge(StagingRun run, StageDispatch dispatch, ImageRef produced) {
        StageConfig stage = run.getPlan().stage(dispatch.getStageIndex());
        ImageRef image = produced.withFallbackDimensions(run.getLatestImage());

        ValidationVerdict verdict;
        try {
            verdict = validator.validate(run.getLatestImage(), image, stage);
        } catch (ImageLoadException e) {
            log.warn("Could not load images to validate stage {}: {}", dispatch.getStageIndex(), e.getMessage());
            return Outcome.transport(ViolationTag.PROVIDER_ERROR, DispatchState.FAILED,
                    "Image load failed: " + e.getMessage());
        }
        if (!verdict.passed()) {
            return Outcome.rejected(verdict);
        }

        try {
            ImageRef stored = imageStore.persist(run.getId(), dispatch.getStageIndex(), image)
                    .withFallbackDimensions(image);
            return Outcome.accepted(verdict.itemCountEstimate(), stored);
        } catch (ImageStoreException e) {
            log.warn("Could not store image for stage {}: {}", dispatch.getStageIndex(), e.getMessage());
            return Outcome.transport(ViolationTag.PROVIDER_ERROR, DispatchState.FAILED,
                    "Image store failed: " + e.getMessage());
        }
    }

    /**
     * Record the outcome of one attempt and decide what comes next.
     *
     * @return the next attempt to dispatch, or null when the run is now terminal
     */
    private Attempt applyOutcome(StagingRun run, StageDispatch dispatch, Outcome outcome) {
        int idx = dispatch.getStageIndex();
        StageKind kind = dispatch.getStageKind();
        int attempt = dispatch.getAttempt();

        dispatch.resolve(outcome.dispatchState(), outcome.detail());
        dispatchRepo.save(dispatch);

        if (outcome.accepted()) {
            run.appendResult(StageResult.accepted(idx, kind, outcome.itemsAdded(), attempt,
                    outcome.image(), dispatch.getJobHandle()));
            run.acceptImage(outcome.image());
            countAttempt(kind, "accepted");
            log.info("Stage {} ({}) accepted on attempt {} (~{} items)", idx + 1, kind, attempt, outcome.itemsAdded());

            if (run.getPlan().isLast(idx)) {
                run.complete();
                countFinished(run);
                log.info("Run {} COMPLETED", run.getId());
                return null;
            }
            return new Attempt(idx + 1, 0, run.getPlan().stage(idx + 1).instruction());
        }

        run.appendResult(StageResult.rejected(idx, kind, outcome.itemsAdded(), outcome.violations(),
                attempt, dispatch.getJobHandle()));
        countAttempt(kind, outcomeTag(outcome));

        if (attempt < MAX_ATTEMPT) {
            log.warn("Stage {} ({}) rejected: {} ({}); retrying with corrections",
                    idx + 1, kind, tags(outcome.violations()), outcome.detail());
            String instruction = corrections.correct(
                    run.getPlan().stage(idx).instruction(), kind, outcome.violations());
            return new Attempt(idx, attempt + 1, instruction);
        }

        String message = "Stage " + (idx + 1) + " (" + kind + ") failed after corrective retry: "
                + tags(outcome.violations());
        run.fail(idx, message);
        countFinished(run);
        log.error("Run {} FAILED: {} ({})", run.getId(), message, outcome.detail());
        return null;
    }

    /**
     * Issue attempts until one is waiting on the provider or the run is
     * terminal. Synchronous outcomes (an immediate image, or a submit that
     * failed outright) are judged on the spot and may chain into the next
     * attempt.
     */
    private void dispatchFrom(StagingRun run, Attempt attempt) {
        if (attempt == null) return;
        ImageProvider provider = providers.byName(run.getProviderName());

        while (attempt != null) {
            StageConfig stage = run.getPlan().stage(attempt.stageIndex());
            run.enterStage(attempt.stageIndex());
            MDC.put("stageIndex", String.valueOf(attempt.stageIndex()));

            StageDispatch dispatch = new StageDispatch(run.getId(), attempt.stageIndex(), stage.stageKind(),
                    attempt.attempt(), provider.name(), attempt.instruction());

            Outcome outcome;
            try {
                SubmitResult submitted = executor.dispatch(provider, run.getLatestImage(), attempt.instruction());
                if (submitted.kind() == SubmitResult.Kind.SUBMITTED) {
                    dispatch.setJobHandle(submitted.jobHandle());
                    run.recordJobHandle(attempt.stageIndex(), submitted.jobHandle());
                    dispatchRepo.save(dispatch);
                    MDC.put("jobHandle", submitted.jobHandle());
                    log.info("Stage {} ({}) attempt {} dispatched as job {}",
                            attempt.stageIndex() + 1, stage.stageKind(), attempt.attempt(), submitted.jobHandle());
                    return;
                }
                run.recordJobHandle(attempt.stageIndex(), null);
                dispatch = dispatchRepo.save(dispatch);
                outcome = judge(run, dispatch, submitted.image());
            } catch (ProviderException e) {
                log.warn("Dispatch of stage {} ({}) attempt {} failed: {}",
                        attempt.stageIndex() + 1, stage.stageKind(), attempt.attempt(), e.getMessage());
                run.recordJobHandle(attempt.stageIndex(), null);
                dispatch = dispatchRepo.save(dispatch);
                outcome = Outcome.transport(ViolationTag.PROVIDER_ERROR, DispatchState.FAILED, e.getMessage());
            }
            attempt = applyOutcome(run, dispatch, outcome);
        }
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private void countAttempt(StageKind kind, String outcome) {
        meterRegistry.counter("stagecraft.stage.attempts",
                "kind", kind.name().toLowerCase(), "outcome", outcome).increment();
    }

    private void countFinished(StagingRun run) {
        meterRegistry.counter("stagecraft.runs.finished",
                "status", run.getStatus().name().toLowerCase()).increment();
    }

    private static String outcomeTag(Outcome outcome) {
        return switch (outcome.dispatchState()) {
            case TIMED_OUT -> "timeout";
            case FAILED    -> "provider_error";
            default        -> "rejected";
        };
    }

    private static List<String> tags(List<ViolationTag> violations) {
        return violations.stream().map(ViolationTag::tag).toList();
    }

    private static void clearMdc() {
        MDC.remove("runId");
        MDC.remove("stageIndex");
        MDC.remove("jobHandle");
    }

    /** One attempt at one stage, ready to send. */
    private record Attempt(int stageIndex, int attempt, String instruction) {}

    /** The judged result of one attempt. image is set only when accepted. */
    private record Outcome(
            boolean            accepted,
            ImageRef           image,
            int                itemsAdded,
            List<ViolationTag> violations,
            DispatchState      dispatchState,
            String             detail
    ) {
        static Outcome accepted(int itemsAdded, ImageRef image) {
            return new Outcome(true, image, itemsAdded, List.of(), DispatchState.ACCEPTED, null);
        }

        static Outcome rejected(ValidationVerdict verdict) {
            return new Outcome(false, null, verdict.itemCountEstimate(), verdict.detectedViolations(),
                    DispatchState.REJECTED, "Validation failed: " + verdict.detectedViolations());
        }

        static Outcome transport(ViolationTag tag, DispatchState state, String detail) {
            return new Outcome(false, null, 0, List.of(tag), state, detail);
        }
    }
}
