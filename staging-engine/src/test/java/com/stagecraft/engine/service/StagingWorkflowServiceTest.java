package com.stagecraft.engine.service;

import com.stagecraft.engine.model.*;
import com.stagecraft.engine.plan.ExampleSampler;
import com.stagecraft.engine.plan.RoomCatalogue;
import com.stagecraft.engine.plan.StagingPlanBuilder;
import com.stagecraft.engine.provider.*;
import com.stagecraft.engine.repository.StageDispatchRepository;
import com.stagecraft.engine.repository.StagingRunRepository;
import com.stagecraft.engine.storage.ImageStore;
import com.stagecraft.engine.storage.ImageStoreException;
import com.stagecraft.engine.storage.PassThroughImageStore;
import com.stagecraft.engine.validation.ImageLoadException;
import com.stagecraft.engine.validation.StageValidator;
import com.stagecraft.engine.validation.ValidationVerdict;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.*;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

/**
 * Unit tests for the staging state machine.
 *
 * Repositories are Mockito mocks backed by in-memory maps, the provider is
 * scripted, and the validator is mocked so each test decides which attempts
 * pass. No Spring context, no database, no network.
 */
@ExtendWith(MockitoExtension.class)
class StagingWorkflowServiceTest {

    static final String ROOM_URL = "https://cdn.example.com/empty-living-room.jpg";

    @Mock StagingRunRepository    runRepo;
    @Mock StageDispatchRepository dispatchRepo;
    @Mock StageValidator          validator;

    final Map<UUID, StagingRun>    runs       = new HashMap<>();
    final Map<UUID, StageDispatch> dispatches = new LinkedHashMap<>();
    final Deque<Object>            verdicts   = new ArrayDeque<>();

    ScriptedProvider       provider;
    SimpleMeterRegistry    meters;
    ImageStore             imageStore;
    StagingWorkflowService service;

    @BeforeEach
    void setUp() {
        lenient().when(runRepo.save(any())).thenAnswer(inv -> {
            StagingRun run = inv.getArgument(0);
            if (run.getId() == null) Fixtures.withId(run);
            runs.put(run.getId(), run);
            return run;
        });
        lenient().when(runRepo.findById(any())).thenAnswer(inv -> Optional.ofNullable(runs.get(inv.getArgument(0))));
        lenient().when(runRepo.findByIdForUpdate(any())).thenAnswer(inv -> Optional.ofNullable(runs.get(inv.getArgument(0))));
        lenient().when(dispatchRepo.save(any())).thenAnswer(inv -> {
            StageDispatch d = inv.getArgument(0);
            if (d.getId() == null) Fixtures.withId(d);
            dispatches.put(d.getId(), d);
            return d;
        });
        lenient().when(dispatchRepo.findByJobHandle(any())).thenAnswer(inv -> {
            String handle = inv.getArgument(0);
            return dispatches.values().stream().filter(d -> handle.equals(d.getJobHandle())).findFirst();
        });
        lenient().when(dispatchRepo.findByRunIdOrderByDispatchedAtAsc(any())).thenAnswer(inv -> {
            UUID runId = inv.getArgument(0);
            return dispatches.values().stream().filter(d -> d.getRunId().equals(runId)).toList();
        });
        // Scripted verdicts in order; an empty script passes with one item.
        lenient().when(validator.validate(any(ImageRef.class), any(ImageRef.class), any(StageConfig.class)))
                .thenAnswer(inv -> {
                    Object next = verdicts.poll();
                    if (next instanceof RuntimeException) throw (RuntimeException) next;
                    return next == null ? pass() : next;
                });

        provider   = new ScriptedProvider();
        meters     = new SimpleMeterRegistry();
        imageStore = new PassThroughImageStore();
        service    = newService(imageStore);
    }

    private StagingWorkflowService newService(ImageStore store) {
        return new StagingWorkflowService(runRepo, dispatchRepo,
                new StagingPlanBuilder(RoomCatalogue.standard(), new ExampleSampler(new Random(11))),
                new ProviderCapabilityTable(List.of(provider), ScriptedProvider.NAME, ""),
                new StageExecutor(meters),
                validator, store, new CorrectionInstructions(), meters);
    }

    // ------------------------------------------------------------------
    // startRun()
    // ------------------------------------------------------------------

    @Test
    void startRun_dispatchesFirstStageAndWaits() {
        StagingRun run = service.startRun(command(null));

        assertThat(run.getStatus()).isEqualTo(RunStatus.RUNNING);
        assertThat(run.getCurrentStageIndex()).isZero();
        assertThat(run.getProviderName()).isEqualTo(ScriptedProvider.NAME);
        assertThat(run.jobHandleAt(0)).isEqualTo("job-1");
        assertThat(run.getStageResults()).isEmpty();
        assertThat(provider.requests).hasSize(1);
        assertThat(provider.requests.get(0).inputImage().url()).isEqualTo(ROOM_URL);
        assertThat(provider.requests.get(0).width()).isEqualTo(1536);
        assertThat(provider.requests.get(0).instruction()).isEqualTo(run.getPlan().stage(0).instruction());
    }

    @Test
    void startRun_invalidInput_rejectedBeforeAnythingIsStored() {
        assertInvalid(new StartRunCommand(" ", 100, 100, "bedroom", "modern", null), "imageUrl");
        assertInvalid(new StartRunCommand(ROOM_URL, 0, 100, "bedroom", "modern", null), "width");
        assertInvalid(new StartRunCommand(ROOM_URL, -1, -1, "bedroom", "modern", null), "negative");
        assertInvalid(new StartRunCommand(ROOM_URL, 100, 100, "attic", "modern", null), "attic");
        assertInvalid(new StartRunCommand(ROOM_URL, 100, 100, "bedroom", "baroque", null), "baroque");
        assertInvalid(new StartRunCommand(ROOM_URL, 100, 100, "bedroom", "modern",
                StageSelection.of(false, false, false, false)), "stageSelection");

        verify(runRepo, never()).save(any());
        assertThat(provider.requests).isEmpty();
    }

    @Test
    void startRun_unknownDimensions_dispatchesWithoutSizeHints() {
        StagingRun run = service.startRun(new StartRunCommand(ROOM_URL, 0, 0, "bedroom", "modern", null));

        assertThat(run.getStatus()).isEqualTo(RunStatus.RUNNING);
        assertThat(run.getLatestImage().hasDimensions()).isFalse();
        assertThat(provider.requests).hasSize(1);
        assertThat(provider.requests.get(0).hasSize()).isFalse();
        assertThat(provider.requests.get(0).aspectRatio()).isNull();
    }

    @Test
    void startRun_idAssignedOnInsert_flowsIntoDispatchRows() {
        StagingRun run = service.startRun(command(null));

        assertThat(run.getId()).isNotNull();
        assertThat(runs).containsKey(run.getId());
        assertThat(dispatches.values()).singleElement().satisfies(d -> {
            assertThat(d.getId()).isNotNull();
            assertThat(d.getRunId()).isEqualTo(run.getId());
        });
    }

    @Test
    void startRun_noProviderSupportsPair_throwsUnsupported() {
        ImageProvider picky = mock(ImageProvider.class);
        when(picky.name()).thenReturn("picky");
        when(picky.sizeConstraints()).thenReturn(SizeConstraints.DEFAULT);
        when(picky.supports(any(), any())).thenReturn(false);
        StagingWorkflowService pickyService = new StagingWorkflowService(runRepo, dispatchRepo,
                new StagingPlanBuilder(RoomCatalogue.standard(), new ExampleSampler(new Random(1))),
                new ProviderCapabilityTable(List.of(picky), "picky", ""),
                new StageExecutor(meters), validator, imageStore, new CorrectionInstructions(), meters);

        assertThatThrownBy(() -> pickyService.startRun(command(null)))
                .isInstanceOf(UnsupportedStagingException.class);
        verify(runRepo, never()).save(any());
    }

    // ------------------------------------------------------------------
    // End-to-end scenarios
    // ------------------------------------------------------------------

    @Test
    void scenarioA_everyStagePassesFirstTime_runCompletes() {
        StagingRun run = service.startRun(command(null));

        for (int i = 0; i < 4; i++) {
            assertThat(succeed(run)).isEqualTo(TransitionResult.APPLIED);
        }

        assertThat(run.getStatus()).isEqualTo(RunStatus.COMPLETED);
        assertThat(run.getStageResults()).hasSize(4)
                .allMatch(StageResult::succeeded)
                .allMatch(r -> r.retryCount() == 0);
        assertThat(run.getStageResults()).extracting(StageResult::stageKind).containsExactly(
                StageKind.PRIMARY_FURNITURE, StageKind.COMPLEMENTARY,
                StageKind.WINDOW_TREATMENT, StageKind.WALL_DECOR);
        assertThat(run.finalImage()).map(ImageRef::url).contains(ScriptedProvider.output("job-4").url());
        assertThat(run.getFinishedAt()).isNotNull();
        assertThat(meters.counter("stagecraft.runs.finished", "status", "completed").count()).isEqualTo(1.0);
    }

    @Test
    void scenarioA_eachStageEditsThePreviousAcceptedImage() {
        StagingRun run = service.startRun(command(null));
        succeed(run);
        succeed(run);

        assertThat(provider.requests.get(1).inputImage().url()).isEqualTo(ScriptedProvider.output("job-1").url());
        assertThat(provider.requests.get(2).inputImage().url()).isEqualTo(ScriptedProvider.output("job-2").url());
        // Provider output carries no size; the run's known size is reused.
        assertThat(provider.requests.get(2).width()).isEqualTo(1536);
        assertThat(provider.requests.get(2).height()).isEqualTo(1152);
    }

    @Test
    void scenarioB_secondStageRetriedWithCorrections_runCompletes() {
        verdicts.add(pass());
        verdicts.add(reject(ViolationTag.WINDOW_TREATMENT_PRESENT));
        StagingRun run = service.startRun(command(null));

        for (int i = 0; i < 5; i++) {
            assertThat(succeed(run)).isEqualTo(TransitionResult.APPLIED);
        }

        assertThat(run.getStatus()).isEqualTo(RunStatus.COMPLETED);
        List<StageResult> results = run.getStageResults();
        assertThat(results).hasSize(5);
        assertThat(results.get(1).succeeded()).isFalse();
        assertThat(results.get(1).validationViolations()).containsExactly(ViolationTag.WINDOW_TREATMENT_PRESENT);
        assertThat(results.get(2).stageIndex()).isEqualTo(1);
        assertThat(results.get(2).succeeded()).isTrue();
        assertThat(results.get(2).retryCount()).isEqualTo(1);
        assertSequentialAndBounded(results);

        String retryInstruction = provider.requests.get(2).instruction();
        assertThat(retryInstruction).startsWith(run.getPlan().stage(1).instruction());
        assertThat(retryInstruction).contains("CORRECTIONS REQUIRED").contains("Remove any window treatments");
        // The retry edits the image stage 1 accepted, not the rejected output.
        assertThat(provider.requests.get(2).inputImage().url()).isEqualTo(ScriptedProvider.output("job-1").url());
    }

    @Test
    void scenarioC_firstStageFailsTwice_runFailsWithoutReachingStageTwo() {
        verdicts.add(reject(ViolationTag.WALL_DECOR_PRESENT));
        verdicts.add(reject(ViolationTag.WALL_DECOR_PRESENT, ViolationTag.ITEM_COUNT_OUT_OF_RANGE));
        StagingRun run = service.startRun(command(null));

        succeed(run);
        succeed(run);

        assertThat(run.getStatus()).isEqualTo(RunStatus.FAILED);
        assertThat(run.getFailedStageIndex()).isZero();
        assertThat(run.getErrorMessage())
                .contains("Stage 1")
                .contains("PRIMARY_FURNITURE")
                .contains("wall-decor-present")
                .contains("item-count-out-of-range");
        assertThat(provider.requests).hasSize(2);
        assertThat(run.getStageResults()).hasSize(2).noneMatch(StageResult::succeeded);
        assertThat(run.finalImage()).isEmpty();
        assertThat(service.currentDispatch(run.getId())).isEmpty();
        assertSequentialAndBounded(run.getStageResults());
    }

    @Test
    void scenarioD_windowStageOmitted_neverRuns() {
        StagingRun run = service.startRun(command(StageSelection.without(StageKind.WINDOW_TREATMENT)));

        assertThat(run.getPlan().size()).isEqualTo(3);
        while (run.getStatus() == RunStatus.RUNNING) {
            succeed(run);
        }

        assertThat(run.getStatus()).isEqualTo(RunStatus.COMPLETED);
        assertThat(run.getStageResults()).hasSize(3)
                .extracting(StageResult::stageKind)
                .doesNotContain(StageKind.WINDOW_TREATMENT);
    }

    // ------------------------------------------------------------------
    // Event filtering
    // ------------------------------------------------------------------

    @Test
    void duplicateCallback_isDroppedAndChangesNothing() {
        StagingRun run = service.startRun(command(null));
        ProviderCallback cb = new ProviderCallback("job-1", JobStatus.succeeded(ScriptedProvider.output("job-1")));

        assertThat(service.onProviderCallback(ScriptedProvider.NAME, cb)).isEqualTo(TransitionResult.APPLIED);
        int resultsAfterFirst = run.getStageResults().size();
        int requestsAfterFirst = provider.requests.size();

        assertThat(service.onProviderCallback(ScriptedProvider.NAME, cb)).isEqualTo(TransitionResult.DUPLICATE);
        assertThat(run.getStageResults()).hasSize(resultsAfterFirst);
        assertThat(provider.requests).hasSize(requestsAfterFirst);
        assertThat(run.getCurrentStageIndex()).isEqualTo(1);
    }

    @Test
    void lateEventForSupersededAttempt_isDropped() {
        verdicts.add(reject(ViolationTag.COLOR_DRIFT_DETECTED));
        StagingRun run = service.startRun(command(null));
        succeed(run);   // job-1 rejected, job-2 is the retry

        TransitionResult late = service.onJobStatus("job-1", JobStatus.failed("late failure"));

        assertThat(late).isEqualTo(TransitionResult.DUPLICATE);
        assertThat(run.jobHandleAt(0)).isEqualTo("job-2");
        assertThat(run.getStageResults()).hasSize(1);
    }

    @Test
    void unknownHandle_returnsUnknown() {
        service.startRun(command(null));

        assertThat(service.onJobStatus("never-issued", JobStatus.failed("x")))
                .isEqualTo(TransitionResult.UNKNOWN_HANDLE);
        verify(runRepo, never()).findByIdForUpdate(any());
    }

    @Test
    void callbackThroughOtherProvidersEndpoint_isTreatedAsUnknown() {
        StagingRun run = service.startRun(command(null));
        ProviderCallback cb = new ProviderCallback("job-1", JobStatus.succeeded(ScriptedProvider.output("x")));

        assertThat(service.onProviderCallback("someone-else", cb)).isEqualTo(TransitionResult.UNKNOWN_HANDLE);
        assertThat(run.getStageResults()).isEmpty();
    }

    @Test
    void pendingStatus_onlyUpdatesPollBookkeeping() {
        StagingRun run = service.startRun(command(null));

        assertThat(service.onJobStatus("job-1", JobStatus.PENDING)).isEqualTo(TransitionResult.IGNORED_PENDING);

        StageDispatch dispatch = service.currentDispatch(run.getId()).orElseThrow();
        assertThat(dispatch.getPollCount()).isEqualTo(1);
        assertThat(dispatch.getLastPolledAt()).isNotNull();
        assertThat(dispatch.isAwaiting()).isTrue();
        assertThat(run.getStageResults()).isEmpty();
    }

    // ------------------------------------------------------------------
    // Transport failures
    // ------------------------------------------------------------------

    @Test
    void providerReportsFailure_countsAsAttemptAndRetriesWithReinforcement() {
        StagingRun run = service.startRun(command(null));

        service.onJobStatus("job-1", JobStatus.failed("Content Moderated"));

        StageResult first = run.getStageResults().get(0);
        assertThat(first.succeeded()).isFalse();
        assertThat(first.validationViolations()).containsExactly(ViolationTag.PROVIDER_ERROR);
        assertThat(first.itemsAdded()).isZero();
        assertThat(provider.requests.get(1).instruction()).contains("REINFORCEMENT:");
        assertThat(dispatchFor("job-1").getState()).isEqualTo(DispatchState.FAILED);
        assertThat(dispatchFor("job-1").getDetail()).isEqualTo("Content Moderated");

        succeed(run);
        assertThat(run.getCurrentStageIndex()).isEqualTo(1);
        assertThat(run.getStageResults().get(1).retryCount()).isEqualTo(1);
    }

    @Test
    void timeout_recordsProviderTimeoutAndRetries() {
        StagingRun run = service.startRun(command(null));

        assertThat(service.onDispatchTimeout("job-1")).isEqualTo(TransitionResult.APPLIED);

        assertThat(run.getStageResults().get(0).validationViolations()).containsExactly(ViolationTag.PROVIDER_TIMEOUT);
        assertThat(dispatchFor("job-1").getState()).isEqualTo(DispatchState.TIMED_OUT);
        assertThat(run.jobHandleAt(0)).isEqualTo("job-2");
        assertThat(meters.counter("stagecraft.stage.attempts",
                "kind", "primary_furniture", "outcome", "timeout").count()).isEqualTo(1.0);
    }

    @Test
    void submitFailsTwice_runFailsDuringStart() {
        provider.script.add(new ProviderException(ProviderException.Kind.TRANSPORT, "connection refused"));
        provider.script.add(new ProviderException(ProviderException.Kind.HTTP_STATUS, "HTTP 503"));

        StagingRun run = service.startRun(command(null));

        assertThat(run.getStatus()).isEqualTo(RunStatus.FAILED);
        assertThat(run.getErrorMessage()).contains("provider-error");
        assertThat(run.getStageResults()).hasSize(2);
        assertThat(dispatches.values()).hasSize(2).allMatch(d -> d.getState() == DispatchState.FAILED);
    }

    @Test
    void imageCannotBeLoaded_countsAsProviderError() {
        verdicts.add(new ImageLoadException("HTTP 403 for result"));
        StagingRun run = service.startRun(command(null));

        succeed(run);

        assertThat(run.getStageResults().get(0).validationViolations()).containsExactly(ViolationTag.PROVIDER_ERROR);
        assertThat(run.getStatus()).isEqualTo(RunStatus.RUNNING);
        assertThat(run.jobHandleAt(0)).isEqualTo("job-2");
    }

    @Test
    void imageCannotBeStored_countsAsProviderError() {
        ImageStore failing = mock(ImageStore.class);
        when(failing.persist(any(), anyInt(), any())).thenThrow(new ImageStoreException("bucket unavailable", null));
        service = newService(failing);
        StagingRun run = service.startRun(command(null));

        succeed(run);

        assertThat(run.getStageResults().get(0).validationViolations()).containsExactly(ViolationTag.PROVIDER_ERROR);
        assertThat(dispatchFor("job-1").getDetail()).contains("bucket unavailable");
    }

    // ------------------------------------------------------------------
    // Synchronous providers
    // ------------------------------------------------------------------

    @Test
    void immediateProvider_runCompletesInsideStart() {
        for (int i = 1; i <= 4; i++) provider.script.add(ScriptedProvider.output("sync-" + i));

        StagingRun run = service.startRun(command(null));

        assertThat(run.getStatus()).isEqualTo(RunStatus.COMPLETED);
        assertThat(run.getStageResults()).hasSize(4).allMatch(StageResult::succeeded);
        assertThat(run.getStageJobHandles()).containsOnlyNulls();
        assertThat(run.finalImage()).map(ImageRef::url).contains(ScriptedProvider.output("sync-4").url());
    }

    @Test
    void dispatches_listsEveryJobWithItsInstruction() {
        verdicts.add(reject(ViolationTag.CIRCULATION_BLOCKED));
        StagingRun run = service.startRun(command(null));
        succeed(run);

        List<StageDispatch> list = service.dispatches(run.getId());

        assertThat(list).extracting(StageDispatch::getJobHandle).containsExactly("job-1", "job-2");
        assertThat(list).extracting(StageDispatch::getAttempt).containsExactly(0, 1);
        assertThat(list.get(1).getInstruction()).contains("Keep at least 90 cm of clear circulation");
        assertThat(list.get(0).getState()).isEqualTo(DispatchState.REJECTED);
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private TransitionResult succeed(StagingRun run) {
        String handle = run.jobHandleAt(run.getCurrentStageIndex());
        return service.onJobStatus(handle, JobStatus.succeeded(ScriptedProvider.output(handle)));
    }

    private StageDispatch dispatchFor(String handle) {
        return dispatches.values().stream()
                .filter(d -> handle.equals(d.getJobHandle()))
                .findFirst().orElseThrow();
    }

    private void assertInvalid(StartRunCommand cmd, String messagePart) {
        assertThatThrownBy(() -> service.startRun(cmd))
                .isInstanceOf(InvalidRunRequestException.class)
                .hasMessageContaining(messagePart);
    }

    /** A rejected entry may only be followed by the retry of the same stage; at most two entries per stage. */
    private static void assertSequentialAndBounded(List<StageResult> results) {
        for (int i = 0; i + 1 < results.size(); i++) {
            if (!results.get(i).succeeded()) {
                assertThat(results.get(i + 1).stageIndex()).isEqualTo(results.get(i).stageIndex());
                assertThat(results.get(i + 1).retryCount()).isEqualTo(1);
            }
        }
        Map<Integer, Long> perStage = results.stream()
                .collect(Collectors.groupingBy(StageResult::stageIndex, Collectors.counting()));
        assertThat(perStage.values()).allMatch(n -> n <= 2);
    }

    private static StartRunCommand command(StageSelection selection) {
        return new StartRunCommand(ROOM_URL, 4032, 3024, "living_room", "modern", selection);
    }

    private static ValidationVerdict pass() {
        return ValidationVerdict.of(1, List.of());
    }

    private static ValidationVerdict reject(ViolationTag... tags) {
        return ValidationVerdict.of(1, List.of(tags));
    }
}
