package com.stagecraft.engine.api;

import com.stagecraft.engine.model.*;
import com.stagecraft.engine.provider.UnsupportedStagingException;
import com.stagecraft.engine.service.BlockingStagingRunner;
import com.stagecraft.engine.service.InvalidRunRequestException;
import com.stagecraft.engine.service.StagingWorkflowService;
import com.stagecraft.engine.service.StartRunCommand;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

/**
 * Slice test for StagingRunController.
 *
 * @WebMvcTest spins up only the web layer (no DB, no sweeper, no provider).
 */
@WebMvcTest(StagingRunController.class)
class StagingRunControllerTest {

    @Autowired   MockMvc                mockMvc;
    @MockitoBean StagingWorkflowService workflow;
    @MockitoBean BlockingStagingRunner  blockingRunner;

    static final String LIVING_ROOM_REQUEST = """
            {"imageUrl":"https://cdn.example.com/empty.jpg","width":4032,"height":3024,
             "roomCategory":"living_room","styleProfile":"modern"}
            """;

    // ------------------------------------------------------------------
    // POST /runs
    // ------------------------------------------------------------------

    @Test
    void startRun_validRequest_returns201WithRunningStatus() throws Exception {
        StagingRun run = fakeRun();
        run.enterStage(0);
        when(workflow.startRun(any())).thenReturn(run);

        mockMvc.perform(post("/runs")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(LIVING_ROOM_REQUEST))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.id").value(run.getId().toString()))
                .andExpect(jsonPath("$.status").value("RUNNING"))
                .andExpect(jsonPath("$.currentStageKind").value("PRIMARY_FURNITURE"))
                .andExpect(jsonPath("$.totalStages").value(2));

        verify(blockingRunner, never()).startAndAwait(any());
    }

    @Test
    void startRun_stageSelection_mappedToCommand() throws Exception {
        when(workflow.startRun(any())).thenReturn(fakeRun());

        mockMvc.perform(post("/runs")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"imageUrl":"https://cdn.example.com/empty.jpg","width":800,"height":600,
                                 "roomCategory":"bedroom","styleProfile":"coastal",
                                 "stageSelection":{"windowTreatment":false}}
                                """))
                .andExpect(status().isCreated());

        ArgumentCaptor<StartRunCommand> captor = ArgumentCaptor.forClass(StartRunCommand.class);
        verify(workflow).startRun(captor.capture());
        StageSelection selection = captor.getValue().stageSelection();
        assertThat(selection.includes(StageKind.WINDOW_TREATMENT)).isFalse();
        assertThat(selection.includes(StageKind.PRIMARY_FURNITURE)).isTrue();
        assertThat(selection.includes(StageKind.WALL_DECOR)).isTrue();
    }

    @Test
    void startRun_withoutDimensions_passesUnknownSize() throws Exception {
        when(workflow.startRun(any())).thenReturn(fakeRun());

        mockMvc.perform(post("/runs")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"imageUrl":"https://cdn.example.com/empty.jpg",
                                 "roomCategory":"bedroom","styleProfile":"modern"}
                                """))
                .andExpect(status().isCreated());

        ArgumentCaptor<StartRunCommand> captor = ArgumentCaptor.forClass(StartRunCommand.class);
        verify(workflow).startRun(captor.capture());
        assertThat(captor.getValue().width()).isZero();
        assertThat(captor.getValue().height()).isZero();
    }

    @Test
    void startRun_wait_returns200WithFinalImage() throws Exception {
        StagingRun run = fakeRun();
        run.enterStage(1);
        run.acceptImage(ImageRef.of("https://out.example.com/final.jpg"));
        run.complete();
        when(blockingRunner.startAndAwait(any())).thenReturn(run);

        mockMvc.perform(post("/runs").param("wait", "true")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(LIVING_ROOM_REQUEST))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("COMPLETED"))
                .andExpect(jsonPath("$.finalImageUrl").value("https://out.example.com/final.jpg"));

        verify(workflow, never()).startRun(any());
    }

    @Test
    void startRun_invalidInput_returns400() throws Exception {
        when(workflow.startRun(any())).thenThrow(new InvalidRunRequestException("Unknown room category: attic"));

        mockMvc.perform(post("/runs")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"imageUrl":"https://cdn.example.com/empty.jpg","width":800,"height":600,
                                 "roomCategory":"attic","styleProfile":"modern"}
                                """))
                .andExpect(status().isBadRequest());
    }

    @Test
    void startRun_unsupportedPair_returns400() throws Exception {
        when(workflow.startRun(any()))
                .thenThrow(new UnsupportedStagingException(RoomCategory.OUTDOOR, StyleProfile.LUXURY));

        mockMvc.perform(post("/runs")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(LIVING_ROOM_REQUEST))
                .andExpect(status().isBadRequest());
    }

    // ------------------------------------------------------------------
    // GET /runs/{id}
    // ------------------------------------------------------------------

    @Test
    void getRun_failedRun_exposesStageAndViolations() throws Exception {
        StagingRun run = fakeRun();
        run.enterStage(0);
        run.appendResult(StageResult.rejected(0, StageKind.PRIMARY_FURNITURE, 2,
                List.of(ViolationTag.WALL_DECOR_PRESENT), 0, "job-1"));
        run.appendResult(StageResult.rejected(0, StageKind.PRIMARY_FURNITURE, 2,
                List.of(ViolationTag.WALL_DECOR_PRESENT), 1, "job-2"));
        run.fail(0, "Stage 1 (PRIMARY_FURNITURE) failed after corrective retry: [wall-decor-present]");
        when(workflow.findRun(run.getId())).thenReturn(Optional.of(run));

        mockMvc.perform(get("/runs/{id}", run.getId()))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("FAILED"))
                .andExpect(jsonPath("$.failedStageIndex").value(0))
                .andExpect(jsonPath("$.errorMessage").value(
                        "Stage 1 (PRIMARY_FURNITURE) failed after corrective retry: [wall-decor-present]"))
                .andExpect(jsonPath("$.stageResults.length()").value(2))
                .andExpect(jsonPath("$.stageResults[1].retryCount").value(1))
                .andExpect(jsonPath("$.stageResults[1].validationViolations[0]").value("wall-decor-present"))
                .andExpect(jsonPath("$.finalImageUrl").isEmpty());
    }

    @Test
    void getRun_unknownId_returns404() throws Exception {
        UUID unknown = UUID.randomUUID();
        when(workflow.findRun(unknown)).thenReturn(Optional.empty());

        mockMvc.perform(get("/runs/{id}", unknown))
                .andExpect(status().isNotFound());
    }

    // ------------------------------------------------------------------
    // GET /runs/{id}/plan and /dispatches
    // ------------------------------------------------------------------

    @Test
    void getPlan_returnsStagesInOrder() throws Exception {
        StagingRun run = fakeRun();
        when(workflow.findRun(run.getId())).thenReturn(Optional.of(run));

        mockMvc.perform(get("/runs/{id}/plan", run.getId()))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.roomCategory").value("living_room"))
                .andExpect(jsonPath("$.stages[0].stageKind").value("PRIMARY_FURNITURE"))
                .andExpect(jsonPath("$.stages[1].stageKind").value("WALL_DECOR"))
                .andExpect(jsonPath("$.stages[1].maxItems").value(2));
    }

    @Test
    void getDispatches_returnsInstructions() throws Exception {
        StagingRun run = fakeRun();
        StageDispatch d = new StageDispatch(run.getId(), 0, StageKind.PRIMARY_FURNITURE, 0,
                "flux-kontext", "Add a sofa");
        d.setJobHandle("job-1");
        when(workflow.findRun(run.getId())).thenReturn(Optional.of(run));
        when(workflow.dispatches(run.getId())).thenReturn(List.of(d));

        mockMvc.perform(get("/runs/{id}/dispatches", run.getId()))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].jobHandle").value("job-1"))
                .andExpect(jsonPath("$[0].state").value("AWAITING"))
                .andExpect(jsonPath("$[0].instruction").value("Add a sofa"));
    }

    @Test
    void getDispatches_unknownRun_returns404() throws Exception {
        UUID unknown = UUID.randomUUID();
        when(workflow.findRun(unknown)).thenReturn(Optional.empty());

        mockMvc.perform(get("/runs/{id}/dispatches", unknown))
                .andExpect(status().isNotFound());
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private StagingRun fakeRun() {
        StagingPlan plan = new StagingPlan(RoomCategory.LIVING_ROOM, StyleProfile.MODERN, List.of(
                new StageConfig(StageKind.PRIMARY_FURNITURE, 2, 4, List.of("sofa", "armchair"), "Add a sofa"),
                new StageConfig(StageKind.WALL_DECOR, 0, 2, List.of("framed print"), "Add art")));
        StagingRun run = new StagingRun(RoomCategory.LIVING_ROOM, StyleProfile.MODERN, "flux-kontext", plan,
                new ImageRef("https://cdn.example.com/empty.jpg", 4032, 3024));
        try {
            var f = run.getClass().getDeclaredField("id");
            f.setAccessible(true);
            f.set(run, UUID.randomUUID());
        } catch (Exception e) {
            throw new RuntimeException(e);
        }
        return run;
    }
}
