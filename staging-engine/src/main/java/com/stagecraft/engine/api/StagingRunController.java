package com.stagecraft.engine.api;

import com.stagecraft.engine.api.dto.DispatchResponse;
import com.stagecraft.engine.api.dto.PlanResponse;
import com.stagecraft.engine.api.dto.RunStatusResponse;
import com.stagecraft.engine.api.dto.StartRunRequest;
import com.stagecraft.engine.model.StagingRun;
import com.stagecraft.engine.provider.UnsupportedStagingException;
import com.stagecraft.engine.service.BlockingStagingRunner;
import com.stagecraft.engine.service.InvalidRunRequestException;
import com.stagecraft.engine.service.StagingWorkflowService;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.server.ResponseStatusException;

import java.util.List;
import java.util.UUID;

/**
 * REST API for staging runs.
 *
 * POST /runs                  start a run (add ?wait=true to block until it finishes)
 * GET  /runs/{id}             current status and stage audit trail
 * GET  /runs/{id}/plan        the stage plan fixed at creation
 * GET  /runs/{id}/dispatches  every provider job issued for the run
 */
@RestController
@RequestMapping("/runs")
public class StagingRunController {

    private final StagingWorkflowService workflow;
    private final BlockingStagingRunner  blockingRunner;

    public StagingRunController(StagingWorkflowService workflow, BlockingStagingRunner blockingRunner) {
        this.workflow       = workflow;
        this.blockingRunner = blockingRunner;
    }

    /**
     * Start a staging run.
     *
     * Example:
     *   curl -X POST http://localhost:8080/runs \
     *     -H "Content-Type: application/json" \
     *     -d '{"imageUrl":"https://cdn.example.com/empty.jpg","width":4032,"height":3024,
     *          "roomCategory":"living_room","styleProfile":"modern"}'
     *
     * HTTP 201: run accepted, stage 1 dispatched
     * HTTP 200: wait=true and the run reached COMPLETED or FAILED
     * HTTP 400: invalid input or no provider for the room/style pair
     */
    @PostMapping
    public ResponseEntity<RunStatusResponse> start(@RequestBody StartRunRequest req,
                                                   @RequestParam(defaultValue = "false") boolean wait) {
        try {
            if (wait) {
                StagingRun finished = blockingRunner.startAndAwait(req.toCommand());
                return ResponseEntity.ok(RunStatusResponse.from(finished));
            }
            StagingRun run = workflow.startRun(req.toCommand());
            return ResponseEntity.status(HttpStatus.CREATED).body(RunStatusResponse.from(run));
        } catch (InvalidRunRequestException | UnsupportedStagingException e) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, e.getMessage(), e);
        }
    }

    /**
     * Poll the current state of a run.
     * Returns 404 if the run ID is not found.
     */
    @GetMapping("/{id}")
    public RunStatusResponse getRun(@PathVariable UUID id) {
        return RunStatusResponse.from(requireRun(id));
    }

    @GetMapping("/{id}/plan")
    public PlanResponse getPlan(@PathVariable UUID id) {
        return PlanResponse.from(requireRun(id).getPlan());
    }

    /**
     * List every provider job issued for a run, oldest first, including
     * the exact instruction each one carried.
     */
    @GetMapping("/{id}/dispatches")
    public List<DispatchResponse> getDispatches(@PathVariable UUID id) {
        requireRun(id);
        return workflow.dispatches(id).stream()
                .map(DispatchResponse::from)
                .toList();
    }

    private StagingRun requireRun(UUID id) {
        return workflow.findRun(id).orElseThrow(() ->
                new ResponseStatusException(HttpStatus.NOT_FOUND, "Run not found: " + id));
    }
}
