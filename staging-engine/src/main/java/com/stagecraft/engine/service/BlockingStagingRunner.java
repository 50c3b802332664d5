package com.stagecraft.engine.service;

import com.stagecraft.engine.model.StageDispatch;
import com.stagecraft.engine.model.StagingRun;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Optional;
import java.util.UUID;

/**
 * Drives a run to a terminal state from the calling thread by polling.
 *
 * Each dispatch is polled every {@code stagecraft.blocking.poll-interval}
 * up to {@code stagecraft.blocking.max-poll-attempts} times; after that the
 * attempt is timed out. Webhooks may resolve the same dispatch concurrently:
 * whichever event is applied second is dropped as a duplicate.
 */
@Component
public class BlockingStagingRunner {

    private static final Logger log = LoggerFactory.getLogger(BlockingStagingRunner.class);

    private final StagingWorkflowService workflow;
    private final DispatchPoller         poller;
    private final Duration               pollInterval;
    private final int                    maxPollAttempts;

    public BlockingStagingRunner(
            StagingWorkflowService workflow,
            DispatchPoller poller,
            @Value("${stagecraft.blocking.poll-interval:10s}") Duration pollInterval,
            @Value("${stagecraft.blocking.max-poll-attempts:30}") int maxPollAttempts) {
        this.workflow        = workflow;
        this.poller          = poller;
        this.pollInterval    = pollInterval;
        this.maxPollAttempts = maxPollAttempts;
    }

    /**
     * Start a run and wait for it to finish.
     */
    public StagingRun startAndAwait(StartRunCommand cmd) {
        StagingRun run = workflow.startRun(cmd);
        return awaitCompletion(run.getId());
    }

    /**
     * Poll until the run is COMPLETED or FAILED.
     *
     * @throws IllegalArgumentException if the run does not exist
     */
    public StagingRun awaitCompletion(UUID runId) {
        String currentHandle = null;
        int polls = 0;

        while (true) {
            Optional<StageDispatch> awaiting = workflow.currentDispatch(runId);
            if (awaiting.isEmpty()) {
                return workflow.findRun(runId)
                        .orElseThrow(() -> new IllegalArgumentException("Run not found: " + runId));
            }
            StageDispatch dispatch = awaiting.get();
            if (!dispatch.getJobHandle().equals(currentHandle)) {
                currentHandle = dispatch.getJobHandle();
                polls = 0;
            }

            if (polls >= maxPollAttempts) {
                log.warn("Job {} still pending after {} polls; timing out attempt", currentHandle, polls);
                workflow.onDispatchTimeout(currentHandle);
                continue;
            }

            TransitionResult result = poller.poll(dispatch);
            polls++;
            if (result == TransitionResult.IGNORED_PENDING) {
                log.debug("Job {} pending (poll {}/{})", currentHandle, polls, maxPollAttempts);
                sleep();
            }
        }
    }

    private void sleep() {
        if (pollInterval.isZero() || pollInterval.isNegative()) return;
        try {
            Thread.sleep(pollInterval.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while waiting for provider", e);
        }
    }
}
