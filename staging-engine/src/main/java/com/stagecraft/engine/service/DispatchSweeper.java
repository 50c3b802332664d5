package com.stagecraft.engine.service;

import com.stagecraft.engine.model.StageDispatch;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Background safety net for event-driven runs.
 *
 * Webhooks get lost and processes restart. Every tick, each dispatch that
 * has been awaiting a result for longer than {@code stale-after} is either
 * polled (if nobody polled it recently) or, once older than
 * {@code wait-budget}, timed out. Both go through the same transition
 * function as webhooks, so a sweep racing a callback is harmless.
 */
@Component
@EnableScheduling
@ConditionalOnProperty(name = "stagecraft.sweeper.enabled", havingValue = "true", matchIfMissing = true)
public class DispatchSweeper {

    private static final Logger log = LoggerFactory.getLogger(DispatchSweeper.class);

    private final StagingWorkflowService workflow;
    private final DispatchPoller         poller;
    private final Duration               staleAfter;
    private final Duration               waitBudget;

    public DispatchSweeper(StagingWorkflowService workflow,
                           DispatchPoller poller,
                           @Value("${stagecraft.sweeper.stale-after:60s}") Duration staleAfter,
                           @Value("${stagecraft.sweeper.wait-budget:5m}") Duration waitBudget) {
        this.workflow   = workflow;
        this.poller     = poller;
        this.staleAfter = staleAfter;
        this.waitBudget = waitBudget;
    }

    @Scheduled(fixedDelayString = "${stagecraft.sweeper.interval-ms:30000}")
    public void tick() {
        sweep(Instant.now());
    }

    /** One sweep as of 'now'; returns how many dispatches were touched. */
    public int sweep(Instant now) {
        List<StageDispatch> stale = workflow.awaitingDispatchesBefore(now.minus(staleAfter));
        int touched = 0;
        for (StageDispatch dispatch : stale) {
            try {
                if (dispatch.getDispatchedAt().isBefore(now.minus(waitBudget))) {
                    log.warn("Job {} exceeded the wait budget of {}; timing out", dispatch.getJobHandle(), waitBudget);
                    workflow.onDispatchTimeout(dispatch.getJobHandle());
                    touched++;
                } else if (dispatch.getLastPolledAt() == null
                        || dispatch.getLastPolledAt().isBefore(now.minus(staleAfter))) {
                    poller.poll(dispatch);
                    touched++;
                }
            } catch (Exception e) {
                log.error("Sweep of job {} (run {}) failed: {}",
                        dispatch.getJobHandle(), dispatch.getRunId(), e.getMessage(), e);
            }
        }
        if (touched > 0) {
            log.info("Sweep touched {} of {} stale dispatches", touched, stale.size());
        }
        return touched;
    }
}
