package com.stagecraft.engine.service;

import com.stagecraft.engine.model.StageDispatch;
import com.stagecraft.engine.provider.ImageProvider;
import com.stagecraft.engine.provider.JobStatus;
import com.stagecraft.engine.provider.ProviderCapabilityTable;
import com.stagecraft.engine.provider.ProviderException;
import com.stagecraft.engine.provider.StageExecutor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Asks the provider for the state of one awaiting dispatch and feeds the
 * answer into the workflow.
 *
 * The HTTP call runs outside any transaction so the run row is only locked
 * while the answer is applied. A poll that fails outright counts as a
 * provider error for that attempt.
 */
@Component
public class DispatchPoller {

    private static final Logger log = LoggerFactory.getLogger(DispatchPoller.class);

    private final StagingWorkflowService  workflow;
    private final ProviderCapabilityTable providers;
    private final StageExecutor           executor;

    public DispatchPoller(StagingWorkflowService workflow,
                          ProviderCapabilityTable providers,
                          StageExecutor executor) {
        this.workflow  = workflow;
        this.providers = providers;
        this.executor  = executor;
    }

    public TransitionResult poll(StageDispatch dispatch) {
        ImageProvider provider = providers.byName(dispatch.getProviderName());
        JobStatus status;
        try {
            status = executor.pollStatus(provider, dispatch.getJobHandle());
        } catch (ProviderException e) {
            log.warn("Status poll for job {} failed: {}", dispatch.getJobHandle(), e.getMessage());
            status = JobStatus.failed("Status poll failed: " + e.getMessage());
        }
        return workflow.onJobStatus(dispatch.getJobHandle(), status);
    }
}
