package com.stagecraft.engine.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.stagecraft.engine.provider.ImageProvider;
import com.stagecraft.engine.provider.ProviderCallback;
import com.stagecraft.engine.provider.ProviderCapabilityTable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Entry point for provider webhooks.
 *
 * A fast provider can call back before the transaction that recorded the
 * dispatch has committed, so an unknown handle is retried with exponential
 * backoff ({@code stagecraft.callback.lookup-retries} times, starting at
 * {@code stagecraft.callback.lookup-backoff}) before giving up.
 */
@Component
public class ProviderCallbackHandler {

    private static final Logger log = LoggerFactory.getLogger(ProviderCallbackHandler.class);

    private final StagingWorkflowService  workflow;
    private final ProviderCapabilityTable providers;
    private final int                     lookupRetries;
    private final Duration                lookupBackoff;

    public ProviderCallbackHandler(
            StagingWorkflowService workflow,
            ProviderCapabilityTable providers,
            @Value("${stagecraft.callback.lookup-retries:3}") int lookupRetries,
            @Value("${stagecraft.callback.lookup-backoff:500ms}") Duration lookupBackoff) {
        this.workflow      = workflow;
        this.providers     = providers;
        this.lookupRetries = lookupRetries;
        this.lookupBackoff = lookupBackoff;
    }

    /**
     * @throws com.stagecraft.engine.provider.ProviderNotFoundException   if no adapter has this name
     * @throws com.stagecraft.engine.provider.MalformedCallbackException  if the body cannot be parsed
     */
    public TransitionResult handle(String providerName, JsonNode body) {
        ImageProvider provider = providers.byName(providerName);
        ProviderCallback callback = provider.parseCallback(body);
        log.info("Webhook from '{}' for job {}: {}", providerName, callback.jobHandle(),
                callback.status().state());

        TransitionResult result = workflow.onProviderCallback(providerName, callback);
        for (int attempt = 0; result == TransitionResult.UNKNOWN_HANDLE && attempt < lookupRetries; attempt++) {
            long delay = lookupBackoff.toMillis() << attempt;
            log.debug("Job {} not found yet, retrying in {} ms ({}/{})",
                    callback.jobHandle(), delay, attempt + 1, lookupRetries);
            sleep(delay);
            result = workflow.onProviderCallback(providerName, callback);
        }
        return result;
    }

    private static void sleep(long millis) {
        if (millis <= 0) return;
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while waiting to retry callback", e);
        }
    }
}
