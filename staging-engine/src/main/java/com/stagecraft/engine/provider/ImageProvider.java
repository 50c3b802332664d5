package com.stagecraft.engine.provider;

import com.fasterxml.jackson.databind.JsonNode;
import com.stagecraft.engine.model.RoomCategory;
import com.stagecraft.engine.model.StyleProfile;

/**
 * An external image-synthesis service that can run one instruction-guided
 * edit of an image.
 *
 * All adapters declared as Spring {@code @Component}s are collected by
 * {@link ProviderCapabilityTable}. Adapters never retry on their own: every
 * failure surfaces as a {@link ProviderException} so the workflow can count
 * it against the stage's retry budget.
 */
public interface ImageProvider {

    /** Stable adapter name; also the path segment of its webhook endpoint. */
    String name();

    /** Whether this adapter can stage the given room/style pair. */
    boolean supports(RoomCategory room, StyleProfile style);

    /** Output size limits the provider accepts. */
    SizeConstraints sizeConstraints();

    /**
     * Start one generation job.
     *
     * @throws ProviderException on transport failure, non-2xx status or an unreadable response
     */
    SubmitResult submit(GenerationRequest request);

    /**
     * Ask for the current state of a job.
     *
     * @throws ProviderException on transport failure or an unreadable response
     */
    JobStatus poll(String jobHandle);

    /**
     * Translate a webhook body into a callback.
     *
     * @throws MalformedCallbackException if the body carries no job handle
     */
    ProviderCallback parseCallback(JsonNode body);
}
