package com.stagecraft.engine.storage;

import com.stagecraft.engine.model.ImageRef;

import java.util.UUID;

/**
 * Object storage seam: turns a provider-hosted image (whose URL usually
 * expires) into a stable reference before the workflow records it.
 */
public interface ImageStore {

    /**
     * @throws ImageStoreException if the image could not be copied
     */
    ImageRef persist(UUID runId, int stageIndex, ImageRef providerImage);
}
