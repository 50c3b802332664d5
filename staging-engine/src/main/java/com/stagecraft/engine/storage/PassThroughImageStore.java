package com.stagecraft.engine.storage;

import com.stagecraft.engine.model.ImageRef;
import org.springframework.stereotype.Component;

import java.util.UUID;

/**
 * Default store: keeps the provider URL as-is. Swap in a bucket-backed
 * implementation where provider URLs expire before clients read them.
 */
@Component
public class PassThroughImageStore implements ImageStore {

    @Override
    public ImageRef persist(UUID runId, int stageIndex, ImageRef providerImage) {
        return providerImage;
    }
}
