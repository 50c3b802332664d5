package com.stagecraft.engine.provider;

import com.stagecraft.engine.model.ImageRef;

/**
 * One generation job as sent to a provider. width/height/aspectRatio are
 * already normalized to the provider's limits and are null when the input
 * size is unknown.
 */
public record GenerationRequest(
        ImageRef inputImage,
        String   instruction,
        Integer  width,
        Integer  height,
        String   aspectRatio
) {
    public boolean hasSize() {
        return width != null && height != null;
    }
}
