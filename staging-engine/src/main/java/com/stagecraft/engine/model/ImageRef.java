package com.stagecraft.engine.model;

/**
 * An image the engine passes around without looking inside it: a URL plus
 * the pixel dimensions, when known (0 = unknown).
 */
public record ImageRef(String url, int width, int height) {

    public ImageRef {
        if (url == null || url.isBlank()) {
            throw new IllegalArgumentException("Image url is required");
        }
        if (width < 0 || height < 0) {
            throw new IllegalArgumentException("Image dimensions must not be negative");
        }
    }

    public static ImageRef of(String url) {
        return new ImageRef(url, 0, 0);
    }

    public boolean hasDimensions() {
        return width > 0 && height > 0;
    }

    /** Keep this image's URL but borrow the other image's size when ours is unknown. */
    public ImageRef withFallbackDimensions(ImageRef other) {
        if (hasDimensions() || other == null || !other.hasDimensions()) return this;
        return new ImageRef(url, other.width(), other.height());
    }
}
