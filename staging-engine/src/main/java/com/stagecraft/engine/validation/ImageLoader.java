package com.stagecraft.engine.validation;

import com.stagecraft.engine.model.ImageRef;

import java.awt.image.BufferedImage;

/**
 * Fetches and decodes the pixels behind an {@link ImageRef}.
 */
public interface ImageLoader {

    /**
     * @throws ImageLoadException if the image is unreachable or not a decodable image
     */
    BufferedImage load(ImageRef image);
}
