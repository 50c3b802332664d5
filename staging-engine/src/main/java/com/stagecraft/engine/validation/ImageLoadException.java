package com.stagecraft.engine.validation;

/**
 * Thrown when an image cannot be fetched or decoded for validation.
 */
public class ImageLoadException extends RuntimeException {

    public ImageLoadException(String message) {
        super(message);
    }

    public ImageLoadException(String message, Throwable cause) {
        super(message, cause);
    }
}
