package com.stagecraft.engine.service;

/**
 * A staging request that cannot become a run: missing image, unknown room
 * or style, or a stage selection that keeps nothing.
 */
public class InvalidRunRequestException extends RuntimeException {
    public InvalidRunRequestException(String message) {
        super(message);
    }
}
