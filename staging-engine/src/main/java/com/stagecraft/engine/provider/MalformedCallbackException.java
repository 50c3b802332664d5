package com.stagecraft.engine.provider;

/**
 * Thrown when a webhook body cannot be turned into a {@link ProviderCallback}.
 */
public class MalformedCallbackException extends RuntimeException {

    public MalformedCallbackException(String message) {
        super(message);
    }
}
