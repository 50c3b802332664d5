package com.stagecraft.engine.provider;

/**
 * Thrown when a provider call does not produce a usable answer.
 *
 * Kind mirrors the metric tag recorded for the call.
 */
public class ProviderException extends RuntimeException {

    public enum Kind {
        TRANSPORT,           // connection refused, timeout, interrupted
        HTTP_STATUS,         // non-2xx answer
        MALFORMED_RESPONSE   // 2xx but the body is not what we expect
    }

    private final Kind kind;

    public ProviderException(Kind kind, String message) {
        super("[" + kind + "] " + message);
        this.kind = kind;
    }

    public ProviderException(Kind kind, String message, Throwable cause) {
        super("[" + kind + "] " + message, cause);
        this.kind = kind;
    }

    public Kind getKind() { return kind; }
}
