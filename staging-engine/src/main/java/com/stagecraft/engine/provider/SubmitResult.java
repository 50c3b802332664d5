package com.stagecraft.engine.provider;

import com.stagecraft.engine.model.ImageRef;

/**
 * What a provider answered to a submit: either a handle to wait on, or the
 * finished image straight away.
 */
public record SubmitResult(Kind kind, String jobHandle, ImageRef image) {

    public enum Kind { SUBMITTED, IMMEDIATE }

    public SubmitResult {
        if (kind == Kind.SUBMITTED && (jobHandle == null || jobHandle.isBlank())) {
            throw new IllegalArgumentException("jobHandle is required");
        }
        if (kind == Kind.IMMEDIATE && image == null) {
            throw new IllegalArgumentException("image is required");
        }
    }

    public static SubmitResult submitted(String jobHandle) {
        return new SubmitResult(Kind.SUBMITTED, jobHandle, null);
    }

    public static SubmitResult immediate(ImageRef image) {
        return new SubmitResult(Kind.IMMEDIATE, null, image);
    }
}
