package com.stagecraft.engine.provider;

import com.stagecraft.engine.model.ImageRef;

/**
 * State of a provider job as seen by a poll or a webhook.
 * image is set only when SUCCEEDED, reason only when FAILED.
 */
public record JobStatus(State state, ImageRef image, String reason) {

    public enum State { PENDING, SUCCEEDED, FAILED }

    public static final JobStatus PENDING = new JobStatus(State.PENDING, null, null);

    public JobStatus {
        if (state == State.SUCCEEDED && image == null) {
            throw new IllegalArgumentException("image is required for a succeeded job");
        }
    }

    public static JobStatus succeeded(ImageRef image) {
        return new JobStatus(State.SUCCEEDED, image, null);
    }

    public static JobStatus failed(String reason) {
        return new JobStatus(State.FAILED, null, reason);
    }
}
