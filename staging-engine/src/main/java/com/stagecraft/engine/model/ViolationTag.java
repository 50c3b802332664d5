package com.stagecraft.engine.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;

/**
 * Reasons a stage attempt was rejected.
 *
 * The first five come from the validator; PROVIDER_ERROR and
 * PROVIDER_TIMEOUT are recorded when no usable image came back at all.
 */
public enum ViolationTag {
    WALL_DECOR_PRESENT("wall-decor-present"),
    WINDOW_TREATMENT_PRESENT("window-treatment-present"),
    CIRCULATION_BLOCKED("circulation-blocked"),
    COLOR_DRIFT_DETECTED("color-drift-detected"),
    ITEM_COUNT_OUT_OF_RANGE("item-count-out-of-range"),
    PROVIDER_ERROR("provider-error"),
    PROVIDER_TIMEOUT("provider-timeout");

    private final String tag;

    ViolationTag(String tag) {
        this.tag = tag;
    }

    @JsonValue
    public String tag() { return tag; }

    public boolean isTransport() {
        return this == PROVIDER_ERROR || this == PROVIDER_TIMEOUT;
    }

    @JsonCreator
    public static ViolationTag fromTag(String tag) {
        return Arrays.stream(values())
                .filter(v -> v.tag.equals(tag) || v.name().equals(tag))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown violation tag: " + tag));
    }
}
