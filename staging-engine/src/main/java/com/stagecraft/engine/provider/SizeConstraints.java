package com.stagecraft.engine.provider;

/**
 * Output-size limits of a provider: each side within [minSide, maxSide]
 * and a multiple of granularity.
 */
public record SizeConstraints(int minSide, int maxSide, int granularity) {

    public static final SizeConstraints DEFAULT = new SizeConstraints(512, 1536, 32);

    public SizeConstraints {
        if (granularity <= 0 || minSide <= 0 || minSide > maxSide) {
            throw new IllegalArgumentException(
                    "Invalid size constraints: [" + minSide + ", " + maxSide + "] / " + granularity);
        }
    }
}
