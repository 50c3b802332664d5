package com.stagecraft.engine.provider;

/**
 * Fits an image size into a provider's limits without distorting it.
 *
 * Steps:
 *   1. scale down so the long side fits maxSide, or scale up so the short
 *      side reaches minSide (if both cannot hold, maxSide wins)
 *   2. round each side to the provider granularity, never past maxSide
 *
 * Pure geometry; nothing here touches pixels.
 */
public final class SizeNormalizer {

    public record NormalizedSize(int width, int height) {

        /** Reduced ratio string such as "4:3". */
        public String aspectRatio() {
            int g = gcd(width, height);
            return (width / g) + ":" + (height / g);
        }
    }

    private SizeNormalizer() {}

    public static NormalizedSize normalize(int width, int height, SizeConstraints limits) {
        if (width <= 0 || height <= 0) {
            throw new IllegalArgumentException("Image size must be positive: " + width + "x" + height);
        }
        double longSide  = Math.max(width, height);
        double shortSide = Math.min(width, height);

        double scale = 1.0;
        if (longSide > limits.maxSide()) {
            scale = limits.maxSide() / longSide;
        } else if (shortSide < limits.minSide()) {
            scale = limits.minSide() / shortSide;
            if (longSide * scale > limits.maxSide()) {
                scale = limits.maxSide() / longSide;
            }
        }
        return new NormalizedSize(
                roundSide(width * scale, limits),
                roundSide(height * scale, limits));
    }

    private static int roundSide(double side, SizeConstraints limits) {
        int g = limits.granularity();
        int rounded = (int) Math.round(side / g) * g;
        if (rounded > limits.maxSide()) {
            rounded = (int) Math.floor(side / g) * g;
        } else if (rounded < limits.minSide()) {
            int up = (int) Math.ceil(side / g) * g;
            if (up <= limits.maxSide()) rounded = up;
        }
        return Math.max(rounded, g);
    }

    private static int gcd(int a, int b) {
        return b == 0 ? a : gcd(b, a % b);
    }
}
