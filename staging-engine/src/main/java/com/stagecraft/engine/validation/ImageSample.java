package com.stagecraft.engine.validation;

import java.awt.image.BufferedImage;

/**
 * A fixed-size luminance grid plus the mean RGB of an image.
 *
 * Every image is reduced to {@value #GRID}x{@value #GRID} samples by block
 * averaging, so before/after pairs of different resolutions stay comparable
 * and the heuristics cost the same for any input size.
 */
public final class ImageSample {

    public static final int GRID = 64;

    public enum Axis { HORIZONTAL, VERTICAL }

    private final double[] luma;    // row-major, GRID * GRID
    private final double   meanRed;
    private final double   meanGreen;
    private final double   meanBlue;

    private ImageSample(double[] luma, double meanRed, double meanGreen, double meanBlue) {
        this.luma      = luma;
        this.meanRed   = meanRed;
        this.meanGreen = meanGreen;
        this.meanBlue  = meanBlue;
    }

    public static ImageSample of(BufferedImage image) {
        int w = image.getWidth();
        int h = image.getHeight();
        double[] luma = new double[GRID * GRID];
        double sumR = 0, sumG = 0, sumB = 0;

        for (int gy = 0; gy < GRID; gy++) {
            int y0 = gy * h / GRID;
            int y1 = Math.max(y0 + 1, (gy + 1) * h / GRID);
            for (int gx = 0; gx < GRID; gx++) {
                int x0 = gx * w / GRID;
                int x1 = Math.max(x0 + 1, (gx + 1) * w / GRID);

                double r = 0, g = 0, b = 0;
                int n = 0;
                for (int y = y0; y < Math.min(y1, h); y++) {
                    for (int x = x0; x < Math.min(x1, w); x++) {
                        int rgb = image.getRGB(x, y);
                        r += (rgb >> 16) & 0xFF;
                        g += (rgb >> 8) & 0xFF;
                        b += rgb & 0xFF;
                        n++;
                    }
                }
                r /= n; g /= n; b /= n;
                luma[gy * GRID + gx] = 0.299 * r + 0.587 * g + 0.114 * b;
                sumR += r; sumG += g; sumB += b;
            }
        }
        int cells = GRID * GRID;
        return new ImageSample(luma, sumR / cells, sumG / cells, sumB / cells);
    }

    public double luma(int x, int y) {
        return luma[y * GRID + x];
    }

    public double meanRed()   { return meanRed; }
    public double meanGreen() { return meanGreen; }
    public double meanBlue()  { return meanBlue; }

    /** Average of the three channel means, 0..255. */
    public double meanIntensity() {
        return (meanRed + meanGreen + meanBlue) / 3.0;
    }

    /**
     * Fraction of samples in [x0, x1) x [y0, y1) whose luminance step to the
     * next sample along the axis exceeds threshold. HORIZONTAL steps pick up
     * vertical lines (stripes, frame sides); VERTICAL steps pick up
     * horizontal lines.
     */
    public double edgeDensity(Axis axis, int x0, int y0, int x1, int y1, double threshold) {
        int edges = 0;
        int total = 0;
        for (int y = y0; y < y1; y++) {
            for (int x = x0; x < x1; x++) {
                total++;
                int nx = axis == Axis.HORIZONTAL ? x + 1 : x;
                int ny = axis == Axis.VERTICAL   ? y + 1 : y;
                if (nx >= GRID || ny >= GRID) continue;
                if (Math.abs(luma(nx, ny) - luma(x, y)) > threshold) edges++;
            }
        }
        return total == 0 ? 0.0 : (double) edges / total;
    }
}
