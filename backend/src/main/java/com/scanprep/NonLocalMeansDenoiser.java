package com.scanprep;

import java.awt.image.BufferedImage;
import java.util.Arrays;

/**
 * Non-local means denoising for 8-bit grayscale images.
 * <p>
 * Every output pixel is the weighted average of the pixels in its search window,
 * weighted by how similar their surrounding patch is to the pixel's own patch:
 * {@code w = exp(-d / h²)} with {@code d} the mean squared patch difference.
 * Patch distances are computed per search offset with an integral image, so the
 * cost is O(searchWindow² · pixels) regardless of the template size. Weights come from a
 * lookup table over the integer patch distance and are cut to zero once they fall below
 * {@value #WEIGHT_CUTOFF}; rows are processed in strips to bound the scratch buffers.
 */
public class NonLocalMeansDenoiser {

    static final double WEIGHT_CUTOFF = 1e-3;
    static final int STRIP_ROWS = 128;

    private final int templateRadius;
    private final int searchRadius;
    private final int patchArea;
    private final double[] weights;

    public NonLocalMeansDenoiser(double h, int templateWindow, int searchWindow) {
        if (h <= 0) {
            throw new ConfigException("Filter strength must be positive, got " + h);
        }
        if (templateWindow < 1 || templateWindow % 2 == 0 || searchWindow < 1 || searchWindow % 2 == 0) {
            throw new ConfigException("Template and search windows must be odd and positive, got "
                    + templateWindow + " and " + searchWindow);
        }
        this.templateRadius = templateWindow / 2;
        this.searchRadius = searchWindow / 2;
        this.patchArea = templateWindow * templateWindow;
        this.weights = weightTable(h, patchArea);
    }

    /**
     * {@code exp(-ssd / (patchArea · h²))} for every summed squared difference whose weight
     * is still above the cutoff.
     */
    private static double[] weightTable(double h, int patchArea) {
        double scale = 1.0 / (patchArea * h * h);
        double maxSsd = Math.min(-Math.log(WEIGHT_CUTOFF) / scale, (double) patchArea * 255 * 255);
        double[] table = new double[(int) Math.ceil(maxSsd) + 1];
        for (int ssd = 0; ssd < table.length; ssd++) {
            table[ssd] = Math.exp(-ssd * scale);
        }
        return table;
    }

    public BufferedImage denoise(BufferedImage gray) {
        int w = gray.getWidth();
        int hgt = gray.getHeight();
        int[] samples = GrayRasters.samples(gray);

        // Padded copy so every shifted patch lookup stays in bounds
        int pad = searchRadius + templateRadius;
        int pw = w + 2 * pad;
        int ph = hgt + 2 * pad;
        int[] padded = new int[pw * ph];
        for (int y = 0; y < ph; y++) {
            int sy = GrayRasters.reflect101(y - pad, hgt);
            for (int x = 0; x < pw; x++) {
                int sx = GrayRasters.reflect101(x - pad, w);
                padded[y * pw + x] = samples[sy * w + sx];
            }
        }

        // Region whose patches cover one strip: [-t, size-1+t] in image coordinates
        int rw = w + 2 * templateRadius;
        int stripRows = Math.min(STRIP_ROWS, hgt);
        long[] integral = new long[(rw + 1) * (stripRows + 2 * templateRadius + 1)];
        double[] weightSum = new double[w * stripRows];
        double[] valueSum = new double[w * stripRows];

        // samples is free once padded, so it receives the output
        for (int y0 = 0; y0 < hgt; y0 += stripRows) {
            int rows = Math.min(stripRows, hgt - y0);
            denoiseStrip(padded, pw, pad, w, y0, rows, integral, weightSum, valueSum);
            for (int i = 0; i < rows * w; i++) {
                samples[y0 * w + i] = GrayRasters.clamp((int) Math.round(valueSum[i] / weightSum[i]), 0, 255);
            }
        }
        return GrayRasters.fromSamples(samples, w, hgt);
    }

    private void denoiseStrip(int[] padded, int pw, int pad, int w, int y0, int rows,
                              long[] integral, double[] weightSum, double[] valueSum) {
        int rw = w + 2 * templateRadius;
        int rh = rows + 2 * templateRadius;
        int stride = rw + 1;
        Arrays.fill(weightSum, 0, rows * w, 0.0);
        Arrays.fill(valueSum, 0, rows * w, 0.0);

        for (int dy = -searchRadius; dy <= searchRadius; dy++) {
            for (int dx = -searchRadius; dx <= searchRadius; dx++) {
                buildDistanceIntegral(padded, pw, pad, y0, dx, dy, rw, rh, integral);

                for (int y = 0; y < rows; y++) {
                    int iy0 = y;
                    int iy1 = y + 2 * templateRadius + 1;
                    int rowBase = (y0 + y + pad + dy) * pw + pad + dx;
                    for (int x = 0; x < w; x++) {
                        int ix0 = x;
                        int ix1 = x + 2 * templateRadius + 1;
                        long ssd = integral[iy1 * stride + ix1]
                                - integral[iy0 * stride + ix1]
                                - integral[iy1 * stride + ix0]
                                + integral[iy0 * stride + ix0];
                        if (ssd >= weights.length) {
                            continue;
                        }
                        double weight = weights[(int) ssd];
                        int idx = y * w + x;
                        weightSum[idx] += weight;
                        valueSum[idx] += weight * padded[rowBase + x];
                    }
                }
            }
        }
    }

    /**
     * Integral image of (I(p) - I(p + d))² over the patch region of the strip starting at row {@code y0}.
     */
    private void buildDistanceIntegral(int[] padded, int pw, int pad, int y0, int dx, int dy,
                                       int rw, int rh, long[] integral) {
        int stride = rw + 1;
        int origin = pad - templateRadius;
        for (int y = 0; y < rh; y++) {
            long rowSum = 0;
            int base = (y0 + y + origin) * pw + origin;
            int shifted = (y0 + y + origin + dy) * pw + origin + dx;
            for (int x = 0; x < rw; x++) {
                int diff = padded[base + x] - padded[shifted + x];
                rowSum += (long) diff * diff;
                integral[(y + 1) * stride + x + 1] = integral[y * stride + x + 1] + rowSum;
            }
        }
    }
}
