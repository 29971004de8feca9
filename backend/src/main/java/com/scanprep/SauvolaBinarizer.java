package com.scanprep;

import java.awt.image.BufferedImage;

/**
 * Local adaptive thresholding after Sauvola and Pietikäinen.
 * <p>
 * For each pixel the mean μ and standard deviation σ of its window give the threshold
 * {@code T = μ · (1 + k · (σ / R − 1))}; pixels darker than T become foreground.
 * Window statistics come from integral images of the samples and their squares, so
 * each pixel costs O(1) whatever the window size. Windows are clipped to the image.
 */
public class SauvolaBinarizer implements Binarizer {

    /** Dynamic range of the standard deviation for 8-bit samples. */
    public static final double DYNAMIC_RANGE = 128.0;

    private final double k;
    private final int windowSize;

    public SauvolaBinarizer(double k, int windowSize) {
        if (windowSize < 3 || windowSize % 2 == 0) {
            throw new ConfigException("Sauvola window size must be odd and at least 3, got " + windowSize);
        }
        if (!Double.isFinite(k)) {
            throw new ConfigException("Sauvola k must be finite, got " + k);
        }
        this.k = k;
        this.windowSize = windowSize;
    }

    public SauvolaBinarizer(PreprocessConfig config) {
        this(config.getSauvolaK(), config.getSauvolaWindow());
    }

    @Override
    public BufferedImage binarize(BufferedImage gray) {
        int w = gray.getWidth();
        int h = gray.getHeight();
        int[] src = GrayRasters.samples(gray);
        int stride = w + 1;

        long[] sum = new long[stride * (h + 1)];
        long[] sumSq = new long[stride * (h + 1)];
        for (int y = 0; y < h; y++) {
            long rowSum = 0;
            long rowSumSq = 0;
            for (int x = 0; x < w; x++) {
                long v = src[y * w + x];
                rowSum += v;
                rowSumSq += v * v;
                sum[(y + 1) * stride + x + 1] = sum[y * stride + x + 1] + rowSum;
                sumSq[(y + 1) * stride + x + 1] = sumSq[y * stride + x + 1] + rowSumSq;
            }
        }

        int half = windowSize / 2;
        int[] out = new int[w * h];
        for (int y = 0; y < h; y++) {
            int y0 = Math.max(y - half, 0);
            int y1 = Math.min(y + half + 1, h);
            for (int x = 0; x < w; x++) {
                int x0 = Math.max(x - half, 0);
                int x1 = Math.min(x + half + 1, w);
                long count = (long) (y1 - y0) * (x1 - x0);

                long s = sum[y1 * stride + x1] - sum[y0 * stride + x1] - sum[y1 * stride + x0] + sum[y0 * stride + x0];
                long sq = sumSq[y1 * stride + x1] - sumSq[y0 * stride + x1] - sumSq[y1 * stride + x0] + sumSq[y0 * stride + x0];

                double mean = (double) s / count;
                double variance = (double) sq / count - mean * mean;
                double std = variance > 0 ? Math.sqrt(variance) : 0.0;

                double threshold = mean * (1.0 + k * (std / DYNAMIC_RANGE - 1.0));
                out[y * w + x] = src[y * w + x] < threshold ? GrayRasters.FOREGROUND : GrayRasters.BACKGROUND;
            }
        }
        return GrayRasters.fromSamples(out, w, h);
    }
}
