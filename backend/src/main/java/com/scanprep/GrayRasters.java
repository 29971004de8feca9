package com.scanprep;

import java.awt.image.BufferedImage;
import java.awt.image.WritableRaster;

/**
 * Conversions between single-channel {@link BufferedImage}s and flat sample arrays.
 * Arrays are row-major, {@code index = y * width + x}.
 */
public final class GrayRasters {

    public static final int FOREGROUND = 0;
    public static final int BACKGROUND = 255;

    private GrayRasters() {}

    public static int[] samples(BufferedImage gray) {
        int w = gray.getWidth();
        int h = gray.getHeight();
        return gray.getRaster().getSamples(0, 0, w, h, 0, new int[w * h]);
    }

    public static BufferedImage fromSamples(int[] samples, int width, int height) {
        BufferedImage out = new BufferedImage(width, height, BufferedImage.TYPE_BYTE_GRAY);
        WritableRaster raster = out.getRaster();
        raster.setSamples(0, 0, width, height, 0, samples);
        return out;
    }

    public static BufferedImage copy(BufferedImage gray) {
        return fromSamples(samples(gray), gray.getWidth(), gray.getHeight());
    }

    /**
     * True if every sample is either {@link #FOREGROUND} or {@link #BACKGROUND}.
     */
    public static boolean isBinary(BufferedImage image) {
        if (image.getRaster().getNumBands() != 1) {
            return false;
        }
        for (int v : samples(image)) {
            if (v != FOREGROUND && v != BACKGROUND) {
                return false;
            }
        }
        return true;
    }

    static int clamp(int v, int lo, int hi) {
        return v < lo ? lo : (v > hi ? hi : v);
    }

    /**
     * Reflect-101 border index (…2 1 | 0 1 2 … n-1 | n-2 …), valid for any offset.
     */
    static int reflect101(int i, int n) {
        if (n == 1) {
            return 0;
        }
        int period = 2 * (n - 1);
        int m = Math.floorMod(i, period);
        return m < n ? m : period - m;
    }
}
