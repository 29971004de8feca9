package com.scanprep;

import org.junit.jupiter.api.Test;

import java.awt.image.BufferedImage;

import static org.junit.jupiter.api.Assertions.*;

class NonLocalMeansDenoiserTest {

    @Test
    void constantImageUnchanged() {
        BufferedImage out = new NonLocalMeansDenoiser(10, 7, 21).denoise(TestImages.solidGray(25, 17, 137));
        assertEquals(25 * 17, TestImages.countSamples(out, 137));
    }

    @Test
    void reducesNoiseOnFlatRegion() {
        BufferedImage noisy = TestImages.noisyFlat(48, 48, 128, 8.0, 11);
        BufferedImage out = new NonLocalMeansDenoiser(10, 7, 21).denoise(noisy);
        assertTrue(stdDev(GrayRasters.samples(out)) < stdDev(GrayRasters.samples(noisy)) / 2);
    }

    @Test
    void preservesHardEdges() {
        BufferedImage bars = TestImages.rotatedBars(60, 40, 0, 5, 55, 10, 30, 10, 3);
        BufferedImage out = new NonLocalMeansDenoiser(10, 7, 21).denoise(bars);
        assertArrayEquals(GrayRasters.samples(bars), GrayRasters.samples(out));
    }

    @Test
    void tinyImagesUseReflectedBorder() {
        BufferedImage out = new NonLocalMeansDenoiser(10, 7, 21).denoise(TestImages.noise(1, 3, 2));
        assertEquals(1, out.getWidth());
        assertEquals(3, out.getHeight());
    }

    @Test
    void stripsMatchDirectComputation() {
        int w = 23;
        int h = NonLocalMeansDenoiser.STRIP_ROWS * 2 + 17;
        BufferedImage noisy = TestImages.noisyFlat(w, h, 120, 12.0, 5);
        double strength = 9;
        int template = 3;
        int search = 5;

        int[] out = GrayRasters.samples(new NonLocalMeansDenoiser(strength, template, search).denoise(noisy));
        int[] expected = directNlm(GrayRasters.samples(noisy), w, h, strength, template / 2, search / 2);

        for (int i = 0; i < out.length; i++) {
            assertEquals(expected[i], out[i], 1.0, "pixel " + i);
        }
    }

    @Test
    void evenWindowRejected() {
        assertThrows(ConfigException.class, () -> new NonLocalMeansDenoiser(10, 6, 21));
    }

    /** Per-pixel non-local means with reflected borders and the same weight cutoff. */
    private static int[] directNlm(int[] src, int w, int h, double strength, int t, int r) {
        int area = (2 * t + 1) * (2 * t + 1);
        double scale = 1.0 / (area * strength * strength);
        double maxSsd = Math.ceil(-Math.log(NonLocalMeansDenoiser.WEIGHT_CUTOFF) / scale);
        int[] out = new int[w * h];
        for (int y = 0; y < h; y++) {
            for (int x = 0; x < w; x++) {
                double weightSum = 0;
                double valueSum = 0;
                for (int dy = -r; dy <= r; dy++) {
                    for (int dx = -r; dx <= r; dx++) {
                        long ssd = 0;
                        for (int j = -t; j <= t; j++) {
                            for (int i = -t; i <= t; i++) {
                                int diff = at(src, w, h, x + i, y + j) - at(src, w, h, x + dx + i, y + dy + j);
                                ssd += (long) diff * diff;
                            }
                        }
                        if (ssd > maxSsd) continue;
                        double weight = Math.exp(-ssd * scale);
                        weightSum += weight;
                        valueSum += weight * at(src, w, h, x + dx, y + dy);
                    }
                }
                out[y * w + x] = (int) Math.round(valueSum / weightSum);
            }
        }
        return out;
    }

    private static int at(int[] src, int w, int h, int x, int y) {
        return src[GrayRasters.reflect101(y, h) * w + GrayRasters.reflect101(x, w)];
    }

    private static double stdDev(int[] samples) {
        double mean = 0;
        for (int v : samples) mean += v;
        mean /= samples.length;
        double var = 0;
        for (int v : samples) var += (v - mean) * (v - mean);
        return Math.sqrt(var / samples.length);
    }
}
