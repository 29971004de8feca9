package com.scanprep;

import java.awt.image.BufferedImage;

/**
 * Contrast-limited adaptive histogram equalization for 8-bit grayscale images.
 * <p>
 * The image is split into a grid of tiles, each tile gets its own clipped
 * equalization mapping, and every pixel is remapped by bilinear interpolation
 * between the mappings of the four nearest tile centers so tile seams do not show.
 */
public class Clahe {

    private static final int BINS = 256;

    private final double clipLimit;
    private final int tileGrid;

    public Clahe(double clipLimit, int tileGrid) {
        if (clipLimit <= 0 || tileGrid < 1) {
            throw new ConfigException("CLAHE needs a positive clip limit and tile grid, got "
                    + clipLimit + " and " + tileGrid);
        }
        this.clipLimit = clipLimit;
        this.tileGrid = tileGrid;
    }

    public BufferedImage apply(BufferedImage gray) {
        int w = gray.getWidth();
        int h = gray.getHeight();
        int[] src = GrayRasters.samples(gray);

        int tilesX = Math.min(tileGrid, w);
        int tilesY = Math.min(tileGrid, h);
        int tileW = (w + tilesX - 1) / tilesX;
        int tileH = (h + tilesY - 1) / tilesY;
        // Ceil division can leave trailing tiles empty; shrink the grid to the populated ones
        tilesX = (w + tileW - 1) / tileW;
        tilesY = (h + tileH - 1) / tileH;

        int[][] luts = new int[tilesX * tilesY][];
        for (int ty = 0; ty < tilesY; ty++) {
            for (int tx = 0; tx < tilesX; tx++) {
                int x0 = tx * tileW;
                int y0 = ty * tileH;
                int x1 = Math.min(x0 + tileW, w);
                int y1 = Math.min(y0 + tileH, h);
                luts[ty * tilesX + tx] = tileMapping(src, w, x0, y0, x1, y1);
            }
        }

        int[] out = new int[w * h];
        for (int y = 0; y < h; y++) {
            double tyf = (y + 0.5) / tileH - 0.5;
            int ty1 = (int) Math.floor(tyf);
            double ya = tyf - ty1;
            int ty2 = Math.min(ty1 + 1, tilesY - 1);
            ty1 = Math.max(ty1, 0);

            for (int x = 0; x < w; x++) {
                double txf = (x + 0.5) / tileW - 0.5;
                int tx1 = (int) Math.floor(txf);
                double xa = txf - tx1;
                int tx2 = Math.min(tx1 + 1, tilesX - 1);
                tx1 = Math.max(tx1, 0);

                int v = src[y * w + x];
                double top = (1 - xa) * luts[ty1 * tilesX + tx1][v] + xa * luts[ty1 * tilesX + tx2][v];
                double bottom = (1 - xa) * luts[ty2 * tilesX + tx1][v] + xa * luts[ty2 * tilesX + tx2][v];
                out[y * w + x] = GrayRasters.clamp((int) Math.round((1 - ya) * top + ya * bottom), 0, 255);
            }
        }
        return GrayRasters.fromSamples(out, w, h);
    }

    private int[] tileMapping(int[] src, int w, int x0, int y0, int x1, int y1) {
        int[] hist = new int[BINS];
        for (int y = y0; y < y1; y++) {
            for (int x = x0; x < x1; x++) {
                hist[src[y * w + x]]++;
            }
        }
        int area = (x1 - x0) * (y1 - y0);

        int limit = Math.max((int) (clipLimit * area / BINS), 1);
        int clipped = 0;
        for (int i = 0; i < BINS; i++) {
            if (hist[i] > limit) {
                clipped += hist[i] - limit;
                hist[i] = limit;
            }
        }
        // Spread the clipped mass evenly, then the remainder one bin at a time
        int perBin = clipped / BINS;
        int residual = clipped - perBin * BINS;
        for (int i = 0; i < BINS; i++) {
            hist[i] += perBin;
        }
        if (residual > 0) {
            int step = Math.max(BINS / residual, 1);
            for (int i = 0; i < BINS && residual > 0; i += step, residual--) {
                hist[i]++;
            }
        }

        int[] lut = new int[BINS];
        double scale = 255.0 / area;
        int cdf = 0;
        for (int i = 0; i < BINS; i++) {
            cdf += hist[i];
            lut[i] = GrayRasters.clamp((int) Math.round(cdf * scale), 0, 255);
        }
        return lut;
    }
}
