package com.scanprep;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.awt.geom.AffineTransform;
import java.awt.geom.NoninvertibleTransformException;
import java.awt.image.BufferedImage;

/**
 * Skew correction for binary document images by projection profiling.
 * <p>
 * Each candidate angle in {@code [-maxAngle, +maxAngle]} is scored by the variance of
 * the row histogram of foreground pixels after a virtual rotation; aligned text lines
 * give the most sharply peaked profile. Among near-equal scores the angle closest to
 * zero wins. Pages with too little foreground to carry a line structure, and sweeps whose
 * best score barely beats the unrotated one, are left at 0°.
 */
public class Deskewer {

    private static final Logger log = LoggerFactory.getLogger(Deskewer.class);

    private static final double RELATIVE_TIE_EPSILON = 1e-6;

    // Noise floor: below either limit speckle alone decides the argmax
    static final int MIN_FOREGROUND_PIXELS = 64;
    static final double MIN_FOREGROUND_FRACTION = 2e-4;
    static final double MIN_RELATIVE_GAIN = 0.01;

    private final double maxAngle;
    private final double angleStep;

    public Deskewer(double maxAngle, double angleStep) {
        if (!(angleStep > 0) || !(maxAngle >= 0)) {
            throw new ConfigException("Deskew sweep needs a positive step and non-negative range, got step "
                    + angleStep + " and range " + maxAngle);
        }
        this.maxAngle = maxAngle;
        this.angleStep = angleStep;
    }

    public Deskewer(PreprocessConfig config) {
        this(config.getDeskewMaxAngle(), config.getDeskewAngleStep());
    }

    public DeskewResult deskew(BufferedImage binary) {
        Sweep sweep = sweep(binary);
        BufferedImage rotated = sweep.bestAngle == 0.0 ? GrayRasters.copy(binary) : rotate(binary, sweep.bestAngle);
        log.debug("Deskew angle {} (profile variance {})", sweep.bestAngle, sweep.bestVariance);
        return new DeskewResult(rotated, sweep.bestAngle, sweep.bestVariance);
    }

    /**
     * Angle in degrees that {@link #deskew(BufferedImage)} would rotate the image by.
     */
    public double estimateAngle(BufferedImage binary) {
        return sweep(binary).bestAngle;
    }

    private Sweep sweep(BufferedImage binary) {
        int w = binary.getWidth();
        int h = binary.getHeight();
        int[] src = GrayRasters.samples(binary);

        int count = 0;
        for (int v : src) {
            if (v == GrayRasters.FOREGROUND) count++;
        }
        if (count < Math.max(MIN_FOREGROUND_PIXELS, (long) Math.ceil(MIN_FOREGROUND_FRACTION * w * h))) {
            log.debug("Only {} foreground pixels, treating page as blank", count);
            return new Sweep(0.0, 0.0);
        }

        // Foreground pixel centers relative to the rotation center
        double cx = w / 2.0;
        double cy = h / 2.0;
        double[] dx = new double[count];
        double[] dy = new double[count];
        int n = 0;
        for (int y = 0; y < h; y++) {
            for (int x = 0; x < w; x++) {
                if (src[y * w + x] == GrayRasters.FOREGROUND) {
                    dx[n] = x + 0.5 - cx;
                    dy[n] = y + 0.5 - cy;
                    n++;
                }
            }
        }

        int margin = (int) Math.ceil((Math.hypot(w, h) - h) / 2.0) + 1;
        int bins = h + 2 * margin;

        int steps = (int) Math.floor(maxAngle / angleStep + 1e-9);
        double[] variances = new double[2 * steps + 1];
        double best = 0.0;
        for (int i = -steps; i <= steps; i++) {
            double v = profileVariance(dx, dy, cy, margin, bins, i * angleStep);
            variances[i + steps] = v;
            if (v > best) best = v;
        }
        double unrotated = variances[steps];
        if (best <= 0.0 || best < unrotated * (1 + MIN_RELATIVE_GAIN)) {
            return new Sweep(0.0, unrotated);
        }

        double floor = best - best * RELATIVE_TIE_EPSILON;
        for (int i = 0; i <= steps; i++) {
            double neg = variances[steps - i];
            double pos = variances[steps + i];
            if (neg >= floor || pos >= floor) {
                double angle = pos >= neg ? i * angleStep : -i * angleStep;
                return new Sweep(angle, Math.max(neg, pos));
            }
        }
        return new Sweep(0.0, unrotated);
    }

    private static double profileVariance(double[] dx, double[] dy, double cy, int margin, int bins,
                                          double angleDegrees) {
        double rad = Math.toRadians(angleDegrees);
        double sin = Math.sin(rad);
        double cos = Math.cos(rad);
        long[] rows = new long[bins];
        for (int i = 0; i < dx.length; i++) {
            double rotatedY = cy + dx[i] * sin + dy[i] * cos;
            int bin = (int) Math.floor(rotatedY) + margin;
            rows[GrayRasters.clamp(bin, 0, bins - 1)]++;
        }

        double sum = 0;
        double sumSq = 0;
        for (long c : rows) {
            sum += c;
            sumSq += (double) c * c;
        }
        double mean = sum / bins;
        return sumSq / bins - mean * mean;
    }

    /**
     * Rotates about the image center by nearest-neighbor inverse mapping, keeping the
     * canvas size. Pixels that map outside the source become background.
     */
    static BufferedImage rotate(BufferedImage binary, double angleDegrees) {
        int w = binary.getWidth();
        int h = binary.getHeight();
        int[] src = GrayRasters.samples(binary);

        AffineTransform forward = AffineTransform.getRotateInstance(Math.toRadians(angleDegrees), w / 2.0, h / 2.0);
        double[] m = new double[6];
        try {
            forward.createInverse().getMatrix(m);
        } catch (NoninvertibleTransformException e) {
            // a pure rotation is always invertible
            throw new IllegalStateException(e);
        }

        int[] out = new int[w * h];
        for (int y = 0; y < h; y++) {
            double py = y + 0.5;
            for (int x = 0; x < w; x++) {
                double px = x + 0.5;
                int sx = (int) Math.floor(m[0] * px + m[2] * py + m[4]);
                int sy = (int) Math.floor(m[1] * px + m[3] * py + m[5]);
                out[y * w + x] = (sx >= 0 && sx < w && sy >= 0 && sy < h)
                        ? src[sy * w + sx]
                        : GrayRasters.BACKGROUND;
            }
        }
        return GrayRasters.fromSamples(out, w, h);
    }

    private static final class Sweep {
        final double bestAngle;
        final double bestVariance;

        Sweep(double bestAngle, double bestVariance) {
            this.bestAngle = bestAngle;
            this.bestVariance = bestVariance;
        }
    }
}
