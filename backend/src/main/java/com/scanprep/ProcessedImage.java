package com.scanprep;

import java.awt.image.BufferedImage;
import java.util.OptionalDouble;

/**
 * Result of running a single in-memory image through the pipeline.
 */
public final class ProcessedImage {

    private final BufferedImage image;
    private final OptionalDouble score;
    private final Classification classification;
    private final double deskewAngle;

    ProcessedImage(BufferedImage image, OptionalDouble score, Classification classification, double deskewAngle) {
        this.image = image;
        this.score = score;
        this.classification = classification;
        this.deskewAngle = deskewAngle;
    }

    public BufferedImage getImage() { return image; }

    /** Empty when the image was routed BAD without a score. */
    public OptionalDouble getScore() { return score; }

    public Classification getClassification() { return classification; }

    public double getDeskewAngle() { return deskewAngle; }
}
