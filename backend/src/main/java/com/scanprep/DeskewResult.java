package com.scanprep;

import java.awt.image.BufferedImage;

/**
 * Output of {@link Deskewer#deskew(BufferedImage)}. The angle is kept for diagnostics only.
 */
public final class DeskewResult {

    private final BufferedImage image;
    private final double angleDegrees;
    private final double profileVariance;

    public DeskewResult(BufferedImage image, double angleDegrees, double profileVariance) {
        this.image = image;
        this.angleDegrees = angleDegrees;
        this.profileVariance = profileVariance;
    }

    public BufferedImage getImage() {
        return image;
    }

    /** Rotation applied to the image, in degrees (positive = clockwise on screen). */
    public double getAngleDegrees() {
        return angleDegrees;
    }

    /** Variance of the row projection profile at the chosen angle. */
    public double getProfileVariance() {
        return profileVariance;
    }
}
