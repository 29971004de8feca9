package com.scanprep;

import java.awt.image.BufferedImage;

/**
 * No-reference image quality assessment. Higher is better unless the run is
 * configured with {@code lowerIsBetter}.
 */
@FunctionalInterface
public interface QualityModel {

    double assess(BufferedImage image) throws Exception;

    /**
     * Model used when none is configured: every assessment is unavailable.
     */
    static QualityModel none() {
        return image -> {
            throw new ScoreUnavailableException("No quality model configured");
        };
    }
}
