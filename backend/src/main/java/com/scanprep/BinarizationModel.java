package com.scanprep;

import java.awt.image.BufferedImage;

/**
 * Learned binarization model used by the GOOD branch.
 * Receives an enhanced grayscale image and returns an image of the same size.
 */
@FunctionalInterface
public interface BinarizationModel {

    BufferedImage binarize(BufferedImage gray) throws Exception;

    static BinarizationModel none() {
        return gray -> {
            throw new BinarizationFailedException("No binarization model configured");
        };
    }
}
