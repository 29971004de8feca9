package com.scanprep;

import java.awt.image.BufferedImage;

/**
 * Turns an enhanced grayscale image into a two-level image
 * ({@link GrayRasters#FOREGROUND} ink, {@link GrayRasters#BACKGROUND} paper).
 */
@FunctionalInterface
public interface Binarizer {

    BufferedImage binarize(BufferedImage gray) throws BinarizationFailedException;
}
