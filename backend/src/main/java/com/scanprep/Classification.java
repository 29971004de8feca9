package com.scanprep;

/**
 * Quality class of an image. Selects the binarization branch.
 */
public enum Classification {
    /** Score below the threshold. Binarized with Sauvola. */
    BAD,
    /** Score at or above the threshold. Binarized by the external model. */
    GOOD
}
