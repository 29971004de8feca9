package com.scanprep;

/**
 * Stages a file passes through. Selected files go SELECTED → SCORED → CLASSIFIED →
 * ENHANCED → BINARIZED → DESKEWED → WRITTEN; files excluded by the selection pattern
 * go SELECTED → PASSTHROUGH → WRITTEN.
 */
public enum FileStage {
    SELECTED,
    SCORED,
    CLASSIFIED,
    ENHANCED,
    BINARIZED,
    DESKEWED,
    PASSTHROUGH,
    WRITTEN
}
