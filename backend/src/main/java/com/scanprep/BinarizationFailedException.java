package com.scanprep;

/**
 * A branch binarizer could not produce a binary image. Never retried.
 */
public class BinarizationFailedException extends PreprocessException {

    public BinarizationFailedException(String message) {
        super(message);
    }

    public BinarizationFailedException(String message, Throwable cause) {
        super(message, cause);
    }
}
