package com.scanprep;

/**
 * Base class for failures that affect a single image. The run records them
 * and moves on to the next file.
 */
public class PreprocessException extends Exception {

    public PreprocessException(String message) {
        super(message);
    }

    public PreprocessException(String message, Throwable cause) {
        super(message, cause);
    }
}
