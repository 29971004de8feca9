package com.scanprep;

/**
 * The quality model could not produce a usable score for an image
 * (model error, timeout, non-finite result or no model configured).
 */
public class ScoreUnavailableException extends PreprocessException {

    public ScoreUnavailableException(String message) {
        super(message);
    }

    public ScoreUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
