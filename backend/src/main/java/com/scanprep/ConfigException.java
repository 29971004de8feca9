package com.scanprep;

/**
 * Invalid run configuration. Raised before any image is processed and aborts the run.
 */
public class ConfigException extends RuntimeException {

    public ConfigException(String message) {
        super(message);
    }

    public ConfigException(String message, Throwable cause) {
        super(message, cause);
    }
}
