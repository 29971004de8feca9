package com.scanprep;

import java.io.IOException;

/**
 * The score cache file could not be read or written.
 */
public class CacheIOException extends IOException {

    public CacheIOException(String message, Throwable cause) {
        super(message, cause);
    }
}
