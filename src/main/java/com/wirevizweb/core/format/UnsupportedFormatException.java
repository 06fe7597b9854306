package com.wirevizweb.core.format;

/**
 * Thrown when a MIME type or format token is outside the supported set.
 */
public class UnsupportedFormatException extends RuntimeException {

    public UnsupportedFormatException(String message) {
        super(message);
    }
}
