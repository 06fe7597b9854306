package com.wirevizweb.core.plantuml;

/**
 * Thrown when PlantUML-encoded text cannot be turned back into a document.
 */
public class DecodeException extends RuntimeException {

    public DecodeException(String message) {
        super(message);
    }

    public DecodeException(String message, Throwable cause) {
        super(message, cause);
    }
}
