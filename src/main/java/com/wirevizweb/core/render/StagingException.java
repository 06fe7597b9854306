package com.wirevizweb.core.render;

/**
 * Thrown when the working directory cannot be prepared or read back.
 */
public class StagingException extends RuntimeException {

    public StagingException(String message, Throwable cause) {
        super(message, cause);
    }
}
