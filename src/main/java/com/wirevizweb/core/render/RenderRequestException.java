package com.wirevizweb.core.render;

/**
 * Thrown when a render request carries input that cannot be staged safely,
 * such as an asset named {@code ..}.
 */
public class RenderRequestException extends RuntimeException {

    public RenderRequestException(String message) {
        super(message);
    }
}
