package com.wirevizweb.core.render;

import java.util.Objects;

/**
 * An auxiliary file (usually an image) referenced by a description and
 * staged next to it for the engine.
 *
 * @param filename name as supplied by the client; sanitized when staged
 * @param content  raw file bytes
 */
public record Asset(String filename, byte[] content) {

    public Asset {
        Objects.requireNonNull(content, "content");
    }
}
