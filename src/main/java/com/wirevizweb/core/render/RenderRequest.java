package com.wirevizweb.core.render;

import com.wirevizweb.core.format.ImageFormat;

import java.util.List;
import java.util.Objects;

/**
 * Everything needed for a single render.
 *
 * @param description    the description document bytes (WireViz YAML)
 * @param assets         auxiliary files in upload order, may be empty
 * @param format         desired output format
 * @param sourceFilename client-side name of the description, used to name the
 *                       artifact; may be null
 */
public record RenderRequest(
        byte[] description,
        List<Asset> assets,
        ImageFormat format,
        String sourceFilename
) {

    public RenderRequest {
        Objects.requireNonNull(description, "description");
        Objects.requireNonNull(format, "format");
        assets = assets == null ? List.of() : List.copyOf(assets);
    }
}
