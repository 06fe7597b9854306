package com.wirevizweb.core.render;

import com.wirevizweb.core.format.ImageFormat;

import java.nio.file.Path;

/**
 * Abstraction over the external diagram renderer.
 * Implementation: {@link ProcessRenderEngine} (runs the {@code wireviz} CLI).
 */
public interface RenderEngine {

    /**
     * Renders {@code input} into {@code outputDir}. Blocks until the engine is done.
     * The output file is named after the input's base name plus the format extension.
     *
     * @throws RenderEngineException if the engine fails or times out
     */
    void render(Path input, Path outputDir, ImageFormat format);

    /**
     * Whether the engine looks runnable on this host.
     */
    boolean isAvailable();

    /**
     * Short human-readable description of the engine, for health output.
     */
    String describe();
}
