package com.wirevizweb.core.render;

/**
 * The engine's output, ready to be streamed back to a client.
 *
 * @param content  image bytes
 * @param mimeType MIME type of {@code content}
 * @param filename suggested download name
 */
public record RenderedArtifact(byte[] content, String mimeType, String filename) {}
