package com.wirevizweb.core.format;

import java.util.Arrays;

/**
 * Output image formats the rendering engine can produce.
 *
 * <p>Each constant owns exactly one short token and one MIME type. The token
 * doubles as the file extension of the engine's output file.
 */
public enum ImageFormat {

    SVG("svg", "image/svg+xml"),
    PNG("png", "image/png");

    /** Format used when a caller does not ask for one. */
    public static final ImageFormat DEFAULT = SVG;

    private final String token;
    private final String mimeType;

    ImageFormat(String token, String mimeType) {
        this.token = token;
        this.mimeType = mimeType;
    }

    public String token() {
        return token;
    }

    public String mimeType() {
        return mimeType;
    }

    public String extension() {
        return token;
    }

    /**
     * Looks up a format by its exact token ({@code svg}, {@code png}).
     *
     * @throws UnsupportedFormatException if the token is null or unknown
     */
    public static ImageFormat fromToken(String token) {
        for (ImageFormat format : values()) {
            if (format.token.equals(token)) {
                return format;
            }
        }
        throw new UnsupportedFormatException("Unsupported image type: " + token
                + " (supported: " + supportedTokens() + ")");
    }

    /**
     * Looks up a format by its exact MIME type string.
     *
     * @throws UnsupportedFormatException if the MIME type is null or unknown
     */
    public static ImageFormat fromMimeType(String mimeType) {
        for (ImageFormat format : values()) {
            if (format.mimeType.equals(mimeType)) {
                return format;
            }
        }
        throw new UnsupportedFormatException("Unsupported MIME type: " + mimeType
                + " (supported: " + supportedMimeTypes() + ")");
    }

    static String supportedTokens() {
        return String.join(", ", Arrays.stream(values()).map(ImageFormat::token).toList());
    }

    static String supportedMimeTypes() {
        return String.join(", ", Arrays.stream(values()).map(ImageFormat::mimeType).toList());
    }
}
