package com.wirevizweb.core.format;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.InvalidMediaTypeException;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Maps between MIME types and format tokens, and picks an output format
 * from an HTTP {@code Accept} header.
 */
@Component
public class FormatNegotiator {

    private static final Logger log = LoggerFactory.getLogger(FormatNegotiator.class);

    /**
     * @throws UnsupportedFormatException for anything but the documented MIME strings
     */
    public ImageFormat mimeTypeToToken(String mimeType) {
        return ImageFormat.fromMimeType(mimeType);
    }

    /**
     * @throws UnsupportedFormatException for anything but {@code svg} or {@code png}
     */
    public String tokenToMimeType(String token) {
        return ImageFormat.fromToken(token).mimeType();
    }

    /**
     * Chooses the supported format with the highest quality value in the
     * given {@code Accept} header. Ties keep header order. Falls back to
     * {@link ImageFormat#DEFAULT} when the header is absent, malformed, or
     * names nothing supported (including bare wildcards).
     */
    public ImageFormat negotiate(String acceptHeader) {
        if (acceptHeader == null || acceptHeader.isBlank()) {
            return ImageFormat.DEFAULT;
        }

        List<MediaType> mediaTypes;
        try {
            mediaTypes = MediaType.parseMediaTypes(acceptHeader);
        } catch (InvalidMediaTypeException e) {
            log.debug("Ignoring malformed Accept header '{}': {}", acceptHeader, e.getMessage());
            return ImageFormat.DEFAULT;
        }

        ImageFormat best = null;
        double bestQuality = 0.0;
        for (MediaType mediaType : mediaTypes) {
            ImageFormat candidate = supported(mediaType);
            if (candidate == null) {
                continue;
            }
            double quality = mediaType.getQualityValue();
            if (quality > bestQuality) {
                best = candidate;
                bestQuality = quality;
            }
        }

        if (best == null) {
            log.debug("No supported type in Accept header '{}', using {}", acceptHeader, ImageFormat.DEFAULT);
            return ImageFormat.DEFAULT;
        }
        return best;
    }

    private static ImageFormat supported(MediaType mediaType) {
        if (mediaType.isWildcardType() || mediaType.isWildcardSubtype()) {
            return null;
        }
        String mime = mediaType.getType() + "/" + mediaType.getSubtype();
        for (ImageFormat format : ImageFormat.values()) {
            if (format.mimeType().equals(mime)) {
                return format;
            }
        }
        return null;
    }
}
