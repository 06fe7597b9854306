package com.wirevizweb.core.plantuml;

import org.springframework.stereotype.Component;

import java.io.ByteArrayOutputStream;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.zip.DataFormatException;
import java.util.zip.Deflater;
import java.util.zip.Inflater;

/**
 * PlantUML text encoding: raw DEFLATE followed by a base64 variant whose
 * alphabet runs {@code 0-9 A-Z a-z - _}.
 *
 * <p>Used to carry a whole description document inside a URL path segment.
 */
@Component
public class PlantUmlCodec {

    static final String ALPHABET =
            "0123456789ABCDEFGHIJKLMNOPQRSTUVWXYZabcdefghijklmnopqrstuvwxyz-_";

    /** Upper bound on inflated output; guards against compression bombs. */
    static final int MAX_DECODED_BYTES = 1024 * 1024;

    private static final int[] INDEX = new int[128];

    static {
        Arrays.fill(INDEX, -1);
        for (int i = 0; i < ALPHABET.length(); i++) {
            INDEX[ALPHABET.charAt(i)] = i;
        }
    }

    /**
     * Decodes PlantUML-encoded text back into the original document.
     *
     * @param encoded the encoded text; trailing {@code =} padding is tolerated
     * @return the decoded document, empty for empty input
     * @throws DecodeException on characters outside the alphabet, a dangling
     *                         single character, a corrupt compressed stream or
     *                         output that is not valid UTF-8
     */
    public String decode(String encoded) {
        if (encoded == null) {
            throw new DecodeException("Encoded text is required");
        }
        String trimmed = stripPadding(encoded);
        if (trimmed.isEmpty()) {
            return "";
        }
        byte[] compressed = decodeAlphabet(trimmed);
        byte[] inflated = inflate(compressed);
        return toUtf8(inflated);
    }

    /**
     * Encodes a document the way PlantUML servers expect it in URLs. The
     * output length is always a multiple of four.
     */
    public String encode(String text) {
        if (text == null || text.isEmpty()) {
            return "";
        }
        return encodeAlphabet(deflate(text.getBytes(StandardCharsets.UTF_8)));
    }

    static byte[] decodeAlphabet(String text) {
        int length = text.length();
        if (length % 4 == 1) {
            throw new DecodeException("Encoded text has a dangling character at position " + (length - 1));
        }

        var out = new ByteArrayOutputStream(length * 3 / 4);
        for (int pos = 0; pos < length; pos += 4) {
            int groupLength = Math.min(4, length - pos);
            int bits = 0;
            for (int i = 0; i < 4; i++) {
                int value = i < groupLength ? indexOf(text.charAt(pos + i), pos + i) : 0;
                bits = (bits << 6) | value;
            }
            out.write((bits >> 16) & 0xFF);
            if (groupLength > 2) {
                out.write((bits >> 8) & 0xFF);
            }
            if (groupLength > 3) {
                out.write(bits & 0xFF);
            }
        }
        return out.toByteArray();
    }

    static String encodeAlphabet(byte[] data) {
        var sb = new StringBuilder((data.length + 2) / 3 * 4);
        for (int pos = 0; pos < data.length; pos += 3) {
            int groupLength = Math.min(3, data.length - pos);
            int bits = (data[pos] & 0xFF) << 16;
            if (groupLength > 1) {
                bits |= (data[pos + 1] & 0xFF) << 8;
            }
            if (groupLength > 2) {
                bits |= data[pos + 2] & 0xFF;
            }
            // a short final group is zero-filled to four characters, as PlantUML does
            for (int i = 0; i < 4; i++) {
                sb.append(ALPHABET.charAt((bits >> (18 - 6 * i)) & 0x3F));
            }
        }
        return sb.toString();
    }

    private static int indexOf(char c, int position) {
        int value = c < INDEX.length ? INDEX[c] : -1;
        if (value < 0) {
            throw new DecodeException("Invalid character '" + c + "' at position " + position);
        }
        return value;
    }

    private static String stripPadding(String encoded) {
        int end = encoded.length();
        while (end > 0 && encoded.charAt(end - 1) == '=') {
            end--;
        }
        return encoded.substring(0, end);
    }

    private static byte[] inflate(byte[] compressed) {
        // nowrap mode wants one extra byte past the end of the stream
        var inflater = new Inflater(true);
        try {
            inflater.setInput(Arrays.copyOf(compressed, compressed.length + 1));
            var out = new ByteArrayOutputStream(compressed.length * 4);
            byte[] buffer = new byte[8192];
            while (!inflater.finished()) {
                int n = inflater.inflate(buffer);
                if (n == 0 && (inflater.needsInput() || inflater.needsDictionary())) {
                    throw new DecodeException("Compressed stream is truncated");
                }
                out.write(buffer, 0, n);
                if (out.size() > MAX_DECODED_BYTES) {
                    throw new DecodeException("Decoded document exceeds " + MAX_DECODED_BYTES + " bytes");
                }
            }
            return out.toByteArray();
        } catch (DataFormatException e) {
            throw new DecodeException("Compressed stream is corrupt: " + e.getMessage(), e);
        } finally {
            inflater.end();
        }
    }

    private static byte[] deflate(byte[] data) {
        var deflater = new Deflater(Deflater.BEST_COMPRESSION, true);
        try {
            deflater.setInput(data);
            deflater.finish();
            var out = new ByteArrayOutputStream(data.length / 2 + 16);
            byte[] buffer = new byte[8192];
            while (!deflater.finished()) {
                int n = deflater.deflate(buffer);
                out.write(buffer, 0, n);
            }
            return out.toByteArray();
        } finally {
            deflater.end();
        }
    }

    private static String toUtf8(byte[] bytes) {
        try {
            return StandardCharsets.UTF_8.newDecoder()
                    .onMalformedInput(CodingErrorAction.REPORT)
                    .onUnmappableCharacter(CodingErrorAction.REPORT)
                    .decode(ByteBuffer.wrap(bytes))
                    .toString();
        } catch (CharacterCodingException e) {
            throw new DecodeException("Decoded document is not valid UTF-8", e);
        }
    }
}
