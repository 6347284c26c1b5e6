package de.bsommerfeld.panelvault.core.util;

import de.bsommerfeld.panelvault.core.error.AcquisitionException;

import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.Locale;

/**
 * Decoded {@code data:} URL ({@code data:[<media type>][;base64],<payload>}).
 *
 * @param mediaType the first {@code ;}-separated component of the header,
 *                  empty if the URL declares none
 * @param payload   decoded bytes
 */
public record DataUrl(String mediaType, byte[] payload) {

    private static final String SCHEME = "data:";

    public static boolean isDataUrl(String url) {
        return url != null && url.regionMatches(true, 0, SCHEME, 0, SCHEME.length());
    }

    /**
     * Decodes a {@code data:} URL. A {@code ;base64} marker selects Base64,
     * anything else is treated as percent-encoded text.
     *
     * @throws AcquisitionException of kind {@code PARSE} if the URL is malformed
     */
    public static DataUrl decode(String url) throws AcquisitionException {
        if (!isDataUrl(url)) {
            throw AcquisitionException.parse("Not a data URL");
        }
        int comma = url.indexOf(',');
        if (comma < 0) {
            throw AcquisitionException.parse("Data URL without payload separator");
        }
        String header = url.substring(SCHEME.length(), comma);
        String data = url.substring(comma + 1);

        String[] parts = header.split(";");
        String mediaType = parts[0].trim().toLowerCase(Locale.ROOT);
        boolean base64 = false;
        for (int i = 1; i < parts.length; i++) {
            if (parts[i].trim().equalsIgnoreCase("base64")) {
                base64 = true;
            }
        }

        byte[] payload;
        if (base64) {
            String compact = percentDecodeToString(data).replaceAll("\\s", "");
            try {
                payload = Base64.getDecoder().decode(compact);
            } catch (IllegalArgumentException e) {
                throw AcquisitionException.parse("Invalid base64 payload in data URL: " + e.getMessage());
            }
        } else {
            payload = percentDecode(data);
        }
        return new DataUrl(mediaType, payload);
    }

    private static String percentDecodeToString(String data) throws AcquisitionException {
        return new String(percentDecode(data), StandardCharsets.UTF_8);
    }

    /** RFC 3986 percent-decoding. Unlike form decoding, '+' stays a plus. */
    private static byte[] percentDecode(String data) throws AcquisitionException {
        ByteArrayOutputStream out = new ByteArrayOutputStream(data.length());
        int i = 0;
        while (i < data.length()) {
            char c = data.charAt(i);
            if (c == '%') {
                if (i + 2 >= data.length()) {
                    throw AcquisitionException.parse("Truncated percent escape in data URL");
                }
                int hi = Character.digit(data.charAt(i + 1), 16);
                int lo = Character.digit(data.charAt(i + 2), 16);
                if (hi < 0 || lo < 0) {
                    throw AcquisitionException.parse("Invalid percent escape in data URL");
                }
                out.write((hi << 4) | lo);
                i += 3;
            } else {
                int end = i;
                while (end < data.length() && data.charAt(end) != '%') {
                    end++;
                }
                out.writeBytes(data.substring(i, end).getBytes(StandardCharsets.UTF_8));
                i = end;
            }
        }
        return out.toByteArray();
    }
}
