package de.bsommerfeld.panelvault.scraper.html;

import de.bsommerfeld.panelvault.core.error.AcquisitionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.Charset;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.IllegalCharsetNameException;
import java.nio.charset.StandardCharsets;
import java.nio.charset.UnsupportedCharsetException;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Turns raw HTML bytes into text.
 *
 * <h3>Decoding ladder</h3>
 * Candidates are tried in this order, each one strictly (malformed or
 * unmappable input rejects the candidate):
 * <ol>
 * <li>the charset declared in the Content-Type header</li>
 * <li>UTF-8</li>
 * <li>a sniffed charset: byte order mark, then {@code <meta charset>} or
 * {@code <meta http-equiv>} in the first few KB</li>
 * <li>windows-1252, Mac Roman (where the JDK ships it), US-ASCII</li>
 * </ol>
 * If all of them fail the page is a {@code PARSE} error.
 */
public final class HtmlDecoder {

    private static final Logger LOG = LoggerFactory.getLogger(HtmlDecoder.class);

    private static final int SNIFF_LIMIT = 4096;
    private static final Pattern META_CHARSET = Pattern.compile(
            "<meta[^>]+charset\\s*=\\s*[\"']?\\s*([A-Za-z0-9_.:-]+)", Pattern.CASE_INSENSITIVE);

    private HtmlDecoder() {
    }

    public static String decode(byte[] body, String declaredCharset) throws AcquisitionException {
        if (body == null || body.length == 0) {
            return "";
        }
        for (Charset charset : candidates(body, declaredCharset)) {
            try {
                String text = strictDecode(body, charset);
                return stripBom(text);
            } catch (CharacterCodingException e) {
                LOG.trace("Body is not valid {}", charset.name());
            }
        }
        throw AcquisitionException.parse("Could not decode HTML body with any known charset");
    }

    static List<Charset> candidates(byte[] body, String declaredCharset) {
        Set<Charset> ordered = new LinkedHashSet<>();
        addIfSupported(ordered, declaredCharset);
        ordered.add(StandardCharsets.UTF_8);
        addIfSupported(ordered, sniff(body));
        addIfSupported(ordered, "windows-1252");
        addIfSupported(ordered, "x-MacRoman");
        ordered.add(StandardCharsets.US_ASCII);
        return new ArrayList<>(ordered);
    }

    /** Charset named by a BOM or a meta tag, or null. */
    static String sniff(byte[] body) {
        if (body.length >= 3 && (body[0] & 0xFF) == 0xEF && (body[1] & 0xFF) == 0xBB && (body[2] & 0xFF) == 0xBF) {
            return "UTF-8";
        }
        if (body.length >= 2 && (body[0] & 0xFF) == 0xFE && (body[1] & 0xFF) == 0xFF) {
            return "UTF-16BE";
        }
        if (body.length >= 2 && (body[0] & 0xFF) == 0xFF && (body[1] & 0xFF) == 0xFE) {
            return "UTF-16LE";
        }
        String head = new String(body, 0, Math.min(body.length, SNIFF_LIMIT), StandardCharsets.ISO_8859_1);
        Matcher matcher = META_CHARSET.matcher(head);
        return matcher.find() ? matcher.group(1) : null;
    }

    private static void addIfSupported(Set<Charset> target, String name) {
        if (name == null || name.isBlank()) {
            return;
        }
        try {
            target.add(Charset.forName(name.trim()));
        } catch (IllegalCharsetNameException | UnsupportedCharsetException e) {
            LOG.debug("Ignoring unknown charset '{}'", name);
        }
    }

    private static String strictDecode(byte[] body, Charset charset) throws CharacterCodingException {
        return charset.newDecoder()
                .onMalformedInput(CodingErrorAction.REPORT)
                .onUnmappableCharacter(CodingErrorAction.REPORT)
                .decode(ByteBuffer.wrap(body))
                .toString();
    }

    private static String stripBom(String text) {
        return !text.isEmpty() && text.charAt(0) == '\uFEFF' ? text.substring(1) : text;
    }
}
