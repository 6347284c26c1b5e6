package de.bsommerfeld.panelvault.scraper.html;

import org.junit.jupiter.api.Test;

import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

class HtmlDecoderTest {

    @Test
    void decode_shouldUseDeclaredCharset() throws Exception {
        byte[] body = "Grüße".getBytes(StandardCharsets.ISO_8859_1);
        assertEquals("Grüße", HtmlDecoder.decode(body, "ISO-8859-1"));
    }

    @Test
    void decode_shouldDefaultToUtf8() throws Exception {
        byte[] body = "<p>漫画 – ok</p>".getBytes(StandardCharsets.UTF_8);
        assertEquals("<p>漫画 – ok</p>", HtmlDecoder.decode(body, null));
    }

    @Test
    void decode_shouldFallBackToUtf8WhenDeclaredCharsetIsUnknown() throws Exception {
        byte[] body = "plain".getBytes(StandardCharsets.UTF_8);
        assertEquals("plain", HtmlDecoder.decode(body, "no-such-charset"));
    }

    @Test
    void decode_shouldSniffMetaCharsetWhenUtf8Fails() throws Exception {
        Charset cp1251 = Charset.forName("windows-1251");
        String html = "<html><head><meta charset=\"windows-1251\"></head><body>Привет</body></html>";

        assertEquals(html, HtmlDecoder.decode(html.getBytes(cp1251), null));
    }

    @Test
    void decode_shouldFallBackToWindows1252ForLegacyPages() throws Exception {
        byte[] body = "café".getBytes(StandardCharsets.ISO_8859_1);
        assertEquals("café", HtmlDecoder.decode(body, null));
    }

    @Test
    void decode_shouldStripUtf8Bom() throws Exception {
        byte[] body = { (byte) 0xEF, (byte) 0xBB, (byte) 0xBF, 'h', 'i' };
        assertEquals("hi", HtmlDecoder.decode(body, null));
    }

    @Test
    void decode_shouldReturnEmptyForEmptyBody() throws Exception {
        assertEquals("", HtmlDecoder.decode(new byte[0], "utf-8"));
    }

    @Test
    void sniff_shouldDetectUtf16Bom() {
        assertEquals("UTF-16LE", HtmlDecoder.sniff(new byte[] { (byte) 0xFF, (byte) 0xFE, 'a', 0 }));
    }
}
