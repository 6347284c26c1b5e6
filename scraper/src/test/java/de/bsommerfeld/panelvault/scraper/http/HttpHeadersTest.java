package de.bsommerfeld.panelvault.scraper.http;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class HttpHeadersTest {

    @Test
    void first_shouldBeCaseInsensitive() {
        HttpHeaders headers = HttpHeaders.of(Map.of("content-type", List.of("image/png")));
        assertEquals("image/png", headers.first("Content-Type"));
        assertEquals("image/png", headers.contentType());
    }

    @Test
    void charset_shouldReadQuotedParameter() {
        assertEquals("Shift_JIS", HttpHeaders.of("Content-Type", "text/html; charset=\"Shift_JIS\"").charset());
    }

    @Test
    void charset_shouldBeNullWithoutParameter() {
        assertNull(HttpHeaders.of("Content-Type", "text/html").charset());
        assertNull(HttpHeaders.empty().charset());
    }
}
