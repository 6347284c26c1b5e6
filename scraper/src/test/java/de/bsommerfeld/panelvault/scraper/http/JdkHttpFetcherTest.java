package de.bsommerfeld.panelvault.scraper.http;

import de.bsommerfeld.panelvault.core.config.CrawlConfig;
import de.bsommerfeld.panelvault.core.error.AcquisitionException;
import com.sun.net.httpserver.HttpServer;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.OutputStream;
import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

/**
 * URL validation of JdkHttpFetcher, plus one round trip against a loopback
 * server for temp file placement.
 */
class JdkHttpFetcherTest {

    private final JdkHttpFetcher fetcher = new JdkHttpFetcher(new CrawlConfig(), new HostRateLimiter(Duration.ZERO));

    private AcquisitionException.Kind kindOf(String url) {
        return assertThrows(AcquisitionException.class, () -> fetcher.get(url, null)).getKind();
    }

    @Test
    void get_shouldRejectUnsupportedScheme() {
        assertEquals(AcquisitionException.Kind.PARSE, kindOf("ftp://comic.test/1"));
        assertEquals(AcquisitionException.Kind.PARSE, kindOf("javascript:void(0)"));
    }

    @Test
    void get_shouldRejectMalformedUrl() {
        assertEquals(AcquisitionException.Kind.PARSE, kindOf("http://comic test/1"));
    }

    @Test
    void get_shouldRejectUrlWithoutHost() {
        assertEquals(AcquisitionException.Kind.PARSE, kindOf("http:/just/a/path"));
    }

    @Test
    void downloadToTemp_shouldRejectBadUrlBeforeCreatingTempFile() {
        AcquisitionException ex = assertThrows(AcquisitionException.class,
                () -> fetcher.downloadToTemp("mailto:someone@comic.test", null, Path.of(".")));
        assertEquals(AcquisitionException.Kind.PARSE, ex.getKind());
    }

    @Test
    void downloadToTemp_shouldCreateTempFileInRequestedDirectory(@TempDir Path library) throws Exception {
        byte[] png = { (byte) 0x89, 'P', 'N' };
        HttpServer server = HttpServer.create(new InetSocketAddress(InetAddress.getLoopbackAddress(), 0), 0);
        server.createContext("/panel.png", exchange -> {
            exchange.getResponseHeaders().add("Content-Type", "image/png");
            exchange.sendResponseHeaders(200, png.length);
            try (OutputStream body = exchange.getResponseBody()) {
                body.write(png);
            }
        });
        server.start();
        try {
            Path sourceDir = Files.createDirectories(library.resolve("Comic"));
            String url = "http://127.0.0.1:" + server.getAddress().getPort() + "/panel.png";

            TempDownload temp = fetcher.downloadToTemp(url, null, sourceDir);

            assertEquals(200, temp.status());
            assertEquals(sourceDir, temp.file().getParent());
            assertArrayEquals(png, Files.readAllBytes(temp.file()));
            temp.discard();
            assertFalse(Files.exists(temp.file()));
        } finally {
            server.stop(0);
        }
    }
}
