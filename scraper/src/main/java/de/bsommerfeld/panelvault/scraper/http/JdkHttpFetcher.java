package de.bsommerfeld.panelvault.scraper.http;

import com.google.inject.Singleton;
import de.bsommerfeld.panelvault.core.config.CrawlConfig;
import de.bsommerfeld.panelvault.core.error.AcquisitionException;
import jakarta.inject.Inject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Duration;
import java.util.Locale;

/**
 * {@link HttpFetcher} on top of the JDK's {@link HttpClient}.
 *
 * <h3>Redirect handling</h3>
 * The shared client follows redirects ({@link HttpClient.Redirect#NORMAL}).
 * Comic sites routinely redirect page URLs to canonical forms and image URLs
 * to CDNs.
 *
 * <h3>Politeness</h3>
 * Every request first passes the {@link HostRateLimiter}, so two requests to
 * the same host are always at least the configured interval apart, whether
 * they come from the crawler or from concurrent downloads.
 */
@Singleton
public class JdkHttpFetcher implements HttpFetcher {

    private static final Logger LOG = LoggerFactory.getLogger(JdkHttpFetcher.class);

    private final HttpClient httpClient;
    private final HostRateLimiter rateLimiter;
    private final String userAgent;
    private final Duration requestTimeout;

    @Inject
    public JdkHttpFetcher(CrawlConfig config, HostRateLimiter rateLimiter) {
        this.httpClient = HttpClient.newBuilder()
                .followRedirects(HttpClient.Redirect.NORMAL)
                .connectTimeout(config.getRequestTimeout())
                .build();
        this.rateLimiter = rateLimiter;
        this.userAgent = config.getUserAgent();
        this.requestTimeout = config.getRequestTimeout();
    }

    @Override
    public FetchResponse get(String url, String referer) throws AcquisitionException {
        HttpResponse<byte[]> response = send(request(url, referer).GET().build(),
                HttpResponse.BodyHandlers.ofByteArray(), url);
        return new FetchResponse(response.statusCode(), HttpHeaders.of(response.headers().map()), response.body());
    }

    @Override
    public FetchResponse head(String url, String referer) throws AcquisitionException {
        HttpRequest request = request(url, referer).method("HEAD", HttpRequest.BodyPublishers.noBody()).build();
        HttpResponse<Void> response = send(request, HttpResponse.BodyHandlers.discarding(), url);
        return new FetchResponse(response.statusCode(), HttpHeaders.of(response.headers().map()), null);
    }

    @Override
    public TempDownload downloadToTemp(String url, String referer, Path directory) throws AcquisitionException {
        HttpRequest request = request(url, referer).GET().build();
        Path temp;
        try {
            temp = Files.createTempFile(directory, "panelvault-", ".part");
        } catch (IOException e) {
            throw AcquisitionException.network(url, e);
        }
        try {
            HttpResponse<Path> response = send(request, HttpResponse.BodyHandlers.ofFile(temp,
                    StandardOpenOption.WRITE, StandardOpenOption.TRUNCATE_EXISTING), url);
            return new TempDownload(response.body(), response.statusCode(),
                    HttpHeaders.of(response.headers().map()));
        } catch (AcquisitionException | RuntimeException e) {
            new TempDownload(temp, 0, null).discard();
            throw e;
        }
    }

    // =====================================================================
    // Internals
    // =====================================================================

    private HttpRequest.Builder request(String url, String referer) throws AcquisitionException {
        URI uri;
        try {
            uri = URI.create(url.trim());
        } catch (IllegalArgumentException e) {
            throw AcquisitionException.parse("Malformed URL '" + url + "': " + e.getMessage());
        }
        String scheme = uri.getScheme() != null ? uri.getScheme().toLowerCase(Locale.ROOT) : "";
        if (!scheme.equals("http") && !scheme.equals("https")) {
            throw AcquisitionException.parse("Unsupported URL scheme in '" + url + "'");
        }
        if (uri.getHost() == null) {
            throw AcquisitionException.parse("URL without host: '" + url + "'");
        }

        HttpRequest.Builder builder = HttpRequest.newBuilder(uri)
                .timeout(requestTimeout)
                .header("User-Agent", userAgent)
                .header("Accept", "text/html,application/xhtml+xml,image/*,*/*;q=0.8");
        if (referer != null && !referer.isBlank()) {
            try {
                builder.header("Referer", referer);
            } catch (IllegalArgumentException e) {
                LOG.debug("Dropping unusable Referer '{}': {}", referer, e.getMessage());
            }
        }
        return builder;
    }

    private <T> HttpResponse<T> send(HttpRequest request, HttpResponse.BodyHandler<T> handler, String url)
            throws AcquisitionException {
        try {
            rateLimiter.acquire(url);
            HttpResponse<T> response = httpClient.send(request, handler);
            LOG.trace("{} {} -> {}", request.method(), url, response.statusCode());
            return response;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw AcquisitionException.cancelled(e);
        } catch (IOException e) {
            throw AcquisitionException.network(url, e);
        }
    }
}
