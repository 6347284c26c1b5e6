package de.bsommerfeld.panelvault.scraper.html;

import com.google.inject.Singleton;
import de.bsommerfeld.panelvault.core.concurrent.CancellationToken;
import de.bsommerfeld.panelvault.core.config.CrawlConfig;
import de.bsommerfeld.panelvault.core.error.AcquisitionException;
import de.bsommerfeld.panelvault.core.util.DataUrl;
import de.bsommerfeld.panelvault.scraper.http.FetchResponse;
import de.bsommerfeld.panelvault.scraper.http.HttpFetcher;
import jakarta.inject.Inject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;

/**
 * Fetches pages as text with bounded retries.
 *
 * <h3>Retry policy</h3>
 * Up to {@code retry-attempts} attempts (default 3). After failed attempt
 * {@code n} (1-based) the fetcher sleeps {@code n × retry-backoff}
 * (default 200 ms) before the next one. Every failure kind is retried except
 * cancellation, which aborts at once without sleeping. When all attempts
 * fail, the last error is thrown.
 *
 * <h3>Status and decoding</h3>
 * A non-2xx status is {@code BAD_STATUS}. The body goes through
 * {@link HtmlDecoder}; an undecodable body is {@code PARSE}.
 */
@Singleton
public class HtmlFetcher {

    private static final Logger LOG = LoggerFactory.getLogger(HtmlFetcher.class);

    /** Sleep hook so tests can observe backoff without waiting. */
    @FunctionalInterface
    interface Sleeper {
        void sleep(Duration duration) throws InterruptedException;
    }

    private final HttpFetcher http;
    private final int attempts;
    private final Duration backoff;
    private final Sleeper sleeper;

    @Inject
    public HtmlFetcher(HttpFetcher http, CrawlConfig config) {
        this(http, config.getRetryAttempts(), config.getRetryBackoff(), d -> Thread.sleep(d.toMillis()));
    }

    HtmlFetcher(HttpFetcher http, int attempts, Duration backoff, Sleeper sleeper) {
        this.http = http;
        this.attempts = Math.max(1, attempts);
        this.backoff = backoff;
        this.sleeper = sleeper;
    }

    public String fetchHtml(String url, String referer, CancellationToken token) throws AcquisitionException {
        AcquisitionException last = null;
        for (int attempt = 1; attempt <= attempts; attempt++) {
            token.throwIfCancelled();
            try {
                return fetchOnce(url, referer);
            } catch (AcquisitionException e) {
                if (e.isCancellation()) {
                    throw e;
                }
                last = e;
                LOG.debug("Attempt {}/{} for {} failed: {}", attempt, attempts, url, e.getMessage());
            }
            if (attempt < attempts) {
                pause(backoff.multipliedBy(attempt));
            }
        }
        LOG.warn("Giving up on {} after {} attempts: {}", url, attempts, last.getMessage());
        throw last;
    }

    /**
     * Raw bytes of a single resource, without retries. {@code data:} URLs are
     * decoded locally.
     */
    public byte[] fetchBytes(String url, String referer, CancellationToken token) throws AcquisitionException {
        token.throwIfCancelled();
        if (DataUrl.isDataUrl(url)) {
            return DataUrl.decode(url).payload();
        }
        FetchResponse response = http.get(url, referer);
        if (!response.isSuccess()) {
            throw AcquisitionException.badStatus(response.status(), url);
        }
        return response.body();
    }

    private String fetchOnce(String url, String referer) throws AcquisitionException {
        FetchResponse response = http.get(url, referer);
        if (!response.isSuccess()) {
            throw AcquisitionException.badStatus(response.status(), url);
        }
        return HtmlDecoder.decode(response.body(), response.headers().charset());
    }

    private void pause(Duration duration) throws AcquisitionException {
        if (duration.isZero() || duration.isNegative()) {
            return;
        }
        try {
            sleeper.sleep(duration);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw AcquisitionException.cancelled(e);
        }
    }
}
