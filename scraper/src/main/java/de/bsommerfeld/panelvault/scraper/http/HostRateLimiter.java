package de.bsommerfeld.panelvault.scraper.http;

import com.google.inject.Singleton;
import de.bsommerfeld.panelvault.core.config.CrawlConfig;
import jakarta.inject.Inject;

import java.net.URI;
import java.time.Duration;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.TimeUnit;

/**
 * Spaces out requests to the same host.
 *
 * <p>
 * Each call to {@link #acquire(String)} reserves the next free slot for the
 * URL's host and sleeps until it arrives. Reservations are handed out under a
 * lock, sleeping happens outside of it, so concurrent downloads to different
 * hosts never wait on each other.
 */
@Singleton
public class HostRateLimiter {

    private final long intervalNanos;
    private final Map<String, Long> nextSlot = new HashMap<>();

    @Inject
    public HostRateLimiter(CrawlConfig config) {
        this(config.getHostInterval());
    }

    public HostRateLimiter(Duration interval) {
        this.intervalNanos = interval.toNanos();
    }

    public void acquire(String url) throws InterruptedException {
        if (intervalNanos <= 0) {
            return;
        }
        long waitNanos = reserve(hostOf(url), System.nanoTime());
        if (waitNanos > 0) {
            TimeUnit.NANOSECONDS.sleep(waitNanos);
        }
    }

    /** @return how long the caller has to wait for its slot */
    synchronized long reserve(String host, long now) {
        Long slot = nextSlot.get(host);
        long start = slot == null || slot - now < 0 ? now : slot;
        nextSlot.put(host, start + intervalNanos);
        return start - now;
    }

    static String hostOf(String url) {
        try {
            String host = URI.create(url).getHost();
            return host != null ? host.toLowerCase(Locale.ROOT) : "";
        } catch (IllegalArgumentException e) {
            return "";
        }
    }
}
