package de.bsommerfeld.panelvault.scraper.http;

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class HostRateLimiterTest {

    private static final long INTERVAL = Duration.ofMillis(250).toNanos();

    @Test
    void reserve_shouldLetFirstRequestThroughImmediately() {
        HostRateLimiter limiter = new HostRateLimiter(Duration.ofMillis(250));
        assertEquals(0, limiter.reserve("comic.test", 1_000));
    }

    @Test
    void reserve_shouldSpaceRequestsToSameHost() {
        HostRateLimiter limiter = new HostRateLimiter(Duration.ofMillis(250));

        limiter.reserve("comic.test", 0);
        assertEquals(INTERVAL, limiter.reserve("comic.test", 0));
        assertEquals(2 * INTERVAL, limiter.reserve("comic.test", 0));
    }

    @Test
    void reserve_shouldNotDelayOtherHosts() {
        HostRateLimiter limiter = new HostRateLimiter(Duration.ofMillis(250));

        limiter.reserve("comic.test", 0);
        assertEquals(0, limiter.reserve("cdn.test", 0));
    }

    @Test
    void reserve_shouldNotWaitOnceIntervalHasPassed() {
        HostRateLimiter limiter = new HostRateLimiter(Duration.ofMillis(250));

        limiter.reserve("comic.test", 0);
        assertEquals(0, limiter.reserve("comic.test", INTERVAL + 1));
    }

    @Test
    void hostOf_shouldLowercaseAndTolerateGarbage() {
        assertEquals("comic.test", HostRateLimiter.hostOf("https://Comic.TEST/page/1"));
        assertEquals("", HostRateLimiter.hostOf("not a url"));
    }

    @Test
    void acquire_shouldReturnImmediatelyWithZeroInterval() throws Exception {
        HostRateLimiter limiter = new HostRateLimiter(Duration.ZERO);
        long start = System.nanoTime();
        for (int i = 0; i < 100; i++) {
            limiter.acquire("https://comic.test/" + i);
        }
        assertTrue(System.nanoTime() - start < Duration.ofSeconds(1).toNanos());
    }
}
