package de.bsommerfeld.panelvault.core.config;

import com.fasterxml.jackson.annotation.JsonAutoDetect;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Duration;

/**
 * Crawl and HTTP parameters. Values are persisted in config.toml and loaded
 * at startup. Setters exist for the CLI overrides and tests.
 */
@JsonAutoDetect(fieldVisibility = JsonAutoDetect.Visibility.ANY, getterVisibility = JsonAutoDetect.Visibility.NONE, isGetterVisibility = JsonAutoDetect.Visibility.NONE, setterVisibility = JsonAutoDetect.Visibility.NONE)
public class CrawlConfig {

    public static final String DEFAULT_USER_AGENT = "Mozilla/5.0 (Macintosh; Intel Mac OS X 10_15_7) "
            + "AppleWebKit/605.1.15 (KHTML, like Gecko) Version/17.4 Safari/605.1.15";

    /** Buffered records that trigger a commit (default: 100). */
    @JsonProperty("commit-threshold")
    private int commitThreshold = 100;

    /** How many of the most recent pages seed the dedup set on resume (default: 200). */
    @JsonProperty("dedup-window-pages")
    private int dedupWindowPages = 200;

    /** Maximum new records per crawl, 0 for unlimited. */
    @JsonProperty("max-pages")
    private int maxPages = 0;

    @JsonProperty("user-agent")
    private String userAgent = DEFAULT_USER_AGENT;

    /** Total attempts per HTML fetch (default: 3). */
    @JsonProperty("retry-attempts")
    private int retryAttempts = 3;

    /** Backoff unit between attempts; attempt n waits n times this (default: 200). */
    @JsonProperty("retry-backoff-millis")
    private long retryBackoffMillis = 200;

    @JsonProperty("request-timeout-seconds")
    private long requestTimeoutSeconds = 30;

    /** Minimum spacing between two requests to the same host (default: 250). */
    @JsonProperty("host-interval-millis")
    private long hostIntervalMillis = 250;

    public int getCommitThreshold() {
        return Math.max(1, commitThreshold);
    }

    public void setCommitThreshold(int commitThreshold) {
        this.commitThreshold = commitThreshold;
    }

    public int getDedupWindowPages() {
        return Math.max(0, dedupWindowPages);
    }

    public void setDedupWindowPages(int dedupWindowPages) {
        this.dedupWindowPages = dedupWindowPages;
    }

    public int getMaxPages() {
        return maxPages;
    }

    public void setMaxPages(int maxPages) {
        this.maxPages = maxPages;
    }

    public String getUserAgent() {
        return userAgent;
    }

    public int getRetryAttempts() {
        return Math.max(1, retryAttempts);
    }

    public void setRetryAttempts(int retryAttempts) {
        this.retryAttempts = retryAttempts;
    }

    public Duration getRetryBackoff() {
        return Duration.ofMillis(Math.max(0, retryBackoffMillis));
    }

    public void setRetryBackoffMillis(long retryBackoffMillis) {
        this.retryBackoffMillis = retryBackoffMillis;
    }

    public Duration getRequestTimeout() {
        return Duration.ofSeconds(Math.max(1, requestTimeoutSeconds));
    }

    public Duration getHostInterval() {
        return Duration.ofMillis(Math.max(0, hostIntervalMillis));
    }

    public void setHostIntervalMillis(long hostIntervalMillis) {
        this.hostIntervalMillis = hostIntervalMillis;
    }
}
