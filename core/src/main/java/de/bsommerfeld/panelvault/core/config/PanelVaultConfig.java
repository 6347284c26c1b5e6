package de.bsommerfeld.panelvault.core.config;

import com.fasterxml.jackson.annotation.JsonAutoDetect;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Root of {@code config.toml}. One table per concern.
 */
@JsonAutoDetect(fieldVisibility = JsonAutoDetect.Visibility.ANY, getterVisibility = JsonAutoDetect.Visibility.NONE, isGetterVisibility = JsonAutoDetect.Visibility.NONE, setterVisibility = JsonAutoDetect.Visibility.NONE)
public class PanelVaultConfig {

    @JsonProperty("debug-mode")
    private boolean debugMode = false;

    @JsonProperty("crawl")
    private CrawlConfig crawl = new CrawlConfig();

    @JsonProperty("download")
    private DownloadConfig download = new DownloadConfig();

    public boolean isDebugMode() {
        return debugMode;
    }

    public CrawlConfig getCrawl() {
        return crawl;
    }

    public DownloadConfig getDownload() {
        return download;
    }
}
