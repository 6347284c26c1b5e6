package de.bsommerfeld.panelvault.core.config;

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class ConfigDefaultsTest {

    @Test
    void panelVaultConfig_shouldInitializeSections() {
        var config = new PanelVaultConfig();

        assertNotNull(config.getCrawl());
        assertNotNull(config.getDownload());
        assertFalse(config.isDebugMode());
    }

    @Test
    void crawlConfig_shouldHaveReasonableDefaults() {
        var config = new CrawlConfig();

        assertEquals(100, config.getCommitThreshold());
        assertEquals(200, config.getDedupWindowPages());
        assertEquals(0, config.getMaxPages());
        assertEquals(3, config.getRetryAttempts());
        assertEquals(Duration.ofMillis(200), config.getRetryBackoff());
        assertEquals(Duration.ofMillis(250), config.getHostInterval());
        assertFalse(config.getUserAgent().isBlank());
    }

    @Test
    void downloadConfig_shouldHaveReasonableDefaults() {
        var config = new DownloadConfig();

        assertEquals(10, config.getMaxConcurrent());
        assertFalse(config.isOverwrite());
        assertEquals(50, config.getCommitEvery());
        assertEquals(1000, config.getReconcilePageSize());
        assertEquals("", config.getLibraryDir());
    }

    @Test
    void downloadConfig_shouldClampConcurrency() {
        var config = new DownloadConfig();

        config.setMaxConcurrent(0);
        assertEquals(1, config.getMaxConcurrent());

        config.setMaxConcurrent(100);
        assertEquals(24, config.getMaxConcurrent());
    }
}
