package de.bsommerfeld.panelvault.app.config;

import com.google.inject.AbstractModule;
import de.bsommerfeld.panelvault.app.event.LoggingEventListener;
import de.bsommerfeld.panelvault.core.config.ApplicationMode;
import de.bsommerfeld.panelvault.core.config.ConfigLoader;
import de.bsommerfeld.panelvault.core.config.CrawlConfig;
import de.bsommerfeld.panelvault.core.config.DownloadConfig;
import de.bsommerfeld.panelvault.core.config.PanelVaultConfig;
import de.bsommerfeld.panelvault.core.util.StorageUtils;
import de.bsommerfeld.panelvault.db.CatalogStore;
import de.bsommerfeld.panelvault.db.InMemoryCatalogStore;
import de.bsommerfeld.panelvault.db.SqlCatalogStore;
import de.bsommerfeld.panelvault.scraper.http.HttpFetcher;
import de.bsommerfeld.panelvault.scraper.http.JdkHttpFetcher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Guice module wiring configuration, catalog and HTTP for the application.
 */
public class AppModule extends AbstractModule {

    private static final Logger LOG = LoggerFactory.getLogger(AppModule.class);

    private final Path configPath;
    private final ApplicationMode mode;

    /** Production wiring: config.toml in the app data directory, mode from the environment. */
    public AppModule() {
        this(StorageUtils.getAppDataDir(StorageUtils.APP_NAME).resolve("config.toml"), ApplicationMode.get());
    }

    public AppModule(Path configPath, ApplicationMode mode) {
        this.configPath = configPath;
        this.mode = mode;
    }

    @Override
    protected void configure() {
        PanelVaultConfig config;
        try {
            Path parent = configPath.toAbsolutePath().getParent();
            if (parent != null && !Files.exists(parent)) {
                Files.createDirectories(parent);
            }
            LOG.info("Loading Configuration from: {}", configPath.toAbsolutePath());
            config = ConfigLoader.load(configPath);
        } catch (IOException e) {
            // Config is vital, fail fast
            throw new UncheckedIOException("Failed to load Application Configuration", e);
        }

        bind(PanelVaultConfig.class).toInstance(config);
        bind(CrawlConfig.class).toInstance(config.getCrawl());
        bind(DownloadConfig.class).toInstance(config.getDownload());

        // --- MODE SWITCHING (PROD vs TEST) ---
        LOG.info("Application Mode initialized: {}", mode);
        if (mode.isTest()) {
            // TEST MODE: catalog lives in memory, nothing is saved
            bind(CatalogStore.class).to(InMemoryCatalogStore.class);
        } else {
            bind(CatalogStore.class).to(SqlCatalogStore.class);
        }

        bind(HttpFetcher.class).to(JdkHttpFetcher.class);
        bind(LoggingEventListener.class).asEagerSingleton();
    }
}
