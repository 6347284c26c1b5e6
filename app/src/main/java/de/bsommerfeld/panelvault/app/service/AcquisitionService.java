package de.bsommerfeld.panelvault.app.service;

import com.google.common.io.MoreFiles;
import com.google.common.io.RecursiveDeleteOption;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import com.google.inject.Singleton;
import de.bsommerfeld.panelvault.core.concurrent.CancellationToken;
import de.bsommerfeld.panelvault.core.concurrent.WriteGate;
import de.bsommerfeld.panelvault.core.config.CrawlConfig;
import de.bsommerfeld.panelvault.core.config.DownloadConfig;
import de.bsommerfeld.panelvault.core.domain.Source;
import de.bsommerfeld.panelvault.core.domain.SourceInput;
import de.bsommerfeld.panelvault.core.error.AcquisitionException;
import de.bsommerfeld.panelvault.core.event.AcquisitionEvents;
import de.bsommerfeld.panelvault.core.event.ApplicationEventBus;
import de.bsommerfeld.panelvault.core.profile.ProfileCodec;
import de.bsommerfeld.panelvault.core.profile.ProfileValidationException;
import de.bsommerfeld.panelvault.core.profile.SourceProfile;
import de.bsommerfeld.panelvault.db.CatalogStore;
import de.bsommerfeld.panelvault.downloader.DownloadOptions;
import de.bsommerfeld.panelvault.downloader.DownloadReport;
import de.bsommerfeld.panelvault.downloader.DownloadScheduler;
import de.bsommerfeld.panelvault.scraper.crawl.CrawlResult;
import de.bsommerfeld.panelvault.scraper.crawl.PageCrawler;
import jakarta.inject.Inject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Application facade over the catalog, the crawler and the downloader.
 *
 * <h3>Source lifecycle</h3>
 * Renaming a source moves its download folder along (when the new folder
 * does not exist yet) and rewrites the stored download paths. Deleting a
 * source removes its catalog rows and, on request, its folder.
 *
 * <h3>Background operations</h3>
 * Crawls and downloads each run on their own single-thread executor, so one
 * crawl and one download can overlap while the write gate keeps their
 * commits apart. Every operation gets its own {@link CancellationToken}.
 * Cancellation is logged at INFO and completes the handle with {@code null};
 * any other failure is logged at ERROR, published as
 * {@link AcquisitionEvents.OperationFailedEvent} and completes the handle
 * exceptionally.
 */
@Singleton
public class AcquisitionService {

    private static final Logger LOG = LoggerFactory.getLogger(AcquisitionService.class);

    private final CatalogStore store;
    private final PageCrawler crawler;
    private final DownloadScheduler scheduler;
    private final WriteGate gate;
    private final CrawlConfig crawlConfig;
    private final DownloadConfig downloadConfig;
    private final ApplicationEventBus eventBus;

    private final ExecutorService crawlExecutor = Executors.newSingleThreadExecutor(
            new ThreadFactoryBuilder().setNameFormat("panelvault-crawl-%d").setDaemon(true).build());
    private final ExecutorService downloadExecutor = Executors.newSingleThreadExecutor(
            new ThreadFactoryBuilder().setNameFormat("panelvault-download-%d").setDaemon(true).build());

    @FunctionalInterface
    private interface Operation<T> {
        T run(CancellationToken token) throws AcquisitionException;
    }

    @Inject
    public AcquisitionService(CatalogStore store, PageCrawler crawler, DownloadScheduler scheduler, WriteGate gate,
            CrawlConfig crawlConfig, DownloadConfig downloadConfig, ApplicationEventBus eventBus) {
        this.store = store;
        this.crawler = crawler;
        this.scheduler = scheduler;
        this.gate = gate;
        this.crawlConfig = crawlConfig;
        this.downloadConfig = downloadConfig;
        this.eventBus = eventBus;
    }

    // =====================================================================
    // Sources
    // =====================================================================

    public List<Source> listSources() {
        return store.getAllSources();
    }

    /** @return the source, or null if it does not exist */
    public Source getSource(long sourceId) {
        return store.getSource(sourceId);
    }

    public long addSource(SourceInput input) {
        requireName(input);
        long id = store.createSource(input);
        LOG.info("Added source '{}' with id {}", input.name(), id);
        return id;
    }

    /**
     * Replaces the editable fields of a source. A changed name renames the
     * download folder and rewrites stored paths.
     */
    public void editSource(long sourceId, SourceInput input) throws IOException, InterruptedException {
        requireName(input);
        Source old = requireSource(sourceId);
        Path root = libraryRoot();
        Path oldDir = DownloadScheduler.sourceFolder(root, old).toAbsolutePath();
        Path newDir = DownloadScheduler.sourceFolder(root, renamed(old, input.name())).toAbsolutePath();

        boolean moved = false;
        if (!oldDir.equals(newDir) && Files.isDirectory(oldDir)) {
            if (Files.exists(newDir)) {
                LOG.warn("Not moving {} because {} already exists", oldDir, newDir);
            } else {
                Files.move(oldDir, newDir);
                moved = true;
            }
        }

        boolean rewrite = moved;
        gate.runPaused(() -> {
            store.updateSource(sourceId, input);
            if (rewrite) {
                int count = store.rewriteDownloadPaths(sourceId, oldDir + File.separator, newDir + File.separator);
                LOG.info("Moved {} to {} and rewrote {} download paths", oldDir, newDir, count);
            }
        });
    }

    /** Removes the source from the catalog and optionally its download folder. */
    public void deleteSource(long sourceId, boolean deleteFiles) throws IOException, InterruptedException {
        Source source = requireSource(sourceId);
        gate.runPaused(() -> store.deleteSource(sourceId));
        LOG.info("Deleted source '{}' ({})", source.name(), sourceId);

        if (deleteFiles) {
            Path dir = DownloadScheduler.sourceFolder(libraryRoot(), source);
            if (Files.isDirectory(dir)) {
                MoreFiles.deleteRecursively(dir, RecursiveDeleteOption.ALLOW_INSECURE);
                LOG.info("Deleted folder {}", dir);
            }
        }
    }

    // =====================================================================
    // Profiles
    // =====================================================================

    public void exportProfile(long sourceId, Path file) throws IOException {
        ProfileCodec.write(file, SourceProfile.of(requireSource(sourceId)));
        LOG.info("Exported source {} to {}", sourceId, file);
    }

    /** @return the id of the newly created source */
    public long importProfile(Path file) throws IOException, ProfileValidationException {
        SourceProfile profile = ProfileCodec.read(file);
        return addSource(profile.toInput());
    }

    // =====================================================================
    // Background operations
    // =====================================================================

    /** @param maxPages new records to collect, 0 or less for the configured default */
    public OperationHandle<CrawlResult> startCrawl(long sourceId, int maxPages) {
        requireSource(sourceId);
        int limit = maxPages > 0 ? maxPages : crawlConfig.getMaxPages();
        return submit("crawl", sourceId, crawlExecutor, token -> crawler.crawl(sourceId, limit, token));
    }

    public OperationHandle<DownloadReport> startDownload(long sourceId, DownloadOptions options) {
        requireSource(sourceId);
        return submit("download", sourceId, downloadExecutor, token -> scheduler.download(sourceId, options, token));
    }

    /** Download with the configured options. */
    public OperationHandle<DownloadReport> startDownload(long sourceId) {
        return startDownload(sourceId, defaultDownloadOptions());
    }

    /** Crawls for new pages, then downloads whatever is missing. */
    public OperationHandle<SyncResult> sync(long sourceId) {
        requireSource(sourceId);
        DownloadOptions options = defaultDownloadOptions();
        return submit("sync", sourceId, crawlExecutor, token -> {
            CrawlResult crawled = crawler.crawl(sourceId, crawlConfig.getMaxPages(), token);
            LOG.info("Sync of source {} crawled {} new images ({}), downloading", sourceId, crawled.recordsAdded(),
                    crawled.stopReason());
            return new SyncResult(crawled, scheduler.download(sourceId, options, token));
        });
    }

    public DownloadOptions defaultDownloadOptions() {
        return DownloadOptions.from(downloadConfig);
    }

    public void shutdown() {
        crawlExecutor.shutdownNow();
        downloadExecutor.shutdownNow();
    }

    private <T> OperationHandle<T> submit(String name, long sourceId, ExecutorService executor,
            Operation<T> operation) {
        CancellationToken token = new CancellationToken();
        CompletableFuture<T> future = CompletableFuture.supplyAsync(() -> {
            try {
                return operation.run(token);
            } catch (AcquisitionException e) {
                if (e.isCancellation()) {
                    LOG.info("{} of source {} cancelled", name, sourceId);
                    return null;
                }
                fail(name, sourceId, e);
                throw new CompletionException(e);
            } catch (RuntimeException e) {
                fail(name, sourceId, e);
                throw e;
            }
        }, executor);
        return new OperationHandle<>(name, sourceId, token, future);
    }

    private void fail(String name, long sourceId, Exception e) {
        LOG.error("{} of source {} failed", name, sourceId, e);
        eventBus.post(new AcquisitionEvents.OperationFailedEvent(sourceId, name, String.valueOf(e.getMessage())));
    }

    // =====================================================================
    // Helpers
    // =====================================================================

    private Path libraryRoot() {
        return DownloadOptions.libraryRoot(downloadConfig);
    }

    private Source requireSource(long sourceId) {
        Source source = store.getSource(sourceId);
        if (source == null) {
            throw new IllegalArgumentException("Unknown source " + sourceId);
        }
        return source;
    }

    private static void requireName(SourceInput input) {
        if (input.name() == null || input.name().isBlank()) {
            throw new IllegalArgumentException("Source name must not be blank");
        }
    }

    private static Source renamed(Source source, String name) {
        return new Source(source.id(), name, source.author(), source.description(), source.url(),
                source.firstPageUrl(), source.selectorImage(), source.selectorTitle(), source.selectorNext(),
                source.coverImage(), source.pageCount(), source.imageCount(), source.downloadedImageCount());
    }
}
