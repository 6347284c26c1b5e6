package de.bsommerfeld.panelvault.downloader;

import com.google.common.util.concurrent.ThreadFactoryBuilder;
import com.google.inject.Singleton;
import de.bsommerfeld.panelvault.core.concurrent.CancellationToken;
import de.bsommerfeld.panelvault.core.concurrent.WriteGate;
import de.bsommerfeld.panelvault.core.config.DownloadConfig;
import de.bsommerfeld.panelvault.core.domain.DownloadUpdate;
import de.bsommerfeld.panelvault.core.domain.Source;
import de.bsommerfeld.panelvault.core.error.AcquisitionException;
import de.bsommerfeld.panelvault.core.event.AcquisitionEvents;
import de.bsommerfeld.panelvault.core.event.ApplicationEventBus;
import de.bsommerfeld.panelvault.core.util.FileNaming;
import de.bsommerfeld.panelvault.db.CatalogStore;
import jakarta.inject.Inject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

/**
 * Downloads every image of a source that is not on disk yet.
 *
 * <h3>Scheduling</h3>
 * At most {@code maxConcurrent} downloads run at once on a fixed pool. The
 * calling thread is the single owner of all run state: it submits work,
 * takes completions in whatever order they finish, applies them and submits
 * the next item. Workers never touch the catalog.
 *
 * <h3>Catalog effects</h3>
 * <ul>
 * <li>fresh image written or already present: path set, downloaded counter
 * +1</li>
 * <li>missing file restored: path rewritten, counter unchanged</li>
 * <li>missing file not restored: path cleared, counter -1</li>
 * </ul>
 * Changes are committed through the write gate after every
 * {@code commit-every} successful images and once more at the end, whatever
 * the outcome.
 *
 * <h3>Stopping</h3>
 * A transport error or cancellation stops new submissions. In-flight
 * downloads are drained and committed before the error, or
 * {@code CANCELLED}, is thrown.
 */
@Singleton
public class DownloadScheduler {

    private static final Logger LOG = LoggerFactory.getLogger(DownloadScheduler.class);

    private final WorkSetBuilder workSetBuilder;
    private final AssetDownloader assetDownloader;
    private final CatalogStore store;
    private final WriteGate gate;
    private final DownloadConfig config;
    private final ApplicationEventBus eventBus;

    private record Completed(WorkItem item, DownloadResult result) {
    }

    @Inject
    public DownloadScheduler(WorkSetBuilder workSetBuilder, AssetDownloader assetDownloader, CatalogStore store,
            WriteGate gate, DownloadConfig config, ApplicationEventBus eventBus) {
        this.workSetBuilder = workSetBuilder;
        this.assetDownloader = assetDownloader;
        this.store = store;
        this.gate = gate;
        this.config = config;
        this.eventBus = eventBus;
    }

    /**
     * Folder of a source below the library root, named after the sanitized
     * source name. A name that sanitizes to nothing falls back to
     * {@code source-{id}}.
     */
    public static Path sourceFolder(Path libraryRoot, Source source) {
        String name = FileNaming.sanitize(source.name());
        return libraryRoot.resolve(name.isEmpty() ? "source-" + source.id() : name);
    }

    public DownloadReport download(long sourceId, DownloadOptions options, CancellationToken token)
            throws AcquisitionException {
        Source source = store.getSource(sourceId);
        if (source == null) {
            throw new IllegalArgumentException("Unknown source " + sourceId);
        }
        Path sourceDir = sourceFolder(options.libraryRoot(), source);
        try {
            Files.createDirectories(sourceDir);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot create source folder " + sourceDir, e);
        }

        List<WorkItem> items = workSetBuilder.build(sourceId, sourceDir);
        DownloadRun run = new DownloadRun(sourceId, items.size(), !source.hasCover());
        LOG.info("Downloading {} images of '{}' into {} (concurrency {}, overwrite {})", items.size(),
                source.name(), sourceDir, options.maxConcurrent(), options.overwrite());
        eventBus.post(new AcquisitionEvents.DownloadStartedEvent(sourceId, items.size(), options.maxConcurrent()));

        AcquisitionException failure = null;
        boolean interrupted = false;
        if (!items.isEmpty()) {
            ExecutorService pool = Executors.newFixedThreadPool(Math.min(options.maxConcurrent(), items.size()),
                    new ThreadFactoryBuilder()
                            .setNameFormat("panelvault-download-" + sourceId + "-%d")
                            .setDaemon(true)
                            .build());
            CompletionService<Completed> completions = new ExecutorCompletionService<>(pool);
            boolean drained = false;
            try {
                Iterator<WorkItem> queue = items.iterator();
                int inFlight = 0;
                while (true) {
                    while (failure == null && !interrupted && !token.isCancelled()
                            && inFlight < options.maxConcurrent() && queue.hasNext()) {
                        WorkItem item = queue.next();
                        boolean wantCover = run.coverNeeded;
                        completions.submit(() -> new Completed(item,
                                assetDownloader.download(item.image(), sourceDir, options.overwrite(), wantCover)));
                        inFlight++;
                    }
                    if (inFlight == 0) {
                        break;
                    }

                    Future<Completed> done;
                    try {
                        done = completions.take();
                    } catch (InterruptedException e) {
                        LOG.info("Download of source {} interrupted, draining {} running tasks", sourceId, inFlight);
                        interrupted = true;
                        token.cancel();
                        continue;
                    }
                    inFlight--;
                    failure = collect(done, run, failure);
                    eventBus.post(new AcquisitionEvents.DownloadProgressEvent(sourceId, run.completed,
                            run.considered));

                    if (run.successesSinceCommit >= config.getCommitEvery()) {
                        commit(run);
                    }
                }
                drained = true;
            } finally {
                pool.shutdownNow();
                if (!drained) {
                    commitAfterFailure(run);
                }
            }
        }
        commit(run);

        if (failure != null) {
            LOG.error("Download of '{}' stopped after {} of {} images: {}", source.name(), run.completed,
                    run.considered, failure.getMessage());
            throw failure;
        }
        if (interrupted || (token.isCancelled() && run.completed < run.considered)) {
            if (interrupted) {
                Thread.currentThread().interrupt();
            }
            LOG.info("Download of '{}' cancelled after {} of {} images", source.name(), run.completed,
                    run.considered);
            throw AcquisitionException.cancelled();
        }

        DownloadReport report = run.report();
        LOG.info("Download of '{}' finished: {}", source.name(), report);
        eventBus.post(new AcquisitionEvents.DownloadFinishedEvent(sourceId, report.considered(), report.written(),
                report.alreadyPresent(), report.notWritten()));
        return report;
    }

    // =====================================================================
    // Completions
    // =====================================================================

    private static AcquisitionException collect(Future<Completed> done, DownloadRun run,
            AcquisitionException failure) {
        try {
            Completed completed = done.get();
            run.apply(completed.item(), completed.result());
            return failure;
        } catch (ExecutionException e) {
            run.failed();
            Throwable cause = e.getCause();
            if (cause instanceof AcquisitionException acquisitionError) {
                LOG.warn("Stopping downloads: {}", acquisitionError.getMessage());
                return failure != null ? failure : acquisitionError;
            }
            LOG.error("Unexpected error while downloading an image", cause);
            return failure;
        } catch (InterruptedException e) {
            // take() only returns finished futures, get() cannot block here
            Thread.currentThread().interrupt();
            run.failed();
            return failure;
        }
    }

    // =====================================================================
    // Commits
    // =====================================================================

    private void commit(DownloadRun run) throws AcquisitionException {
        if (!run.hasChanges()) {
            return;
        }
        List<DownloadUpdate> updates = new ArrayList<>(run.updates);
        int delta = run.downloadedDelta;
        byte[] cover = run.cover;
        try {
            gate.runPaused(() -> store.commitDownloads(run.sourceId, updates, delta, cover));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw AcquisitionException.cancelled(e);
        }
        LOG.debug("Committed {} download updates for source {} (counter delta {})", updates.size(), run.sourceId,
                delta);
        run.committed();
    }

    private void commitAfterFailure(DownloadRun run) {
        try {
            commit(run);
        } catch (AcquisitionException | RuntimeException e) {
            LOG.error("Final commit of {} download updates for source {} failed", run.updates.size(), run.sourceId,
                    e);
        }
    }
}
