package de.bsommerfeld.panelvault.scraper.crawl;

import com.google.inject.Singleton;
import de.bsommerfeld.panelvault.core.concurrent.CancellationToken;
import de.bsommerfeld.panelvault.core.concurrent.WriteGate;
import de.bsommerfeld.panelvault.core.config.CrawlConfig;
import de.bsommerfeld.panelvault.core.domain.DedupKey;
import de.bsommerfeld.panelvault.core.domain.NewPage;
import de.bsommerfeld.panelvault.core.domain.Page;
import de.bsommerfeld.panelvault.core.domain.PendingRecord;
import de.bsommerfeld.panelvault.core.domain.Source;
import de.bsommerfeld.panelvault.core.error.AcquisitionException;
import de.bsommerfeld.panelvault.core.event.AcquisitionEvents;
import de.bsommerfeld.panelvault.core.event.ApplicationEventBus;
import de.bsommerfeld.panelvault.db.CatalogStore;
import de.bsommerfeld.panelvault.scraper.html.HtmlFetcher;
import de.bsommerfeld.panelvault.scraper.html.ParsedPage;
import de.bsommerfeld.panelvault.scraper.html.SelectorExtractor;
import de.bsommerfeld.panelvault.scraper.html.SelectorSet;
import jakarta.inject.Inject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Walks a comic page by page and feeds new images into the catalog.
 *
 * <h3>Start point</h3>
 * If the source already has pages, the crawl resumes at the highest-indexed
 * page, with the page below it as Referer. Re-fetching that page picks up a
 * next link that did not exist last time. A source without pages starts at
 * its first-page URL without a Referer.
 *
 * <h3>Step</h3>
 *
 * <pre>
 * loop:
 *   cap reached?                       → stop (PAGE_LIMIT)
 *   current URL visited this run?      → stop (CYCLE), else mark visited
 *   fetch (Referer = previous URL), extract
 *   no images?                         → stop (END_OF_COMIC)
 *   first page of a fresh source?      → capture cover in the background
 *   per image: skip known dedup keys, buffer the rest, stop at the cap
 *   buffer ≥ commit threshold or cap?  → flush
 *   cap reached?                       → stop (PAGE_LIMIT)
 *   no next link / next link visited?  → stop (NO_NEXT_LINK / CYCLE)
 *   previous = current, current = next
 * </pre>
 *
 * <h3>Dedup</h3>
 * Known keys are seeded from the images of the last {@code dedup-window-pages}
 * pages. Anything older is assumed not to reappear.
 *
 * <h3>Termination</h3>
 * Every exit path, including errors and cancellation, ends with one more
 * best-effort flush so that buffered records are not lost. A failure of that
 * final flush is logged and does not replace the original outcome.
 */
@Singleton
public class PageCrawler {

    private static final Logger LOG = LoggerFactory.getLogger(PageCrawler.class);
    private static final long COVER_JOIN_TIMEOUT_SECONDS = 30;

    private final HtmlFetcher fetcher;
    private final SelectorExtractor extractor;
    private final CommitBatcher batcher;
    private final CatalogStore store;
    private final WriteGate gate;
    private final CrawlConfig config;
    private final ApplicationEventBus eventBus;
    private final Executor coverExecutor;

    @Inject
    public PageCrawler(HtmlFetcher fetcher, SelectorExtractor extractor, CommitBatcher batcher, CatalogStore store,
            WriteGate gate, CrawlConfig config, ApplicationEventBus eventBus) {
        this(fetcher, extractor, batcher, store, gate, config, eventBus, PageCrawler::startCoverThread);
    }

    PageCrawler(HtmlFetcher fetcher, SelectorExtractor extractor, CommitBatcher batcher, CatalogStore store,
            WriteGate gate, CrawlConfig config, ApplicationEventBus eventBus, Executor coverExecutor) {
        this.fetcher = fetcher;
        this.extractor = extractor;
        this.batcher = batcher;
        this.store = store;
        this.gate = gate;
        this.config = config;
        this.eventBus = eventBus;
        this.coverExecutor = coverExecutor;
    }

    private static void startCoverThread(Runnable task) {
        Thread thread = new Thread(task, "panelvault-cover");
        thread.setDaemon(true);
        thread.start();
    }

    /**
     * Crawls one source.
     *
     * @param sourceId the source to crawl
     * @param maxPages maximum number of new records, 0 or less for unlimited
     * @param token    cooperative cancellation
     * @throws AcquisitionException {@code MISSING_SELECTOR} or
     *                              {@code INVALID_BASE_URL} before any I/O,
     *                              otherwise whatever ended the walk
     */
    public CrawlResult crawl(long sourceId, int maxPages, CancellationToken token) throws AcquisitionException {
        Source source = store.getSource(sourceId);
        if (source == null) {
            throw new IllegalArgumentException("Unknown source " + sourceId);
        }
        if (source.selectorImage() == null || source.selectorImage().isBlank()) {
            throw AcquisitionException.missingSelector("image");
        }

        FetchState state = initialState(source);
        boolean freshSource = state.maxIndex == 0;
        SelectorSet selectors = SelectorSet.of(source);
        LOG.info("Crawling '{}' from {} (maxPages={}, resumed={})", source.name(), state.currentUrl,
                maxPages > 0 ? maxPages : "unlimited", !freshSource);
        eventBus.post(new AcquisitionEvents.CrawlStartedEvent(sourceId, state.currentUrl, !freshSource));

        CompletableFuture<Void> coverTask = CompletableFuture.completedFuture(null);
        CrawlResult.StopReason reason;
        try {
            while (true) {
                token.throwIfCancelled();

                if (state.capReached(maxPages)) {
                    reason = CrawlResult.StopReason.PAGE_LIMIT;
                    break;
                }
                if (!state.visited.add(state.currentUrl)) {
                    reason = CrawlResult.StopReason.CYCLE;
                    break;
                }

                String html = fetcher.fetchHtml(state.currentUrl, state.previousUrl, token);
                ParsedPage page = extractor.extract(html, state.currentUrl, selectors);
                if (page.imageUrls().isEmpty()) {
                    LOG.info("No images on {}, treating it as the end of the comic", state.currentUrl);
                    reason = CrawlResult.StopReason.END_OF_COMIC;
                    break;
                }

                if (freshSource && !state.coverRequested && !source.hasCover()) {
                    state.coverRequested = true;
                    coverTask = captureCover(sourceId, page.imageUrls().get(0), state.currentUrl, token);
                }

                bufferImages(state, page, maxPages);

                if (state.pending.size() >= config.getCommitThreshold() || state.capReached(maxPages)) {
                    flush(sourceId, state);
                }
                if (state.capReached(maxPages)) {
                    reason = CrawlResult.StopReason.PAGE_LIMIT;
                    break;
                }

                String next = page.nextUrl();
                if (next == null) {
                    reason = CrawlResult.StopReason.NO_NEXT_LINK;
                    break;
                }
                if (state.visited.contains(next)) {
                    LOG.info("Next link {} was already visited, stopping", next);
                    reason = CrawlResult.StopReason.CYCLE;
                    break;
                }
                state.advanceTo(next);
            }
        } finally {
            finalFlush(sourceId, state);
            awaitCover(coverTask);
        }

        LOG.info("Crawl of '{}' finished: {} new images on {} new pages ({})", source.name(), state.recordsAdded,
                state.pagesCommitted, reason);
        eventBus.post(new AcquisitionEvents.CrawlFinishedEvent(sourceId, state.recordsAdded, reason.name()));
        return new CrawlResult(state.recordsAdded, state.pagesCommitted, reason);
    }

    // =====================================================================
    // State
    // =====================================================================

    private FetchState initialState(Source source) throws AcquisitionException {
        Page last = store.getLastPage(source.id());
        String firstPageUrl = source.firstPageUrl() != null ? source.firstPageUrl().trim() : "";
        String startUrl;
        // hotlink-protected hosts want a Referer from their own site, the first page is the fallback
        String referer = firstPageUrl.isEmpty() ? null : firstPageUrl;
        if (last != null) {
            startUrl = last.url();
            Page before = store.getPageBefore(source.id(), last.index());
            if (before != null) {
                referer = before.url();
            }
        } else {
            startUrl = firstPageUrl;
        }
        if (!isAbsoluteHttpUrl(startUrl)) {
            throw AcquisitionException.invalidBaseUrl(startUrl);
        }

        int maxIndex = last != null ? last.index() : 0;
        Set<DedupKey> known = maxIndex > 0
                ? store.getDedupKeysFrom(source.id(), Math.max(1, maxIndex - config.getDedupWindowPages() + 1))
                : Set.of();
        return new FetchState(startUrl, referer, known, maxIndex);
    }

    static boolean isAbsoluteHttpUrl(String url) {
        if (url == null || url.isBlank()) {
            return false;
        }
        try {
            URI uri = URI.create(url);
            String scheme = uri.getScheme();
            return scheme != null
                    && (scheme.toLowerCase(Locale.ROOT).equals("http") || scheme.toLowerCase(Locale.ROOT).equals("https"))
                    && uri.getHost() != null;
        } catch (IllegalArgumentException e) {
            return false;
        }
    }

    private static void bufferImages(FetchState state, ParsedPage page, int maxPages) {
        String title = page.title() != null ? page.title() : "";
        for (String imageUrl : page.imageUrls()) {
            if (state.capReached(maxPages)) {
                break;
            }
            DedupKey key = new DedupKey(state.currentUrl, imageUrl);
            if (!state.knownKeys.add(key)) {
                continue;
            }
            state.pending.add(new PendingRecord(state.currentUrl, imageUrl, title));
            state.recordsAdded++;
        }
    }

    // =====================================================================
    // Commits
    // =====================================================================

    private void flush(long sourceId, FetchState state) throws AcquisitionException {
        List<NewPage> committed = batcher.flush(sourceId, state.pending);
        if (!committed.isEmpty()) {
            state.pagesCommitted += committed.size();
            state.maxIndex = committed.get(committed.size() - 1).index();
        }
    }

    private void finalFlush(long sourceId, FetchState state) {
        if (state.pending.isEmpty()) {
            return;
        }
        try {
            flush(sourceId, state);
        } catch (AcquisitionException | RuntimeException e) {
            LOG.error("Final commit of {} buffered images for source {} failed", state.pending.size(), sourceId, e);
        }
    }

    // =====================================================================
    // Cover
    // =====================================================================

    private CompletableFuture<Void> captureCover(long sourceId, String imageUrl, String pageUrl,
            CancellationToken token) {
        return CompletableFuture.runAsync(() -> {
            try {
                byte[] bytes = fetcher.fetchBytes(imageUrl, pageUrl, token);
                gate.runPaused(() -> store.setCoverIfAbsent(sourceId, bytes));
                LOG.debug("Captured cover for source {} from {}", sourceId, imageUrl);
            } catch (AcquisitionException | RuntimeException e) {
                LOG.debug("Cover capture for source {} failed: {}", sourceId, e.getMessage());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                LOG.debug("Cover capture for source {} interrupted", sourceId);
            }
        }, coverExecutor);
    }

    private static void awaitCover(CompletableFuture<Void> coverTask) {
        try {
            coverTask.get(COVER_JOIN_TIMEOUT_SECONDS, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } catch (ExecutionException | TimeoutException e) {
            LOG.debug("Cover capture did not complete: {}", e.getMessage());
        }
    }
}
