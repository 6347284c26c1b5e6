package de.bsommerfeld.panelvault.scraper.crawl;

import de.bsommerfeld.panelvault.core.concurrent.CancellationToken;
import de.bsommerfeld.panelvault.core.concurrent.WriteGate;
import de.bsommerfeld.panelvault.core.config.CrawlConfig;
import de.bsommerfeld.panelvault.core.domain.Page;
import de.bsommerfeld.panelvault.core.domain.PageImage;
import de.bsommerfeld.panelvault.core.domain.SourceInput;
import de.bsommerfeld.panelvault.core.error.AcquisitionException;
import de.bsommerfeld.panelvault.core.event.AcquisitionEvents;
import de.bsommerfeld.panelvault.core.event.ApplicationEventBus;
import de.bsommerfeld.panelvault.db.InMemoryCatalogStore;
import de.bsommerfeld.panelvault.scraper.html.HtmlFetcher;
import de.bsommerfeld.panelvault.scraper.html.SelectorExtractor;
import de.bsommerfeld.panelvault.scraper.http.FetchResponse;
import de.bsommerfeld.panelvault.scraper.http.HttpFetcher;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

/**
 * End-to-end crawls against an in-memory site and an in-memory catalog. Cover
 * capture runs inline so its effects are visible when crawl() returns.
 */
class PageCrawlerTest {

    private static final String BASE = "https://comic.test/";
    private static final String CDN = "https://cdn.test/";

    private InMemoryCatalogStore store;
    private CrawlConfig config;
    private ApplicationEventBus eventBus;
    private FakeSite site;

    @BeforeEach
    void setUp() {
        store = new InMemoryCatalogStore();
        config = new CrawlConfig();
        config.setRetryBackoffMillis(0);
        eventBus = mock(ApplicationEventBus.class);
        site = new FakeSite();
    }

    private PageCrawler crawler(HttpFetcher http) {
        WriteGate gate = new WriteGate();
        return new PageCrawler(new HtmlFetcher(http, config), new SelectorExtractor(),
                new CommitBatcher(store, gate, eventBus), store, gate, config, eventBus, Runnable::run);
    }

    private long source(String firstPageUrl, String imageSelector) {
        return store.createSource(new SourceInput("Comic", "Someone", "", BASE, firstPageUrl, imageSelector,
                "h1.title", "a.next"));
    }

    private long source() {
        return source(BASE + "1", "#comic img");
    }

    /** Pages 1..3, one image each, page 3 has no next link. */
    private void threePageComic() {
        site.page(BASE + "1", "One", BASE + "2", CDN + "1.png")
                .page(BASE + "2", "Two", BASE + "3", CDN + "2.png")
                .page(BASE + "3", "Three", null, CDN + "3.png")
                .image(CDN + "1.png", new byte[] { 1, 2, 3 });
    }

    private List<FakeSite.Request> pageRequests() {
        return site.requests().stream().filter(r -> r.url().startsWith(BASE)).toList();
    }

    // -- Walking --

    @Test
    void crawl_shouldCommitEveryPageUntilNoNextLink() throws Exception {
        threePageComic();
        long id = source();

        CrawlResult result = crawler(site).crawl(id, 0, CancellationToken.none());

        assertEquals(new CrawlResult(3, 3, CrawlResult.StopReason.NO_NEXT_LINK), result);
        List<Page> pages = store.getPages(id);
        assertEquals(List.of(1, 2, 3), pages.stream().map(Page::index).toList());
        assertEquals(List.of("One", "Two", "Three"), pages.stream().map(Page::title).toList());
        assertEquals(CDN + "2.png", store.getImages(pages.get(1).id()).get(0).imageUrl());
        assertEquals(3, store.getSource(id).pageCount());
        assertEquals(3, store.getSource(id).imageCount());
    }

    @Test
    void crawl_shouldSendPreviousPageAsReferer() throws Exception {
        threePageComic();
        long id = source();

        crawler(site).crawl(id, 0, CancellationToken.none());

        assertEquals(List.of(
                new FakeSite.Request(BASE + "1", BASE + "1"),
                new FakeSite.Request(BASE + "2", BASE + "1"),
                new FakeSite.Request(BASE + "3", BASE + "2")), pageRequests());
    }

    @Test
    void crawl_shouldKeepAllImagesOfOnePageInOrder() throws Exception {
        site.page(BASE + "1", "Spread", null, CDN + "left.png", CDN + "right.png");
        long id = source();

        CrawlResult result = crawler(site).crawl(id, 0, CancellationToken.none());

        assertEquals(2, result.recordsAdded());
        assertEquals(1, result.pagesCommitted());
        Page page = store.getPages(id).get(0);
        List<PageImage> images = store.getImages(page.id());
        assertEquals(List.of(CDN + "left.png", CDN + "right.png"), images.stream().map(PageImage::imageUrl).toList());
        assertEquals(List.of(0, 1), images.stream().map(PageImage::index).toList());
    }

    // -- Resume and dedup --

    @Test
    void crawl_shouldAddNothingWhenRunTwice() throws Exception {
        threePageComic();
        long id = source();
        PageCrawler crawler = crawler(site);
        crawler.crawl(id, 0, CancellationToken.none());

        CrawlResult second = crawler.crawl(id, 0, CancellationToken.none());

        assertEquals(0, second.recordsAdded());
        assertEquals(0, second.pagesCommitted());
        assertEquals(3, store.getPages(id).size());
        assertEquals(3, store.getSource(id).imageCount());
    }

    @Test
    void crawl_shouldFallBackToFirstPageAsRefererWhenResumingSinglePage() throws Exception {
        site.page(BASE + "1", "One", null, CDN + "1.png");
        long id = source();
        PageCrawler crawler = crawler(site);
        crawler.crawl(id, 0, CancellationToken.none());

        site.page(BASE + "1", "One", BASE + "2", CDN + "1.png")
                .page(BASE + "2", "Two", null, CDN + "2.png");
        int before = site.requests().size();

        crawler.crawl(id, 0, CancellationToken.none());

        assertEquals(new FakeSite.Request(BASE + "1", BASE + "1"), site.requests().get(before));
        assertEquals(2, store.getSource(id).pageCount());
    }

    @Test
    void crawl_shouldResumeFromLastPageWithItsPredecessorAsReferer() throws Exception {
        threePageComic();
        long id = source();
        PageCrawler crawler = crawler(site);
        crawler.crawl(id, 0, CancellationToken.none());

        // the comic grows by one page
        site.page(BASE + "3", "Three", BASE + "4", CDN + "3.png")
                .page(BASE + "4", "Four", null, CDN + "4.png");
        int before = site.requests().size();

        CrawlResult result = crawler.crawl(id, 0, CancellationToken.none());

        assertEquals(new CrawlResult(1, 1, CrawlResult.StopReason.NO_NEXT_LINK), result);
        FakeSite.Request first = site.requests().get(before);
        assertEquals(new FakeSite.Request(BASE + "3", BASE + "2"), first);
        Page last = store.getLastPage(id);
        assertEquals(4, last.index());
        assertEquals(BASE + "4", last.url());
    }

    // -- Stop conditions --

    @Test
    void crawl_shouldStopExactlyAtCap() throws Exception {
        threePageComic();
        long id = source();

        CrawlResult result = crawler(site).crawl(id, 2, CancellationToken.none());

        assertEquals(new CrawlResult(2, 2, CrawlResult.StopReason.PAGE_LIMIT), result);
        assertFalse(site.requestedUrls().contains(BASE + "3"));
        assertEquals(2, store.getPages(id).size());
    }

    @Test
    void crawl_shouldStopAtCapInTheMiddleOfAPage() throws Exception {
        site.page(BASE + "1", "Many", BASE + "2", CDN + "a.png", CDN + "b.png", CDN + "c.png");
        long id = source();

        CrawlResult result = crawler(site).crawl(id, 2, CancellationToken.none());

        assertEquals(CrawlResult.StopReason.PAGE_LIMIT, result.stopReason());
        assertEquals(2, result.recordsAdded());
        assertEquals(2, store.getSource(id).imageCount());
        assertFalse(site.requestedUrls().contains(BASE + "2"));
    }

    @Test
    void crawl_shouldDetectCycle() throws Exception {
        site.page(BASE + "1", "One", BASE + "2", CDN + "1.png")
                .page(BASE + "2", "Two", BASE + "1", CDN + "2.png");
        long id = source();

        CrawlResult result = crawler(site).crawl(id, 0, CancellationToken.none());

        assertEquals(new CrawlResult(2, 2, CrawlResult.StopReason.CYCLE), result);
        assertEquals(2, pageRequests().size());
    }

    @Test
    void crawl_shouldTreatPageWithoutImagesAsEnd() throws Exception {
        site.page(BASE + "1", "One", BASE + "2", CDN + "1.png")
                .page(BASE + "2", "Coming soon", BASE + "3");
        long id = source();

        CrawlResult result = crawler(site).crawl(id, 0, CancellationToken.none());

        assertEquals(new CrawlResult(1, 1, CrawlResult.StopReason.END_OF_COMIC), result);
        assertFalse(site.requestedUrls().contains(BASE + "3"));
    }

    // -- Validation --

    @Test
    void crawl_shouldRejectMissingImageSelectorBeforeAnyRequest() {
        long id = source(BASE + "1", "  ");

        AcquisitionException ex = assertThrows(AcquisitionException.class,
                () -> crawler(site).crawl(id, 0, CancellationToken.none()));

        assertEquals(AcquisitionException.Kind.MISSING_SELECTOR, ex.getKind());
        assertEquals("image", ex.getSelectorName());
        assertTrue(site.requests().isEmpty());
    }

    @Test
    void crawl_shouldRejectRelativeFirstPageUrl() {
        long id = source("comic.test/1", "#comic img");

        AcquisitionException ex = assertThrows(AcquisitionException.class,
                () -> crawler(site).crawl(id, 0, CancellationToken.none()));

        assertEquals(AcquisitionException.Kind.INVALID_BASE_URL, ex.getKind());
        assertTrue(site.requests().isEmpty());
    }

    @Test
    void crawl_shouldRejectUnknownSource() {
        assertThrows(IllegalArgumentException.class, () -> crawler(site).crawl(999, 0, CancellationToken.none()));
    }

    // -- Cover --

    @Test
    void crawl_shouldCaptureCoverFromFirstImageOfFreshSource() throws Exception {
        threePageComic();
        long id = source();

        crawler(site).crawl(id, 0, CancellationToken.none());

        assertArrayEquals(new byte[] { 1, 2, 3 }, store.getSource(id).coverImage());
        assertTrue(site.requests().contains(new FakeSite.Request(CDN + "1.png", BASE + "1")));
    }

    @Test
    void crawl_shouldFinishEvenIfCoverCannotBeFetched() throws Exception {
        site.page(BASE + "1", "One", null, CDN + "missing.png");
        long id = source();

        CrawlResult result = crawler(site).crawl(id, 0, CancellationToken.none());

        assertEquals(1, result.recordsAdded());
        assertFalse(store.getSource(id).hasCover());
    }

    // -- Commits --

    @Test
    void crawl_shouldFlushWheneverThresholdIsReached() throws Exception {
        config.setCommitThreshold(1);
        threePageComic();
        long id = source();

        crawler(site).crawl(id, 0, CancellationToken.none());

        verify(eventBus, times(3)).post(any(AcquisitionEvents.PagesCommittedEvent.class));
    }

    @Test
    void crawl_shouldKeepEarlierPagesWhenALaterFetchFails() {
        site.page(BASE + "1", "One", BASE + "2", CDN + "1.png")
                .page(BASE + "2", "Two", BASE + "3", CDN + "2.png")
                .status(BASE + "3", 500);
        long id = source();

        AcquisitionException ex = assertThrows(AcquisitionException.class,
                () -> crawler(site).crawl(id, 0, CancellationToken.none()));

        assertEquals(AcquisitionException.Kind.BAD_STATUS, ex.getKind());
        assertEquals(500, ex.getStatusCode());
        assertEquals(2, store.getPages(id).size());
        assertEquals(3, site.requestedUrls().stream().filter((BASE + "3")::equals).count());
    }

    @Test
    void crawl_shouldCommitBufferedPagesWhenCancelled() {
        threePageComic();
        long id = source();
        CancellationToken token = new CancellationToken();
        HttpFetcher cancellingSite = new FakeSite() {
            @Override
            public FetchResponse get(String url, String referer) throws AcquisitionException {
                FetchResponse response = site.get(url, referer);
                if (url.equals(BASE + "2")) {
                    token.cancel();
                }
                return response;
            }
        };

        AcquisitionException ex = assertThrows(AcquisitionException.class,
                () -> crawler(cancellingSite).crawl(id, 0, token));

        assertTrue(ex.isCancellation());
        assertEquals(2, store.getPages(id).size());
        assertFalse(site.requestedUrls().contains(BASE + "3"));
    }
}
