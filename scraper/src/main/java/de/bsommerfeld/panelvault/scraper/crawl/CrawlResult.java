package de.bsommerfeld.panelvault.scraper.crawl;

/**
 * Outcome of a finished crawl.
 *
 * @param recordsAdded   newly discovered images; with one image per page this
 *                       equals new pages
 * @param pagesCommitted new pages that became durable
 * @param stopReason     why the walk ended
 */
public record CrawlResult(int recordsAdded, int pagesCommitted, StopReason stopReason) {

    public enum StopReason {
        /** The requested maximum number of new records was reached. */
        PAGE_LIMIT,
        /** The page had no image matching the image selector. */
        END_OF_COMIC,
        /** The page had no next link. */
        NO_NEXT_LINK,
        /** The next link pointed to a page already visited in this run. */
        CYCLE
    }
}
