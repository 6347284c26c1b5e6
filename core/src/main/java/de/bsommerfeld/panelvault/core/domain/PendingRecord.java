package de.bsommerfeld.panelvault.core.domain;

/**
 * One image discovered during a crawl that has not been committed yet.
 * {@code title} is the title of the page it was found on, possibly empty.
 */
public record PendingRecord(String pageUrl, String imageUrl, String title) {

    public DedupKey key() {
        return new DedupKey(pageUrl, imageUrl);
    }
}
