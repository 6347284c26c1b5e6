package de.bsommerfeld.panelvault.scraper.crawl;

import de.bsommerfeld.panelvault.core.domain.DedupKey;
import de.bsommerfeld.panelvault.core.domain.PendingRecord;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Cursor of one crawl invocation. Owned by exactly one thread and discarded
 * when the crawl returns.
 */
final class FetchState {

    String currentUrl;
    /** Sent as Referer when fetching {@link #currentUrl}. */
    String previousUrl;

    final Set<String> visited = new HashSet<>();
    final Set<DedupKey> knownKeys;
    final List<PendingRecord> pending = new ArrayList<>();

    /** Highest page index known to be committed. */
    int maxIndex;
    int recordsAdded;
    int pagesCommitted;
    boolean coverRequested;

    FetchState(String startUrl, String referer, Set<DedupKey> knownKeys, int maxIndex) {
        this.currentUrl = startUrl;
        this.previousUrl = referer;
        this.knownKeys = new HashSet<>(knownKeys);
        this.maxIndex = maxIndex;
    }

    boolean capReached(int maxPages) {
        return maxPages > 0 && recordsAdded >= maxPages;
    }

    void advanceTo(String nextUrl) {
        previousUrl = currentUrl;
        currentUrl = nextUrl;
    }
}
