package de.bsommerfeld.panelvault.scraper.crawl;

import com.google.inject.Singleton;
import de.bsommerfeld.panelvault.core.concurrent.WriteGate;
import de.bsommerfeld.panelvault.core.domain.NewPage;
import de.bsommerfeld.panelvault.core.domain.PendingRecord;
import de.bsommerfeld.panelvault.core.error.AcquisitionException;
import de.bsommerfeld.panelvault.core.event.AcquisitionEvents;
import de.bsommerfeld.panelvault.core.event.ApplicationEventBus;
import de.bsommerfeld.panelvault.db.CatalogException;
import de.bsommerfeld.panelvault.db.CatalogStore;
import jakarta.inject.Inject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Turns buffered crawl records into durable pages.
 *
 * <h3>Grouping</h3>
 * Records are grouped by page URL in first-seen order. Each distinct page URL
 * gets the next unused page index, continuing from the catalog's current
 * maximum for the source. Images keep their extraction order and are numbered
 * from 0 within their page. A page URL that already exists in the catalog
 * (outside the dedup window) gets a new index, indices are never reused.
 *
 * <h3>Atomicity</h3>
 * The whole batch is one store transaction inside one write-gate window, and
 * the maximum index is read inside that window so no other writer can take
 * the same indices. The pending buffer is cleared only after a successful
 * commit. On failure it is left untouched for the next attempt.
 */
@Singleton
public class CommitBatcher {

    private static final Logger LOG = LoggerFactory.getLogger(CommitBatcher.class);

    private final CatalogStore store;
    private final WriteGate gate;
    private final ApplicationEventBus eventBus;

    @Inject
    public CommitBatcher(CatalogStore store, WriteGate gate, ApplicationEventBus eventBus) {
        this.store = store;
        this.gate = gate;
        this.eventBus = eventBus;
    }

    /**
     * Commits and clears {@code pending}.
     *
     * @return the pages that were committed, empty if nothing was pending
     * @throws CatalogException     if the store rejects the batch
     * @throws AcquisitionException of kind {@code CANCELLED} if interrupted while
     *                              waiting for the write gate
     */
    public List<NewPage> flush(long sourceId, List<PendingRecord> pending) throws AcquisitionException {
        if (pending.isEmpty()) {
            return List.of();
        }
        List<NewPage> committed;
        try {
            committed = gate.callPaused(() -> {
                List<NewPage> pages = group(pending, store.getMaxPageIndex(sourceId) + 1);
                store.commitPages(sourceId, pages);
                return pages;
            });
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw AcquisitionException.cancelled(e);
        }

        int images = pending.size();
        pending.clear();
        int lastIndex = committed.get(committed.size() - 1).index();
        LOG.info("Committed {} pages ({} images) for source {}, last index {}", committed.size(), images, sourceId,
                lastIndex);
        eventBus.post(new AcquisitionEvents.PagesCommittedEvent(sourceId, committed.size(), images, lastIndex));
        return committed;
    }

    /**
     * Groups records by page URL in first-seen order and assigns consecutive
     * indices starting at {@code firstIndex}.
     */
    static List<NewPage> group(List<PendingRecord> pending, int firstIndex) {
        Map<String, List<PendingRecord>> byPage = new LinkedHashMap<>();
        for (PendingRecord record : pending) {
            byPage.computeIfAbsent(record.pageUrl(), k -> new ArrayList<>()).add(record);
        }

        List<NewPage> pages = new ArrayList<>(byPage.size());
        int index = firstIndex;
        for (Map.Entry<String, List<PendingRecord>> entry : byPage.entrySet()) {
            List<PendingRecord> records = entry.getValue();
            List<String> imageUrls = new ArrayList<>(records.size());
            for (PendingRecord record : records) {
                imageUrls.add(record.imageUrl());
            }
            String title = records.get(0).title();
            pages.add(new NewPage(index++, title != null ? title : "", entry.getKey(), imageUrls));
        }
        return pages;
    }
}
