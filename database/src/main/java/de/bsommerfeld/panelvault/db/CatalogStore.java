package de.bsommerfeld.panelvault.db;

import de.bsommerfeld.panelvault.core.domain.CatalogImage;
import de.bsommerfeld.panelvault.core.domain.DedupKey;
import de.bsommerfeld.panelvault.core.domain.DownloadUpdate;
import de.bsommerfeld.panelvault.core.domain.NewPage;
import de.bsommerfeld.panelvault.core.domain.Page;
import de.bsommerfeld.panelvault.core.domain.PageImage;
import de.bsommerfeld.panelvault.core.domain.Source;
import de.bsommerfeld.panelvault.core.domain.SourceInput;

import java.util.List;
import java.util.Set;

/**
 * Persistent catalog of sources, pages and images.
 *
 * <p>
 * Single-row lookups return {@code null} when nothing matches. Failures are
 * reported as {@link CatalogException}. The two commit operations,
 * {@link #commitPages} and {@link #commitDownloads}, are atomic: either every
 * change in the batch becomes visible or none does.
 *
 * <p>
 * Implementations are thread-safe. Callers that commit go through the
 * application's write gate; plain reads do not need to.
 */
public interface CatalogStore {

    // -- Sources --

    /** @return the id of the new source */
    long createSource(SourceInput input);

    Source getSource(long sourceId);

    /** All sources ordered by name. */
    List<Source> getAllSources();

    /** Replaces the user-editable fields. Counters, cover and pages are untouched. */
    void updateSource(long sourceId, SourceInput input);

    /** Removes the source with all of its pages and images. */
    void deleteSource(long sourceId);

    /**
     * Stores {@code cover} only if the source has none yet.
     *
     * @return true if the cover was stored
     */
    boolean setCoverIfAbsent(long sourceId, byte[] cover);

    // -- Crawl support --

    /** The page with the highest index, or null if the source has no pages. */
    Page getLastPage(long sourceId);

    /** The page with the highest index below {@code pageIndex}, or null. */
    Page getPageBefore(long sourceId, int pageIndex);

    /** Highest assigned page index, 0 if none. */
    int getMaxPageIndex(long sourceId);

    /** Dedup keys of all images on pages with index &gt;= {@code fromPageIndex}. */
    Set<DedupKey> getDedupKeysFrom(long sourceId, int fromPageIndex);

    /**
     * Inserts the pages with their images and bumps the source's page and
     * image counters, all in one transaction.
     *
     * @throws CatalogException if any insert fails; nothing is stored then
     */
    void commitPages(long sourceId, List<NewPage> pages);

    List<Page> getPages(long sourceId);

    List<PageImage> getImages(long pageId);

    // -- Download support --

    /** Images without a download path, ordered by page index then image index. */
    List<CatalogImage> getUndownloadedImages(long sourceId);

    /**
     * One slice of the images that have a download path, ordered by page index
     * then image index.
     */
    List<CatalogImage> getDownloadedImages(long sourceId, int offset, int limit);

    /**
     * Applies download path changes, adjusts the downloaded counter by
     * {@code downloadedDelta} (never below zero) and stores {@code cover} if
     * it is non-null and the source has none yet. One transaction.
     */
    void commitDownloads(long sourceId, List<DownloadUpdate> updates, int downloadedDelta, byte[] cover);

    /**
     * Rewrites every download path of the source that starts with
     * {@code oldPrefix} so that it starts with {@code newPrefix} instead.
     *
     * @return number of rewritten paths
     */
    int rewriteDownloadPaths(long sourceId, String oldPrefix, String newPrefix);
}
