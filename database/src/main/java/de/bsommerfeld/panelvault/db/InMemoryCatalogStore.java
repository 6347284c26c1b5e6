package de.bsommerfeld.panelvault.db;

import com.google.inject.Singleton;
import de.bsommerfeld.panelvault.core.domain.CatalogImage;
import de.bsommerfeld.panelvault.core.domain.DedupKey;
import de.bsommerfeld.panelvault.core.domain.DownloadUpdate;
import de.bsommerfeld.panelvault.core.domain.NewPage;
import de.bsommerfeld.panelvault.core.domain.Page;
import de.bsommerfeld.panelvault.core.domain.PageImage;
import de.bsommerfeld.panelvault.core.domain.Source;
import de.bsommerfeld.panelvault.core.domain.SourceInput;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * In-memory {@link CatalogStore} for TEST mode and unit tests. No disk I/O,
 * nothing survives the JVM.
 *
 * <p>
 * Every method is {@code synchronized} on the store, which gives the same
 * all-or-nothing visibility the SQLite transactions give: a commit validates
 * the whole batch before it mutates anything.
 */
@Singleton
public class InMemoryCatalogStore implements CatalogStore {

    private static final Logger LOG = LoggerFactory.getLogger(InMemoryCatalogStore.class);

    private static final Comparator<ImageRow> READING_ORDER = Comparator
            .comparingInt((ImageRow i) -> i.page.index)
            .thenComparingInt(i -> i.index);

    private final Map<Long, SourceRow> sources = new LinkedHashMap<>();
    private final Map<Long, PageRow> pages = new LinkedHashMap<>();
    private final Map<Long, ImageRow> images = new LinkedHashMap<>();
    private long nextId = 1;

    public InMemoryCatalogStore() {
        LOG.warn("########################################################");
        LOG.warn("#  TEST MODE ENABLED: Catalog persistence is DISABLED  #");
        LOG.warn("########################################################");
    }

    // =====================================================================
    // Sources
    // =====================================================================

    @Override
    public synchronized long createSource(SourceInput input) {
        if (input.name() == null) {
            throw new CatalogException("Source name must not be null");
        }
        long id = nextId++;
        SourceRow row = new SourceRow(id);
        row.input = input;
        sources.put(id, row);
        return id;
    }

    @Override
    public synchronized Source getSource(long sourceId) {
        SourceRow row = sources.get(sourceId);
        return row != null ? row.toSource() : null;
    }

    @Override
    public synchronized List<Source> getAllSources() {
        return sources.values().stream()
                .sorted(Comparator.comparing((SourceRow r) -> r.input.name(), String.CASE_INSENSITIVE_ORDER)
                        .thenComparingLong(r -> r.id))
                .map(SourceRow::toSource)
                .toList();
    }

    @Override
    public synchronized void updateSource(long sourceId, SourceInput input) {
        if (input.name() == null) {
            throw new CatalogException("Source name must not be null");
        }
        requireSource(sourceId).input = input;
    }

    @Override
    public synchronized void deleteSource(long sourceId) {
        images.values().removeIf(i -> i.page.sourceId == sourceId);
        pages.values().removeIf(p -> p.sourceId == sourceId);
        sources.remove(sourceId);
    }

    @Override
    public synchronized boolean setCoverIfAbsent(long sourceId, byte[] cover) {
        SourceRow row = sources.get(sourceId);
        if (row == null || cover == null || cover.length == 0 || row.cover != null) {
            return false;
        }
        row.cover = cover.clone();
        return true;
    }

    // =====================================================================
    // Pages
    // =====================================================================

    @Override
    public synchronized Page getLastPage(long sourceId) {
        return pagesOf(sourceId).stream()
                .max(Comparator.comparingInt(p -> p.index))
                .map(PageRow::toPage)
                .orElse(null);
    }

    @Override
    public synchronized Page getPageBefore(long sourceId, int pageIndex) {
        return pagesOf(sourceId).stream()
                .filter(p -> p.index < pageIndex)
                .max(Comparator.comparingInt(p -> p.index))
                .map(PageRow::toPage)
                .orElse(null);
    }

    @Override
    public synchronized int getMaxPageIndex(long sourceId) {
        return pagesOf(sourceId).stream().mapToInt(p -> p.index).max().orElse(0);
    }

    @Override
    public synchronized Set<DedupKey> getDedupKeysFrom(long sourceId, int fromPageIndex) {
        Set<DedupKey> keys = new HashSet<>();
        for (ImageRow image : images.values()) {
            if (image.page.sourceId == sourceId && image.page.index >= fromPageIndex) {
                keys.add(new DedupKey(image.page.url, image.url));
            }
        }
        return keys;
    }

    @Override
    public synchronized void commitPages(long sourceId, List<NewPage> newPages) {
        if (newPages == null || newPages.isEmpty())
            return;

        SourceRow source = requireSource(sourceId);
        Set<Integer> taken = new HashSet<>();
        for (PageRow p : pagesOf(sourceId)) {
            taken.add(p.index);
        }
        for (NewPage page : newPages) {
            if (!taken.add(page.index())) {
                throw new CatalogException("Page index " + page.index() + " already exists for source " + sourceId);
            }
        }

        Instant now = Instant.now();
        int imageCount = 0;
        for (NewPage page : newPages) {
            PageRow pageRow = new PageRow(nextId++, sourceId, page.index(),
                    page.title() != null ? page.title() : "", page.url(), now);
            pages.put(pageRow.id, pageRow);
            for (int i = 0; i < page.imageUrls().size(); i++) {
                ImageRow imageRow = new ImageRow(nextId++, pageRow, i, page.imageUrls().get(i));
                images.put(imageRow.id, imageRow);
            }
            imageCount += page.imageUrls().size();
        }
        source.pageCount += newPages.size();
        source.imageCount += imageCount;
    }

    @Override
    public synchronized List<Page> getPages(long sourceId) {
        return pagesOf(sourceId).stream()
                .sorted(Comparator.comparingInt(p -> p.index))
                .map(PageRow::toPage)
                .toList();
    }

    @Override
    public synchronized List<PageImage> getImages(long pageId) {
        return images.values().stream()
                .filter(i -> i.page.id == pageId)
                .sorted(Comparator.comparingInt(i -> i.index))
                .map(ImageRow::toPageImage)
                .toList();
    }

    // =====================================================================
    // Downloads
    // =====================================================================

    @Override
    public synchronized List<CatalogImage> getUndownloadedImages(long sourceId) {
        return images.values().stream()
                .filter(i -> i.page.sourceId == sourceId && i.downloadPath.isEmpty())
                .sorted(READING_ORDER)
                .map(this::toCatalogImage)
                .toList();
    }

    @Override
    public synchronized List<CatalogImage> getDownloadedImages(long sourceId, int offset, int limit) {
        return images.values().stream()
                .filter(i -> i.page.sourceId == sourceId && !i.downloadPath.isEmpty())
                .sorted(READING_ORDER)
                .skip(offset)
                .limit(limit)
                .map(this::toCatalogImage)
                .toList();
    }

    @Override
    public synchronized void commitDownloads(long sourceId, List<DownloadUpdate> updates, int downloadedDelta,
            byte[] cover) {
        SourceRow source = requireSource(sourceId);
        List<ImageRow> targets = new ArrayList<>();
        if (updates != null) {
            for (DownloadUpdate update : updates) {
                ImageRow row = images.get(update.imageId());
                if (row == null) {
                    throw new CatalogException("Image " + update.imageId() + " does not exist");
                }
                targets.add(row);
            }
            Instant now = Instant.now();
            for (int i = 0; i < targets.size(); i++) {
                DownloadUpdate update = updates.get(i);
                ImageRow row = targets.get(i);
                row.downloadPath = update.isReset() ? "" : update.downloadPath();
                row.downloadedAt = update.isReset() ? null : now;
            }
        }
        source.downloadedCount = Math.max(0, source.downloadedCount + downloadedDelta);
        if (cover != null && cover.length > 0 && source.cover == null) {
            source.cover = cover.clone();
        }
    }

    @Override
    public synchronized int rewriteDownloadPaths(long sourceId, String oldPrefix, String newPrefix) {
        if (oldPrefix == null || oldPrefix.isEmpty() || oldPrefix.equals(newPrefix))
            return 0;
        int rewritten = 0;
        for (ImageRow image : images.values()) {
            if (image.page.sourceId == sourceId && image.downloadPath.startsWith(oldPrefix)) {
                image.downloadPath = newPrefix + image.downloadPath.substring(oldPrefix.length());
                rewritten++;
            }
        }
        return rewritten;
    }

    // =====================================================================
    // Rows
    // =====================================================================

    private SourceRow requireSource(long sourceId) {
        SourceRow row = sources.get(sourceId);
        if (row == null) {
            throw new CatalogException("Source " + sourceId + " does not exist");
        }
        return row;
    }

    private List<PageRow> pagesOf(long sourceId) {
        List<PageRow> result = new ArrayList<>();
        for (PageRow p : pages.values()) {
            if (p.sourceId == sourceId) {
                result.add(p);
            }
        }
        return result;
    }

    private CatalogImage toCatalogImage(ImageRow image) {
        int count = 0;
        for (ImageRow other : images.values()) {
            if (other.page == image.page) {
                count++;
            }
        }
        return new CatalogImage(image.id, image.page.index, image.index, count, image.page.title,
                image.page.url, image.url, image.downloadPath);
    }

    private static final class SourceRow {
        final long id;
        SourceInput input;
        byte[] cover;
        int pageCount;
        int imageCount;
        int downloadedCount;

        SourceRow(long id) {
            this.id = id;
        }

        Source toSource() {
            return new Source(id, input.name(), nullToEmpty(input.author()), nullToEmpty(input.description()),
                    nullToEmpty(input.url()), nullToEmpty(input.firstPageUrl()),
                    nullToEmpty(input.selectorImage()), nullToEmpty(input.selectorTitle()),
                    nullToEmpty(input.selectorNext()), cover != null ? cover.clone() : null,
                    pageCount, imageCount, downloadedCount);
        }
    }

    private static final class PageRow {
        final long id;
        final long sourceId;
        final int index;
        final String title;
        final String url;
        final Instant fetchedAt;

        PageRow(long id, long sourceId, int index, String title, String url, Instant fetchedAt) {
            this.id = id;
            this.sourceId = sourceId;
            this.index = index;
            this.title = title;
            this.url = url;
            this.fetchedAt = fetchedAt;
        }

        Page toPage() {
            return new Page(id, sourceId, index, title, url, fetchedAt);
        }
    }

    private static final class ImageRow {
        final long id;
        final PageRow page;
        final int index;
        final String url;
        String downloadPath = "";
        Instant downloadedAt;

        ImageRow(long id, PageRow page, int index, String url) {
            this.id = id;
            this.page = page;
            this.index = index;
            this.url = url;
        }

        PageImage toPageImage() {
            return new PageImage(id, page.id, index, page.url, url, downloadPath, downloadedAt);
        }
    }

    private static String nullToEmpty(String s) {
        return s == null ? "" : s;
    }
}
