package de.bsommerfeld.panelvault.downloader;

import com.google.inject.Singleton;
import de.bsommerfeld.panelvault.core.config.DownloadConfig;
import de.bsommerfeld.panelvault.core.domain.CatalogImage;
import de.bsommerfeld.panelvault.db.CatalogStore;
import jakarta.inject.Inject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.nio.file.FileSystemNotFoundException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Stream;

/**
 * Decides which images a download run has to fetch.
 *
 * <h3>Work set</h3>
 * Every image without a download path, plus every image whose recorded path
 * no longer exists on disk. The result is deduplicated by image id and sorted
 * by page index, then image index.
 *
 * <h3>Reconciliation</h3>
 * Recorded paths are scanned in slices of {@code reconcile-page-size}. Paths
 * directly inside the source folder are checked against one directory
 * listing taken up front; anything else falls back to {@link Files#exists}.
 * Paths stored as {@code file:} URIs are accepted.
 */
@Singleton
public class WorkSetBuilder {

    private static final Logger LOG = LoggerFactory.getLogger(WorkSetBuilder.class);

    private static final Comparator<WorkItem> READING_ORDER = Comparator
            .comparingInt((WorkItem w) -> w.image().pageIndex())
            .thenComparingInt(w -> w.image().imageIndex());

    private final CatalogStore store;
    private final DownloadConfig config;

    @Inject
    public WorkSetBuilder(CatalogStore store, DownloadConfig config) {
        this.store = store;
        this.config = config;
    }

    public List<WorkItem> build(long sourceId, Path sourceDir) {
        Map<Long, WorkItem> byId = new LinkedHashMap<>();
        for (CatalogImage image : store.getUndownloadedImages(sourceId)) {
            byId.putIfAbsent(image.imageId(), new WorkItem(image, false));
        }
        int fresh = byId.size();

        Path dir = sourceDir.toAbsolutePath().normalize();
        Set<String> listing = listFileNames(dir);
        int sliceSize = Math.max(1, config.getReconcilePageSize());
        int missing = 0;
        for (int offset = 0;; offset += sliceSize) {
            List<CatalogImage> slice = store.getDownloadedImages(sourceId, offset, sliceSize);
            for (CatalogImage image : slice) {
                if (!existsOnDisk(image.downloadPath(), dir, listing)
                        && byId.putIfAbsent(image.imageId(), new WorkItem(image, true)) == null) {
                    missing++;
                }
            }
            if (slice.size() < sliceSize) {
                break;
            }
        }

        List<WorkItem> items = new ArrayList<>(byId.values());
        items.sort(READING_ORDER);
        LOG.debug("Work set for source {}: {} fresh, {} missing on disk", sourceId, fresh, missing);
        return items;
    }

    // =====================================================================
    // Disk checks
    // =====================================================================

    private static Set<String> listFileNames(Path dir) {
        Set<String> names = new HashSet<>();
        if (!Files.isDirectory(dir)) {
            return names;
        }
        try (Stream<Path> files = Files.list(dir)) {
            files.forEach(p -> names.add(p.getFileName().toString()));
        } catch (IOException e) {
            // An empty listing sends every check down the slow path
            LOG.warn("Could not list {}: {}", dir, e.getMessage());
            names.clear();
        }
        return names;
    }

    static boolean existsOnDisk(String downloadPath, Path sourceDir, Set<String> listing) {
        Path path = toPath(downloadPath);
        if (path == null) {
            return false;
        }
        Path normalized = path.toAbsolutePath().normalize();
        Path parent = normalized.getParent();
        if (parent != null && parent.equals(sourceDir) && !listing.isEmpty()) {
            return listing.contains(normalized.getFileName().toString());
        }
        return Files.exists(normalized);
    }

    /** Stored path as {@link Path}, or null if it cannot be interpreted. */
    static Path toPath(String downloadPath) {
        if (downloadPath == null || downloadPath.isBlank()) {
            return null;
        }
        try {
            if (downloadPath.regionMatches(true, 0, "file:", 0, 5)) {
                return Paths.get(URI.create(downloadPath));
            }
            return Paths.get(downloadPath);
        } catch (IllegalArgumentException | FileSystemNotFoundException e) {
            LOG.debug("Unusable download path '{}': {}", downloadPath, e.getMessage());
            return null;
        }
    }
}
