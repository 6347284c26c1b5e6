package de.bsommerfeld.panelvault.core.domain;

import java.time.Instant;

/**
 * A stored image reference. {@code downloadPath} is empty until the file has
 * been written.
 */
public record PageImage(
        long id,
        long pageId,
        int index,
        String pageUrl,
        String imageUrl,
        String downloadPath,
        Instant downloadedAt) {

    public boolean isDownloaded() {
        return downloadPath != null && !downloadPath.isEmpty();
    }
}
