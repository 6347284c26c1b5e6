package de.bsommerfeld.panelvault.downloader;

import de.bsommerfeld.panelvault.core.domain.CatalogImage;

/**
 * One entry of a download work set.
 *
 * @param image     the image to fetch
 * @param reconcile true if the catalog records a path whose file is gone
 */
public record WorkItem(CatalogImage image, boolean reconcile) {

    public long imageId() {
        return image.imageId();
    }
}
