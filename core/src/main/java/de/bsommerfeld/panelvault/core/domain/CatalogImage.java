package de.bsommerfeld.panelvault.core.domain;

/**
 * Flattened view of an image joined with its page. This is what the download
 * scheduler works on: everything needed to name, fetch and write a file
 * without touching the catalog again.
 *
 * @param imageId        catalog id of the image
 * @param pageIndex      1-based page index
 * @param imageIndex     0-based position of the image within its page
 * @param pageImageCount number of images on the page
 * @param pageTitle      page title, possibly empty
 * @param pageUrl        page URL, used as Referer
 * @param imageUrl       remote image URL or {@code data:} URL
 * @param downloadPath   current download path, empty if none
 */
public record CatalogImage(
        long imageId,
        int pageIndex,
        int imageIndex,
        int pageImageCount,
        String pageTitle,
        String pageUrl,
        String imageUrl,
        String downloadPath) {

    public boolean hasDownloadPath() {
        return downloadPath != null && !downloadPath.isEmpty();
    }
}
