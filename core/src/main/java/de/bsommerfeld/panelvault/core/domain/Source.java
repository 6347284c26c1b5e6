package de.bsommerfeld.panelvault.core.domain;

/**
 * A comic source as stored in the catalog: user-supplied metadata, the three
 * CSS selectors that drive extraction, an optional cover image and the
 * denormalized counters maintained by the crawler and the downloader.
 *
 * @param id                   catalog id
 * @param name                 display name, also the basis of the download
 *                             folder name
 * @param author               free text
 * @param description          free text
 * @param url                  homepage URL
 * @param firstPageUrl         where a fresh crawl starts
 * @param selectorImage        selects the page's image elements (required)
 * @param selectorTitle        selects the page title (optional)
 * @param selectorNext         selects the link to the next page (optional)
 * @param coverImage           raw cover bytes, or null
 * @param pageCount            number of stored pages
 * @param imageCount           number of stored images
 * @param downloadedImageCount number of images believed to be on disk
 */
public record Source(
        long id,
        String name,
        String author,
        String description,
        String url,
        String firstPageUrl,
        String selectorImage,
        String selectorTitle,
        String selectorNext,
        byte[] coverImage,
        int pageCount,
        int imageCount,
        int downloadedImageCount) {

    public boolean hasCover() {
        return coverImage != null && coverImage.length > 0;
    }

    public SourceInput toInput() {
        return new SourceInput(name, author, description, url, firstPageUrl, selectorImage, selectorTitle,
                selectorNext);
    }
}
