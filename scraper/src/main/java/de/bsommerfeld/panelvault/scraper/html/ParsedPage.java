package de.bsommerfeld.panelvault.scraper.html;

import java.util.List;

/**
 * What the extractor found on one page.
 *
 * @param title     trimmed page title, or null
 * @param imageUrls absolute image URLs in document order, without duplicates
 * @param nextUrl   absolute URL of the next page, or null
 */
public record ParsedPage(String title, List<String> imageUrls, String nextUrl) {

    public ParsedPage {
        imageUrls = List.copyOf(imageUrls);
    }
}
