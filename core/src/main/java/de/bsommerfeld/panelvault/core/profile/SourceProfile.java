package de.bsommerfeld.panelvault.core.profile;

import de.bsommerfeld.panelvault.core.domain.Source;
import de.bsommerfeld.panelvault.core.domain.SourceInput;

/**
 * Portable description of a source: metadata plus selectors, without any
 * catalog state. This is what gets exported to and imported from
 * {@code .json} profile files.
 */
public record SourceProfile(
        int version,
        String name,
        String author,
        String descriptionText,
        String url,
        String firstPageUrl,
        String selectorImage,
        String selectorTitle,
        String selectorNext) {

    public static final int CURRENT_VERSION = 1;

    public static SourceProfile of(Source source) {
        return new SourceProfile(CURRENT_VERSION, source.name(), source.author(), source.description(),
                source.url(), source.firstPageUrl(), source.selectorImage(), source.selectorTitle(),
                source.selectorNext());
    }

    public SourceInput toInput() {
        return new SourceInput(name, author, descriptionText, url, firstPageUrl, selectorImage, selectorTitle,
                selectorNext);
    }
}
