package de.bsommerfeld.panelvault.scraper.html;

import de.bsommerfeld.panelvault.core.domain.Source;

/**
 * The three CSS selectors that drive extraction. Blank selectors are allowed
 * and simply match nothing.
 */
public record SelectorSet(String image, String title, String next) {

    public static SelectorSet of(Source source) {
        return new SelectorSet(source.selectorImage(), source.selectorTitle(), source.selectorNext());
    }
}
