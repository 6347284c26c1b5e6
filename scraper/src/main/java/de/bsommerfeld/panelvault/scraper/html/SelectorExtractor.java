package de.bsommerfeld.panelvault.scraper.html;

import com.google.inject.Singleton;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.select.Elements;
import org.jsoup.select.Selector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.MalformedURLException;
import java.net.URL;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Pulls title, image URLs and the next-page link out of an HTML page using
 * user-supplied CSS selectors. Selector matching is jsoup's.
 *
 * <h3>Image URL choice</h3>
 * Per matched element the widest {@code srcset} candidate wins; a candidate
 * without a {@code w} descriptor counts as width 0. Without {@code srcset}
 * the {@code src} attribute is used, then {@code data-src} (lazy loaders).
 * Elements with none of them are skipped. Relative URLs are resolved against
 * the page URL and duplicates within the page are dropped, first occurrence
 * wins.
 *
 * <h3>Bad selectors</h3>
 * A selector jsoup cannot parse behaves like a selector that matches nothing.
 * It is logged at WARN so the user can fix the profile.
 */
@Singleton
public class SelectorExtractor {

    private static final Logger LOG = LoggerFactory.getLogger(SelectorExtractor.class);

    public ParsedPage extract(String html, String pageUrl, SelectorSet selectors) {
        Document document = Jsoup.parse(html, pageUrl);
        return new ParsedPage(
                extractTitle(document, selectors.title()),
                extractImages(document, selectors.image(), pageUrl),
                extractNextLink(document, selectors.next(), pageUrl));
    }

    /** Text of the first match, trimmed; null if absent or empty. */
    public String extractTitle(Document document, String selector) {
        Element first = selectFirst(document, selector);
        if (first == null) {
            return null;
        }
        String text = first.text().trim();
        return text.isEmpty() ? null : text;
    }

    public List<String> extractImages(Document document, String selector, String baseUrl) {
        Set<String> urls = new LinkedHashSet<>();
        for (Element element : select(document, selector)) {
            String raw = rawImageUrl(element);
            if (raw == null) {
                continue;
            }
            String absolute = resolve(baseUrl, raw);
            if (absolute != null) {
                urls.add(absolute);
            }
        }
        return new ArrayList<>(urls);
    }

    /** Resolved {@code href} of the first match, or null. */
    public String extractNextLink(Document document, String selector, String baseUrl) {
        Element first = selectFirst(document, selector);
        if (first == null) {
            return null;
        }
        String href = first.attr("href").trim();
        if (href.isEmpty() || href.startsWith("#") || href.toLowerCase().startsWith("javascript:")) {
            return null;
        }
        return resolve(baseUrl, href);
    }

    // =====================================================================
    // Internals
    // =====================================================================

    private static String rawImageUrl(Element element) {
        String srcset = element.attr("srcset").trim();
        if (!srcset.isEmpty()) {
            String widest = widestSrcsetCandidate(srcset);
            if (widest != null) {
                return widest;
            }
        }
        String src = element.attr("src").trim();
        if (!src.isEmpty()) {
            return src;
        }
        String dataSrc = element.attr("data-src").trim();
        return dataSrc.isEmpty() ? null : dataSrc;
    }

    /**
     * Picks the candidate with the largest {@code w} descriptor. Ties keep the
     * first candidate.
     */
    static String widestSrcsetCandidate(String srcset) {
        String best = null;
        int bestWidth = -1;
        for (String candidate : srcset.split(",")) {
            String[] parts = candidate.trim().split("\\s+");
            if (parts.length == 0 || parts[0].isEmpty()) {
                continue;
            }
            int width = parts.length > 1 ? parseWidth(parts[1]) : 0;
            if (width > bestWidth) {
                best = parts[0];
                bestWidth = width;
            }
        }
        return best;
    }

    private static int parseWidth(String descriptor) {
        if (!descriptor.endsWith("w")) {
            return 0;
        }
        try {
            return Integer.parseInt(descriptor.substring(0, descriptor.length() - 1));
        } catch (NumberFormatException e) {
            return 0;
        }
    }

    static String resolve(String baseUrl, String raw) {
        if (raw.regionMatches(true, 0, "data:", 0, 5)) {
            return raw;
        }
        try {
            URL base = new URL(baseUrl);
            return new URL(base, raw).toExternalForm();
        } catch (MalformedURLException e) {
            LOG.debug("Skipping unresolvable URL '{}' on {}", raw, baseUrl);
            return null;
        }
    }

    private Elements select(Document document, String selector) {
        if (selector == null || selector.isBlank()) {
            return new Elements();
        }
        try {
            return document.select(selector);
        } catch (Selector.SelectorParseException | IllegalArgumentException e) {
            LOG.warn("Invalid CSS selector '{}': {}", selector, e.getMessage());
            return new Elements();
        }
    }

    private Element selectFirst(Document document, String selector) {
        Elements matches = select(document, selector);
        return matches.isEmpty() ? null : matches.first();
    }
}
