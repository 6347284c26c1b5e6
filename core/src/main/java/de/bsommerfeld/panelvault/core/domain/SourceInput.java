package de.bsommerfeld.panelvault.core.domain;

/**
 * The user-editable part of a {@link Source}. Used for creation, edits and
 * profile import.
 */
public record SourceInput(
        String name,
        String author,
        String description,
        String url,
        String firstPageUrl,
        String selectorImage,
        String selectorTitle,
        String selectorNext) {
}
