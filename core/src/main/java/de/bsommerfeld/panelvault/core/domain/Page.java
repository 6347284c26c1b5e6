package de.bsommerfeld.panelvault.core.domain;

import java.time.Instant;

/**
 * A stored comic page. {@code index} is 1-based, unique per source and never
 * reused or renumbered once assigned.
 */
public record Page(long id, long sourceId, int index, String title, String url, Instant fetchedAt) {
}
