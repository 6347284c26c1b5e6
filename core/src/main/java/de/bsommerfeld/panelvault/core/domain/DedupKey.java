package de.bsommerfeld.panelvault.core.domain;

/**
 * Identity of an image within a source's catalog. Two crawls that see the same
 * image on the same page produce the same key.
 */
public record DedupKey(String pageUrl, String imageUrl) {
}
