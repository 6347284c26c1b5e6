package de.bsommerfeld.panelvault.core.domain;

/**
 * A pending change to an image's download path. An empty path clears it
 * (reconciliation reset).
 */
public record DownloadUpdate(long imageId, String downloadPath) {

    public static DownloadUpdate reset(long imageId) {
        return new DownloadUpdate(imageId, "");
    }

    public boolean isReset() {
        return downloadPath == null || downloadPath.isEmpty();
    }
}
