package de.bsommerfeld.panelvault.downloader;

/**
 * Outcome of one image download.
 *
 * @param imageId      catalog id of the image
 * @param finalPath    absolute path of the file on disk, null if nothing usable
 *                     exists
 * @param wroteNewFile whether this download wrote the file
 * @param coverBytes   the written bytes when a cover was requested, else null
 */
public record DownloadResult(long imageId, String finalPath, boolean wroteNewFile, byte[] coverBytes) {

    public static DownloadResult notWritten(long imageId) {
        return new DownloadResult(imageId, null, false, null);
    }

    public static DownloadResult alreadyPresent(long imageId, String finalPath) {
        return new DownloadResult(imageId, finalPath, false, null);
    }

    /** A file exists at {@link #finalPath()}, written now or before. */
    public boolean hasFile() {
        return finalPath != null;
    }
}
