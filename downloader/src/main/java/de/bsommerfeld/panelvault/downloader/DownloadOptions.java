package de.bsommerfeld.panelvault.downloader;

import de.bsommerfeld.panelvault.core.config.DownloadConfig;
import de.bsommerfeld.panelvault.core.util.StorageUtils;

import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Per-run download settings. {@code maxConcurrent} is clamped to
 * {@value DownloadConfig#MIN_CONCURRENT}..{@value DownloadConfig#MAX_CONCURRENT}.
 *
 * @param libraryRoot   folder that holds one sub-folder per source
 * @param overwrite     replace files that already exist
 * @param maxConcurrent upper bound on parallel downloads
 */
public record DownloadOptions(Path libraryRoot, boolean overwrite, int maxConcurrent) {

    public DownloadOptions {
        maxConcurrent = DownloadConfig.clampConcurrency(maxConcurrent);
    }

    /** Options as configured, with the app data library folder as fallback root. */
    public static DownloadOptions from(DownloadConfig config) {
        return new DownloadOptions(libraryRoot(config), config.isOverwrite(), config.getMaxConcurrent());
    }

    public static Path libraryRoot(DownloadConfig config) {
        String dir = config.getLibraryDir();
        return dir == null || dir.isBlank()
                ? StorageUtils.getLibraryDir(StorageUtils.APP_NAME)
                : Paths.get(dir).toAbsolutePath();
    }

    public DownloadOptions withOverwrite(boolean overwrite) {
        return new DownloadOptions(libraryRoot, overwrite, maxConcurrent);
    }

    public DownloadOptions withMaxConcurrent(int maxConcurrent) {
        return new DownloadOptions(libraryRoot, overwrite, maxConcurrent);
    }
}
