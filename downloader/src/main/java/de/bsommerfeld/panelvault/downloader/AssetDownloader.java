package de.bsommerfeld.panelvault.downloader;

import com.google.inject.Singleton;
import de.bsommerfeld.panelvault.core.domain.CatalogImage;
import de.bsommerfeld.panelvault.core.error.AcquisitionException;
import de.bsommerfeld.panelvault.core.util.DataUrl;
import de.bsommerfeld.panelvault.core.util.FileNaming;
import de.bsommerfeld.panelvault.core.util.MediaTypes;
import de.bsommerfeld.panelvault.scraper.http.HttpFetcher;
import de.bsommerfeld.panelvault.scraper.http.TempDownload;
import jakarta.inject.Inject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

/**
 * Fetches one image and places it in the source folder.
 *
 * <h3>Sources of bytes</h3>
 * {@code data:} URLs are decoded locally and never touch the network.
 * Everything else is streamed to a temp file with the page URL as Referer.
 *
 * <h3>Placement</h3>
 * The extension comes from the Content-Type, else the URL path, else
 * {@value MediaTypes#DEFAULT_EXTENSION}. An existing target is kept unless
 * {@code overwrite} is set, in which case it is deleted first. The temp file
 * is moved into place atomically where the filesystem allows it.
 *
 * <h3>Failures</h3>
 * Only transport errors ({@code NETWORK}) are thrown. A bad status, a broken
 * data URL, an I/O error or an interrupted transfer makes the image
 * "not written" and the run goes on.
 */
@Singleton
public class AssetDownloader {

    private static final Logger LOG = LoggerFactory.getLogger(AssetDownloader.class);

    private final HttpFetcher http;

    @Inject
    public AssetDownloader(HttpFetcher http) {
        this.http = http;
    }

    /**
     * @param image        the image to fetch
     * @param sourceDir    existing folder of the image's source
     * @param overwrite    replace an existing file
     * @param captureCover return the written bytes as cover candidate
     * @throws AcquisitionException of kind {@code NETWORK} only
     */
    public DownloadResult download(CatalogImage image, Path sourceDir, boolean overwrite, boolean captureCover)
            throws AcquisitionException {
        try {
            return DataUrl.isDataUrl(image.imageUrl())
                    ? writeDataUrl(image, sourceDir, overwrite, captureCover)
                    : fetchRemote(image, sourceDir, overwrite, captureCover);
        } catch (AcquisitionException e) {
            if (e.getKind() == AcquisitionException.Kind.NETWORK) {
                throw e;
            }
            LOG.warn("Image {} of page {} not written: {}", image.imageIndex(), image.pageIndex(), e.getMessage());
            return DownloadResult.notWritten(image.imageId());
        } catch (IOException e) {
            LOG.warn("Image {} of page {} not written, file error: {}", image.imageIndex(), image.pageIndex(),
                    e.getMessage());
            return DownloadResult.notWritten(image.imageId());
        }
    }

    private DownloadResult writeDataUrl(CatalogImage image, Path sourceDir, boolean overwrite,
            boolean captureCover) throws AcquisitionException, IOException {
        DataUrl data = DataUrl.decode(image.imageUrl());
        Path target = sourceDir.resolve(fileName(image, MediaTypes.resolveExtension(data.mediaType(), null)));
        if (Files.exists(target) && !overwrite) {
            return DownloadResult.alreadyPresent(image.imageId(), target.toAbsolutePath().toString());
        }
        Path temp = Files.createTempFile(sourceDir, "panelvault-", ".part");
        try {
            Files.write(temp, data.payload());
        } catch (IOException e) {
            new TempDownload(temp, 0, null).discard();
            throw e;
        }
        return place(image, new TempDownload(temp, 200, null), target, overwrite, captureCover);
    }

    private DownloadResult fetchRemote(CatalogImage image, Path sourceDir, boolean overwrite, boolean captureCover)
            throws AcquisitionException, IOException {
        TempDownload temp = http.downloadToTemp(image.imageUrl(), image.pageUrl(), sourceDir);
        if (!temp.isSuccess()) {
            temp.discard();
            LOG.warn("HTTP {} for {}, image not written", temp.status(), image.imageUrl());
            return DownloadResult.notWritten(image.imageId());
        }
        String ext = MediaTypes.resolveExtension(temp.headers().contentType(), image.imageUrl());
        Path target = sourceDir.resolve(fileName(image, ext));
        if (Files.exists(target) && !overwrite) {
            temp.discard();
            return DownloadResult.alreadyPresent(image.imageId(), target.toAbsolutePath().toString());
        }
        return place(image, temp, target, overwrite, captureCover);
    }

    private static DownloadResult place(CatalogImage image, TempDownload temp, Path target, boolean overwrite,
            boolean captureCover) throws IOException {
        try {
            if (overwrite) {
                Files.deleteIfExists(target);
            }
            move(temp.file(), target);
        } catch (IOException e) {
            temp.discard();
            throw e;
        }
        byte[] cover = captureCover ? Files.readAllBytes(target) : null;
        LOG.debug("Wrote {}", target);
        return new DownloadResult(image.imageId(), target.toAbsolutePath().toString(), true, cover);
    }

    private static void move(Path from, Path to) throws IOException {
        try {
            Files.move(from, to, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException e) {
            LOG.trace("Atomic move not supported for {}, falling back to replace", to);
            Files.move(from, to, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    static String fileName(CatalogImage image, String extension) {
        return FileNaming.fileName(image.pageIndex(), image.imageIndex(), image.pageImageCount(),
                image.pageTitle(), extension);
    }
}
