package de.bsommerfeld.panelvault.scraper.http;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * A response body streamed to a temp file.
 */
public record TempDownload(Path file, int status, HttpHeaders headers) {

    private static final Logger LOG = LoggerFactory.getLogger(TempDownload.class);

    public TempDownload {
        headers = headers != null ? headers : HttpHeaders.empty();
    }

    public boolean isSuccess() {
        return status >= 200 && status < 300;
    }

    /** Deletes the temp file. A file that cannot be deleted is only logged. */
    public void discard() {
        try {
            Files.deleteIfExists(file);
        } catch (IOException e) {
            LOG.warn("Could not delete temp file {}: {}", file, e.getMessage());
        }
    }
}
