package de.bsommerfeld.panelvault.scraper.http;

import de.bsommerfeld.panelvault.core.error.AcquisitionException;

import java.nio.file.Path;

/**
 * The only way the acquisition engine talks to the network.
 *
 * <p>
 * Every call sends the configured User-Agent and, when {@code referer} is
 * non-null, a {@code Referer} header. Non-2xx responses are returned, not
 * thrown; callers decide what a bad status means for them.
 *
 * <p>
 * Transport failures surface as {@link AcquisitionException.Kind#NETWORK},
 * interruption as {@link AcquisitionException.Kind#CANCELLED} and unusable
 * URLs as {@link AcquisitionException.Kind#PARSE}.
 */
public interface HttpFetcher {

    FetchResponse get(String url, String referer) throws AcquisitionException;

    /** Same as {@link #get} but without a body. */
    FetchResponse head(String url, String referer) throws AcquisitionException;

    /**
     * Streams the response body into a fresh temp file inside
     * {@code directory}. The caller owns the file and must move or
     * {@link TempDownload#discard() discard} it. Keeping the temp file on the
     * target's filesystem is what lets the final move be atomic.
     */
    TempDownload downloadToTemp(String url, String referer, Path directory) throws AcquisitionException;
}
