package de.bsommerfeld.panelvault.core.error;

/**
 * Checked failure raised by the acquisition engine (crawler, fetcher and
 * downloader).
 *
 * <p>
 * Every failure carries a {@link Kind} so callers can branch on the category
 * instead of the message. {@link Kind#BAD_STATUS} carries the HTTP status code,
 * {@link Kind#MISSING_SELECTOR} the name of the selector that was left empty.
 *
 * <h3>Propagation policy</h3>
 * <ul>
 * <li>{@link Kind#CANCELLED} is never retried and is swallowed by the
 * background operation runner</li>
 * <li>{@link Kind#NETWORK} during downloads stops the scheduler</li>
 * <li>{@link Kind#MISSING_SELECTOR} and {@link Kind#INVALID_BASE_URL} are
 * raised before any I/O happens</li>
 * </ul>
 */
public class AcquisitionException extends Exception {

    public enum Kind {
        /** Transport-level failure (DNS, connect, TLS, reset). */
        NETWORK,
        /** The server answered with a non-2xx status. */
        BAD_STATUS,
        /** The body could not be decoded or parsed. */
        PARSE,
        /** The crawl start URL is blank or not an absolute URL. */
        INVALID_BASE_URL,
        /** A required selector is empty. */
        MISSING_SELECTOR,
        /** The operation was cancelled cooperatively. */
        CANCELLED
    }

    private final Kind kind;
    private final int statusCode;
    private final String selectorName;

    private AcquisitionException(Kind kind, String message, Throwable cause, int statusCode, String selectorName) {
        super(message, cause);
        this.kind = kind;
        this.statusCode = statusCode;
        this.selectorName = selectorName;
    }

    public static AcquisitionException network(String url, Throwable cause) {
        return new AcquisitionException(Kind.NETWORK, "Network error for " + url + ": " + cause.getMessage(), cause, 0,
                null);
    }

    public static AcquisitionException badStatus(int statusCode, String url) {
        return new AcquisitionException(Kind.BAD_STATUS, "HTTP " + statusCode + " for " + url, null, statusCode, null);
    }

    public static AcquisitionException parse(String message) {
        return new AcquisitionException(Kind.PARSE, message, null, 0, null);
    }

    public static AcquisitionException invalidBaseUrl(String url) {
        return new AcquisitionException(Kind.INVALID_BASE_URL, "Invalid start URL: '" + url + "'", null, 0, null);
    }

    public static AcquisitionException missingSelector(String selectorName) {
        return new AcquisitionException(Kind.MISSING_SELECTOR, "Missing selector: " + selectorName, null, 0,
                selectorName);
    }

    public static AcquisitionException cancelled() {
        return new AcquisitionException(Kind.CANCELLED, "Operation cancelled", null, 0, null);
    }

    public static AcquisitionException cancelled(Throwable cause) {
        return new AcquisitionException(Kind.CANCELLED, "Operation cancelled", cause, 0, null);
    }

    public Kind getKind() {
        return kind;
    }

    public boolean isCancellation() {
        return kind == Kind.CANCELLED;
    }

    /** HTTP status code for {@link Kind#BAD_STATUS}, otherwise 0. */
    public int getStatusCode() {
        return statusCode;
    }

    /** Selector name for {@link Kind#MISSING_SELECTOR}, otherwise null. */
    public String getSelectorName() {
        return selectorName;
    }
}
