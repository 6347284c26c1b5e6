package de.bsommerfeld.panelvault.core.event;

/**
 * Progress events published by the crawler and the download scheduler.
 */
public class AcquisitionEvents {

    public record CrawlStartedEvent(long sourceId, String startUrl, boolean resumed) {
    }

    /** A batch of pages became durable. */
    public record PagesCommittedEvent(long sourceId, int pages, int images, int lastPageIndex) {
    }

    public record CrawlFinishedEvent(long sourceId, int recordsAdded, String stopReason) {
    }

    public record DownloadStartedEvent(long sourceId, int considered, int maxConcurrent) {
    }

    /**
     * Fired once per finished item. {@code completed} counts finished items,
     * not written files.
     */
    public record DownloadProgressEvent(long sourceId, int completed, int total) {
    }

    public record DownloadFinishedEvent(long sourceId, int considered, int written, int alreadyPresent,
            int notWritten) {
    }

    /** A background operation ended with an error other than cancellation. */
    public record OperationFailedEvent(long sourceId, String operation, String message) {
    }
}
