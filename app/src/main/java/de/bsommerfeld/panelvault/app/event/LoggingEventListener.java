package de.bsommerfeld.panelvault.app.event;

import com.google.common.eventbus.Subscribe;
import com.google.inject.Singleton;
import de.bsommerfeld.panelvault.core.event.AcquisitionEvents.CrawlFinishedEvent;
import de.bsommerfeld.panelvault.core.event.AcquisitionEvents.CrawlStartedEvent;
import de.bsommerfeld.panelvault.core.event.AcquisitionEvents.DownloadFinishedEvent;
import de.bsommerfeld.panelvault.core.event.AcquisitionEvents.DownloadProgressEvent;
import de.bsommerfeld.panelvault.core.event.AcquisitionEvents.OperationFailedEvent;
import de.bsommerfeld.panelvault.core.event.AcquisitionEvents.PagesCommittedEvent;
import de.bsommerfeld.panelvault.core.event.ApplicationEventBus;
import jakarta.inject.Inject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes acquisition progress to the log. Download progress is reduced to
 * one line per tenth of the work set.
 */
@Singleton
public class LoggingEventListener {

    private static final Logger LOG = LoggerFactory.getLogger(LoggingEventListener.class);

    @Inject
    public LoggingEventListener(ApplicationEventBus eventBus) {
        eventBus.register(this);
    }

    @Subscribe
    public void onCrawlStarted(CrawlStartedEvent event) {
        LOG.info("[source {}] crawl {} at {}", event.sourceId(), event.resumed() ? "resumed" : "started",
                event.startUrl());
    }

    @Subscribe
    public void onPagesCommitted(PagesCommittedEvent event) {
        LOG.info("[source {}] saved {} pages ({} images), now at page {}", event.sourceId(), event.pages(),
                event.images(), event.lastPageIndex());
    }

    @Subscribe
    public void onCrawlFinished(CrawlFinishedEvent event) {
        LOG.info("[source {}] crawl finished with {} new images ({})", event.sourceId(), event.recordsAdded(),
                event.stopReason());
    }

    @Subscribe
    public void onDownloadProgress(DownloadProgressEvent event) {
        if (isMilestone(event.completed(), event.total())) {
            LOG.info("[source {}] downloaded {}/{}", event.sourceId(), event.completed(), event.total());
        }
    }

    @Subscribe
    public void onDownloadFinished(DownloadFinishedEvent event) {
        LOG.info("[source {}] download finished: {} written, {} already present, {} not written",
                event.sourceId(), event.written(), event.alreadyPresent(), event.notWritten());
    }

    @Subscribe
    public void onOperationFailed(OperationFailedEvent event) {
        LOG.warn("[source {}] {} failed: {}", event.sourceId(), event.operation(), event.message());
    }

    static boolean isMilestone(int completed, int total) {
        if (total <= 0) {
            return false;
        }
        int step = Math.max(1, total / 10);
        return completed == total || completed % step == 0;
    }
}
