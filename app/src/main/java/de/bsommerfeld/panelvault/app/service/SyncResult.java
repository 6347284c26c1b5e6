package de.bsommerfeld.panelvault.app.service;

import de.bsommerfeld.panelvault.downloader.DownloadReport;
import de.bsommerfeld.panelvault.scraper.crawl.CrawlResult;

/**
 * What a sync did: the crawl that looked for new pages and the download that
 * followed it.
 */
public record SyncResult(CrawlResult crawl, DownloadReport download) {
}
