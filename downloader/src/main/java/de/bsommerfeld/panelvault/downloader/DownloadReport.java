package de.bsommerfeld.panelvault.downloader;

/**
 * Summary of a download run.
 *
 * @param considered    images in the work set
 * @param written       files written by this run
 * @param alreadyPresent files that existed and were left alone
 * @param notWritten    images that failed or were skipped
 */
public record DownloadReport(int considered, int written, int alreadyPresent, int notWritten) {
}
