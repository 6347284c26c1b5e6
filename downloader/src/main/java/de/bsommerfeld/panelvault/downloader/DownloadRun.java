package de.bsommerfeld.panelvault.downloader;

import de.bsommerfeld.panelvault.core.domain.DownloadUpdate;

import java.util.ArrayList;
import java.util.List;

/**
 * Mutable bookkeeping of one download run. Touched only by the scheduler's
 * owner thread.
 */
final class DownloadRun {

    final long sourceId;
    final int considered;

    int completed;
    int written;
    int alreadyPresent;
    int notWritten;

    /** Changes not yet committed. */
    final List<DownloadUpdate> updates = new ArrayList<>();
    int downloadedDelta;
    byte[] cover;
    boolean coverNeeded;
    int successesSinceCommit;

    DownloadRun(long sourceId, int considered, boolean coverNeeded) {
        this.sourceId = sourceId;
        this.considered = considered;
        this.coverNeeded = coverNeeded;
    }

    /** Records the outcome of one item. */
    void apply(WorkItem item, DownloadResult result) {
        completed++;
        if (result.hasFile()) {
            if (result.wroteNewFile()) {
                written++;
            } else {
                alreadyPresent++;
            }
            updates.add(new DownloadUpdate(item.imageId(), result.finalPath()));
            if (!item.reconcile()) {
                downloadedDelta++;
            }
            successesSinceCommit++;
        } else {
            notWritten++;
            if (item.reconcile()) {
                updates.add(DownloadUpdate.reset(item.imageId()));
                downloadedDelta--;
            }
        }
        if (coverNeeded && result.coverBytes() != null) {
            cover = result.coverBytes();
            coverNeeded = false;
        }
    }

    /** Counts an item that ended without a result. */
    void failed() {
        completed++;
        notWritten++;
    }

    boolean hasChanges() {
        return !updates.isEmpty() || downloadedDelta != 0 || cover != null;
    }

    void committed() {
        updates.clear();
        downloadedDelta = 0;
        cover = null;
        successesSinceCommit = 0;
    }

    DownloadReport report() {
        return new DownloadReport(considered, written, alreadyPresent, notWritten);
    }
}
