package de.bsommerfeld.panelvault.core.concurrent;

import de.bsommerfeld.panelvault.core.error.AcquisitionException;

/**
 * Cooperative cancellation flag shared between a background operation and
 * whoever started it. Long-running loops check it at their head and before
 * each network call.
 */
public final class CancellationToken {

    private volatile boolean cancelled;

    /** Token that is never cancelled. Handy for tests and one-shot calls. */
    public static CancellationToken none() {
        return new CancellationToken();
    }

    public void cancel() {
        cancelled = true;
    }

    public boolean isCancelled() {
        return cancelled || Thread.currentThread().isInterrupted();
    }

    /**
     * @throws AcquisitionException of kind {@code CANCELLED} if cancellation was
     *                              requested or the current thread was
     *                              interrupted
     */
    public void throwIfCancelled() throws AcquisitionException {
        if (isCancelled()) {
            throw AcquisitionException.cancelled();
        }
    }
}
