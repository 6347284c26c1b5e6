package de.bsommerfeld.panelvault.app.service;

import de.bsommerfeld.panelvault.core.concurrent.CancellationToken;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * A background crawl, download or sync. The future completes with the
 * operation's result, with {@code null} if it was cancelled, or
 * exceptionally if it failed.
 */
public final class OperationHandle<T> {

    private static final Logger LOG = LoggerFactory.getLogger(OperationHandle.class);

    private final String operation;
    private final long sourceId;
    private final CancellationToken token;
    private final CompletableFuture<T> future;

    public OperationHandle(String operation, long sourceId, CancellationToken token, CompletableFuture<T> future) {
        this.operation = operation;
        this.sourceId = sourceId;
        this.token = token;
        this.future = future;
    }

    public String operation() {
        return operation;
    }

    public long sourceId() {
        return sourceId;
    }

    public CompletableFuture<T> future() {
        return future;
    }

    /** Requests cooperative cancellation. The future completes once the operation has wound down. */
    public void cancel() {
        token.cancel();
    }

    /**
     * Requests cancellation and blocks until the operation has wound down,
     * so its final flush and commit get to run.
     *
     * @return false if the operation was still running when {@code timeout}
     *         elapsed or the wait was interrupted
     */
    public boolean cancelAndAwait(Duration timeout) {
        token.cancel();
        try {
            future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            return true;
        } catch (ExecutionException | CancellationException e) {
            // failed or aborted, either way it has stopped
            return true;
        } catch (TimeoutException e) {
            LOG.warn("{} of source {} still running after {} ms", operation, sourceId, timeout.toMillis());
            return false;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    public boolean isCancelRequested() {
        return token.isCancelled();
    }

    public boolean isDone() {
        return future.isDone();
    }
}
