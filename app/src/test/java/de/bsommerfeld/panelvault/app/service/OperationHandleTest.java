package de.bsommerfeld.panelvault.app.service;

import de.bsommerfeld.panelvault.core.concurrent.CancellationToken;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.*;

class OperationHandleTest {

    @Test
    void cancelAndAwait_shouldCancelTokenAndReturnOnceDone() {
        CancellationToken token = new CancellationToken();
        OperationHandle<String> handle = new OperationHandle<>("download", 3, token,
                CompletableFuture.completedFuture(null));

        assertTrue(handle.cancelAndAwait(Duration.ofSeconds(1)));
        assertTrue(handle.isCancelRequested());
    }

    @Test
    void cancelAndAwait_shouldTreatFailedOperationAsStopped() {
        CompletableFuture<String> failed = new CompletableFuture<>();
        failed.completeExceptionally(new IllegalStateException("boom"));
        OperationHandle<String> handle = new OperationHandle<>("crawl", 3, new CancellationToken(), failed);

        assertTrue(handle.cancelAndAwait(Duration.ofSeconds(1)));
    }

    @Test
    void cancelAndAwait_shouldGiveUpAfterTimeout() {
        OperationHandle<String> handle = new OperationHandle<>("crawl", 3, new CancellationToken(),
                new CompletableFuture<>());

        assertFalse(handle.cancelAndAwait(Duration.ofMillis(50)));
        assertFalse(handle.isDone());
    }
}
