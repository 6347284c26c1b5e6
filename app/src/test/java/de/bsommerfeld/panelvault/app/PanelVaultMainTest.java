package de.bsommerfeld.panelvault.app;

import de.bsommerfeld.panelvault.app.service.AcquisitionService;
import de.bsommerfeld.panelvault.app.service.OperationHandle;
import de.bsommerfeld.panelvault.app.service.SyncResult;
import de.bsommerfeld.panelvault.core.concurrent.CancellationToken;
import de.bsommerfeld.panelvault.core.domain.Source;
import de.bsommerfeld.panelvault.core.error.AcquisitionException;
import de.bsommerfeld.panelvault.downloader.DownloadOptions;
import de.bsommerfeld.panelvault.downloader.DownloadReport;
import de.bsommerfeld.panelvault.scraper.crawl.CrawlResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class PanelVaultMainTest {

    private AcquisitionService service;
    private ByteArrayOutputStream buffer;
    private PanelVaultMain cli;

    @BeforeEach
    void setUp() {
        service = mock(AcquisitionService.class);
        buffer = new ByteArrayOutputStream();
        cli = new PanelVaultMain(service, new PrintStream(buffer, true, StandardCharsets.UTF_8));
    }

    private String output() {
        return buffer.toString(StandardCharsets.UTF_8);
    }

    private static <T> OperationHandle<T> done(String operation, T value) {
        return new OperationHandle<>(operation, 1, new CancellationToken(), CompletableFuture.completedFuture(value));
    }

    // -- Usage --

    @Test
    void run_shouldPrintUsageWithoutArguments() {
        assertEquals(PanelVaultMain.EXIT_USAGE, cli.run(new String[0]));
        assertTrue(output().contains("Usage: panelvault"));
    }

    @Test
    void run_shouldRejectUnknownCommand() {
        assertEquals(PanelVaultMain.EXIT_USAGE, cli.run(new String[] { "fly" }));
        assertTrue(output().contains("Unknown command: fly"));
    }

    @Test
    void run_shouldRejectNonNumericId() {
        assertEquals(PanelVaultMain.EXIT_USAGE, cli.run(new String[] { "crawl", "abc" }));
        verifyNoInteractions(service);
    }

    // -- Commands --

    @Test
    void list_shouldPrintOneLinePerSource() {
        when(service.listSources()).thenReturn(List.of(
                new Source(1, "Alpha", "", "", "", "", "", "", "", null, 3, 4, 2),
                new Source(2, "Beta", "", "", "", "", "", "", "", null, 0, 0, 0)));

        assertEquals(PanelVaultMain.EXIT_OK, cli.run(new String[] { "list" }));

        String out = output();
        assertTrue(out.contains("Alpha"));
        assertTrue(out.contains("Beta"));
        assertEquals(2, out.lines().count());
    }

    @Test
    void crawl_shouldPassMaxPages() {
        when(service.startCrawl(7, 12)).thenReturn(done("crawl",
                new CrawlResult(12, 10, CrawlResult.StopReason.PAGE_LIMIT)));

        assertEquals(PanelVaultMain.EXIT_OK, cli.run(new String[] { "crawl", "7", "--max-pages", "12" }));

        assertTrue(output().contains("12 new images on 10 new pages (PAGE_LIMIT)"));
    }

    @Test
    void download_shouldApplyFlagsOnTopOfConfiguredOptions() {
        DownloadOptions configured = new DownloadOptions(Path.of("/library"), false, 10);
        when(service.defaultDownloadOptions()).thenReturn(configured);
        DownloadOptions expected = new DownloadOptions(Path.of("/library"), true, 3);
        when(service.startDownload(5, expected)).thenReturn(done("download", new DownloadReport(4, 3, 1, 0)));

        int exit = cli.run(new String[] { "download", "--overwrite", "5", "--concurrency", "3" });

        assertEquals(PanelVaultMain.EXIT_OK, exit);
        assertTrue(output().contains("4 considered, 3 written, 1 already present, 0 not written"));
    }

    @Test
    void download_shouldReportFailure() {
        when(service.defaultDownloadOptions()).thenReturn(new DownloadOptions(Path.of("/library"), false, 10));
        CompletableFuture<DownloadReport> failed = new CompletableFuture<>();
        failed.completeExceptionally(AcquisitionException.network("https://cdn.test", new java.io.IOException("x")));
        when(service.startDownload(eq(5L), any())).thenReturn(
                new OperationHandle<>("download", 5, new CancellationToken(), failed));

        assertEquals(PanelVaultMain.EXIT_FAILED, cli.run(new String[] { "download", "5" }));
        assertTrue(output().startsWith("Error: download failed"));
    }

    @Test
    void delete_shouldForwardFilesFlag() throws Exception {
        assertEquals(PanelVaultMain.EXIT_OK, cli.run(new String[] { "delete", "3", "--files" }));

        verify(service).deleteSource(3, true);
    }

    @Test
    void add_shouldImportProfile() throws Exception {
        when(service.importProfile(Path.of("comic.json"))).thenReturn(9L);

        assertEquals(PanelVaultMain.EXIT_OK, cli.run(new String[] { "add", "comic.json" }));

        assertTrue(output().contains("Added source 9"));
    }

    @Test
    void sync_shouldPrintCrawlAndDownloadSummary() {
        when(service.sync(2)).thenReturn(done("sync", new SyncResult(
                new CrawlResult(4, 3, CrawlResult.StopReason.NO_NEXT_LINK), new DownloadReport(4, 4, 0, 0))));

        assertEquals(PanelVaultMain.EXIT_OK, cli.run(new String[] { "sync", "2" }));

        String out = output();
        assertTrue(out.contains("4 new images on 3 new pages (NO_NEXT_LINK)"));
        assertTrue(out.contains("4 considered, 4 written, 0 already present, 0 not written"));
    }

    @Test
    void sync_shouldPrintCancelledWhenOperationWasCancelled() {
        when(service.sync(2)).thenReturn(done("sync", null));

        assertEquals(PanelVaultMain.EXIT_OK, cli.run(new String[] { "sync", "2" }));

        assertTrue(output().contains("Cancelled"));
    }

    // -- Shutdown --

    @Test
    void shutdownHook_shouldHoldUntilCancelledOperationHasFlushed() throws Exception {
        CancellationToken token = new CancellationToken();
        CompletableFuture<CrawlResult> future = new CompletableFuture<>();
        AtomicBoolean flushed = new AtomicBoolean();
        Thread worker = new Thread(() -> {
            while (!token.isCancelled()) {
                Thread.onSpinWait();
            }
            try {
                Thread.sleep(200);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            flushed.set(true);
            future.complete(null);
        });
        worker.setDaemon(true);
        worker.start();

        PanelVaultMain.shutdownHook(new OperationHandle<>("crawl", 1, token, future)).run();

        assertTrue(flushed.get());
        assertTrue(future.isDone());
    }
}
