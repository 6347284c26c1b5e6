package de.bsommerfeld.panelvault.app;

import com.google.inject.Guice;
import com.google.inject.Injector;
import de.bsommerfeld.panelvault.app.config.AppModule;
import de.bsommerfeld.panelvault.app.service.AcquisitionService;
import de.bsommerfeld.panelvault.app.service.OperationHandle;
import de.bsommerfeld.panelvault.app.service.SyncResult;
import de.bsommerfeld.panelvault.core.domain.Source;
import de.bsommerfeld.panelvault.core.profile.ProfileValidationException;
import de.bsommerfeld.panelvault.core.util.StorageUtils;
import de.bsommerfeld.panelvault.downloader.DownloadOptions;
import de.bsommerfeld.panelvault.downloader.DownloadReport;
import de.bsommerfeld.panelvault.scraper.crawl.CrawlResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.CompletionException;

/**
 * Command line entry point.
 *
 * <pre>
 * list
 * add &lt;profile.json&gt;
 * export &lt;id&gt; &lt;file&gt;
 * crawl &lt;id&gt; [--max-pages N]
 * download &lt;id&gt; [--overwrite] [--concurrency N]
 * sync &lt;id&gt;
 * delete &lt;id&gt; [--files]
 * </pre>
 *
 * Exit code 0 on success, 1 when the operation failed, 2 on bad usage.
 * Ctrl+C cancels a running crawl or download cooperatively.
 */
public final class PanelVaultMain {

    static final String LOGS_PROPERTY = "panelvault.logs";

    // Must run before the first logger is created, logback.xml reads it
    static {
        if (System.getProperty(LOGS_PROPERTY) == null) {
            System.setProperty(LOGS_PROPERTY, StorageUtils.getLogsDir(StorageUtils.APP_NAME).toString());
        }
    }

    private static final Logger LOG = LoggerFactory.getLogger(PanelVaultMain.class);

    static final int EXIT_OK = 0;
    static final int EXIT_FAILED = 1;
    static final int EXIT_USAGE = 2;

    /** How long Ctrl+C waits for the final flush of a cancelled operation. */
    static final Duration SHUTDOWN_GRACE = Duration.ofSeconds(30);

    private final AcquisitionService service;
    private final PrintStream out;

    PanelVaultMain(AcquisitionService service, PrintStream out) {
        this.service = service;
        this.out = out;
    }

    public static void main(String[] args) {
        Injector injector = Guice.createInjector(new AppModule());
        AcquisitionService service = injector.getInstance(AcquisitionService.class);
        int exitCode;
        try {
            exitCode = new PanelVaultMain(service, System.out).run(args);
        } finally {
            service.shutdown();
        }
        System.exit(exitCode);
    }

    int run(String[] args) {
        if (args.length == 0) {
            printUsage();
            return EXIT_USAGE;
        }
        String command = args[0].toLowerCase(Locale.ROOT);
        List<String> rest = new ArrayList<>(Arrays.asList(args).subList(1, args.length));
        try {
            switch (command) {
                case "list":
                    return list();
                case "add":
                    return add(rest);
                case "export":
                    return export(rest);
                case "crawl":
                    return crawl(rest);
                case "download":
                    return download(rest);
                case "sync":
                    return sync(rest);
                case "delete":
                    return delete(rest);
                case "help":
                case "--help":
                    printUsage();
                    return EXIT_OK;
                default:
                    out.println("Unknown command: " + args[0]);
                    printUsage();
                    return EXIT_USAGE;
            }
        } catch (UsageException e) {
            out.println(e.getMessage());
            printUsage();
            return EXIT_USAGE;
        } catch (CompletionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            out.println("Error: " + command + " failed: " + cause.getMessage());
            return EXIT_FAILED;
        } catch (IllegalArgumentException e) {
            out.println("Error: " + e.getMessage());
            return EXIT_FAILED;
        } catch (IOException | ProfileValidationException e) {
            LOG.debug("Command '{}' failed", command, e);
            out.println("Error: " + e.getMessage());
            return EXIT_FAILED;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            out.println("Interrupted");
            return EXIT_FAILED;
        }
    }

    // =====================================================================
    // Commands
    // =====================================================================

    private int list() {
        List<Source> sources = service.listSources();
        if (sources.isEmpty()) {
            out.println("No sources yet. Add one with: add <profile.json>");
            return EXIT_OK;
        }
        for (Source source : sources) {
            out.printf(Locale.ROOT, "%4d  %-30s  %6d pages  %6d images  %6d downloaded%n", source.id(),
                    source.name(), source.pageCount(), source.imageCount(), source.downloadedImageCount());
        }
        return EXIT_OK;
    }

    private int add(List<String> args) throws IOException, ProfileValidationException, UsageException {
        Path file = Paths.get(single(args, "add <profile.json>"));
        long id = service.importProfile(file);
        out.println("Added source " + id);
        return EXIT_OK;
    }

    private int export(List<String> args) throws IOException, UsageException {
        if (args.size() != 2) {
            throw new UsageException("Usage: export <id> <file>");
        }
        service.exportProfile(parseId(args.get(0)), Paths.get(args.get(1)));
        out.println("Exported to " + args.get(1));
        return EXIT_OK;
    }

    private int crawl(List<String> args) throws UsageException {
        int maxPages = intOption(args, "--max-pages", 0);
        long id = parseId(single(args, "crawl <id> [--max-pages N]"));
        printCrawl(await(service.startCrawl(id, maxPages)));
        return EXIT_OK;
    }

    private int download(List<String> args) throws UsageException {
        boolean overwrite = args.remove("--overwrite");
        DownloadOptions options = service.defaultDownloadOptions();
        int concurrency = intOption(args, "--concurrency", options.maxConcurrent());
        long id = parseId(single(args, "download <id> [--overwrite] [--concurrency N]"));
        options = options.withMaxConcurrent(concurrency).withOverwrite(overwrite || options.overwrite());
        printReport(await(service.startDownload(id, options)));
        return EXIT_OK;
    }

    private int sync(List<String> args) throws UsageException {
        long id = parseId(single(args, "sync <id>"));
        SyncResult result = await(service.sync(id));
        if (result == null) {
            out.println("Cancelled");
        } else {
            printCrawl(result.crawl());
            printReport(result.download());
        }
        return EXIT_OK;
    }

    private int delete(List<String> args) throws IOException, InterruptedException, UsageException {
        boolean files = args.remove("--files");
        long id = parseId(single(args, "delete <id> [--files]"));
        service.deleteSource(id, files);
        out.println("Deleted source " + id + (files ? " and its files" : ""));
        return EXIT_OK;
    }

    private void printCrawl(CrawlResult result) {
        if (result == null) {
            out.println("Cancelled");
            return;
        }
        out.printf(Locale.ROOT, "%d new images on %d new pages (%s)%n", result.recordsAdded(),
                result.pagesCommitted(), result.stopReason());
    }

    private void printReport(DownloadReport report) {
        if (report == null) {
            out.println("Cancelled");
            return;
        }
        out.printf(Locale.ROOT, "%d considered, %d written, %d already present, %d not written%n",
                report.considered(), report.written(), report.alreadyPresent(), report.notWritten());
    }

    /**
     * Waits for a background operation. Ctrl+C during the wait cancels it.
     *
     * @return the result, or null if the operation was cancelled
     * @throws CompletionException if the operation failed
     */
    private static <T> T await(OperationHandle<T> handle) {
        Thread hook = shutdownHook(handle);
        Runtime.getRuntime().addShutdownHook(hook);
        try {
            return handle.future().join();
        } finally {
            try {
                Runtime.getRuntime().removeShutdownHook(hook);
            } catch (IllegalStateException e) {
                LOG.trace("JVM is shutting down, hook stays registered");
            }
        }
    }

    /**
     * The worker threads are daemons, so the hook has to hold the JVM open
     * until the cancelled operation has committed what it buffered.
     */
    static Thread shutdownHook(OperationHandle<?> handle) {
        return new Thread(() -> handle.cancelAndAwait(SHUTDOWN_GRACE), "panelvault-cancel");
    }

    // =====================================================================
    // Argument parsing
    // =====================================================================

    private static final class UsageException extends Exception {
        UsageException(String message) {
            super(message);
        }
    }

    private static String single(List<String> args, String usage) throws UsageException {
        if (args.size() != 1) {
            throw new UsageException("Usage: " + usage);
        }
        return args.get(0);
    }

    private static long parseId(String value) throws UsageException {
        try {
            return Long.parseLong(value);
        } catch (NumberFormatException e) {
            throw new UsageException("Not a source id: " + value);
        }
    }

    /** Removes {@code name N} from {@code args} and returns N, or the fallback. */
    private static int intOption(List<String> args, String name, int fallback) throws UsageException {
        int at = args.indexOf(name);
        if (at < 0) {
            return fallback;
        }
        if (at + 1 >= args.size()) {
            throw new UsageException(name + " needs a number");
        }
        String value = args.get(at + 1);
        args.remove(at + 1);
        args.remove(at);
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            throw new UsageException(name + " needs a number, got " + value);
        }
    }

    private void printUsage() {
        out.println("Usage: panelvault <command> [args]");
        out.println("  list");
        out.println("  add <profile.json>");
        out.println("  export <id> <file>");
        out.println("  crawl <id> [--max-pages N]");
        out.println("  download <id> [--overwrite] [--concurrency N]");
        out.println("  sync <id>");
        out.println("  delete <id> [--files]");
    }
}
