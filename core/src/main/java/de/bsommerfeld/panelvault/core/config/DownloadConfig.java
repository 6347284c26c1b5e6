package de.bsommerfeld.panelvault.core.config;

import com.fasterxml.jackson.annotation.JsonAutoDetect;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Download scheduler parameters. Values are persisted in config.toml and
 * loaded at startup.
 */
@JsonAutoDetect(fieldVisibility = JsonAutoDetect.Visibility.ANY, getterVisibility = JsonAutoDetect.Visibility.NONE, isGetterVisibility = JsonAutoDetect.Visibility.NONE, setterVisibility = JsonAutoDetect.Visibility.NONE)
public class DownloadConfig {

    public static final int MIN_CONCURRENT = 1;
    public static final int MAX_CONCURRENT = 24;

    @JsonProperty("max-concurrent")
    private int maxConcurrent = 10;

    @JsonProperty("overwrite")
    private boolean overwrite = false;

    /** Successful writes between two intermediate commits (default: 50). */
    @JsonProperty("commit-every")
    private int commitEvery = 50;

    /** Page size used when scanning existing download paths (default: 1000). */
    @JsonProperty("reconcile-page-size")
    private int reconcilePageSize = 1000;

    /** Root folder for downloads; empty means {appData}/library. */
    @JsonProperty("library-dir")
    private String libraryDir = "";

    /** Clamps a requested concurrency into [{@value #MIN_CONCURRENT}, {@value #MAX_CONCURRENT}]. */
    public static int clampConcurrency(int requested) {
        return Math.max(MIN_CONCURRENT, Math.min(MAX_CONCURRENT, requested));
    }

    public int getMaxConcurrent() {
        return clampConcurrency(maxConcurrent);
    }

    public void setMaxConcurrent(int maxConcurrent) {
        this.maxConcurrent = maxConcurrent;
    }

    public boolean isOverwrite() {
        return overwrite;
    }

    public void setOverwrite(boolean overwrite) {
        this.overwrite = overwrite;
    }

    public int getCommitEvery() {
        return Math.max(1, commitEvery);
    }

    public void setCommitEvery(int commitEvery) {
        this.commitEvery = commitEvery;
    }

    public int getReconcilePageSize() {
        return Math.max(1, reconcilePageSize);
    }

    public void setReconcilePageSize(int reconcilePageSize) {
        this.reconcilePageSize = reconcilePageSize;
    }

    public String getLibraryDir() {
        return libraryDir;
    }

    public void setLibraryDir(String libraryDir) {
        this.libraryDir = libraryDir;
    }
}
