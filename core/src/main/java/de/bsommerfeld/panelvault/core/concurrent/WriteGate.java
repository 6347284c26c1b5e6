package de.bsommerfeld.panelvault.core.concurrent;

import com.google.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Application-wide pause/resume coordinator around catalog commits.
 *
 * <p>
 * The crawler and the downloader both flush into the same catalog store.
 * Each flush opens a commit window with {@link #pause()} and closes it with
 * {@link #resume()}; while a window is open, other writers block in
 * {@link #pause()} and readers that want a consistent view block in
 * {@link #waitIfPaused()}.
 *
 * <h3>Scope</h3>
 * Only commit sections go through the gate. Page fetches, image downloads and
 * temp-file I/O never touch it, so a commit never waits on the network.
 *
 * <h3>Waiting</h3>
 * All waiting happens on a {@link Condition}; nothing spins. Windows are not
 * reentrant: a thread calling {@link #pause()} twice without resuming blocks
 * on itself.
 */
@Singleton
public class WriteGate {

    private static final Logger LOG = LoggerFactory.getLogger(WriteGate.class);

    private final ReentrantLock lock = new ReentrantLock();
    private final Condition released = lock.newCondition();
    private boolean paused;

    /**
     * Opens a commit window, waiting for any currently open window to close
     * first.
     */
    public void pause() throws InterruptedException {
        lock.lockInterruptibly();
        try {
            while (paused) {
                released.await();
            }
            paused = true;
            LOG.trace("Write gate paused by {}", Thread.currentThread().getName());
        } finally {
            lock.unlock();
        }
    }

    /** Closes the current commit window and wakes every waiter. */
    public void resume() {
        lock.lock();
        try {
            paused = false;
            released.signalAll();
            LOG.trace("Write gate resumed by {}", Thread.currentThread().getName());
        } finally {
            lock.unlock();
        }
    }

    /** Blocks while a commit window is open. Returns immediately otherwise. */
    public void waitIfPaused() throws InterruptedException {
        lock.lockInterruptibly();
        try {
            while (paused) {
                released.await();
            }
        } finally {
            lock.unlock();
        }
    }

    public boolean isPaused() {
        lock.lock();
        try {
            return paused;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Runs {@code commit} inside a commit window. The window is closed even if
     * the commit throws.
     */
    public <T> T callPaused(Supplier<T> commit) throws InterruptedException {
        pause();
        try {
            return commit.get();
        } finally {
            resume();
        }
    }

    /** Void variant of {@link #callPaused(Supplier)}. */
    public void runPaused(Runnable commit) throws InterruptedException {
        pause();
        try {
            commit.run();
        } finally {
            resume();
        }
    }
}
