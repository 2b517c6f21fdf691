package com.phillippitts.streamtalker.service.cache;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Coalesces index save requests: the first request schedules a save after the debounce window,
 * further requests inside the window ride along with it.
 *
 * <p>A scheduled save stops counting as pending once it starts, so a request that arrives while
 * a save is writing schedules another one. Saves never run concurrently, whichever thread runs
 * them. A debounce of zero saves synchronously on every request.
 */
final class DebouncedIndexWriter implements AutoCloseable {

    private static final Logger LOG = LogManager.getLogger(DebouncedIndexWriter.class);

    /** Save action; may throw, failures are logged and the next request retries. */
    @FunctionalInterface
    interface SaveAction {
        void save() throws IOException;
    }

    private final SaveAction action;
    private final long debounceMs;
    private final ScheduledExecutorService scheduler;
    private final Object monitor = new Object();
    private final Lock saveLock = new ReentrantLock();
    private ScheduledFuture<?> pending;
    private boolean closed;

    DebouncedIndexWriter(SaveAction action, long debounceMs) {
        this.action = action;
        this.debounceMs = debounceMs;
        this.scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "cache-index-writer");
            t.setDaemon(true);
            return t;
        });
    }

    void requestSave() {
        if (debounceMs <= 0) {
            runSave();
            return;
        }
        synchronized (monitor) {
            if (closed || (pending != null && !pending.isDone())) {
                return;
            }
            pending = scheduler.schedule(this::runScheduledSave, debounceMs, TimeUnit.MILLISECONDS);
        }
    }

    boolean hasPendingSave() {
        synchronized (monitor) {
            return pending != null && !pending.isDone();
        }
    }

    /**
     * Cancels any scheduled save and saves now on the calling thread.
     */
    void flush() {
        synchronized (monitor) {
            if (pending != null) {
                pending.cancel(false);
                pending = null;
            }
        }
        runSave();
    }

    @Override
    public void close() {
        synchronized (monitor) {
            closed = true;
        }
        flush();
        scheduler.shutdownNow();
    }

    private void runScheduledSave() {
        synchronized (monitor) {
            pending = null;
        }
        runSave();
    }

    private void runSave() {
        saveLock.lock();
        try {
            action.save();
        } catch (IOException | RuntimeException e) {
            LOG.error("Failed to save cache index: {}", e.getMessage(), e);
        } finally {
            saveLock.unlock();
        }
    }
}
