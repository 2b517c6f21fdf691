package com.phillippitts.streamtalker.service.pipeline;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Runs one task repeatedly on a dedicated thread, waiting a fixed interval after each iteration
 * ends. {@link #wakeUp()} cuts the current wait short.
 *
 * <p>Iterations never overlap, including ones triggered through {@link #runOnce()}. An exception
 * from the task is logged and the loop carries on.
 */
public final class FixedDelayCycle implements AutoCloseable {

    private static final Logger LOG = LogManager.getLogger(FixedDelayCycle.class);

    private final String name;
    private final Duration interval;
    private final Runnable task;

    private final Lock lock = new ReentrantLock();
    private final Condition wake = lock.newCondition();
    private final AtomicBoolean iterating = new AtomicBoolean();
    private boolean wakeRequested;
    private volatile boolean running;
    private Thread thread;

    public FixedDelayCycle(String name, Duration interval, Runnable task) {
        if (interval.isNegative() || interval.isZero()) {
            throw new IllegalArgumentException("interval must be positive: " + interval);
        }
        this.name = Objects.requireNonNull(name, "name");
        this.interval = interval;
        this.task = Objects.requireNonNull(task, "task");
    }

    public synchronized void start() {
        if (running) {
            return;
        }
        running = true;
        thread = new Thread(this::loop, name);
        thread.setDaemon(true);
        thread.start();
        LOG.info("Cycle {} started (interval {} ms)", name, interval.toMillis());
    }

    /**
     * Stops the loop and waits briefly for the current iteration to end.
     */
    public synchronized void stop() {
        if (!running) {
            return;
        }
        running = false;
        wakeUp();
        try {
            thread.join(TimeUnit.SECONDS.toMillis(5));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        thread = null;
        LOG.info("Cycle {} stopped", name);
    }

    /** Makes the next iteration start now instead of after the interval. */
    public void wakeUp() {
        lock.lock();
        try {
            wakeRequested = true;
            wake.signalAll();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Runs one iteration on the calling thread unless one is already running.
     *
     * @return false if skipped because another iteration was in progress
     */
    public boolean runOnce() {
        if (!iterating.compareAndSet(false, true)) {
            return false;
        }
        try {
            task.run();
        } catch (RuntimeException e) {
            LOG.error("Cycle {} iteration failed", name, e);
        } finally {
            iterating.set(false);
        }
        return true;
    }

    public boolean isRunning() {
        return running;
    }

    private void loop() {
        while (running) {
            runOnce();
            lock.lock();
            try {
                if (!wakeRequested && running) {
                    wake.await(interval.toMillis(), TimeUnit.MILLISECONDS);
                }
                wakeRequested = false;
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                running = false;
            } finally {
                lock.unlock();
            }
        }
    }

    @Override
    public void close() {
        stop();
    }
}
