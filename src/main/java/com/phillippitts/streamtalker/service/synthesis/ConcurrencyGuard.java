package com.phillippitts.streamtalker.service.synthesis;

import java.util.concurrent.Semaphore;

/**
 * Bounds the number of synthesis batches in flight across all voices.
 *
 * <p>The scheduler never waits for a permit: when none is free the voice stays queued until a
 * later cycle. Permits are released by the batch completion handler, which may run on another
 * thread than the one that acquired them.
 *
 * @since 1.0
 */
public final class ConcurrencyGuard {

    private final Semaphore semaphore;
    private final int maxPermits;

    public ConcurrencyGuard(int maxPermits) {
        if (maxPermits <= 0) {
            throw new IllegalArgumentException("maxPermits must be positive: " + maxPermits);
        }
        this.maxPermits = maxPermits;
        this.semaphore = new Semaphore(maxPermits);
    }

    /**
     * @return true if a permit was taken
     */
    public boolean tryAcquire() {
        return semaphore.tryAcquire();
    }

    public void release() {
        semaphore.release();
    }

    public int availablePermits() {
        return semaphore.availablePermits();
    }

    public int inUse() {
        return maxPermits - semaphore.availablePermits();
    }

    public int maxPermits() {
        return maxPermits;
    }
}
