package org.astroseq.engine.memory;

import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Counting gate that bounds the number of frames in flight between a worker's read and the
 * writer's confirmation.
 * <p>
 * One instance per run. A limit {@code <= 0} means unlimited. In deferred mode (frame size not
 * known before the first decode) acquisitions are counted but never block until
 * {@link #applyDeferredLimit(int)} is called.
 * <p>
 * <strong>Thread Safety:</strong> All methods are thread-safe. Waiters are served in FIFO order
 * (fair lock).
 */
public final class MemoryAdmissionController {

    private static final Logger log = LoggerFactory.getLogger(MemoryAdmissionController.class);

    private final ReentrantLock lock = new ReentrantLock(true);
    private final Condition slotFreed = lock.newCondition();

    private int maxActiveBlocks;
    private int activeBlocks;
    private int peakActiveBlocks;
    private boolean deferred;

    /**
     * Sets the bound and resets the active count to zero.
     *
     * @param maxActiveBlocks Maximum number of frames in flight, {@code <= 0} for unlimited.
     */
    public void configure(int maxActiveBlocks) {
        lock.lock();
        try {
            this.maxActiveBlocks = Math.max(0, maxActiveBlocks);
            this.activeBlocks = 0;
            this.peakActiveBlocks = 0;
            this.deferred = false;
            slotFreed.signalAll();
        } finally {
            lock.unlock();
        }
        log.debug("Admission limit set to {}", maxActiveBlocks > 0 ? maxActiveBlocks : "unlimited");
    }

    /**
     * Resets the active count and lets every acquisition through until
     * {@link #applyDeferredLimit(int)} is called.
     */
    public void configureDeferred() {
        lock.lock();
        try {
            this.maxActiveBlocks = 0;
            this.activeBlocks = 0;
            this.peakActiveBlocks = 0;
            this.deferred = true;
        } finally {
            lock.unlock();
        }
        log.debug("Admission limit deferred until the first frame is decoded");
    }

    /**
     * Applies the limit computed from the first decoded frame. The active count is kept, so
     * later acquisitions block until the frames admitted before the limit drain below it.
     *
     * @return {@code true} if the limit was applied, {@code false} if it had already been
     *         applied or the controller was unblocked in the meantime.
     */
    public boolean applyDeferredLimit(int maxActiveBlocks) {
        lock.lock();
        try {
            if (!deferred) {
                return false;
            }
            this.deferred = false;
            this.maxActiveBlocks = Math.max(0, maxActiveBlocks);
            slotFreed.signalAll();
        } finally {
            lock.unlock();
        }
        log.debug("Deferred admission limit applied: {}", maxActiveBlocks > 0 ? maxActiveBlocks : "unlimited");
        return true;
    }

    /**
     * Takes one credit, blocking while the limit is reached.
     *
     * @throws InterruptedException if the calling thread is interrupted while waiting.
     */
    public void acquire() throws InterruptedException {
        lock.lockInterruptibly();
        try {
            while (maxActiveBlocks > 0 && activeBlocks >= maxActiveBlocks) {
                slotFreed.await();
            }
            activeBlocks++;
            if (activeBlocks > peakActiveBlocks) {
                peakActiveBlocks = activeBlocks;
            }
        } finally {
            lock.unlock();
        }
    }

    /**
     * Returns one credit and wakes one waiter. Never lets the active count drop below zero.
     */
    public void release() {
        lock.lock();
        try {
            if (activeBlocks > 0) {
                activeBlocks--;
            } else {
                log.debug("Credit released with no active blocks");
            }
            slotFreed.signal();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Switches to unlimited and wakes every waiter. Used on abort and at the end of a run.
     */
    public void unblockAll() {
        lock.lock();
        try {
            maxActiveBlocks = 0;
            deferred = false;
            slotFreed.signalAll();
        } finally {
            lock.unlock();
        }
    }

    public int getActiveBlocks() {
        lock.lock();
        try {
            return activeBlocks;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Current limit, {@code 0} when unlimited.
     */
    public int getMaxActiveBlocks() {
        lock.lock();
        try {
            return maxActiveBlocks;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Highest active count observed since the last configuration.
     */
    public int getPeakActiveBlocks() {
        lock.lock();
        try {
            return peakActiveBlocks;
        } finally {
            lock.unlock();
        }
    }

    public boolean isDeferred() {
        lock.lock();
        try {
            return deferred;
        } finally {
            lock.unlock();
        }
    }
}
