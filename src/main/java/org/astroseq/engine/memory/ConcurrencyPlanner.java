package org.astroseq.engine.memory;

import org.astroseq.api.memory.ByteSizes;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Derives the worker pool size and the admission limit from the memory budget.
 * <p>
 * The number of frames that fit the budget is {@code available / perFrameBytes}. The pool never
 * has more threads than frames that fit, and the admission limit allows at most
 * {@code queueFactor} frames per worker so that the reorder queues cannot grow without bound.
 */
public final class ConcurrencyPlanner {

    private static final Logger log = LoggerFactory.getLogger(ConcurrencyPlanner.class);

    private ConcurrencyPlanner() {
    }

    /**
     * @param threads        Requested worker threads ({@code >= 1}).
     * @param perFrameBytes  Size of one decoded frame, {@code <= 0} if unknown before decoding.
     * @param availableBytes Memory budget, negative for unlimited.
     * @param queueFactor    Frames in flight per worker (K).
     */
    public static ConcurrencyPlan plan(int threads, long perFrameBytes, long availableBytes, int queueFactor) {
        if (threads < 1) {
            throw new IllegalArgumentException("threads must be >= 1, got " + threads);
        }
        if (queueFactor < 1) {
            throw new IllegalArgumentException("queueFactor must be >= 1, got " + queueFactor);
        }
        if (availableBytes < 0) {
            return new ConcurrencyPlan(threads, 0, false, perFrameBytes, availableBytes);
        }
        if (perFrameBytes <= 0) {
            return new ConcurrencyPlan(threads, 0, true, perFrameBytes, availableBytes);
        }
        long limit = availableBytes / perFrameBytes;
        if (limit < 1) {
            log.warn("Memory budget {} is smaller than one frame ({}), processing one frame at a time",
                    ByteSizes.formatBytes(availableBytes), ByteSizes.formatBytes(perFrameBytes));
        }
        int poolSize = (int) clamp(limit, 1, threads);
        int maxActive = (int) clamp(limit, 1, (long) poolSize * queueFactor);
        if (poolSize < threads) {
            log.info("Limiting processing to {} thread(s) to fit {} frames of {} in {}",
                    poolSize, limit, ByteSizes.formatBytes(perFrameBytes), ByteSizes.formatBytes(availableBytes));
        }
        return new ConcurrencyPlan(poolSize, maxActive, false, perFrameBytes, availableBytes);
    }

    /**
     * Admission limit for a pool that is already running, once the frame size is known.
     */
    public static int deferredLimit(int poolSize, long perFrameBytes, long availableBytes, int queueFactor) {
        if (availableBytes < 0 || perFrameBytes <= 0) {
            return 0;
        }
        long limit = availableBytes / perFrameBytes;
        return (int) clamp(limit, 1, (long) poolSize * queueFactor);
    }

    private static long clamp(long value, long min, long max) {
        return Math.max(min, Math.min(max, value));
    }
}
