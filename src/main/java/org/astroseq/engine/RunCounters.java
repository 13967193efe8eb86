package org.astroseq.engine;

import java.util.concurrent.atomic.AtomicInteger;

/**
 * Frame counters of one run, updated concurrently by the workers.
 * <p>
 * {@code excluded} counts every input frame that does not reach the outputs: frames rejected
 * by the filter plus frames that failed. {@code failed} counts only the latter.
 */
public final class RunCounters {

    private final int totalInput;
    private final AtomicInteger converted = new AtomicInteger();
    private final AtomicInteger failed = new AtomicInteger();
    private final AtomicInteger excluded = new AtomicInteger();

    public RunCounters(int totalInput) {
        this.totalInput = totalInput;
    }

    public void recordConverted() {
        converted.incrementAndGet();
    }

    /**
     * Records a soft per-frame failure.
     */
    public void recordFailure() {
        failed.incrementAndGet();
        excluded.incrementAndGet();
    }

    public void addExcluded(int count) {
        excluded.addAndGet(count);
    }

    public int getConverted() {
        return converted.get();
    }

    public int getFailed() {
        return failed.get();
    }

    public int getExcluded() {
        return excluded.get();
    }

    public int getTotalInput() {
        return totalInput;
    }

    public Snapshot snapshot() {
        return new Snapshot(totalInput, converted.get(), failed.get(), excluded.get());
    }

    /**
     * Immutable view of the counters.
     */
    public record Snapshot(int totalInput, int converted, int failed, int excluded) {
    }
}
