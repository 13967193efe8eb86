package org.astroseq.engine.source;

import java.util.concurrent.atomic.AtomicInteger;

/**
 * Number of reads still pending on one container. The caller that brings it to zero owns
 * closing the container.
 */
public final class SequenceCounter {

    private final AtomicInteger remaining;

    public SequenceCounter(int initial) {
        if (initial < 0) {
            throw new IllegalArgumentException("initial must be >= 0, got " + initial);
        }
        this.remaining = new AtomicInteger(initial);
    }

    /**
     * @return {@code true} for exactly one caller: the one that reached zero.
     * @throws IllegalStateException if the counter is already at zero.
     */
    public boolean countDown() {
        int value = remaining.decrementAndGet();
        if (value < 0) {
            remaining.incrementAndGet();
            throw new IllegalStateException("SequenceCounter counted down past zero");
        }
        return value == 0;
    }

    public int remaining() {
        return remaining.get();
    }
}
