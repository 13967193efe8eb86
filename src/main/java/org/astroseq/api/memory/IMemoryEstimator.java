package org.astroseq.api.memory;

/**
 * Source of the memory budget that bounds how many frames may be in flight.
 */
@FunctionalInterface
public interface IMemoryEstimator {

    /**
     * Bytes available for decoded frames, sampled when a run starts.
     *
     * @return available bytes, or a negative value for an unlimited budget.
     */
    long availableBytes();

    static IMemoryEstimator unlimited() {
        return () -> -1L;
    }

    static IMemoryEstimator fixed(long bytes) {
        return () -> bytes;
    }
}
