package org.astroseq.engine.memory;

/**
 * Outcome of {@link ConcurrencyPlanner#plan}.
 *
 * @param poolSize        Number of worker threads.
 * @param maxActiveBlocks Frames allowed in flight, {@code 0} for unlimited.
 * @param deferred        Whether {@code maxActiveBlocks} must be computed after the first decode.
 * @param perFrameBytes   Bytes of one decoded frame, {@code <= 0} if not known yet.
 * @param availableBytes  Memory budget, negative for unlimited.
 */
public record ConcurrencyPlan(int poolSize, int maxActiveBlocks, boolean deferred,
                              long perFrameBytes, long availableBytes) {

    public boolean isUnlimited() {
        return maxActiveBlocks <= 0 && !deferred;
    }
}
