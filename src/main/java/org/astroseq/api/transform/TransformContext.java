package org.astroseq.api.transform;

import java.util.Optional;
import java.util.function.BooleanSupplier;

import org.astroseq.api.sequence.FrameGeometry;

/**
 * Read-only view of the run handed to an {@link ITransform}.
 */
public final class TransformContext {

    private final String sequenceName;
    private final int frameCount;
    private final int threads;
    private final FrameGeometry inputGeometry;
    private final BooleanSupplier abortFlag;

    public TransformContext(String sequenceName, int frameCount, int threads,
                            FrameGeometry inputGeometry, BooleanSupplier abortFlag) {
        this.sequenceName = sequenceName;
        this.frameCount = frameCount;
        this.threads = threads;
        this.inputGeometry = inputGeometry;
        this.abortFlag = abortFlag;
    }

    public String getSequenceName() {
        return sequenceName;
    }

    /**
     * Number of frames that passed the filter.
     */
    public int getFrameCount() {
        return frameCount;
    }

    public int getThreads() {
        return threads;
    }

    /**
     * Input geometry if the sequence knows it before decoding.
     */
    public Optional<FrameGeometry> getInputGeometry() {
        return Optional.ofNullable(inputGeometry);
    }

    /**
     * Long-running transforms may poll this to stop early.
     */
    public boolean isAbortRequested() {
        return abortFlag.getAsBoolean();
    }
}
