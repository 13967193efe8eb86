package org.astroseq.engine.writer;

import org.astroseq.api.sequence.Frame;

/**
 * A frame (or a skip marker when {@code frame} is {@code null}) on its way to an output.
 *
 * @param outputIndex Dense output index.
 * @param inputIndex  Original input index.
 * @param frame       Frame to write, owned by the receiving output; {@code null} for a skip.
 */
public record PendingWrite(int outputIndex, int inputIndex, Frame frame) {

    /**
     * Sentinel that stops a writer thread regardless of the frames still missing.
     */
    public static final PendingWrite ABORT = new PendingWrite(-1, -1, null);

    public static PendingWrite skip(int outputIndex, int inputIndex) {
        return new PendingWrite(outputIndex, inputIndex, null);
    }

    public boolean isSkip() {
        return frame == null && this != ABORT;
    }

    public boolean isAbort() {
        return this == ABORT;
    }

    /**
     * Releases the frame if there is one and it is still held.
     */
    void releaseFrame() {
        if (frame != null && !frame.isReleased()) {
            frame.release();
        }
    }
}
