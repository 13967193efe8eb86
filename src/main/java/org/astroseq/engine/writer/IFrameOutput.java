package org.astroseq.engine.writer;

import java.io.IOException;

/**
 * Destination of one output sequence during a run.
 */
public interface IFrameOutput {

    String getName();

    /**
     * Whether frames pass through a reorder queue and hold an admission credit until written.
     */
    boolean isQueued();

    default void start() {
    }

    /**
     * Hands over one frame or skip marker. Takes ownership of the frame, also when throwing.
     *
     * @throws IOException if a synchronous write fails.
     */
    void submit(PendingWrite write) throws IOException;

    /**
     * Stops the output and finalizes its container. Blocks until the writer thread, if any,
     * has terminated.
     *
     * @param aborted Whether the run was aborted.
     */
    WriterResult finish(boolean aborted);
}
