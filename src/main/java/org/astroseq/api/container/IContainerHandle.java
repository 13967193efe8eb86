package org.astroseq.api.container;

import java.io.IOException;
import java.nio.file.Path;

import org.astroseq.api.sequence.Frame;

/**
 * Open output container.
 * <p>
 * Handles of contiguous formats are driven by a single writer thread. Handles of
 * non-contiguous formats must accept concurrent {@link #writeFrame} calls.
 */
public interface IContainerHandle {

    /**
     * Path of the container, or of the directory receiving per-frame files.
     */
    Path getPath();

    /**
     * Writes one frame. The handle does not take ownership of the frame.
     *
     * @param frame The frame to write.
     * @param index Output or input index, see {@link IContainerWriter#getIndexing()}.
     * @throws IOException on any write failure.
     */
    void writeFrame(Frame frame, int index) throws IOException;

    /**
     * Records that the frame at {@code index} will not be written. Formats that simply omit
     * missing frames ignore this.
     */
    default void writeSkip(int index) throws IOException {
    }

    /**
     * Finalizes the container with the number of frames actually written.
     *
     * @throws IOException if the container cannot be finalized.
     */
    void close(int actualCount) throws IOException;

    /**
     * Closes and deletes whatever has been written so far.
     *
     * @throws IOException if the partial output cannot be deleted.
     */
    void abortAndDelete() throws IOException;
}
