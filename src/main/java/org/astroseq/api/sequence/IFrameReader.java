package org.astroseq.api.sequence;

import java.io.Closeable;
import java.io.IOException;

/**
 * Open handle on one physical container. Not required to be thread-safe: callers serialise
 * access per container.
 */
public interface IFrameReader extends Closeable {

    /**
     * Reads and decodes one frame.
     *
     * @param localIndex Index of the frame inside this container.
     * @return A newly allocated frame owned by the caller.
     * @throws IOException if the frame cannot be read or decoded.
     */
    Frame readFrame(int localIndex) throws IOException;
}
