package org.astroseq.api.sequence;

import java.io.IOException;

/**
 * One physical storage unit of a sequence: a multi-frame file or a single-frame file.
 */
public interface IFrameContainer {

    /**
     * Name used in log messages, typically the file name.
     */
    String getName();

    /**
     * Number of frames stored in this container.
     */
    int getFrameCount();

    /**
     * Opens the container for reading.
     *
     * @throws IOException if the container cannot be opened.
     */
    IFrameReader open() throws IOException;
}
