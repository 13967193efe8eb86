package org.astroseq.api.container;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Factory for output containers of one storage format.
 */
public interface IContainerWriter {

    /**
     * Short format name used in logs and on the command line.
     */
    String getFormatName();

    /**
     * Contiguous formats store all frames in one file that can only be appended to in order.
     * They are written through a single reorder queue. Non-contiguous formats (one file per
     * frame) are written directly by the workers.
     */
    boolean isContiguous();

    OutputIndexing getIndexing();

    /**
     * Whether the frame count must be known when the container is created. An aborted run
     * deletes such a container instead of keeping a shorter one.
     */
    boolean isCountMandatory();

    /**
     * Resolves the output path for a sequence name with the given prefix.
     */
    Path resolveOutput(Path directory, String prefix, String sequenceName);

    /**
     * Creates a new container.
     *
     * @param path          Output path as returned by {@link #resolveOutput}.
     * @param expectedCount Number of frames that will be written, or a negative value if unknown.
     * @throws IOException if the container cannot be created.
     */
    IContainerHandle open(Path path, int expectedCount) throws IOException;
}
