package org.astroseq.engine.writer;

import java.nio.file.Path;

/**
 * Final report of one output.
 *
 * @param name          Output name.
 * @param path          Container path.
 * @param status        Final state of the container.
 * @param framesWritten Frames stored in the container.
 * @param framesSkipped Skip markers received (failed or aborted frames).
 */
public record WriterResult(String name, Path path, WriterStatus status, int framesWritten, int framesSkipped) {

    public boolean isUsable() {
        return status == WriterStatus.COMPLETED || status == WriterStatus.TRUNCATED;
    }
}
