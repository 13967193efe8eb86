package org.astroseq.engine;

import java.nio.file.Path;

import org.astroseq.api.container.IContainerWriter;

/**
 * One output sequence of a run.
 *
 * @param name   Name used in logs and for the writer thread.
 * @param path   Container path.
 * @param format Container format.
 */
public record OutputSpec(String name, Path path, IContainerWriter format) {

    public OutputSpec {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Output name must not be blank");
        }
        if (path == null || format == null) {
            throw new IllegalArgumentException("Output '" + name + "' needs a path and a format");
        }
    }
}
