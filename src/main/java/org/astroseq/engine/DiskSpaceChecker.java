package org.astroseq.engine;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import org.astroseq.api.memory.ByteSizes;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Verifies that an output directory can hold the expected amount of data before a run starts.
 */
public class DiskSpaceChecker {

    private static final Logger log = LoggerFactory.getLogger(DiskSpaceChecker.class);

    /**
     * Returns the usable bytes of the file store holding a directory.
     */
    @FunctionalInterface
    public interface UsableSpaceProbe {
        long usableBytes(Path directory) throws IOException;
    }

    private final UsableSpaceProbe probe;

    public DiskSpaceChecker() {
        this(directory -> Files.getFileStore(directory).getUsableSpace());
    }

    public DiskSpaceChecker(UsableSpaceProbe probe) {
        this.probe = probe;
    }

    /**
     * @param directory     Directory the output will be written to (walked up to the first existing parent).
     * @param requiredBytes Bytes the run is expected to write there.
     * @return {@code true} if there is enough space or the space cannot be determined.
     */
    public boolean hasSpaceFor(Path directory, long requiredBytes) {
        Path existing = directory.toAbsolutePath();
        while (existing != null && !Files.exists(existing)) {
            existing = existing.getParent();
        }
        if (existing == null) {
            return true;
        }
        long available;
        try {
            available = probe.usableBytes(existing);
        } catch (IOException e) {
            log.warn("Cannot determine free disk space of '{}': {}", existing, e.getMessage());
            return true;
        }
        if (available >= requiredBytes) {
            log.debug("{} available in '{}', {} needed", ByteSizes.formatBytes(available), existing,
                    ByteSizes.formatBytes(requiredBytes));
            return true;
        }
        log.error("Not enough free disk space in '{}': {} available, {} needed (missing {})",
                existing, ByteSizes.formatBytes(available), ByteSizes.formatBytes(requiredBytes),
                ByteSizes.formatBytes(requiredBytes - available));
        return false;
    }
}
