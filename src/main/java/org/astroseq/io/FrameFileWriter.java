package org.astroseq.io;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Queue;
import java.util.UUID;
import java.util.concurrent.ConcurrentLinkedQueue;

import org.astroseq.api.container.IContainerHandle;
import org.astroseq.api.container.IContainerWriter;
import org.astroseq.api.container.OutputIndexing;
import org.astroseq.api.sequence.Frame;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes every frame to its own single-frame {@code .fstk} file, named after the frame's input
 * index: {@code <prefix><sequence>_00042.fstk}.
 * <p>
 * Each file is written to a temporary file and moved into place atomically, so concurrent
 * writers never expose a partial frame.
 */
public final class FrameFileWriter implements IContainerWriter {

    private static final Logger log = LoggerFactory.getLogger(FrameFileWriter.class);

    @Override
    public String getFormatName() {
        return "files";
    }

    @Override
    public boolean isContiguous() {
        return false;
    }

    @Override
    public OutputIndexing getIndexing() {
        return OutputIndexing.INPUT;
    }

    @Override
    public boolean isCountMandatory() {
        return false;
    }

    /**
     * Returns the base path of the per-frame files; see {@link #frameFile(Path, int)}.
     */
    @Override
    public Path resolveOutput(Path directory, String prefix, String sequenceName) {
        return directory.resolve(prefix + sequenceName);
    }

    /**
     * Path of the file holding the frame with the given input index.
     */
    public static Path frameFile(Path base, int index) {
        String name = base.getFileName() + "_" + String.format("%05d", index) + FrameStackCodec.EXTENSION;
        Path parent = base.getParent();
        return parent != null ? parent.resolve(name) : Path.of(name);
    }

    @Override
    public IContainerHandle open(Path base, int expectedCount) throws IOException {
        Path parent = base.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        return new Handle(base);
    }

    private static final class Handle implements IContainerHandle {

        private final Path base;
        private final Queue<Path> writtenFiles = new ConcurrentLinkedQueue<>();

        private Handle(Path base) {
            this.base = base;
        }

        @Override
        public Path getPath() {
            return base;
        }

        @Override
        public void writeFrame(Frame frame, int index) throws IOException {
            Path target = frameFile(base, index);
            Path temp = target.resolveSibling(target.getFileName() + "." + UUID.randomUUID() + ".tmp");
            try {
                try (OutputStream out = Files.newOutputStream(temp)) {
                    out.write(FrameStackCodec.encodeHeader(frame.getGeometry(), 1).array());
                    out.write(frame.getData());
                }
                Files.move(temp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } catch (IOException e) {
                try {
                    Files.deleteIfExists(temp);
                } catch (IOException cleanupEx) {
                    log.warn("Failed to clean up temp file after write failure: {}", temp, cleanupEx);
                }
                throw e;
            }
            writtenFiles.add(target);
        }

        @Override
        public void close(int actualCount) {
            log.debug("{} frame file(s) written for '{}'", actualCount, base.getFileName());
        }

        @Override
        public void abortAndDelete() throws IOException {
            IOException firstFailure = null;
            Path file;
            while ((file = writtenFiles.poll()) != null) {
                try {
                    Files.deleteIfExists(file);
                } catch (IOException e) {
                    if (firstFailure == null) {
                        firstFailure = e;
                    }
                }
            }
            if (firstFailure != null) {
                throw firstFailure;
            }
        }
    }
}
