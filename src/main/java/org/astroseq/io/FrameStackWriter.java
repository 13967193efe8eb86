package org.astroseq.io;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;

import org.astroseq.api.container.IContainerHandle;
import org.astroseq.api.container.IContainerWriter;
import org.astroseq.api.container.OutputIndexing;
import org.astroseq.api.sequence.Frame;
import org.astroseq.api.sequence.FrameGeometry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes a whole output sequence into one {@code .fstk} file.
 * <p>
 * Frames are appended in increasing output index; skipped frames are simply omitted. The
 * header is written with the first frame and its frame count is patched on close.
 */
public final class FrameStackWriter implements IContainerWriter {

    private static final Logger log = LoggerFactory.getLogger(FrameStackWriter.class);

    private final boolean countMandatory;

    public FrameStackWriter() {
        this(false);
    }

    /**
     * @param countMandatory Whether an aborted run deletes the file instead of keeping the
     *                       frames written so far.
     */
    public FrameStackWriter(boolean countMandatory) {
        this.countMandatory = countMandatory;
    }

    @Override
    public String getFormatName() {
        return "stack";
    }

    @Override
    public boolean isContiguous() {
        return true;
    }

    @Override
    public OutputIndexing getIndexing() {
        return OutputIndexing.OUTPUT;
    }

    @Override
    public boolean isCountMandatory() {
        return countMandatory;
    }

    @Override
    public Path resolveOutput(Path directory, String prefix, String sequenceName) {
        return directory.resolve(prefix + sequenceName + FrameStackCodec.EXTENSION);
    }

    @Override
    public IContainerHandle open(Path path, int expectedCount) throws IOException {
        Path parent = path.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        FileChannel channel = FileChannel.open(path, StandardOpenOption.CREATE, StandardOpenOption.WRITE,
                StandardOpenOption.TRUNCATE_EXISTING);
        return new Handle(path, channel, expectedCount);
    }

    private static final class Handle implements IContainerHandle {

        private final Path path;
        private final FileChannel channel;
        private final int expectedCount;
        private FrameGeometry geometry;
        private int written;
        private int lastIndex = -1;
        private boolean closed;

        private Handle(Path path, FileChannel channel, int expectedCount) {
            this.path = path;
            this.channel = channel;
            this.expectedCount = expectedCount;
        }

        @Override
        public Path getPath() {
            return path;
        }

        @Override
        public void writeFrame(Frame frame, int index) throws IOException {
            if (closed) {
                throw new IOException("Frame stack '" + path + "' is closed");
            }
            if (index <= lastIndex) {
                throw new IOException("Frame " + index + " written out of order to '" + path
                        + "', last was " + lastIndex);
            }
            if (geometry == null) {
                geometry = frame.getGeometry();
                writeFully(FrameStackCodec.encodeHeader(geometry, Math.max(expectedCount, 0)));
            } else if (!geometry.equals(frame.getGeometry())) {
                throw new IOException("Cannot add a frame with different properties (" + frame.getGeometry()
                        + ") to an existing sequence (" + geometry + ")");
            }
            writeFully(ByteBuffer.wrap(frame.getData()));
            written++;
            lastIndex = index;
        }

        @Override
        public void close(int actualCount) throws IOException {
            if (closed) {
                return;
            }
            closed = true;
            if (geometry == null) {
                channel.close();
                Files.deleteIfExists(path);
                log.warn("No frame was written to '{}', file removed", path);
                return;
            }
            if (actualCount != written) {
                log.debug("Closing '{}' with count {} but {} frame(s) on disk", path, actualCount, written);
            }
            try {
                channel.write(FrameStackCodec.encodeCount(written), FrameStackCodec.COUNT_OFFSET);
                channel.force(false);
            } finally {
                channel.close();
            }
        }

        @Override
        public void abortAndDelete() throws IOException {
            if (!closed) {
                closed = true;
                channel.close();
            }
            Files.deleteIfExists(path);
        }

        private void writeFully(ByteBuffer buffer) throws IOException {
            while (buffer.hasRemaining()) {
                channel.write(buffer);
            }
        }
    }
}
