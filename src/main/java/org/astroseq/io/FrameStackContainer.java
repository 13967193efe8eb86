package org.astroseq.io;

import java.io.EOFException;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;

import org.astroseq.api.sequence.Frame;
import org.astroseq.api.sequence.IFrameContainer;
import org.astroseq.api.sequence.IFrameReader;

/**
 * Input container backed by one {@code .fstk} file.
 */
public final class FrameStackContainer implements IFrameContainer {

    private final Path path;
    private final FrameStackCodec.Header header;

    private FrameStackContainer(Path path, FrameStackCodec.Header header) {
        this.path = path;
        this.header = header;
    }

    /**
     * Reads the header of a stack file.
     *
     * @throws IOException if the file cannot be read or is not a frame stack.
     */
    public static FrameStackContainer probe(Path path) throws IOException {
        try (FileChannel channel = FileChannel.open(path, StandardOpenOption.READ)) {
            ByteBuffer buffer = ByteBuffer.allocate(FrameStackCodec.HEADER_SIZE);
            readFully(channel, buffer, 0);
            buffer.flip();
            try {
                return new FrameStackContainer(path, FrameStackCodec.decodeHeader(buffer));
            } catch (IOException e) {
                throw new IOException(path.getFileName() + ": " + e.getMessage(), e);
            }
        }
    }

    public Path getPath() {
        return path;
    }

    public FrameStackCodec.Header getHeader() {
        return header;
    }

    @Override
    public String getName() {
        return path.getFileName().toString();
    }

    @Override
    public int getFrameCount() {
        return header.frameCount();
    }

    @Override
    public IFrameReader open() throws IOException {
        FileChannel channel = FileChannel.open(path, StandardOpenOption.READ);
        return new Reader(channel);
    }

    private static void readFully(FileChannel channel, ByteBuffer buffer, long position) throws IOException {
        long offset = position;
        while (buffer.hasRemaining()) {
            int read = channel.read(buffer, offset);
            if (read < 0) {
                throw new EOFException("Unexpected end of file at offset " + offset);
            }
            offset += read;
        }
    }

    private final class Reader implements IFrameReader {

        private final FileChannel channel;

        private Reader(FileChannel channel) {
            this.channel = channel;
        }

        @Override
        public Frame readFrame(int localIndex) throws IOException {
            if (localIndex < 0 || localIndex >= header.frameCount()) {
                throw new IOException("Frame " + localIndex + " out of range, '" + getName() + "' holds "
                        + header.frameCount() + " frame(s)");
            }
            Frame frame = Frame.allocate(header.geometry());
            readFully(channel, ByteBuffer.wrap(frame.getData()), header.frameOffset(localIndex));
            return frame;
        }

        @Override
        public void close() throws IOException {
            channel.close();
        }
    }
}
