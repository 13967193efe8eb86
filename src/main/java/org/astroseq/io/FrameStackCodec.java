package org.astroseq.io;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;

import org.astroseq.api.sequence.FrameGeometry;
import org.astroseq.api.sequence.PixelType;

/**
 * Layout of the frame stack container ({@code .fstk}).
 * <p>
 * A 32-byte big-endian header followed by {@code frameCount} planar frames of identical
 * geometry:
 * <pre>
 *   offset  size  field
 *   0       8     magic "ASQSTACK"
 *   8       4     version
 *   12      4     width
 *   16      4     height
 *   20      4     channels
 *   24      4     pixel type code
 *   28      4     frame count
 * </pre>
 */
public final class FrameStackCodec {

    public static final String EXTENSION = ".fstk";
    public static final int VERSION = 1;
    public static final int HEADER_SIZE = 32;
    public static final int COUNT_OFFSET = 28;

    private static final byte[] MAGIC = "ASQSTACK".getBytes(StandardCharsets.US_ASCII);

    private FrameStackCodec() {
    }

    /**
     * Decoded header.
     */
    public record Header(FrameGeometry geometry, int frameCount) {

        /**
         * File offset of the first byte of a frame.
         */
        public long frameOffset(int index) {
            return HEADER_SIZE + index * geometry.bytesPerFrame();
        }

        public long expectedFileSize() {
            return frameOffset(frameCount);
        }
    }

    public static ByteBuffer encodeHeader(FrameGeometry geometry, int frameCount) {
        ByteBuffer buffer = ByteBuffer.allocate(HEADER_SIZE).order(ByteOrder.BIG_ENDIAN);
        buffer.put(MAGIC);
        buffer.putInt(VERSION);
        buffer.putInt(geometry.width());
        buffer.putInt(geometry.height());
        buffer.putInt(geometry.channels());
        buffer.putInt(geometry.pixelType().code());
        buffer.putInt(frameCount);
        buffer.flip();
        return buffer;
    }

    /**
     * @throws IOException if the buffer does not hold a valid header.
     */
    public static Header decodeHeader(ByteBuffer buffer) throws IOException {
        if (buffer.remaining() < HEADER_SIZE) {
            throw new IOException("Truncated frame stack header (" + buffer.remaining() + " bytes)");
        }
        buffer.order(ByteOrder.BIG_ENDIAN);
        byte[] magic = new byte[MAGIC.length];
        buffer.get(magic);
        if (!Arrays.equals(magic, MAGIC)) {
            throw new IOException("Not a frame stack");
        }
        int version = buffer.getInt();
        if (version != VERSION) {
            throw new IOException("Unsupported frame stack version " + version);
        }
        int width = buffer.getInt();
        int height = buffer.getInt();
        int channels = buffer.getInt();
        int pixelCode = buffer.getInt();
        int frameCount = buffer.getInt();
        if (frameCount < 0) {
            throw new IOException("Negative frame count " + frameCount);
        }
        try {
            return new Header(new FrameGeometry(width, height, channels, PixelType.fromCode(pixelCode)), frameCount);
        } catch (IllegalArgumentException e) {
            throw new IOException("Invalid frame stack header: " + e.getMessage(), e);
        }
    }

    public static ByteBuffer encodeCount(int frameCount) {
        ByteBuffer buffer = ByteBuffer.allocate(4).order(ByteOrder.BIG_ENDIAN);
        buffer.putInt(frameCount);
        buffer.flip();
        return buffer;
    }
}
