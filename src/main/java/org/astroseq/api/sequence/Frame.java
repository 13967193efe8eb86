package org.astroseq.api.sequence;

/**
 * A decoded frame: a planar pixel buffer plus its geometry.
 * <p>
 * Ownership moves from the reader to the worker and then to the writer. Whoever holds the
 * frame last calls {@link #release()} exactly once; afterwards the buffer is gone.
 * <p>
 * <strong>Thread Safety:</strong> Not thread-safe. A frame is owned by one thread at a time.
 */
public final class Frame {

    private final FrameGeometry geometry;
    private byte[] data;

    public Frame(FrameGeometry geometry, byte[] data) {
        if (geometry == null) {
            throw new IllegalArgumentException("geometry must not be null");
        }
        if (data == null || data.length != geometry.bytesPerFrame()) {
            throw new IllegalArgumentException("Buffer size " + (data == null ? "null" : data.length)
                    + " does not match geometry " + geometry + " (" + geometry.bytesPerFrame() + " bytes)");
        }
        this.geometry = geometry;
        this.data = data;
    }

    /**
     * Allocates a zero-filled frame of the given geometry.
     */
    public static Frame allocate(FrameGeometry geometry) {
        long size = geometry.bytesPerFrame();
        if (size > Integer.MAX_VALUE - 8) {
            throw new IllegalArgumentException("Frame too large for a single buffer: " + geometry);
        }
        return new Frame(geometry, new byte[(int) size]);
    }

    public FrameGeometry getGeometry() {
        return geometry;
    }

    /**
     * Returns the planar pixel buffer (all samples of channel 0, then channel 1, ...).
     *
     * @throws IllegalStateException if the frame has been released.
     */
    public byte[] getData() {
        if (data == null) {
            throw new IllegalStateException("Frame has already been released");
        }
        return data;
    }

    public boolean isReleased() {
        return data == null;
    }

    /**
     * Frees the pixel buffer.
     *
     * @throws IllegalStateException if the frame has already been released.
     */
    public void release() {
        if (data == null) {
            throw new IllegalStateException("Frame has already been released");
        }
        data = null;
    }
}
