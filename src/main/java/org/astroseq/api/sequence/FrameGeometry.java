package org.astroseq.api.sequence;

/**
 * Dimensions and sample type of a decoded frame.
 *
 * @param width     Width in pixels.
 * @param height    Height in pixels.
 * @param channels  Number of planes (1 for mono, 3 for RGB).
 * @param pixelType Sample type.
 */
public record FrameGeometry(int width, int height, int channels, PixelType pixelType) {

    public FrameGeometry {
        if (width <= 0 || height <= 0 || channels <= 0) {
            throw new IllegalArgumentException(
                    "Invalid frame geometry " + width + "x" + height + "x" + channels);
        }
        if (pixelType == null) {
            throw new IllegalArgumentException("pixelType must not be null");
        }
    }

    /**
     * Size of one channel plane in bytes.
     */
    public long bytesPerPlane() {
        return (long) width * height * pixelType.bytesPerSample();
    }

    /**
     * Size of the full decoded frame in bytes, i.e. width * height * channels * bytesPerSample.
     */
    public long bytesPerFrame() {
        return bytesPerPlane() * channels;
    }

    /**
     * Returns the geometry of a single plane of this frame.
     */
    public FrameGeometry withChannels(int newChannels) {
        return new FrameGeometry(width, height, newChannels, pixelType);
    }

    @Override
    public String toString() {
        return width + "x" + height + "x" + channels + " " + pixelType;
    }
}
