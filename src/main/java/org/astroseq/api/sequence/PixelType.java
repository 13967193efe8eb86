package org.astroseq.api.sequence;

/**
 * Sample type of a frame's pixels.
 */
public enum PixelType {
    BYTE(1, 1),
    USHORT(2, 2),
    FLOAT(4, 3);

    private final int bytesPerSample;
    private final int code;

    PixelType(int bytesPerSample, int code) {
        this.bytesPerSample = bytesPerSample;
        this.code = code;
    }

    public int bytesPerSample() {
        return bytesPerSample;
    }

    /**
     * Stable numeric code used in container headers.
     */
    public int code() {
        return code;
    }

    public static PixelType fromCode(int code) {
        for (PixelType type : values()) {
            if (type.code == code) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown pixel type code: " + code);
    }
}
