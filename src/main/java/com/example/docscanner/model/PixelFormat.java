package com.example.docscanner.model;

/**
 * Pixel layouts a {@link Frame} can carry. Interleaved formats use one byte per channel.
 */
public enum PixelFormat {

    /** Single 8-bit luminance channel. */
    GRAY,

    /** Interleaved 8-bit red, green, blue. */
    RGB,

    /** Android camera layout: full Y plane followed by an interleaved V/U plane at quarter resolution. */
    NV21;

    /**
     * @return number of bytes a {@code width x height} buffer of this format occupies
     */
    public long bufferSize(int width, int height) {
        long pixels = (long) width * height;
        return switch (this) {
            case GRAY -> pixels;
            case RGB -> pixels * 3;
            case NV21 -> pixels + (long) width * (height / 2);
        };
    }
}
