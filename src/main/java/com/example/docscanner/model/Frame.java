package com.example.docscanner.model;

import java.util.Objects;

/**
 * Read-only view over one camera frame or still image. The pixel array is not copied: the
 * caller owns it for the duration of a single call and the detector never keeps a reference
 * once that call returns.
 *
 * @param width    buffer width in pixels, before rotation
 * @param height   buffer height in pixels, before rotation
 * @param format   pixel layout of {@code data}
 * @param rotation clockwise rotation (0, 90, 180 or 270) that brings the buffer upright
 * @param data     raw pixels
 */
public record Frame(int width, int height, PixelFormat format, int rotation, byte[] data) {

    public Frame {
        Objects.requireNonNull(format, "Pixel format must not be null");
        Objects.requireNonNull(data, "Pixel data must not be null");
        if (width < 0 || height < 0) {
            throw new IllegalArgumentException("Frame dimensions must not be negative: " + width + "x" + height);
        }
        if (!isSupportedRotation(rotation)) {
            throw new IllegalArgumentException("Rotation must be one of 0, 90, 180, 270 but was " + rotation);
        }
        if (format == PixelFormat.NV21 && height % 2 != 0) {
            throw new IllegalArgumentException("NV21 frames require an even height but was " + height);
        }
        long expected = format.bufferSize(width, height);
        if (data.length != expected) {
            throw new IllegalArgumentException(String.format(
                    "Buffer of %d bytes does not match %dx%d %s (expected %d bytes)",
                    data.length, width, height, format, expected));
        }
    }

    public static Frame gray(int width, int height, byte[] data) {
        return new Frame(width, height, PixelFormat.GRAY, 0, data);
    }

    public static Frame rgb(int width, int height, byte[] data) {
        return new Frame(width, height, PixelFormat.RGB, 0, data);
    }

    public static Frame nv21(int width, int height, int rotation, byte[] data) {
        return new Frame(width, height, PixelFormat.NV21, rotation, data);
    }

    public static boolean isSupportedRotation(int rotation) {
        return rotation == 0 || rotation == 90 || rotation == 180 || rotation == 270;
    }

    /**
     * @return {@code true} when the frame carries no pixels at all
     */
    public boolean isEmpty() {
        return width == 0 || height == 0;
    }

    /**
     * @return width of the frame once the rotation hint has been applied
     */
    public int uprightWidth() {
        return swapsAxes() ? height : width;
    }

    /**
     * @return height of the frame once the rotation hint has been applied
     */
    public int uprightHeight() {
        return swapsAxes() ? width : height;
    }

    private boolean swapsAxes() {
        return rotation == 90 || rotation == 270;
    }

    @Override
    public String toString() {
        return "Frame[" + width + "x" + height + " " + format + " rotation=" + rotation + "]";
    }
}
