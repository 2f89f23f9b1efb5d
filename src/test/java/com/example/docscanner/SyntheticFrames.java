package com.example.docscanner;

import com.example.docscanner.model.Frame;

import java.util.Arrays;

/**
 * Builds in-memory test frames: a uniform background with an optional filled box.
 */
public final class SyntheticFrames {

    private SyntheticFrames() {
    }

    public static Frame uniformGray(int width, int height, int value) {
        byte[] data = new byte[width * height];
        Arrays.fill(data, (byte) value);
        return Frame.gray(width, height, data);
    }

    /**
     * Gray frame with {@code [x0, x1) x [y0, y1)} painted in {@code foreground}.
     */
    public static Frame grayWithBox(int width, int height, int background, int foreground,
                                    int x0, int y0, int x1, int y1) {
        byte[] data = new byte[width * height];
        Arrays.fill(data, (byte) background);
        for (int y = y0; y < y1; y++) {
            for (int x = x0; x < x1; x++) {
                data[y * width + x] = (byte) foreground;
            }
        }
        return Frame.gray(width, height, data);
    }

    /**
     * NV21 buffer whose Y plane holds the box and whose chroma plane is neutral.
     */
    public static byte[] nv21WithBox(int width, int height, int background, int foreground,
                                     int x0, int y0, int x1, int y1) {
        byte[] data = new byte[width * height + width * (height / 2)];
        Frame luma = grayWithBox(width, height, background, foreground, x0, y0, x1, y1);
        System.arraycopy(luma.data(), 0, data, 0, width * height);
        Arrays.fill(data, width * height, data.length, (byte) 128);
        return data;
    }

    /**
     * Gray frame whose pixel value encodes its position, useful to follow pixels through a warp.
     */
    public static Frame gradient(int width, int height) {
        byte[] data = new byte[width * height];
        for (int y = 0; y < height; y++) {
            for (int x = 0; x < width; x++) {
                data[y * width + x] = (byte) ((x * 3 + y * 2) % 256);
            }
        }
        return Frame.gray(width, height, data);
    }

    public static int pixel(Frame frame, int x, int y) {
        return frame.data()[y * frame.width() + x] & 0xFF;
    }
}
