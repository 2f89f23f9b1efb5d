package com.example.docscanner.util;

import com.example.docscanner.model.Frame;
import com.example.docscanner.model.PixelFormat;

import javax.imageio.ImageIO;
import java.awt.AlphaComposite;
import java.awt.Graphics2D;
import java.awt.image.BufferedImage;
import java.awt.image.DataBufferByte;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.Arrays;

/**
 * Conversions between AWT images and {@link Frame} values. Gray images stay single channel,
 * everything else is flattened to packed RGB.
 */
public final class FrameImages {

    private FrameImages() {
    }

    /**
     * Decodes an encoded image (PNG, JPEG, ...).
     *
     * @throws IllegalArgumentException when no installed reader understands the bytes
     */
    public static Frame decode(InputStream input) throws IOException {
        BufferedImage image = ImageIO.read(input);
        if (image == null) {
            throw new IllegalArgumentException("Unsupported image format");
        }
        return toFrame(image);
    }

    public static Frame toFrame(BufferedImage image) {
        if (image == null) {
            throw new IllegalArgumentException("Input image cannot be null");
        }
        int width = image.getWidth();
        int height = image.getHeight();
        if (image.getType() == BufferedImage.TYPE_BYTE_GRAY) {
            byte[] gray = copyPixels(redraw(image, BufferedImage.TYPE_BYTE_GRAY));
            return Frame.gray(width, height, gray);
        }
        byte[] bgr = copyPixels(redraw(image, BufferedImage.TYPE_3BYTE_BGR));
        swapRedBlue(bgr);
        return Frame.rgb(width, height, bgr);
    }

    /**
     * Renders a gray or RGB frame as stored; the rotation hint is not applied.
     */
    public static BufferedImage toBufferedImage(Frame frame) {
        if (frame.format() == PixelFormat.NV21) {
            throw new IllegalArgumentException("NV21 frames must be converted to RGB before rendering");
        }
        if (frame.isEmpty()) {
            throw new IllegalArgumentException("Cannot render an empty frame");
        }
        if (frame.format() == PixelFormat.GRAY) {
            BufferedImage image = new BufferedImage(frame.width(), frame.height(), BufferedImage.TYPE_BYTE_GRAY);
            byte[] target = ((DataBufferByte) image.getRaster().getDataBuffer()).getData();
            System.arraycopy(frame.data(), 0, target, 0, target.length);
            return image;
        }
        BufferedImage image = new BufferedImage(frame.width(), frame.height(), BufferedImage.TYPE_3BYTE_BGR);
        byte[] target = ((DataBufferByte) image.getRaster().getDataBuffer()).getData();
        System.arraycopy(frame.data(), 0, target, 0, target.length);
        swapRedBlue(target);
        return image;
    }

    public static byte[] toPng(Frame frame) {
        ByteArrayOutputStream output = new ByteArrayOutputStream();
        try {
            if (!ImageIO.write(toBufferedImage(frame), "png", output)) {
                throw new IllegalStateException("No PNG writer available");
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to encode frame as PNG", e);
        }
        return output.toByteArray();
    }

    private static BufferedImage redraw(BufferedImage input, int type) {
        BufferedImage converted = new BufferedImage(input.getWidth(), input.getHeight(), type);
        Graphics2D g = converted.createGraphics();
        g.setComposite(AlphaComposite.Src);
        g.drawImage(input, 0, 0, null);
        g.dispose();
        return converted;
    }

    private static byte[] copyPixels(BufferedImage image) {
        byte[] pixels = ((DataBufferByte) image.getRaster().getDataBuffer()).getData();
        return Arrays.copyOf(pixels, pixels.length);
    }

    private static void swapRedBlue(byte[] packed) {
        for (int i = 0; i + 2 < packed.length; i += 3) {
            byte first = packed[i];
            packed[i] = packed[i + 2];
            packed[i + 2] = first;
        }
    }
}
