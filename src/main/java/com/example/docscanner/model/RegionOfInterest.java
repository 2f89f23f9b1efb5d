package com.example.docscanner.model;

import io.swagger.v3.oas.annotations.media.Schema;

/**
 * Axis-aligned box in upright image space, typically derived from an external object
 * detector's bounding box. Coordinates follow the pixel grid with the origin at the top-left.
 */
@Schema(description = "Axis-aligned region of interest restricting detection")
public record RegionOfInterest(
        @Schema(description = "Left edge in pixels", example = "40") int x,
        @Schema(description = "Top edge in pixels", example = "60") int y,
        @Schema(description = "Width in pixels", example = "400") int width,
        @Schema(description = "Height in pixels", example = "300") int height) {

    public int right() {
        return x + width;
    }

    public int bottom() {
        return y + height;
    }

    /**
     * Grows the box by {@code ratio} of its size on every side, without leaving the image.
     */
    public RegionOfInterest expand(double ratio, int imageWidth, int imageHeight) {
        int padX = (int) (width * ratio);
        int padY = (int) (height * ratio);
        int left = Math.max(0, x - padX);
        int top = Math.max(0, y - padY);
        int rightEdge = Math.min(imageWidth, right() + padX);
        int bottomEdge = Math.min(imageHeight, bottom() + padY);
        return new RegionOfInterest(left, top, rightEdge - left, bottomEdge - top);
    }

    /**
     * Shrinks the box around its center so that it keeps {@code ratio} of its width and height.
     */
    public RegionOfInterest inset(double ratio) {
        if (ratio >= 1.0) {
            return this;
        }
        int insetX = (int) Math.round((1.0 - ratio) * width / 2.0);
        int insetY = (int) Math.round((1.0 - ratio) * height / 2.0);
        return new RegionOfInterest(x + insetX, y + insetY, width - 2 * insetX, height - 2 * insetY);
    }

    /**
     * Forces the box inside a {@code imageWidth x imageHeight} image. The result always keeps at
     * least one pixel in each direction, so a box lying completely outside the image collapses
     * onto the nearest border pixel.
     */
    public RegionOfInterest clampTo(int imageWidth, int imageHeight) {
        if (imageWidth <= 0 || imageHeight <= 0) {
            throw new IllegalArgumentException("Cannot clamp a region to an empty image");
        }
        int left = clamp(x, 0, imageWidth - 1);
        int top = clamp(y, 0, imageHeight - 1);
        int rightEdge = clamp(right(), left + 1, imageWidth);
        int bottomEdge = clamp(bottom(), top + 1, imageHeight);
        return new RegionOfInterest(left, top, rightEdge - left, bottomEdge - top);
    }

    /**
     * @return {@code true} when at least one pixel of the box lies inside the image
     */
    public boolean overlaps(int imageWidth, int imageHeight) {
        return width > 0 && height > 0
                && x < imageWidth && y < imageHeight
                && right() > 0 && bottom() > 0;
    }

    public boolean coversWholeImage(int imageWidth, int imageHeight) {
        return x == 0 && y == 0 && width == imageWidth && height == imageHeight;
    }

    public Rectangle toRectangle() {
        return Rectangle.ofBox(x, y, width, height);
    }

    private static int clamp(int value, int min, int max) {
        if (value < min) {
            return min;
        }
        if (value > max) {
            return max;
        }
        return value;
    }
}
