package com.example.docscanner.mapping;

import com.example.docscanner.model.Frame;
import com.example.docscanner.model.ScaleMode;
import io.swagger.v3.oas.annotations.media.Schema;

/**
 * Geometry shared by the coordinate spaces. Sizes that a mapping does not touch may be left at
 * zero; {@link CoordinateMapper} only checks the ones it needs.
 *
 * @param imageWidth   upright image width
 * @param imageHeight  upright image height
 * @param rotation     clockwise rotation taking the sensor buffer to the upright image
 * @param viewWidth    viewport width
 * @param viewHeight   viewport height
 * @param scaleMode    how the image is laid out in the viewport, {@link ScaleMode#FILL} when absent
 * @param bitmapWidth  target bitmap width
 * @param bitmapHeight target bitmap height
 */
@Schema(description = "Sizes and policies used to move a rectangle between coordinate spaces")
public record MappingParams(
        @Schema(description = "Upright image width", example = "960") int imageWidth,
        @Schema(description = "Upright image height", example = "1280") int imageHeight,
        @Schema(description = "Clockwise sensor to image rotation", allowableValues = {"0", "90", "180", "270"})
        int rotation,
        @Schema(description = "Viewport width", example = "1080") int viewWidth,
        @Schema(description = "Viewport height", example = "1920") int viewHeight,
        @Schema(description = "Viewport layout policy", defaultValue = "FILL") ScaleMode scaleMode,
        @Schema(description = "Target bitmap width", example = "3024") int bitmapWidth,
        @Schema(description = "Target bitmap height", example = "4032") int bitmapHeight) {

    public MappingParams {
        if (!Frame.isSupportedRotation(rotation)) {
            throw new IllegalArgumentException("Rotation must be one of 0, 90, 180 or 270 but was " + rotation);
        }
        if (imageWidth < 0 || imageHeight < 0 || viewWidth < 0 || viewHeight < 0 || bitmapWidth < 0 || bitmapHeight < 0) {
            throw new IllegalArgumentException("Sizes must not be negative");
        }
        if (scaleMode == null) {
            scaleMode = ScaleMode.FILL;
        }
    }

    public static MappingParams forImage(int imageWidth, int imageHeight) {
        return new MappingParams(imageWidth, imageHeight, 0, 0, 0, ScaleMode.FILL, 0, 0);
    }

    public MappingParams withRotation(int rotation) {
        return new MappingParams(imageWidth, imageHeight, rotation, viewWidth, viewHeight, scaleMode, bitmapWidth, bitmapHeight);
    }

    public MappingParams withView(int viewWidth, int viewHeight, ScaleMode scaleMode) {
        return new MappingParams(imageWidth, imageHeight, rotation, viewWidth, viewHeight, scaleMode, bitmapWidth, bitmapHeight);
    }

    public MappingParams withBitmap(int bitmapWidth, int bitmapHeight) {
        return new MappingParams(imageWidth, imageHeight, rotation, viewWidth, viewHeight, scaleMode, bitmapWidth, bitmapHeight);
    }

    public int sensorWidth() {
        return isQuarterTurn() ? imageHeight : imageWidth;
    }

    public int sensorHeight() {
        return isQuarterTurn() ? imageWidth : imageHeight;
    }

    private boolean isQuarterTurn() {
        return rotation == 90 || rotation == 270;
    }
}
