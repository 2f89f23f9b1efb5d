package com.example.docscanner.warp;

import io.swagger.v3.oas.annotations.media.Schema;

@Schema(description = "Color controls applied to a cropped document")
public record ColorAdjustment(
        @Schema(description = "Additive brightness in [-1, 1], scaled to the 8-bit range", example = "0.0")
        double brightness,
        @Schema(description = "Contrast multiplier, 1 leaves the image untouched", example = "1.0")
        double contrast,
        @Schema(description = "Saturation multiplier, 0 gives a gray image", example = "1.0")
        double saturation) {

    public static final ColorAdjustment NEUTRAL = new ColorAdjustment(0.0, 1.0, 1.0);

    public ColorAdjustment {
        if (!Double.isFinite(brightness) || brightness < -1.0 || brightness > 1.0) {
            throw new IllegalArgumentException("Brightness must be within [-1, 1] but was " + brightness);
        }
        if (!Double.isFinite(contrast) || contrast < 0.0) {
            throw new IllegalArgumentException("Contrast must be a non-negative number but was " + contrast);
        }
        if (!Double.isFinite(saturation) || saturation < 0.0) {
            throw new IllegalArgumentException("Saturation must be a non-negative number but was " + saturation);
        }
    }

    public boolean isNeutral() {
        return brightness == 0.0 && contrast == 1.0 && saturation == 1.0;
    }
}
