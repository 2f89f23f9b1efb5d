package com.example.docscanner.model;

import java.util.Objects;
import java.util.Optional;

/**
 * Outcome of one detection call. Corner coordinates are in upright image space, i.e. after the
 * frame's rotation hint was applied, and {@code frameWidth x frameHeight} describe that space.
 */
public record DetectionResult(Rectangle rectangle, int frameWidth, int frameHeight, DetectionPass pass) {

    public DetectionResult {
        Objects.requireNonNull(pass, "Detection pass must not be null");
        if ((rectangle == null) != (pass == DetectionPass.NONE)) {
            throw new IllegalArgumentException("Pass " + pass + " is inconsistent with rectangle " + rectangle);
        }
    }

    public static DetectionResult none(int frameWidth, int frameHeight) {
        return new DetectionResult(null, frameWidth, frameHeight, DetectionPass.NONE);
    }

    public static DetectionResult found(Rectangle rectangle, int frameWidth, int frameHeight, DetectionPass pass) {
        return new DetectionResult(Objects.requireNonNull(rectangle), frameWidth, frameHeight, pass);
    }

    public Optional<Rectangle> detectedRectangle() {
        return Optional.ofNullable(rectangle);
    }

    public boolean isFound() {
        return rectangle != null;
    }
}
