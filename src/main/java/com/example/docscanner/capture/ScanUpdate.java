package com.example.docscanner.capture;

import com.example.docscanner.model.DetectionResult;
import com.example.docscanner.model.Quality;
import com.example.docscanner.model.Rectangle;

/**
 * Outcome of one analysed preview frame.
 *
 * @param detection     raw detector output
 * @param rectangle     rectangle after smoothing, in image space, {@code null} when none
 * @param viewRectangle the same rectangle in view space, {@code null} without a view size
 * @param quality       verdict that fed the stabilizer
 * @param counter       stabilizer counter after this frame
 * @param state         stabilizer state after this frame
 */
public record ScanUpdate(
        DetectionResult detection,
        Rectangle rectangle,
        Rectangle viewRectangle,
        Quality quality,
        int counter,
        StabilizerState state) {

    public boolean captureDue() {
        return state == StabilizerState.READY;
    }
}
