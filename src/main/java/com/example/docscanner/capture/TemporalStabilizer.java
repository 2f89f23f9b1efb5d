package com.example.docscanner.capture;

import com.example.docscanner.model.Quality;
import com.example.docscanner.model.Rectangle;

import java.util.Objects;

/**
 * Bounded confidence counter fed with one quality verdict per analysed frame.
 *
 * <p>A GOOD frame increments the counter up to {@code requiredGoodFrames}; BAD_ANGLE and TOO_FAR
 * decrement it down to zero; a frame without a rectangle resets it. With a positive
 * {@code maxCornerDriftPx} a rectangle that moved further than that from the previous one also
 * resets the counter, so a document sliding across the preview never becomes ready.
 *
 * <p>Not thread safe. The counter belongs to the single loop that analyses frames and triggers
 * captures.
 */
public class TemporalStabilizer {

    private final int requiredGoodFrames;
    private final double maxCornerDriftPx;

    private int counter;
    private Rectangle previous;

    public TemporalStabilizer(int requiredGoodFrames, double maxCornerDriftPx) {
        if (requiredGoodFrames < 1) {
            throw new IllegalArgumentException("Required good frames must be at least 1 but was " + requiredGoodFrames);
        }
        if (maxCornerDriftPx < 0) {
            throw new IllegalArgumentException("Corner drift must not be negative but was " + maxCornerDriftPx);
        }
        this.requiredGoodFrames = requiredGoodFrames;
        this.maxCornerDriftPx = maxCornerDriftPx;
    }

    /**
     * @param rectangle rectangle seen in this frame, {@code null} when none
     * @param quality   verdict for that rectangle, ignored when the rectangle is {@code null}
     */
    public StabilizerState update(Rectangle rectangle, Quality quality) {
        if (rectangle == null) {
            counter = 0;
            previous = null;
            return state();
        }
        Objects.requireNonNull(quality, "Quality must not be null when a rectangle is present");

        if (hasDrifted(rectangle)) {
            counter = 0;
        } else if (quality == Quality.GOOD) {
            counter = Math.min(requiredGoodFrames, counter + 1);
        } else {
            counter = Math.max(0, counter - 1);
        }
        previous = rectangle;
        return state();
    }

    /** Called after a capture so the next one needs a fresh run of good frames. */
    public void reset() {
        counter = 0;
        previous = null;
    }

    public int counter() {
        return counter;
    }

    public int requiredGoodFrames() {
        return requiredGoodFrames;
    }

    public StabilizerState state() {
        return StabilizerState.of(counter, requiredGoodFrames);
    }

    public boolean isReady() {
        return state() == StabilizerState.READY;
    }

    private boolean hasDrifted(Rectangle rectangle) {
        return maxCornerDriftPx > 0
                && previous != null
                && rectangle.meanCornerDistance(previous) > maxCornerDriftPx;
    }
}
