package com.example.docscanner.capture;

public enum StabilizerState {

    /** No good frame counted. */
    IDLE,

    /** Some good frames counted, not enough to act on. */
    ACCUMULATING,

    /** The counter reached its cap; an automatic capture may fire. */
    READY;

    public static StabilizerState of(int counter, int requiredGoodFrames) {
        if (counter <= 0) {
            return IDLE;
        }
        return counter >= requiredGoodFrames ? READY : ACCUMULATING;
    }
}
