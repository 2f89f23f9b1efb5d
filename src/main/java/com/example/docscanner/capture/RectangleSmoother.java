package com.example.docscanner.capture;

import com.example.docscanner.model.Rectangle;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * Bridges single missed frames: after a miss the last rectangle is reported again until it is
 * older than the hold duration. Not thread safe.
 */
public class RectangleSmoother {

    private final Clock clock;
    private final Duration hold;

    private Rectangle last;
    private Instant lastSeen;

    public RectangleSmoother(Duration hold) {
        this(hold, Clock.systemUTC());
    }

    public RectangleSmoother(Duration hold, Clock clock) {
        Objects.requireNonNull(hold, "Hold duration must not be null");
        if (hold.isNegative()) {
            throw new IllegalArgumentException("Hold duration must not be negative but was " + hold);
        }
        this.hold = hold;
        this.clock = Objects.requireNonNull(clock, "Clock must not be null");
    }

    public Optional<Rectangle> smooth(Rectangle detected) {
        Instant now = clock.instant();
        if (detected != null) {
            last = detected;
            lastSeen = now;
            return Optional.of(detected);
        }
        if (last != null && Duration.between(lastSeen, now).compareTo(hold) < 0) {
            return Optional.of(last);
        }
        clear();
        return Optional.empty();
    }

    public void clear() {
        last = null;
        lastSeen = null;
    }
}
