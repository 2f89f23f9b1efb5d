package com.example.docscanner.capture;

import com.example.docscanner.model.Rectangle;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;

class RectangleSmootherTest {

    private final MutableClock clock = new MutableClock();
    private final RectangleSmoother smoother = new RectangleSmoother(Duration.ofMillis(150), clock);
    private final Rectangle document = Rectangle.ofBox(10, 10, 200, 100);

    @Test
    void shouldPassThroughDetections() {
        assertThat(smoother.smooth(document)).contains(document);
    }

    @Test
    void shouldHoldLastRectangleForShortGap() {
        smoother.smooth(document);
        clock.advance(Duration.ofMillis(100));

        assertThat(smoother.smooth(null)).contains(document);
    }

    @Test
    void shouldDropRectangleOnceHoldExpires() {
        smoother.smooth(document);
        clock.advance(Duration.ofMillis(150));

        assertThat(smoother.smooth(null)).isEmpty();

        clock.advance(Duration.ofMillis(1));
        assertThat(smoother.smooth(null)).isEmpty();
    }

    @Test
    void shouldForgetRectangleWhenCleared() {
        smoother.smooth(document);
        smoother.clear();

        assertThat(smoother.smooth(null)).isEmpty();
    }
}
