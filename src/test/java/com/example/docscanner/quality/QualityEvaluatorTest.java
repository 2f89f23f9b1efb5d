package com.example.docscanner.quality;

import com.example.docscanner.model.Point;
import com.example.docscanner.model.Quality;
import com.example.docscanner.model.QualitySpace;
import com.example.docscanner.model.Rectangle;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class QualityEvaluatorTest {

    private final QualityEvaluator evaluator = new QualityEvaluator(QualityThresholds.defaults());

    @Test
    void shouldAcceptHalfOfViewWithoutSkew() {
        double side = Math.sqrt(0.5) * 1000;
        Rectangle half = Rectangle.ofBox((1000 - side) / 2, (1000 - side) / 2, side, side);

        assertThat(evaluator.evaluate(half, 1000, 1000, QualitySpace.VIEW)).isEqualTo(Quality.GOOD);
    }

    @Test
    void shouldFlagSmallRectangleAsTooFarInView() {
        Rectangle small = Rectangle.ofBox(400, 400, 200, 200);

        assertThat(evaluator.evaluate(small, 1000, 1000, QualitySpace.VIEW)).isEqualTo(Quality.TOO_FAR);
    }

    @Test
    void shouldFlagViewportSizedRectangleAsTooFar() {
        Rectangle border = Rectangle.ofBox(2, 2, 996, 996);

        assertThat(evaluator.evaluate(border, 1000, 1000, QualitySpace.VIEW)).isEqualTo(Quality.TOO_FAR);
    }

    @Test
    void shouldFlagEdgeSkewedByTwentyDegrees() {
        double length = 700;
        double angle = Math.toRadians(20);
        Rectangle skewed = new Rectangle(
                new Point(150, 300),
                new Point(150 + length * Math.cos(angle), 300 - length * Math.sin(angle)),
                new Point(150, 850),
                new Point(850, 850));

        assertThat(evaluator.evaluate(skewed, 1000, 1000, QualitySpace.VIEW)).isEqualTo(Quality.BAD_ANGLE);
    }

    @Test
    void shouldFlagStrongKeystoneAsBadAngle() {
        // slight per-edge skew but the top edge is a quarter of the bottom edge
        Rectangle keystone = new Rectangle(
                new Point(400, 100), new Point(560, 100), new Point(200, 900), new Point(800, 900));

        assertThat(evaluator.evaluate(keystone, 1000, 1000, QualitySpace.VIEW)).isEqualTo(Quality.BAD_ANGLE);
    }

    @Test
    void shouldTreatMissingReferenceSizeAsTooFar() {
        Rectangle box = Rectangle.ofBox(0, 0, 100, 100);

        assertThat(evaluator.evaluate(box, 0, 1000, QualitySpace.VIEW)).isEqualTo(Quality.TOO_FAR);
        assertThat(evaluator.evaluate(box, 1000, 0, QualitySpace.IMAGE)).isEqualTo(Quality.TOO_FAR);
    }

    @Test
    void shouldAcceptFrameFillingRectangleInImageSpace() {
        Rectangle filling = new Rectangle(
                new Point(100, 100), new Point(900, 120), new Point(110, 900), new Point(900, 880));

        assertThat(evaluator.evaluate(filling, 1000, 1000, QualitySpace.IMAGE)).isEqualTo(Quality.GOOD);
    }

    @Test
    void shouldFlagMisalignedEdgesInImageSpace() {
        Rectangle tilted = new Rectangle(
                new Point(100, 100), new Point(900, 250), new Point(100, 900), new Point(900, 900));

        assertThat(evaluator.evaluate(tilted, 1000, 1000, QualitySpace.IMAGE)).isEqualTo(Quality.BAD_ANGLE);
    }

    @Test
    void shouldFlagRectangleAwayFromFrameEdgesInImageSpace() {
        Rectangle centered = Rectangle.ofBox(300, 300, 400, 400);

        assertThat(evaluator.evaluate(centered, 1000, 1000, QualitySpace.IMAGE)).isEqualTo(Quality.TOO_FAR);
    }

    @Test
    void shouldRejectEmptyAreaBand() {
        assertThatThrownBy(() -> new QualityThresholds(100, 150, 0.5, 0.4, 0.3, 0.33, 3.0))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
