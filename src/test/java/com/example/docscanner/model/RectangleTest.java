package com.example.docscanner.model;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class RectangleTest {

    @Test
    void shouldComputeEdgesAreaAndPerimeterOfBox() {
        Rectangle box = Rectangle.ofBox(10, 20, 300, 200);

        assertThat(box.topEdge()).isEqualTo(300.0);
        assertThat(box.leftEdge()).isEqualTo(200.0);
        assertThat(box.perimeter()).isEqualTo(1000.0);
        assertThat(box.area()).isCloseTo(60000.0, within(1e-9));
        assertThat(box.center()).isEqualTo(new Point(160, 120));
        assertThat(box.isValid()).isTrue();
    }

    @Test
    void shouldRejectCrossedCorners() {
        // topRight and bottomRight swapped, the outline becomes a bow tie
        Rectangle bowTie = new Rectangle(
                new Point(0, 0), new Point(100, 100), new Point(0, 100), new Point(100, 0));

        assertThat(bowTie.isSimple()).isFalse();
        assertThat(bowTie.isValid()).isFalse();
    }

    @Test
    void shouldRejectRepeatedCorners() {
        Rectangle collapsed = new Rectangle(
                new Point(5, 5), new Point(5, 5), new Point(0, 10), new Point(10, 10));

        assertThat(collapsed.hasDistinctCorners()).isFalse();
        assertThat(collapsed.isValid()).isFalse();
    }

    @Test
    void shouldRejectNonFiniteCorners() {
        Rectangle broken = new Rectangle(
                new Point(Double.NaN, 0), new Point(10, 0), new Point(0, 10), new Point(10, 10));

        assertThat(broken.isValid()).isFalse();
    }

    @Test
    void shouldMeasureCornerDriftAfterTranslation() {
        Rectangle box = Rectangle.ofBox(0, 0, 50, 50);

        assertThat(box.meanCornerDistance(box.translate(3, 4))).isCloseTo(5.0, within(1e-9));
        assertThat(box.translate(3, 4).minX()).isEqualTo(3.0);
        assertThat(box.translate(3, 4).maxY()).isEqualTo(54.0);
    }
}
