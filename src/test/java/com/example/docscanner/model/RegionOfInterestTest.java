package com.example.docscanner.model;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RegionOfInterestTest {

    @Test
    void shouldExpandByQuarterWithinImage() {
        RegionOfInterest expanded = new RegionOfInterest(100, 100, 200, 100).expand(0.25, 640, 480);

        assertThat(expanded).isEqualTo(new RegionOfInterest(50, 75, 300, 150));
    }

    @Test
    void shouldStopExpandingAtImageBorder() {
        RegionOfInterest expanded = new RegionOfInterest(10, 10, 600, 400).expand(0.25, 640, 480);

        assertThat(expanded).isEqualTo(new RegionOfInterest(0, 0, 640, 480));
        assertThat(expanded.coversWholeImage(640, 480)).isTrue();
    }

    @Test
    void shouldInsetAroundCenter() {
        RegionOfInterest inset = new RegionOfInterest(100, 100, 200, 100).inset(0.9);

        assertThat(inset).isEqualTo(new RegionOfInterest(110, 105, 180, 90));
    }

    @Test
    void shouldClampRegionOutsideImage() {
        RegionOfInterest clamped = new RegionOfInterest(700, -50, 100, 100).clampTo(640, 480);

        assertThat(clamped.x()).isEqualTo(639);
        assertThat(clamped.y()).isZero();
        assertThat(clamped.width()).isEqualTo(1);
        assertThat(clamped.height()).isEqualTo(50);
    }

    @Test
    void shouldDetectOverlapWithImage() {
        assertThat(new RegionOfInterest(600, 400, 100, 100).overlaps(640, 480)).isTrue();
        assertThat(new RegionOfInterest(-50, -50, 51, 51).overlaps(640, 480)).isTrue();
        assertThat(new RegionOfInterest(640, 0, 10, 10).overlaps(640, 480)).isFalse();
        assertThat(new RegionOfInterest(-20, 10, 20, 10).overlaps(640, 480)).isFalse();
        assertThat(new RegionOfInterest(10, 10, 0, 10).overlaps(640, 480)).isFalse();
    }

    @Test
    void shouldRefuseToClampToEmptyImage() {
        assertThatThrownBy(() -> new RegionOfInterest(0, 0, 10, 10).clampTo(0, 10))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
