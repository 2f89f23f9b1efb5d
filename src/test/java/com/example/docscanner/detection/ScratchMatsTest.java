package com.example.docscanner.detection;

import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;
import org.opencv.core.CvType;
import org.opencv.core.Mat;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ScratchMatsTest {

    @BeforeAll
    static void loadNatives() {
        OpenCvRuntime.ensureLoaded();
    }

    @Test
    void shouldReleaseEveryTrackedMatOnClose() {
        Mat allocated;
        Mat tracked;
        try (ScratchMats scratch = new ScratchMats()) {
            allocated = scratch.mat();
            tracked = scratch.track(new Mat(10, 10, CvType.CV_8UC1));
            assertThat(scratch.size()).isEqualTo(2);
            assertThat(tracked.empty()).isFalse();
        }
        assertThat(allocated.empty()).isTrue();
        assertThat(tracked.empty()).isTrue();
    }

    @Test
    void shouldRefuseAllocationAfterClose() {
        ScratchMats scratch = new ScratchMats();
        scratch.close();
        scratch.close();

        assertThatThrownBy(scratch::mat).isInstanceOf(IllegalStateException.class);
    }
}
