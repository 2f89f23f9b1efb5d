package com.example.docscanner.detection;

import com.example.docscanner.SyntheticFrames;
import com.example.docscanner.model.DetectionPass;
import com.example.docscanner.model.DetectionResult;
import com.example.docscanner.model.Frame;
import com.example.docscanner.model.Point;
import com.example.docscanner.model.Rectangle;
import com.example.docscanner.model.RegionOfInterest;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class DocumentDetectorTest {

    private final DocumentDetector detector = new DocumentDetector(DetectionConfig.defaults());

    @Test
    void shouldFindHighContrastDocumentWithCanny() {
        Frame frame = SyntheticFrames.grayWithBox(640, 480, 50, 200, 150, 100, 450, 340);

        DetectionResult result = detector.detect(frame);

        assertThat(result.pass()).isEqualTo(DetectionPass.CANNY);
        assertThat(result.frameWidth()).isEqualTo(640);
        assertThat(result.frameHeight()).isEqualTo(480);
        Rectangle rectangle = result.detectedRectangle().orElseThrow();
        assertCorners(rectangle, 150, 100, 450, 340, 4.0);
    }

    @Test
    void shouldReturnNoDocumentForBlankFrame() {
        DetectionResult result = detector.detect(SyntheticFrames.uniformGray(640, 480, 128));

        assertThat(result.isFound()).isFalse();
        assertThat(result.rectangle()).isNull();
        assertThat(result.pass()).isEqualTo(DetectionPass.NONE);
        assertThat(result.frameWidth()).isEqualTo(640);
    }

    @Test
    void shouldFindLowContrastDocumentThroughAdaptiveFallback() {
        Frame frame = SyntheticFrames.grayWithBox(640, 480, 100, 110, 150, 100, 450, 340);

        DetectionResult result = detector.detect(frame);

        assertThat(result.pass()).isEqualTo(DetectionPass.ADAPTIVE_THRESHOLD);
        assertCorners(result.detectedRectangle().orElseThrow(), 150, 100, 450, 340, 8.0);
    }

    @Test
    void shouldMissLowContrastDocumentWithoutFallback() {
        DetectionConfig defaults = DetectionConfig.defaults();
        DetectionConfig.EdgeDetection edges = defaults.edges();
        DocumentDetector cannyOnly = new DocumentDetector(defaults.withEdges(new DetectionConfig.EdgeDetection(
                edges.sigma(), edges.cannyLowFloor(), edges.cannyHighFloor(), edges.closeKernelSize(),
                edges.adaptiveBlockSize(), edges.adaptiveC(), false)));
        Frame frame = SyntheticFrames.grayWithBox(640, 480, 100, 110, 150, 100, 450, 340);

        assertThat(cannyOnly.detect(frame).isFound()).isFalse();
    }

    @Test
    void shouldReportUprightDimensionsForRotatedYuvFrame() {
        byte[] nv21 = SyntheticFrames.nv21WithBox(1280, 960, 50, 200, 200, 300, 700, 700);

        DetectionResult result = detector.detectInYuv(nv21, 1280, 960, 90, null);

        assertThat(result.frameWidth()).isEqualTo(960);
        assertThat(result.frameHeight()).isEqualTo(1280);
        // sensor (x, y) lands on upright (960 - y, x)
        assertCorners(result.detectedRectangle().orElseThrow(), 260, 200, 660, 700, 5.0);
    }

    @Test
    void shouldReturnNoDocumentForEmptyYuvBuffer() {
        DetectionResult result = detector.detectInYuv(new byte[0], 1280, 960, 90, null);

        assertThat(result.isFound()).isFalse();
        assertThat(result.frameWidth()).isEqualTo(960);
        assertThat(result.frameHeight()).isEqualTo(1280);
    }

    @Test
    void shouldRejectYuvBufferOfWrongLength() {
        assertThatThrownBy(() -> detector.detectInYuv(new byte[100], 1280, 960, 0, null))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void shouldReturnNoDocumentForZeroAreaFrame() {
        DetectionResult result = detector.detect(Frame.gray(0, 0, new byte[0]));

        assertThat(result.isFound()).isFalse();
    }

    @Test
    void shouldTranslateDetectionInsideRegionBackToImageCoordinates() {
        Frame frame = SyntheticFrames.grayWithBox(640, 480, 50, 200, 150, 100, 450, 340);

        DetectionResult result = detector.detect(frame, new RegionOfInterest(140, 90, 320, 260));

        assertThat(result.pass()).isEqualTo(DetectionPass.CANNY);
        assertCorners(result.detectedRectangle().orElseThrow(), 150, 100, 450, 340, 4.0);
    }

    @Test
    void shouldReportInsetHintWhenRegionHoldsNoDocument() {
        DetectionResult result = detector.detect(
                SyntheticFrames.uniformGray(640, 480, 128), new RegionOfInterest(100, 100, 200, 100));

        assertThat(result.pass()).isEqualTo(DetectionPass.HINT_FALLBACK);
        assertThat(result.rectangle()).isEqualTo(Rectangle.ofBox(110, 105, 180, 90));
    }

    @Test
    void shouldReturnNoDocumentForRegionOutsideImage() {
        DetectionResult result = detector.detect(
                SyntheticFrames.uniformGray(640, 480, 128), new RegionOfInterest(5000, 5000, 100, 100));

        assertThat(result.isFound()).isFalse();
        assertThat(result.pass()).isEqualTo(DetectionPass.NONE);
        assertThat(result.frameWidth()).isEqualTo(640);
    }

    @Test
    void shouldNotReportTinyHintAsDocument() {
        DetectionResult result = detector.detect(
                SyntheticFrames.uniformGray(640, 480, 128), new RegionOfInterest(300, 200, 6, 6));

        assertThat(result.isFound()).isFalse();
    }

    @Test
    void shouldNotReportElongatedHintAsDocument() {
        DetectionResult result = detector.detect(
                SyntheticFrames.uniformGray(640, 480, 128), new RegionOfInterest(20, 200, 600, 80));

        assertThat(result.isFound()).isFalse();
    }

    @Test
    void shouldClampRegionReachingOutsideImage() {
        Frame frame = SyntheticFrames.grayWithBox(640, 480, 50, 200, 150, 100, 450, 340);

        DetectionResult result = detector.detect(frame, new RegionOfInterest(120, 80, 900, 900));

        assertCorners(result.detectedRectangle().orElseThrow(), 150, 100, 450, 340, 4.0);
    }

    @Test
    void shouldNotFallBackToHintWhenDisabled() {
        DocumentDetector strict = new DocumentDetector(
                DetectionConfig.defaults().withHint(new DetectionConfig.RegionHint(0.25, 0.9, false)));

        DetectionResult result = strict.detect(
                SyntheticFrames.uniformGray(640, 480, 128), new RegionOfInterest(100, 100, 200, 100));

        assertThat(result.isFound()).isFalse();
    }

    private static void assertCorners(Rectangle rectangle, double left, double top, double right, double bottom,
                                      double tolerance) {
        assertNear(rectangle.topLeft(), left, top, tolerance);
        assertNear(rectangle.topRight(), right, top, tolerance);
        assertNear(rectangle.bottomLeft(), left, bottom, tolerance);
        assertNear(rectangle.bottomRight(), right, bottom, tolerance);
    }

    private static void assertNear(Point actual, double x, double y, double tolerance) {
        assertThat(actual.x()).as("x of %s", actual).isCloseTo(x, within(tolerance));
        assertThat(actual.y()).as("y of %s", actual).isCloseTo(y, within(tolerance));
    }
}
