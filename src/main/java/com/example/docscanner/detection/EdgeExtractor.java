package com.example.docscanner.detection;

import org.opencv.core.Core;
import org.opencv.core.Mat;
import org.opencv.core.MatOfFloat;
import org.opencv.core.MatOfInt;
import org.opencv.core.Size;
import org.opencv.imgproc.Imgproc;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Turns the blurred gray image into binary edge maps. The primary map comes from Canny with
 * thresholds derived from the image median; the secondary map comes from adaptive Gaussian
 * thresholding and is meant for low-contrast scenes where Canny sees nothing.
 */
public final class EdgeExtractor {

    private static final Logger log = LoggerFactory.getLogger(EdgeExtractor.class);

    private final DetectionConfig.EdgeDetection config;

    public EdgeExtractor(DetectionConfig.EdgeDetection config) {
        this.config = config;
        OpenCvRuntime.ensureLoaded();
    }

    /**
     * Canny edges followed by a morphological close that bridges gaps left by glare and shadow.
     */
    public Mat cannyEdges(Mat blurred, ScratchMats scratch) {
        CannyThresholds thresholds = thresholdsFor(blurred);
        log.debug("Canny thresholds low={} high={} (median {})", thresholds.low(), thresholds.high(), thresholds.median());
        Mat edges = scratch.mat();
        Imgproc.Canny(blurred, edges, thresholds.low(), thresholds.high());
        return close(edges, scratch);
    }

    /**
     * Two sided adaptive Gaussian threshold: a pixel is foreground when it is more than
     * {@code adaptiveC} brighter, or at least {@code adaptiveC} darker, than the Gaussian weighted
     * mean of its {@code adaptiveBlockSize} neighbourhood. Both polarities are kept so that a
     * closed ring forms around the document whichever side of its boundary is brighter.
     */
    public Mat adaptiveEdges(Mat blurred, ScratchMats scratch) {
        int block = config.adaptiveBlockSize();
        double c = config.adaptiveC();

        Mat brighter = scratch.mat();
        Imgproc.adaptiveThreshold(blurred, brighter, 255,
                Imgproc.ADAPTIVE_THRESH_GAUSSIAN_C, Imgproc.THRESH_BINARY, block, -c);

        Mat darker = scratch.mat();
        Imgproc.adaptiveThreshold(blurred, darker, 255,
                Imgproc.ADAPTIVE_THRESH_GAUSSIAN_C, Imgproc.THRESH_BINARY_INV, block, c);

        Mat mask = scratch.mat();
        Core.bitwise_or(brighter, darker, mask);
        return close(mask, scratch);
    }

    /**
     * Median based Canny thresholds: {@code low = max(lowFloor, (1 - sigma) * median)} and
     * {@code high = max(highFloor, (1 + sigma) * median)}.
     */
    public CannyThresholds thresholdsFor(Mat blurred) {
        double median = median(blurred);
        double sigma = config.sigma();
        double low = Math.max(config.cannyLowFloor(), (1.0 - sigma) * median);
        double high = Math.max(config.cannyHighFloor(), (1.0 + sigma) * median);
        return new CannyThresholds(median, low, high);
    }

    /**
     * Intensity median of an 8-bit single channel image, computed from its histogram.
     */
    static double median(Mat gray) {
        Mat histogram = new Mat();
        MatOfInt channels = new MatOfInt(0);
        MatOfInt histSize = new MatOfInt(256);
        MatOfFloat ranges = new MatOfFloat(0f, 256f);
        Mat noMask = new Mat();
        try {
            Imgproc.calcHist(List.of(gray), channels, noMask, histogram, histSize, ranges);
            double half = gray.total() * 0.5;
            double cumulative = 0.0;
            for (int bin = 0; bin < 256; bin++) {
                cumulative += histogram.get(bin, 0)[0];
                if (cumulative >= half) {
                    return bin;
                }
            }
            return 255.0;
        } finally {
            histogram.release();
            channels.release();
            histSize.release();
            ranges.release();
            noMask.release();
        }
    }

    private Mat close(Mat binary, ScratchMats scratch) {
        int size = config.closeKernelSize();
        Mat kernel = scratch.track(Imgproc.getStructuringElement(Imgproc.MORPH_RECT, new Size(size, size)));
        Mat closed = scratch.mat();
        Imgproc.morphologyEx(binary, closed, Imgproc.MORPH_CLOSE, kernel);
        return closed;
    }

    public record CannyThresholds(double median, double low, double high) {
    }
}
