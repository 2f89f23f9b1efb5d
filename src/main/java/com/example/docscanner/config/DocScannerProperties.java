package com.example.docscanner.config;

import com.example.docscanner.detection.DetectionConfig;
import com.example.docscanner.quality.QualityThresholds;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Binds the {@code docscanner.*} properties. Defaults match {@link DetectionConfig#defaults()}
 * and {@link QualityThresholds#defaults()} so an empty configuration behaves like the library.
 */
@ConfigurationProperties(prefix = "docscanner")
public class DocScannerProperties {

    private String configVersion = DetectionConfig.DEFAULT_VERSION;
    private final Preprocessing preprocessing = new Preprocessing();
    private final Edges edges = new Edges();
    private final Contours contours = new Contours();
    private final Refinement refinement = new Refinement();
    private final Hint hint = new Hint();
    private final Quality quality = new Quality();
    private final Stabilizer stabilizer = new Stabilizer();

    public DetectionConfig toDetectionConfig() {
        return new DetectionConfig(
                configVersion,
                new DetectionConfig.Preprocessing(
                        preprocessing.getClaheClipLimit(),
                        preprocessing.getClaheTileGridSize(),
                        preprocessing.getBlurKernelSize()),
                new DetectionConfig.EdgeDetection(
                        edges.getSigma(),
                        edges.getCannyLowFloor(),
                        edges.getCannyHighFloor(),
                        edges.getCloseKernelSize(),
                        edges.getAdaptiveBlockSize(),
                        edges.getAdaptiveC(),
                        edges.isFallbackEnabled()),
                new DetectionConfig.ContourFilter(
                        contours.getMinAreaFloor(),
                        contours.getMinAreaRatio(),
                        contours.getMaxAreaRatio(),
                        contours.getEpsilonRatio(),
                        contours.getRelaxedEpsilonRatio(),
                        contours.getMinRectangularity(),
                        contours.getMinFallbackRectangularity(),
                        contours.getMinEdgeFloor(),
                        contours.getMinEdgeRatio(),
                        contours.getMinAspectRatio(),
                        contours.getMaxAspectRatio()),
                new DetectionConfig.Refinement(
                        refinement.isEnabled(),
                        refinement.getWindowHalfSize(),
                        refinement.getMaxIterations(),
                        refinement.getEpsilon()),
                new DetectionConfig.RegionHint(
                        hint.getExpandRatio(),
                        hint.getInsetRatio(),
                        hint.isFallbackToHint()));
    }

    public QualityThresholds toQualityThresholds() {
        return new QualityThresholds(
                quality.getMaxEdgeMisalignmentPx(),
                quality.getEdgeMarginPx(),
                quality.getMinAreaRatio(),
                quality.getMaxAreaRatio(),
                quality.getMaxSkewRatio(),
                quality.getMinOppositeEdgeRatio(),
                quality.getMaxOppositeEdgeRatio());
    }

    public String getConfigVersion() {
        return configVersion;
    }

    public void setConfigVersion(String configVersion) {
        this.configVersion = configVersion;
    }

    public Preprocessing getPreprocessing() {
        return preprocessing;
    }

    public Edges getEdges() {
        return edges;
    }

    public Contours getContours() {
        return contours;
    }

    public Refinement getRefinement() {
        return refinement;
    }

    public Hint getHint() {
        return hint;
    }

    public Quality getQuality() {
        return quality;
    }

    public Stabilizer getStabilizer() {
        return stabilizer;
    }

    public static class Preprocessing {

        private double claheClipLimit = 2.5;
        private int claheTileGridSize = 8;
        private int blurKernelSize = 3;

        public double getClaheClipLimit() {
            return claheClipLimit;
        }

        public void setClaheClipLimit(double claheClipLimit) {
            this.claheClipLimit = claheClipLimit;
        }

        public int getClaheTileGridSize() {
            return claheTileGridSize;
        }

        public void setClaheTileGridSize(int claheTileGridSize) {
            this.claheTileGridSize = claheTileGridSize;
        }

        public int getBlurKernelSize() {
            return blurKernelSize;
        }

        public void setBlurKernelSize(int blurKernelSize) {
            this.blurKernelSize = blurKernelSize;
        }
    }

    public static class Edges {

        private double sigma = 0.33;
        private double cannyLowFloor = 50.0;
        private double cannyHighFloor = 150.0;
        private int closeKernelSize = 3;
        private int adaptiveBlockSize = 15;
        private double adaptiveC = 2.0;
        private boolean fallbackEnabled = true;

        public double getSigma() {
            return sigma;
        }

        public void setSigma(double sigma) {
            this.sigma = sigma;
        }

        public double getCannyLowFloor() {
            return cannyLowFloor;
        }

        public void setCannyLowFloor(double cannyLowFloor) {
            this.cannyLowFloor = cannyLowFloor;
        }

        public double getCannyHighFloor() {
            return cannyHighFloor;
        }

        public void setCannyHighFloor(double cannyHighFloor) {
            this.cannyHighFloor = cannyHighFloor;
        }

        public int getCloseKernelSize() {
            return closeKernelSize;
        }

        public void setCloseKernelSize(int closeKernelSize) {
            this.closeKernelSize = closeKernelSize;
        }

        public int getAdaptiveBlockSize() {
            return adaptiveBlockSize;
        }

        public void setAdaptiveBlockSize(int adaptiveBlockSize) {
            this.adaptiveBlockSize = adaptiveBlockSize;
        }

        public double getAdaptiveC() {
            return adaptiveC;
        }

        public void setAdaptiveC(double adaptiveC) {
            this.adaptiveC = adaptiveC;
        }

        public boolean isFallbackEnabled() {
            return fallbackEnabled;
        }

        public void setFallbackEnabled(boolean fallbackEnabled) {
            this.fallbackEnabled = fallbackEnabled;
        }
    }

    public static class Contours {

        private double minAreaFloor = 350.0;
        private double minAreaRatio = 0.02;
        private double maxAreaRatio = 0.85;
        private double epsilonRatio = 0.01;
        private double relaxedEpsilonRatio = 0.02;
        private double minRectangularity = 0.7;
        private double minFallbackRectangularity = 0.5;
        private double minEdgeFloor = 60.0;
        private double minEdgeRatio = 0.08;
        private double minAspectRatio = 0.45;
        private double maxAspectRatio = 2.8;

        public double getMinAreaFloor() {
            return minAreaFloor;
        }

        public void setMinAreaFloor(double minAreaFloor) {
            this.minAreaFloor = minAreaFloor;
        }

        public double getMinAreaRatio() {
            return minAreaRatio;
        }

        public void setMinAreaRatio(double minAreaRatio) {
            this.minAreaRatio = minAreaRatio;
        }

        public double getMaxAreaRatio() {
            return maxAreaRatio;
        }

        public void setMaxAreaRatio(double maxAreaRatio) {
            this.maxAreaRatio = maxAreaRatio;
        }

        public double getEpsilonRatio() {
            return epsilonRatio;
        }

        public void setEpsilonRatio(double epsilonRatio) {
            this.epsilonRatio = epsilonRatio;
        }

        public double getRelaxedEpsilonRatio() {
            return relaxedEpsilonRatio;
        }

        public void setRelaxedEpsilonRatio(double relaxedEpsilonRatio) {
            this.relaxedEpsilonRatio = relaxedEpsilonRatio;
        }

        public double getMinRectangularity() {
            return minRectangularity;
        }

        public void setMinRectangularity(double minRectangularity) {
            this.minRectangularity = minRectangularity;
        }

        public double getMinFallbackRectangularity() {
            return minFallbackRectangularity;
        }

        public void setMinFallbackRectangularity(double minFallbackRectangularity) {
            this.minFallbackRectangularity = minFallbackRectangularity;
        }

        public double getMinEdgeFloor() {
            return minEdgeFloor;
        }

        public void setMinEdgeFloor(double minEdgeFloor) {
            this.minEdgeFloor = minEdgeFloor;
        }

        public double getMinEdgeRatio() {
            return minEdgeRatio;
        }

        public void setMinEdgeRatio(double minEdgeRatio) {
            this.minEdgeRatio = minEdgeRatio;
        }

        public double getMinAspectRatio() {
            return minAspectRatio;
        }

        public void setMinAspectRatio(double minAspectRatio) {
            this.minAspectRatio = minAspectRatio;
        }

        public double getMaxAspectRatio() {
            return maxAspectRatio;
        }

        public void setMaxAspectRatio(double maxAspectRatio) {
            this.maxAspectRatio = maxAspectRatio;
        }
    }

    public static class Refinement {

        private boolean enabled = true;
        private int windowHalfSize = 5;
        private int maxIterations = 40;
        private double epsilon = 0.001;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public int getWindowHalfSize() {
            return windowHalfSize;
        }

        public void setWindowHalfSize(int windowHalfSize) {
            this.windowHalfSize = windowHalfSize;
        }

        public int getMaxIterations() {
            return maxIterations;
        }

        public void setMaxIterations(int maxIterations) {
            this.maxIterations = maxIterations;
        }

        public double getEpsilon() {
            return epsilon;
        }

        public void setEpsilon(double epsilon) {
            this.epsilon = epsilon;
        }
    }

    public static class Hint {

        private double expandRatio = 0.25;
        private double insetRatio = 0.9;
        private boolean fallbackToHint = true;

        public double getExpandRatio() {
            return expandRatio;
        }

        public void setExpandRatio(double expandRatio) {
            this.expandRatio = expandRatio;
        }

        public double getInsetRatio() {
            return insetRatio;
        }

        public void setInsetRatio(double insetRatio) {
            this.insetRatio = insetRatio;
        }

        public boolean isFallbackToHint() {
            return fallbackToHint;
        }

        public void setFallbackToHint(boolean fallbackToHint) {
            this.fallbackToHint = fallbackToHint;
        }
    }

    public static class Quality {

        private double maxEdgeMisalignmentPx = 100.0;
        private double edgeMarginPx = 150.0;
        private double minAreaRatio = 0.06;
        private double maxAreaRatio = 0.95;
        private double maxSkewRatio = 0.3;
        private double minOppositeEdgeRatio = 0.33;
        private double maxOppositeEdgeRatio = 3.0;

        public double getMaxEdgeMisalignmentPx() {
            return maxEdgeMisalignmentPx;
        }

        public void setMaxEdgeMisalignmentPx(double maxEdgeMisalignmentPx) {
            this.maxEdgeMisalignmentPx = maxEdgeMisalignmentPx;
        }

        public double getEdgeMarginPx() {
            return edgeMarginPx;
        }

        public void setEdgeMarginPx(double edgeMarginPx) {
            this.edgeMarginPx = edgeMarginPx;
        }

        public double getMinAreaRatio() {
            return minAreaRatio;
        }

        public void setMinAreaRatio(double minAreaRatio) {
            this.minAreaRatio = minAreaRatio;
        }

        public double getMaxAreaRatio() {
            return maxAreaRatio;
        }

        public void setMaxAreaRatio(double maxAreaRatio) {
            this.maxAreaRatio = maxAreaRatio;
        }

        public double getMaxSkewRatio() {
            return maxSkewRatio;
        }

        public void setMaxSkewRatio(double maxSkewRatio) {
            this.maxSkewRatio = maxSkewRatio;
        }

        public double getMinOppositeEdgeRatio() {
            return minOppositeEdgeRatio;
        }

        public void setMinOppositeEdgeRatio(double minOppositeEdgeRatio) {
            this.minOppositeEdgeRatio = minOppositeEdgeRatio;
        }

        public double getMaxOppositeEdgeRatio() {
            return maxOppositeEdgeRatio;
        }

        public void setMaxOppositeEdgeRatio(double maxOppositeEdgeRatio) {
            this.maxOppositeEdgeRatio = maxOppositeEdgeRatio;
        }
    }

    public static class Stabilizer {

        private int requiredGoodFrames = 5;
        private double maxCornerDriftPx = 0.0;
        private Duration holdLastRectangle = Duration.ofMillis(150);

        public int getRequiredGoodFrames() {
            return requiredGoodFrames;
        }

        public void setRequiredGoodFrames(int requiredGoodFrames) {
            this.requiredGoodFrames = requiredGoodFrames;
        }

        public double getMaxCornerDriftPx() {
            return maxCornerDriftPx;
        }

        public void setMaxCornerDriftPx(double maxCornerDriftPx) {
            this.maxCornerDriftPx = maxCornerDriftPx;
        }

        public Duration getHoldLastRectangle() {
            return holdLastRectangle;
        }

        public void setHoldLastRectangle(Duration holdLastRectangle) {
            this.holdLastRectangle = holdLastRectangle;
        }
    }
}
