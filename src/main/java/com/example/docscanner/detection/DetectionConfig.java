package com.example.docscanner.detection;

import java.util.Objects;

/**
 * Tuning knobs of the detection pipeline. Backend specific tuning is expressed as a different
 * instance of this record rather than a different code path; {@link #version()} identifies which
 * set of constants produced a result when comparing devices.
 */
public record DetectionConfig(
        String version,
        Preprocessing preprocessing,
        EdgeDetection edges,
        ContourFilter contours,
        Refinement refinement,
        RegionHint hint) {

    public static final String DEFAULT_VERSION = "1.0";

    public DetectionConfig {
        Objects.requireNonNull(version, "version");
        Objects.requireNonNull(preprocessing, "preprocessing");
        Objects.requireNonNull(edges, "edges");
        Objects.requireNonNull(contours, "contours");
        Objects.requireNonNull(refinement, "refinement");
        Objects.requireNonNull(hint, "hint");
    }

    public static DetectionConfig defaults() {
        return new DetectionConfig(
                DEFAULT_VERSION,
                Preprocessing.defaults(),
                EdgeDetection.defaults(),
                ContourFilter.defaults(),
                Refinement.defaults(),
                RegionHint.defaults());
    }

    public DetectionConfig withEdges(EdgeDetection replacement) {
        return new DetectionConfig(version, preprocessing, replacement, contours, refinement, hint);
    }

    public DetectionConfig withRefinement(Refinement replacement) {
        return new DetectionConfig(version, preprocessing, edges, contours, replacement, hint);
    }

    public DetectionConfig withHint(RegionHint replacement) {
        return new DetectionConfig(version, preprocessing, edges, contours, refinement, replacement);
    }

    /**
     * @param claheClipLimit    contrast limit of the local histogram equalisation
     * @param claheTileGridSize number of CLAHE tiles along each axis
     * @param blurKernelSize    odd side length of the Gaussian noise filter
     */
    public record Preprocessing(double claheClipLimit, int claheTileGridSize, int blurKernelSize) {

        public Preprocessing {
            requirePositive(claheClipLimit, "claheClipLimit");
            requirePositive(claheTileGridSize, "claheTileGridSize");
            requireOdd(blurKernelSize, "blurKernelSize");
        }

        public static Preprocessing defaults() {
            return new Preprocessing(2.5, 8, 3);
        }
    }

    /**
     * @param sigma              spread around the median used for the Canny threshold pair
     * @param cannyLowFloor      lower bound of the Canny low threshold
     * @param cannyHighFloor     lower bound of the Canny high threshold
     * @param closeKernelSize    side length of the rectangular closing kernel
     * @param adaptiveBlockSize  odd neighbourhood size of the adaptive threshold
     * @param adaptiveC          minimum deviation from the local mean marked as an edge
     * @param fallbackEnabled    whether the adaptive threshold pass runs when Canny finds nothing
     */
    public record EdgeDetection(
            double sigma,
            double cannyLowFloor,
            double cannyHighFloor,
            int closeKernelSize,
            int adaptiveBlockSize,
            double adaptiveC,
            boolean fallbackEnabled) {

        public EdgeDetection {
            if (sigma < 0.0 || sigma >= 1.0) {
                throw new IllegalArgumentException("sigma must be in [0, 1) but was " + sigma);
            }
            requirePositive(closeKernelSize, "closeKernelSize");
            requireOdd(adaptiveBlockSize, "adaptiveBlockSize");
            if (adaptiveBlockSize < 3) {
                throw new IllegalArgumentException("adaptiveBlockSize must be at least 3");
            }
        }

        public static EdgeDetection defaults() {
            return new EdgeDetection(0.33, 50.0, 150.0, 3, 15, 2.0, true);
        }
    }

    /**
     * Geometric acceptance rules for contour candidates. Ratios refer to the analysed region.
     */
    public record ContourFilter(
            double minAreaFloor,
            double minAreaRatio,
            double maxAreaRatio,
            double epsilonRatio,
            double relaxedEpsilonRatio,
            double minRectangularity,
            double minFallbackRectangularity,
            double minEdgeFloor,
            double minEdgeRatio,
            double minAspectRatio,
            double maxAspectRatio) {

        public ContourFilter {
            if (minAreaRatio < 0.0 || maxAreaRatio > 1.0 || minAreaRatio >= maxAreaRatio) {
                throw new IllegalArgumentException("Area ratios must satisfy 0 <= min < max <= 1");
            }
            requirePositive(epsilonRatio, "epsilonRatio");
            requirePositive(relaxedEpsilonRatio, "relaxedEpsilonRatio");
            if (minAspectRatio <= 0.0 || minAspectRatio >= maxAspectRatio) {
                throw new IllegalArgumentException("Aspect ratios must satisfy 0 < min < max");
            }
        }

        public static ContourFilter defaults() {
            return new ContourFilter(350.0, 0.02, 0.85, 0.01, 0.02, 0.7, 0.5, 60.0, 0.08, 0.45, 2.8);
        }

        public double minArea(double regionArea) {
            return Math.max(minAreaFloor, regionArea * minAreaRatio);
        }

        public double maxArea(double regionArea) {
            return regionArea * maxAreaRatio;
        }

        public double minEdge(int regionWidth, int regionHeight) {
            return Math.max(minEdgeFloor, Math.min(regionWidth, regionHeight) * minEdgeRatio);
        }
    }

    /**
     * @param windowHalfSize half side of the sub-pixel search window; 5 gives an 11x11 window
     */
    public record Refinement(boolean enabled, int windowHalfSize, int maxIterations, double epsilon) {

        public Refinement {
            requirePositive(windowHalfSize, "windowHalfSize");
            requirePositive(maxIterations, "maxIterations");
            requirePositive(epsilon, "epsilon");
        }

        public static Refinement defaults() {
            return new Refinement(true, 5, 40, 0.001);
        }
    }

    /**
     * @param expandRatio    growth applied to an external bounding-box hint before detection
     * @param insetRatio     share of the hint box reported when nothing is detected inside it
     * @param fallbackToHint whether to report the inset hint box instead of no document
     */
    public record RegionHint(double expandRatio, double insetRatio, boolean fallbackToHint) {

        public RegionHint {
            if (expandRatio < 0.0) {
                throw new IllegalArgumentException("expandRatio must not be negative");
            }
            if (insetRatio <= 0.0 || insetRatio > 1.0) {
                throw new IllegalArgumentException("insetRatio must be in (0, 1]");
            }
        }

        public static RegionHint defaults() {
            return new RegionHint(0.25, 0.9, true);
        }
    }

    private static void requirePositive(double value, String name) {
        if (!(value > 0.0)) {
            throw new IllegalArgumentException(name + " must be positive but was " + value);
        }
    }

    private static void requireOdd(int value, String name) {
        if (value <= 0 || value % 2 == 0) {
            throw new IllegalArgumentException(name + " must be a positive odd number but was " + value);
        }
    }
}
