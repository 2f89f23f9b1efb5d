package com.example.docscanner.detection;

import com.example.docscanner.model.Rectangle;
import org.opencv.core.Mat;
import org.opencv.core.MatOfPoint;
import org.opencv.core.MatOfPoint2f;
import org.opencv.core.RotatedRect;
import org.opencv.imgproc.Imgproc;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Picks the most document-like quadrilateral among the outer contours of a binary edge map.
 *
 * <p>Each contour inside the configured area band is approximated to a polygon, first at the
 * strict epsilon and then at the relaxed one. A convex quadrilateral is kept when its
 * rectangularity (contour area over minimum-area-rectangle area) reaches the strict cutoff. A
 * contour that does not reduce to a convex quadrilateral may still qualify through its rotated
 * minimum-area box at the lower fallback cutoff. Either way the candidate must pass the edge
 * length and aspect checks of {@link #isPlausible(Rectangle, int, int)}. Candidates are ranked by
 * {@code contourArea * rectangularity}; on a tie the contour found first wins.
 */
public final class ContourScorer {

    private static final Logger log = LoggerFactory.getLogger(ContourScorer.class);

    private final DetectionConfig.ContourFilter config;
    private final PointOrderer orderer;

    public ContourScorer(DetectionConfig.ContourFilter config, PointOrderer orderer) {
        this.config = config;
        this.orderer = orderer;
        OpenCvRuntime.ensureLoaded();
    }

    /**
     * @param binary 8-bit edge map of the analysed region; it is not modified
     * @return best candidate with corners in region coordinates, unrefined
     */
    public Optional<Candidate> findBest(Mat binary, ScratchMats scratch) {
        int width = binary.cols();
        int height = binary.rows();
        double regionArea = (double) width * height;
        double minArea = config.minArea(regionArea);
        double maxArea = config.maxArea(regionArea);

        List<MatOfPoint> contours = new ArrayList<>();
        Mat hierarchy = scratch.mat();
        Imgproc.findContours(scratch.track(binary.clone()), contours, hierarchy, Imgproc.RETR_EXTERNAL, Imgproc.CHAIN_APPROX_SIMPLE);
        contours.forEach(scratch::track);

        Candidate best = null;
        int considered = 0;
        for (MatOfPoint contour : contours) {
            double contourArea = Imgproc.contourArea(contour);
            if (contourArea < minArea || contourArea > maxArea) {
                continue;
            }
            considered++;
            Optional<Candidate> candidate = evaluate(contour, contourArea, width, height, scratch);
            if (candidate.isPresent() && (best == null || candidate.get().score() > best.score())) {
                best = candidate.get();
            }
        }
        log.debug("Scored {} contours ({} within area band), best score {}",
                contours.size(), considered, best == null ? 0.0 : best.score());
        return Optional.ofNullable(best);
    }

    private Optional<Candidate> evaluate(MatOfPoint contour, double contourArea, int width, int height, ScratchMats scratch) {
        MatOfPoint2f curve = scratch.track(new MatOfPoint2f(contour.toArray()));
        double perimeter = Imgproc.arcLength(curve, true);

        MatOfPoint2f approx = scratch.track(new MatOfPoint2f());
        Imgproc.approxPolyDP(curve, approx, config.epsilonRatio() * perimeter, true);
        if (approx.total() != 4) {
            Imgproc.approxPolyDP(curve, approx, config.relaxedEpsilonRatio() * perimeter, true);
        }

        if (approx.total() == 4 && Imgproc.isContourConvex(scratch.track(new MatOfPoint(approx.toArray())))) {
            org.opencv.core.Point[] corners = approx.toArray();
            RotatedRect bounds = Imgproc.minAreaRect(approx);
            return accept(corners, contourArea, bounds.size.area(), config.minRectangularity(),
                    Candidate.Source.POLYGON, width, height);
        }

        RotatedRect rotated = Imgproc.minAreaRect(curve);
        org.opencv.core.Point[] boxCorners = new org.opencv.core.Point[4];
        rotated.points(boxCorners);
        return accept(boxCorners, contourArea, rotated.size.area(), config.minFallbackRectangularity(),
                Candidate.Source.ROTATED_BOX, width, height);
    }

    private Optional<Candidate> accept(org.opencv.core.Point[] corners, double contourArea, double boundsArea,
                                       double minRectangularity, Candidate.Source source, int width, int height) {
        if (boundsArea <= 1.0) {
            return Optional.empty();
        }
        double rectangularity = contourArea / boundsArea;
        if (rectangularity < minRectangularity) {
            return Optional.empty();
        }
        Rectangle rectangle = orderer.order(PointOrderer.fromOpenCv(corners));
        if (!rectangle.isValid() || !isPlausible(rectangle, width, height)) {
            return Optional.empty();
        }
        return Optional.of(new Candidate(rectangle, contourArea * rectangularity, rectangularity, source));
    }

    /**
     * Edge sanity check: the shortest edge must reach {@code max(minEdgeFloor, minEdgeRatio *
     * shortSide)} and the ratio of mean horizontal to mean vertical edge length must lie inside
     * the configured aspect band.
     */
    boolean isPlausible(Rectangle rectangle, int regionWidth, int regionHeight) {
        double top = rectangle.topEdge();
        double bottom = rectangle.bottomEdge();
        double left = rectangle.leftEdge();
        double right = rectangle.rightEdge();
        double shortest = Math.min(Math.min(top, bottom), Math.min(left, right));
        if (shortest < config.minEdge(regionWidth, regionHeight)) {
            return false;
        }
        double aspect = ((top + bottom) / 2.0) / ((left + right) / 2.0);
        return aspect >= config.minAspectRatio() && aspect <= config.maxAspectRatio();
    }

    /**
     * @param rectangle      ordered corners in region coordinates
     * @param score          {@code contourArea * rectangularity}
     * @param rectangularity contour area over minimum-area-rectangle area
     * @param source         which acceptance path produced the corners
     */
    public record Candidate(Rectangle rectangle, double score, double rectangularity, Source source) {

        public enum Source {
            POLYGON,
            ROTATED_BOX
        }
    }
}
