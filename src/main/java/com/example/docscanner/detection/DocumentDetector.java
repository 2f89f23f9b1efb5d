package com.example.docscanner.detection;

import com.example.docscanner.model.DetectionPass;
import com.example.docscanner.model.DetectionResult;
import com.example.docscanner.model.Frame;
import com.example.docscanner.model.Rectangle;
import com.example.docscanner.model.RegionOfInterest;
import org.opencv.core.Mat;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;

/**
 * Entry point of the detection pipeline: preprocessing, two pass edge extraction, contour
 * scoring and sub-pixel refinement on a single frame.
 *
 * <p>Instances hold configuration only. Each call allocates its own scratch buffers and releases
 * them before returning, so one detector may serve several frame sources concurrently. Callers
 * are expected to keep at most one detection in flight per source (see
 * {@link com.example.docscanner.capture.LatestFrameGate}).
 */
public class DocumentDetector {

    private static final Logger log = LoggerFactory.getLogger(DocumentDetector.class);

    private final DetectionConfig config;
    private final FrameConverter converter;
    private final Preprocessor preprocessor;
    private final EdgeExtractor edgeExtractor;
    private final ContourScorer contourScorer;
    private final CornerRefiner cornerRefiner;

    public DocumentDetector(DetectionConfig config) {
        this.config = Objects.requireNonNull(config, "Detection config must not be null");
        PointOrderer orderer = new PointOrderer();
        this.converter = new FrameConverter();
        this.preprocessor = new Preprocessor(config.preprocessing());
        this.edgeExtractor = new EdgeExtractor(config.edges());
        this.contourScorer = new ContourScorer(config.contours(), orderer);
        this.cornerRefiner = new CornerRefiner(config.refinement(), orderer);
    }

    public DetectionConfig config() {
        return config;
    }

    public DetectionResult detect(Frame frame) {
        return detect(frame, null);
    }

    /**
     * Runs the full pipeline on a decoded frame.
     *
     * @param frame pixels plus rotation hint; the rotation is applied before detection
     * @param roi   optional hint box in upright image space, may be {@code null}
     * @return the best document boundary in upright image space, or an empty result
     */
    public DetectionResult detect(Frame frame, RegionOfInterest roi) {
        Objects.requireNonNull(frame, "Frame must not be null");
        int uprightWidth = frame.uprightWidth();
        int uprightHeight = frame.uprightHeight();
        if (frame.isEmpty()) {
            log.debug("Skipping detection on empty frame {}", frame);
            return DetectionResult.none(uprightWidth, uprightHeight);
        }

        if (roi != null && !roi.overlaps(uprightWidth, uprightHeight)) {
            log.debug("Hint {} lies outside the {}x{} frame, nothing to detect", roi, uprightWidth, uprightHeight);
            return DetectionResult.none(uprightWidth, uprightHeight);
        }

        long start = System.nanoTime();
        DetectionResult result;
        try (ScratchMats scratch = new ScratchMats()) {
            Mat upright = converter.toUprightMat(frame, scratch);
            RegionOfInterest region = roi == null ? null : resolveRegion(roi, uprightWidth, uprightHeight);
            result = detectInUpright(upright, region, scratch)
                    .map(found -> DetectionResult.found(found.rectangle(), uprightWidth, uprightHeight, found.pass()))
                    .or(() -> hintFallback(roi, uprightWidth, uprightHeight))
                    .orElseGet(() -> DetectionResult.none(uprightWidth, uprightHeight));
        }
        log.debug("Detection on {}x{} finished via {} in {} ms", uprightWidth, uprightHeight,
                result.pass(), Duration.ofNanos(System.nanoTime() - start).toMillis());
        return result;
    }

    /**
     * Same as {@link #detect(Frame, RegionOfInterest)} for raw NV21 camera planes. An empty buffer
     * yields an empty result; a non-empty buffer whose length does not match the declared
     * geometry is rejected with {@link IllegalArgumentException}.
     */
    public DetectionResult detectInYuv(byte[] nv21, int width, int height, int rotation, RegionOfInterest roi) {
        Objects.requireNonNull(nv21, "YUV buffer must not be null");
        if (nv21.length == 0) {
            boolean swap = rotation == 90 || rotation == 270;
            return DetectionResult.none(Math.max(0, swap ? height : width), Math.max(0, swap ? width : height));
        }
        return detect(Frame.nv21(width, height, rotation, nv21), roi);
    }

    private Optional<Found> detectInUpright(Mat upright, RegionOfInterest region, ScratchMats scratch) {
        Mat analysed = upright;
        if (region != null && !region.coversWholeImage(upright.cols(), upright.rows())) {
            analysed = scratch.track(upright.submat(region.y(), region.bottom(), region.x(), region.right()));
        }
        if ((double) analysed.cols() * analysed.rows() < config.contours().minAreaFloor()) {
            log.debug("Analysed region {}x{} is smaller than the minimum document area", analysed.cols(), analysed.rows());
            return Optional.empty();
        }

        Preprocessor.Preprocessed preprocessed = preprocessor.process(analysed, scratch);

        DetectionPass pass = DetectionPass.CANNY;
        Optional<ContourScorer.Candidate> candidate =
                contourScorer.findBest(edgeExtractor.cannyEdges(preprocessed.blurred(), scratch), scratch);
        if (candidate.isEmpty() && config.edges().fallbackEnabled()) {
            pass = DetectionPass.ADAPTIVE_THRESHOLD;
            candidate = contourScorer.findBest(edgeExtractor.adaptiveEdges(preprocessed.blurred(), scratch), scratch);
        }
        if (candidate.isEmpty()) {
            return Optional.empty();
        }

        ContourScorer.Candidate best = candidate.get();
        log.debug("Best candidate from {} pass: score={} rectangularity={} source={}",
                pass, best.score(), best.rectangularity(), best.source());
        Rectangle refined = cornerRefiner.refine(preprocessed.enhanced(), best.rectangle());
        if (region != null) {
            refined = refined.translate(region.x(), region.y());
        }
        return Optional.of(new Found(refined, pass));
    }

    private RegionOfInterest resolveRegion(RegionOfInterest roi, int imageWidth, int imageHeight) {
        return roi.clampTo(imageWidth, imageHeight)
                .expand(config.hint().expandRatio(), imageWidth, imageHeight)
                .clampTo(imageWidth, imageHeight);
    }

    private Optional<DetectionResult> hintFallback(RegionOfInterest roi, int imageWidth, int imageHeight) {
        if (roi == null || !config.hint().fallbackToHint()) {
            return Optional.empty();
        }
        Rectangle box = roi.clampTo(imageWidth, imageHeight).inset(config.hint().insetRatio()).toRectangle();
        double imageArea = (double) imageWidth * imageHeight;
        if (!box.isValid()
                || box.area() < config.contours().minArea(imageArea)
                || !contourScorer.isPlausible(box, imageWidth, imageHeight)) {
            log.debug("Hint box {} is too small or too elongated to stand in for a document", box);
            return Optional.empty();
        }
        log.debug("Nothing detected inside hint {}, reporting inset hint box", roi);
        return Optional.of(DetectionResult.found(box, imageWidth, imageHeight, DetectionPass.HINT_FALLBACK));
    }

    private record Found(Rectangle rectangle, DetectionPass pass) {
    }
}
