package com.example.docscanner.capture;

import com.example.docscanner.detection.DocumentDetector;
import com.example.docscanner.mapping.CoordinateMapper;
import com.example.docscanner.mapping.MappingParams;
import com.example.docscanner.model.CoordinateSpace;
import com.example.docscanner.model.DetectionResult;
import com.example.docscanner.model.Frame;
import com.example.docscanner.model.Quality;
import com.example.docscanner.model.QualitySpace;
import com.example.docscanner.model.Rectangle;
import com.example.docscanner.model.RegionOfInterest;
import com.example.docscanner.model.ScaleMode;
import com.example.docscanner.quality.QualityEvaluator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.Optional;

/**
 * Live preview loop for one frame source: gate, detect, smooth, map into the preview, judge and
 * stabilize. Quality is judged in view space when a view size is known, in image space otherwise.
 */
public class ScanSession {

    private static final Logger log = LoggerFactory.getLogger(ScanSession.class);

    private final DocumentDetector detector;
    private final QualityEvaluator qualityEvaluator;
    private final CoordinateMapper coordinateMapper;
    private final TemporalStabilizer stabilizer;
    private final RectangleSmoother smoother;
    private final LatestFrameGate gate = new LatestFrameGate();

    private volatile int viewWidth;
    private volatile int viewHeight;
    private volatile ScaleMode scaleMode = ScaleMode.FILL;

    public ScanSession(DocumentDetector detector,
                       QualityEvaluator qualityEvaluator,
                       CoordinateMapper coordinateMapper,
                       TemporalStabilizer stabilizer,
                       RectangleSmoother smoother) {
        this.detector = Objects.requireNonNull(detector, "Detector must not be null");
        this.qualityEvaluator = Objects.requireNonNull(qualityEvaluator, "Quality evaluator must not be null");
        this.coordinateMapper = Objects.requireNonNull(coordinateMapper, "Coordinate mapper must not be null");
        this.stabilizer = Objects.requireNonNull(stabilizer, "Stabilizer must not be null");
        this.smoother = Objects.requireNonNull(smoother, "Smoother must not be null");
    }

    /**
     * Sets the preview size. Zero for either side switches quality evaluation to image space.
     */
    public void setView(int width, int height, ScaleMode mode) {
        if (width < 0 || height < 0) {
            throw new IllegalArgumentException("View size must not be negative");
        }
        this.viewWidth = width;
        this.viewHeight = height;
        this.scaleMode = Objects.requireNonNull(mode, "Scale mode must not be null");
    }

    /**
     * Analyses the frame unless another one is still in flight.
     *
     * @return the update, or empty when the frame was dropped
     */
    public Optional<ScanUpdate> onFrame(Frame frame, RegionOfInterest roi) {
        return gate.tryRun(() -> analyse(frame, roi));
    }

    /** Starts a fresh accumulation after a capture. */
    public void onCaptured() {
        stabilizer.reset();
        smoother.clear();
        log.debug("Capture taken, stabilizer reset");
    }

    public long droppedFrames() {
        return gate.droppedFrames();
    }

    private ScanUpdate analyse(Frame frame, RegionOfInterest roi) {
        DetectionResult detection = detector.detect(frame, roi);
        Rectangle rectangle = smoother.smooth(detection.rectangle()).orElse(null);

        int width = viewWidth;
        int height = viewHeight;
        Rectangle inView = null;
        Quality quality;
        if (rectangle == null) {
            quality = Quality.TOO_FAR;
        } else if (width > 0 && height > 0 && detection.frameWidth() > 0 && detection.frameHeight() > 0) {
            MappingParams params = MappingParams.forImage(detection.frameWidth(), detection.frameHeight())
                    .withView(width, height, scaleMode);
            inView = coordinateMapper.map(rectangle, CoordinateSpace.IMAGE, CoordinateSpace.VIEW, params);
            quality = qualityEvaluator.evaluate(inView, width, height, QualitySpace.VIEW);
        } else {
            quality = qualityEvaluator.evaluate(rectangle, detection.frameWidth(), detection.frameHeight(), QualitySpace.IMAGE);
        }

        StabilizerState state = stabilizer.update(rectangle, quality);
        if (state == StabilizerState.READY) {
            log.debug("Document stable for {} frames, capture due", stabilizer.counter());
        }
        return new ScanUpdate(detection, rectangle, inView, quality, stabilizer.counter(), state);
    }
}
