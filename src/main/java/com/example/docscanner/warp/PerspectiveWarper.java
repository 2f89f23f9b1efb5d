package com.example.docscanner.warp;

import com.example.docscanner.detection.FrameConverter;
import com.example.docscanner.detection.OpenCvRuntime;
import com.example.docscanner.detection.ScratchMats;
import com.example.docscanner.model.Frame;
import com.example.docscanner.model.Rectangle;
import org.opencv.core.CvException;
import org.opencv.core.Mat;
import org.opencv.core.MatOfPoint2f;
import org.opencv.core.Point;
import org.opencv.core.Size;
import org.opencv.imgproc.Imgproc;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Flattens the quadrilateral enclosed by a {@link Rectangle} into an axis-aligned image.
 *
 * <p>The rectangle is read in the frame's upright space, the same space
 * {@link com.example.docscanner.detection.DocumentDetector} reports in. The output size is the
 * longer of each pair of opposite edges. A rectangle that cannot be warped yields the upright
 * source frame instead of an error.
 */
public class PerspectiveWarper {

    private static final Logger log = LoggerFactory.getLogger(PerspectiveWarper.class);

    static final double MIN_WARP_AREA = 1.0;

    private final FrameConverter converter;

    public PerspectiveWarper() {
        OpenCvRuntime.ensureLoaded();
        this.converter = new FrameConverter();
    }

    public Frame warpAndCrop(Frame frame, Rectangle rectangle) {
        Objects.requireNonNull(frame, "Frame must not be null");
        Objects.requireNonNull(rectangle, "Rectangle must not be null");
        if (frame.isEmpty()) {
            return frame;
        }

        try (ScratchMats scratch = new ScratchMats()) {
            Mat upright = converter.toUprightMat(frame, scratch);
            if (!rectangle.hasFiniteCorners() || Math.abs(rectangle.area()) < MIN_WARP_AREA) {
                log.warn("Refusing to warp degenerate rectangle {}, returning the original image", rectangle);
                return converter.toFrame(upright);
            }

            int width = (int) Math.round(Math.max(rectangle.topEdge(), rectangle.bottomEdge()));
            int height = (int) Math.round(Math.max(rectangle.leftEdge(), rectangle.rightEdge()));
            if (width < 1 || height < 1) {
                log.warn("Warp target {}x{} is empty, returning the original image", width, height);
                return converter.toFrame(upright);
            }

            try {
                MatOfPoint2f source = scratch.track(new MatOfPoint2f(
                        toOpenCv(rectangle.topLeft()),
                        toOpenCv(rectangle.topRight()),
                        toOpenCv(rectangle.bottomRight()),
                        toOpenCv(rectangle.bottomLeft())));
                MatOfPoint2f target = scratch.track(new MatOfPoint2f(
                        new Point(0, 0),
                        new Point(width, 0),
                        new Point(width, height),
                        new Point(0, height)));
                Mat transform = scratch.track(Imgproc.getPerspectiveTransform(source, target));
                Mat warped = scratch.mat();
                Imgproc.warpPerspective(upright, warped, transform, new Size(width, height));
                log.debug("Warped {} into {}x{}", rectangle, width, height);
                return converter.toFrame(warped);
            } catch (CvException e) {
                log.warn("Perspective warp failed for {}, returning the original image", rectangle, e);
                return converter.toFrame(upright);
            }
        }
    }

    private static Point toOpenCv(com.example.docscanner.model.Point point) {
        return new Point(point.x(), point.y());
    }
}
