package com.example.docscanner.detection;

import com.example.docscanner.model.Point;
import com.example.docscanner.model.Rectangle;
import org.opencv.core.CvException;
import org.opencv.core.Mat;
import org.opencv.core.MatOfPoint2f;
import org.opencv.core.Size;
import org.opencv.core.TermCriteria;
import org.opencv.imgproc.Imgproc;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Sub-pixel corner localisation on the contrast enhanced gray image. Refinement only improves
 * precision: whenever OpenCV fails or returns corners that are not usable, the clamped input
 * corners are returned unchanged.
 */
public final class CornerRefiner {

    private static final Logger log = LoggerFactory.getLogger(CornerRefiner.class);

    private final DetectionConfig.Refinement config;
    private final PointOrderer orderer;

    public CornerRefiner(DetectionConfig.Refinement config, PointOrderer orderer) {
        this.config = config;
        this.orderer = orderer;
        OpenCvRuntime.ensureLoaded();
    }

    /**
     * @param gray      8-bit single channel image the corners were found in
     * @param rectangle corner estimates in the same coordinate space as {@code gray}
     * @return refined and reordered corners, or the clamped estimates when refinement is off or fails
     */
    public Rectangle refine(Mat gray, Rectangle rectangle) {
        double maxX = Math.max(1.0, gray.cols() - 1.0);
        double maxY = Math.max(1.0, gray.rows() - 1.0);
        Rectangle clamped = new Rectangle(
                rectangle.topLeft().clamp(maxX, maxY),
                rectangle.topRight().clamp(maxX, maxY),
                rectangle.bottomLeft().clamp(maxX, maxY),
                rectangle.bottomRight().clamp(maxX, maxY));
        if (!config.enabled()) {
            return clamped;
        }

        MatOfPoint2f corners = new MatOfPoint2f(PointOrderer.toOpenCv(clamped));
        try {
            int half = config.windowHalfSize();
            TermCriteria criteria = new TermCriteria(
                    TermCriteria.EPS + TermCriteria.MAX_ITER, config.maxIterations(), config.epsilon());
            Imgproc.cornerSubPix(gray, corners, new Size(half, half), new Size(-1, -1), criteria);
            List<Point> refined = PointOrderer.fromOpenCv(corners.toArray());
            Rectangle result = orderer.order(refined);
            if (!isUsable(result, clamped, maxX, maxY)) {
                log.warn("Discarding sub-pixel refinement that moved corners outside the search window");
                return clamped;
            }
            return result;
        } catch (CvException ex) {
            log.warn("Sub-pixel corner refinement failed, keeping unrefined corners: {}", ex.getMessage());
            return clamped;
        } finally {
            corners.release();
        }
    }

    private boolean isUsable(Rectangle refined, Rectangle original, double maxX, double maxY) {
        if (!refined.isValid()) {
            return false;
        }
        for (Point corner : refined.polygon()) {
            if (corner.x() < 0.0 || corner.y() < 0.0 || corner.x() > maxX || corner.y() > maxY) {
                return false;
            }
        }
        double limit = Math.hypot(config.windowHalfSize(), config.windowHalfSize()) + 1.0;
        return refined.meanCornerDistance(original) <= limit;
    }
}
