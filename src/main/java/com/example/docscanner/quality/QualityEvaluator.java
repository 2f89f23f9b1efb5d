package com.example.docscanner.quality;

import com.example.docscanner.model.Quality;
import com.example.docscanner.model.QualitySpace;
import com.example.docscanner.model.Rectangle;

import java.util.Objects;

/**
 * Classifies a single rectangle against a reference frame. The verdict carries no history;
 * accumulating verdicts over time is the job of
 * {@link com.example.docscanner.capture.TemporalStabilizer}.
 */
public class QualityEvaluator {

    private final QualityThresholds thresholds;

    public QualityEvaluator(QualityThresholds thresholds) {
        this.thresholds = Objects.requireNonNull(thresholds, "Quality thresholds must not be null");
    }

    public QualityThresholds thresholds() {
        return thresholds;
    }

    /**
     * @param rectangle       rectangle in the same space as the reference size
     * @param referenceWidth  width of the image or view the rectangle lives in
     * @param referenceHeight height of the image or view the rectangle lives in
     * @param space           which rule set to apply
     * @return {@link Quality#TOO_FAR} for an empty reference size or non-finite corners
     */
    public Quality evaluate(Rectangle rectangle, int referenceWidth, int referenceHeight, QualitySpace space) {
        Objects.requireNonNull(rectangle, "Rectangle must not be null");
        Objects.requireNonNull(space, "Quality space must not be null");
        if (referenceWidth <= 0 || referenceHeight <= 0 || !rectangle.hasFiniteCorners()) {
            return Quality.TOO_FAR;
        }
        return switch (space) {
            case IMAGE -> evaluateInImage(rectangle, referenceHeight);
            case VIEW -> evaluateInView(rectangle, referenceWidth, referenceHeight);
        };
    }

    Quality evaluateInImage(Rectangle rectangle, int imageHeight) {
        double maxMisalignment = thresholds.maxEdgeMisalignmentPx();
        if (topOffset(rectangle) > maxMisalignment
                || bottomOffset(rectangle) > maxMisalignment
                || leftOffset(rectangle) > maxMisalignment
                || rightOffset(rectangle) > maxMisalignment) {
            return Quality.BAD_ANGLE;
        }

        double margin = thresholds.edgeMarginPx();
        double bottomLimit = imageHeight - margin;
        if (rectangle.topLeft().y() > margin
                || rectangle.topRight().y() > margin
                || rectangle.bottomLeft().y() < bottomLimit
                || rectangle.bottomRight().y() < bottomLimit) {
            return Quality.TOO_FAR;
        }
        return Quality.GOOD;
    }

    Quality evaluateInView(Rectangle rectangle, int viewWidth, int viewHeight) {
        double top = rectangle.topEdge();
        double bottom = rectangle.bottomEdge();
        double left = rectangle.leftEdge();
        double right = rectangle.rightEdge();

        double approximateArea = Math.max(top, bottom) * Math.max(left, right);
        double areaRatio = approximateArea / ((double) viewWidth * viewHeight);
        if (areaRatio < thresholds.minAreaRatio() || areaRatio > thresholds.maxAreaRatio()) {
            return Quality.TOO_FAR;
        }

        if (top <= 0 || bottom <= 0 || left <= 0 || right <= 0) {
            return Quality.BAD_ANGLE;
        }
        double maxSkew = thresholds.maxSkewRatio();
        if (topOffset(rectangle) / top > maxSkew
                || bottomOffset(rectangle) / bottom > maxSkew
                || leftOffset(rectangle) / left > maxSkew
                || rightOffset(rectangle) / right > maxSkew) {
            return Quality.BAD_ANGLE;
        }

        if (!withinOppositeEdgeBand(top / bottom) || !withinOppositeEdgeBand(left / right)) {
            return Quality.BAD_ANGLE;
        }
        return Quality.GOOD;
    }

    private boolean withinOppositeEdgeBand(double ratio) {
        return ratio >= thresholds.minOppositeEdgeRatio() && ratio <= thresholds.maxOppositeEdgeRatio();
    }

    private static double topOffset(Rectangle r) {
        return Math.abs(r.topRight().y() - r.topLeft().y());
    }

    private static double bottomOffset(Rectangle r) {
        return Math.abs(r.bottomRight().y() - r.bottomLeft().y());
    }

    private static double leftOffset(Rectangle r) {
        return Math.abs(r.bottomLeft().x() - r.topLeft().x());
    }

    private static double rightOffset(Rectangle r) {
        return Math.abs(r.bottomRight().x() - r.topRight().x());
    }
}
