package com.example.docscanner.quality;

import io.swagger.v3.oas.annotations.media.Schema;

/**
 * Policy constants used by {@link QualityEvaluator}. The image-space values are absolute pixels,
 * the view-space values are ratios so they hold on any screen size.
 */
@Schema(description = "Thresholds that classify a rectangle as GOOD, BAD_ANGLE or TOO_FAR")
public record QualityThresholds(
        @Schema(description = "Largest tolerated offset between the ends of an edge, in pixels", example = "100")
        double maxEdgeMisalignmentPx,
        @Schema(description = "Distance corners may keep from the top and bottom frame edges, in pixels", example = "150")
        double edgeMarginPx,
        @Schema(description = "Smallest rectangle to view area ratio", example = "0.06")
        double minAreaRatio,
        @Schema(description = "Largest rectangle to view area ratio", example = "0.95")
        double maxAreaRatio,
        @Schema(description = "Largest perpendicular offset per unit of edge length", example = "0.3")
        double maxSkewRatio,
        @Schema(description = "Smallest opposite edge length ratio", example = "0.33")
        double minOppositeEdgeRatio,
        @Schema(description = "Largest opposite edge length ratio", example = "3.0")
        double maxOppositeEdgeRatio) {

    public QualityThresholds {
        if (maxEdgeMisalignmentPx < 0 || edgeMarginPx < 0) {
            throw new IllegalArgumentException("Pixel thresholds must not be negative");
        }
        if (minAreaRatio < 0 || maxAreaRatio <= minAreaRatio) {
            throw new IllegalArgumentException(
                    "Area ratio band is empty: [" + minAreaRatio + ", " + maxAreaRatio + "]");
        }
        if (maxSkewRatio < 0) {
            throw new IllegalArgumentException("Skew ratio must not be negative");
        }
        if (minOppositeEdgeRatio <= 0 || maxOppositeEdgeRatio < minOppositeEdgeRatio) {
            throw new IllegalArgumentException("Opposite edge ratio band is empty: ["
                    + minOppositeEdgeRatio + ", " + maxOppositeEdgeRatio + "]");
        }
    }

    public static QualityThresholds defaults() {
        return new QualityThresholds(100.0, 150.0, 0.06, 0.95, 0.3, 0.33, 3.0);
    }
}
