package com.example.docscanner.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import io.swagger.v3.oas.annotations.media.Schema;

import java.util.List;
import java.util.Objects;

/**
 * Four document corners in canonical order. Read as a polygon the corners are visited
 * topLeft, topRight, bottomRight, bottomLeft. The record itself does not reject degenerate
 * corner sets because clamped coordinate mappings may legitimately collapse points; producers
 * of detections check {@link #isValid()} before emitting one.
 */
@Schema(description = "Quadrilateral document boundary in canonical corner order")
public record Rectangle(
        @Schema(description = "Corner closest to the image origin") Point topLeft,
        @Schema(description = "Upper right corner") Point topRight,
        @Schema(description = "Lower left corner") Point bottomLeft,
        @Schema(description = "Corner furthest from the image origin") Point bottomRight) {

    private static final double CORNER_EPSILON = 1e-3;

    public Rectangle {
        Objects.requireNonNull(topLeft, "topLeft must not be null");
        Objects.requireNonNull(topRight, "topRight must not be null");
        Objects.requireNonNull(bottomLeft, "bottomLeft must not be null");
        Objects.requireNonNull(bottomRight, "bottomRight must not be null");
    }

    /**
     * Builds the axis-aligned rectangle covering {@code [x, x + width] x [y, y + height]}.
     */
    public static Rectangle ofBox(double x, double y, double width, double height) {
        return new Rectangle(
                new Point(x, y),
                new Point(x + width, y),
                new Point(x, y + height),
                new Point(x + width, y + height));
    }

    /**
     * @return the corners in polygon order: topLeft, topRight, bottomRight, bottomLeft
     */
    public List<Point> polygon() {
        return List.of(topLeft, topRight, bottomRight, bottomLeft);
    }

    public double topEdge() {
        return topLeft.distanceTo(topRight);
    }

    public double bottomEdge() {
        return bottomLeft.distanceTo(bottomRight);
    }

    public double leftEdge() {
        return topLeft.distanceTo(bottomLeft);
    }

    public double rightEdge() {
        return topRight.distanceTo(bottomRight);
    }

    public double perimeter() {
        return topEdge() + rightEdge() + bottomEdge() + leftEdge();
    }

    /**
     * @return polygon area by the shoelace formula
     */
    public double area() {
        List<Point> polygon = polygon();
        double sum = 0.0;
        for (int i = 0; i < polygon.size(); i++) {
            Point current = polygon.get(i);
            Point next = polygon.get((i + 1) % polygon.size());
            sum += current.x() * next.y() - next.x() * current.y();
        }
        return Math.abs(sum) / 2.0;
    }

    public Point center() {
        return new Point(
                (topLeft.x() + topRight.x() + bottomLeft.x() + bottomRight.x()) / 4.0,
                (topLeft.y() + topRight.y() + bottomLeft.y() + bottomRight.y()) / 4.0);
    }

    /**
     * @return mean distance between corresponding corners of the two rectangles
     */
    public double meanCornerDistance(Rectangle other) {
        return (topLeft.distanceTo(other.topLeft)
                + topRight.distanceTo(other.topRight)
                + bottomLeft.distanceTo(other.bottomLeft)
                + bottomRight.distanceTo(other.bottomRight)) / 4.0;
    }

    public Rectangle translate(double dx, double dy) {
        return new Rectangle(
                topLeft.translate(dx, dy),
                topRight.translate(dx, dy),
                bottomLeft.translate(dx, dy),
                bottomRight.translate(dx, dy));
    }

    public double minX() {
        return Math.min(Math.min(topLeft.x(), topRight.x()), Math.min(bottomLeft.x(), bottomRight.x()));
    }

    public double maxX() {
        return Math.max(Math.max(topLeft.x(), topRight.x()), Math.max(bottomLeft.x(), bottomRight.x()));
    }

    public double minY() {
        return Math.min(Math.min(topLeft.y(), topRight.y()), Math.min(bottomLeft.y(), bottomRight.y()));
    }

    public double maxY() {
        return Math.max(Math.max(topLeft.y(), topRight.y()), Math.max(bottomLeft.y(), bottomRight.y()));
    }

    public boolean hasFiniteCorners() {
        return topLeft.isFinite() && topRight.isFinite() && bottomLeft.isFinite() && bottomRight.isFinite();
    }

    public boolean hasDistinctCorners() {
        List<Point> polygon = polygon();
        for (int i = 0; i < polygon.size(); i++) {
            for (int j = i + 1; j < polygon.size(); j++) {
                if (polygon.get(i).distanceTo(polygon.get(j)) < CORNER_EPSILON) {
                    return false;
                }
            }
        }
        return true;
    }

    /**
     * A quadrilateral is simple when its two pairs of opposite sides do not cross.
     */
    @JsonIgnore
    public boolean isSimple() {
        return !segmentsIntersect(topLeft, topRight, bottomRight, bottomLeft)
                && !segmentsIntersect(topRight, bottomRight, bottomLeft, topLeft);
    }

    /**
     * @return {@code true} when the corners are finite, mutually distinct and form a simple polygon
     */
    @JsonIgnore
    public boolean isValid() {
        return hasFiniteCorners() && hasDistinctCorners() && isSimple();
    }

    private static boolean segmentsIntersect(Point a, Point b, Point c, Point d) {
        double d1 = orientation(c, d, a);
        double d2 = orientation(c, d, b);
        double d3 = orientation(a, b, c);
        double d4 = orientation(a, b, d);
        if (((d1 > 0 && d2 < 0) || (d1 < 0 && d2 > 0)) && ((d3 > 0 && d4 < 0) || (d3 < 0 && d4 > 0))) {
            return true;
        }
        return (d1 == 0 && onSegment(c, d, a))
                || (d2 == 0 && onSegment(c, d, b))
                || (d3 == 0 && onSegment(a, b, c))
                || (d4 == 0 && onSegment(a, b, d));
    }

    private static double orientation(Point origin, Point towards, Point probe) {
        return (towards.x() - origin.x()) * (probe.y() - origin.y())
                - (towards.y() - origin.y()) * (probe.x() - origin.x());
    }

    private static boolean onSegment(Point start, Point end, Point probe) {
        return probe.x() >= Math.min(start.x(), end.x()) && probe.x() <= Math.max(start.x(), end.x())
                && probe.y() >= Math.min(start.y(), end.y()) && probe.y() <= Math.max(start.y(), end.y());
    }
}
