package com.example.docscanner.detection;

import com.example.docscanner.model.Point;
import com.example.docscanner.model.Rectangle;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Canonicalises four unordered corners. The sum/difference rule is used everywhere a raw point
 * set becomes a {@link Rectangle}:
 * <ul>
 *     <li>topLeft minimises {@code x + y}</li>
 *     <li>bottomRight maximises {@code x + y}</li>
 *     <li>topRight minimises {@code y - x}</li>
 *     <li>bottomLeft maximises {@code y - x}</li>
 * </ul>
 * Image rows grow downwards, so topRight is the corner with the largest {@code x - y}.
 * Ties resolve to the earliest point in input order. A quadrilateral rotated close to 45 degrees
 * can make one point win two roles; only then the corners are ordered clockwise around their
 * centroid starting from the minimum-sum point, so the result always holds four distinct points.
 */
public final class PointOrderer {

    public Rectangle order(List<Point> points) {
        if (points.size() != 4) {
            throw new IllegalArgumentException("Expected exactly four points but got " + points.size());
        }
        Point topLeft = points.get(0);
        Point bottomRight = points.get(0);
        Point topRight = points.get(0);
        Point bottomLeft = points.get(0);
        for (Point point : points) {
            if (sum(point) < sum(topLeft)) {
                topLeft = point;
            }
            if (sum(point) > sum(bottomRight)) {
                bottomRight = point;
            }
            if (diff(point) < diff(topRight)) {
                topRight = point;
            }
            if (diff(point) > diff(bottomLeft)) {
                bottomLeft = point;
            }
        }
        if (isPermutation(points, topLeft, topRight, bottomLeft, bottomRight)) {
            return new Rectangle(topLeft, topRight, bottomLeft, bottomRight);
        }
        return orderAroundCentroid(points);
    }

    public Rectangle order(Point... points) {
        return order(List.of(points));
    }

    static List<Point> fromOpenCv(org.opencv.core.Point[] points) {
        List<Point> converted = new ArrayList<>(points.length);
        for (org.opencv.core.Point point : points) {
            converted.add(new Point(point.x, point.y));
        }
        return converted;
    }

    static org.opencv.core.Point[] toOpenCv(Rectangle rectangle) {
        return new org.opencv.core.Point[]{
                toOpenCv(rectangle.topLeft()),
                toOpenCv(rectangle.topRight()),
                toOpenCv(rectangle.bottomLeft()),
                toOpenCv(rectangle.bottomRight())
        };
    }

    static org.opencv.core.Point toOpenCv(Point point) {
        return new org.opencv.core.Point(point.x(), point.y());
    }

    private Rectangle orderAroundCentroid(List<Point> points) {
        double cx = points.stream().mapToDouble(Point::x).average().orElse(0.0);
        double cy = points.stream().mapToDouble(Point::y).average().orElse(0.0);
        // image y axis points down, so increasing atan2 walks clockwise on screen
        List<Point> clockwise = new ArrayList<>(points);
        clockwise.sort(Comparator.comparingDouble(p -> Math.atan2(p.y() - cy, p.x() - cx)));
        int start = 0;
        for (int i = 1; i < clockwise.size(); i++) {
            if (sum(clockwise.get(i)) < sum(clockwise.get(start))) {
                start = i;
            }
        }
        Point topLeft = clockwise.get(start);
        Point topRight = clockwise.get((start + 1) % 4);
        Point bottomRight = clockwise.get((start + 2) % 4);
        Point bottomLeft = clockwise.get((start + 3) % 4);
        return new Rectangle(topLeft, topRight, bottomLeft, bottomRight);
    }

    private static boolean isPermutation(List<Point> points, Point... chosen) {
        boolean[] used = new boolean[points.size()];
        for (Point candidate : chosen) {
            int index = indexOfUnused(points, candidate, used);
            if (index < 0) {
                return false;
            }
            used[index] = true;
        }
        return true;
    }

    private static int indexOfUnused(List<Point> points, Point candidate, boolean[] used) {
        for (int i = 0; i < points.size(); i++) {
            if (!used[i] && points.get(i) == candidate) {
                return i;
            }
        }
        return -1;
    }

    private static double sum(Point point) {
        return point.x() + point.y();
    }

    private static double diff(Point point) {
        return point.y() - point.x();
    }
}
