package com.example.docscanner.model;

import io.swagger.v3.oas.annotations.media.Schema;

/**
 * A position in some coordinate space. The space is never stored on the point itself; each
 * method that accepts or returns points documents which space it works in.
 */
@Schema(description = "Point with double precision coordinates")
public record Point(
        @Schema(description = "Horizontal coordinate", example = "120.5") double x,
        @Schema(description = "Vertical coordinate", example = "88.0") double y) {

    public double distanceTo(Point other) {
        return Math.hypot(x - other.x, y - other.y);
    }

    public Point translate(double dx, double dy) {
        return new Point(x + dx, y + dy);
    }

    public Point clamp(double maxX, double maxY) {
        return new Point(Math.max(0.0, Math.min(x, maxX)), Math.max(0.0, Math.min(y, maxY)));
    }

    public boolean isFinite() {
        return Double.isFinite(x) && Double.isFinite(y);
    }
}
