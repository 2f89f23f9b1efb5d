package com.example.docscanner.mapping;

import com.example.docscanner.detection.PointOrderer;
import com.example.docscanner.model.CoordinateSpace;
import com.example.docscanner.model.Point;
import com.example.docscanner.model.Rectangle;
import com.example.docscanner.model.ScaleMode;

import java.util.Objects;
import java.util.function.UnaryOperator;

/**
 * Pure geometric conversions between {@link CoordinateSpace sensor, image, view and bitmap}
 * coordinates. Every conversion goes through the upright image space, clamps each corner to the
 * destination bounds and restores the canonical corner order.
 */
public class CoordinateMapper {

    private final PointOrderer orderer;

    public CoordinateMapper() {
        this(new PointOrderer());
    }

    public CoordinateMapper(PointOrderer orderer) {
        this.orderer = Objects.requireNonNull(orderer, "Point orderer must not be null");
    }

    /**
     * Maps a rectangle between two spaces.
     *
     * @throws IllegalArgumentException when a size needed by the conversion is zero
     */
    public Rectangle map(Rectangle rectangle, CoordinateSpace from, CoordinateSpace to, MappingParams params) {
        Objects.requireNonNull(rectangle, "Rectangle must not be null");
        Objects.requireNonNull(from, "Source space must not be null");
        Objects.requireNonNull(to, "Target space must not be null");
        Objects.requireNonNull(params, "Mapping params must not be null");
        if (from == to) {
            return withinSpace(rectangle, to, params);
        }
        Rectangle inImage = from == CoordinateSpace.IMAGE ? rectangle : toImage(rectangle, from, params);
        return to == CoordinateSpace.IMAGE ? inImage : fromImage(inImage, to, params);
    }

    public Rectangle imageToView(Rectangle rectangle, MappingParams params) {
        return map(rectangle, CoordinateSpace.IMAGE, CoordinateSpace.VIEW, params);
    }

    public Rectangle viewToImage(Rectangle rectangle, MappingParams params) {
        return map(rectangle, CoordinateSpace.VIEW, CoordinateSpace.IMAGE, params);
    }

    private Rectangle toImage(Rectangle rectangle, CoordinateSpace from, MappingParams params) {
        requireSize("image", params.imageWidth(), params.imageHeight());
        UnaryOperator<Point> transform = switch (from) {
            case SENSOR -> rotation(params.rotation(), params.sensorWidth(), params.sensorHeight());
            case VIEW -> {
                ViewLayout layout = layout(params);
                yield p -> new Point((p.x() - layout.offsetX()) / layout.scale(), (p.y() - layout.offsetY()) / layout.scale());
            }
            case BITMAP -> {
                requireSize("bitmap", params.bitmapWidth(), params.bitmapHeight());
                double scaleX = (double) params.imageWidth() / params.bitmapWidth();
                double scaleY = (double) params.imageHeight() / params.bitmapHeight();
                yield p -> new Point(p.x() * scaleX, p.y() * scaleY);
            }
            case IMAGE -> UnaryOperator.identity();
        };
        return apply(rectangle, transform, params.imageWidth(), params.imageHeight());
    }

    private Rectangle fromImage(Rectangle rectangle, CoordinateSpace to, MappingParams params) {
        requireSize("image", params.imageWidth(), params.imageHeight());
        return switch (to) {
            case SENSOR -> apply(rectangle,
                    rotation((360 - params.rotation()) % 360, params.imageWidth(), params.imageHeight()),
                    params.sensorWidth(), params.sensorHeight());
            case VIEW -> {
                ViewLayout layout = layout(params);
                yield apply(rectangle,
                        p -> new Point(p.x() * layout.scale() + layout.offsetX(), p.y() * layout.scale() + layout.offsetY()),
                        params.viewWidth(), params.viewHeight());
            }
            case BITMAP -> {
                requireSize("bitmap", params.bitmapWidth(), params.bitmapHeight());
                double scaleX = (double) params.bitmapWidth() / params.imageWidth();
                double scaleY = (double) params.bitmapHeight() / params.imageHeight();
                yield apply(rectangle, p -> new Point(p.x() * scaleX, p.y() * scaleY),
                        params.bitmapWidth(), params.bitmapHeight());
            }
            case IMAGE -> rectangle;
        };
    }

    private Rectangle withinSpace(Rectangle rectangle, CoordinateSpace space, MappingParams params) {
        UnaryOperator<Point> identity = UnaryOperator.identity();
        return switch (space) {
            case IMAGE -> {
                requireSize("image", params.imageWidth(), params.imageHeight());
                yield apply(rectangle, identity, params.imageWidth(), params.imageHeight());
            }
            case SENSOR -> {
                requireSize("image", params.imageWidth(), params.imageHeight());
                yield apply(rectangle, identity, params.sensorWidth(), params.sensorHeight());
            }
            case VIEW -> {
                requireSize("view", params.viewWidth(), params.viewHeight());
                yield apply(rectangle, identity, params.viewWidth(), params.viewHeight());
            }
            case BITMAP -> {
                requireSize("bitmap", params.bitmapWidth(), params.bitmapHeight());
                yield apply(rectangle, identity, params.bitmapWidth(), params.bitmapHeight());
            }
        };
    }

    /**
     * Clockwise rotation of a point inside a {@code width x height} buffer.
     */
    static UnaryOperator<Point> rotation(int degrees, double width, double height) {
        return switch (degrees) {
            case 0 -> UnaryOperator.identity();
            case 90 -> p -> new Point(height - p.y(), p.x());
            case 180 -> p -> new Point(width - p.x(), height - p.y());
            case 270 -> p -> new Point(p.y(), width - p.x());
            default -> throw new IllegalArgumentException("Unsupported rotation " + degrees);
        };
    }

    static ViewLayout layout(MappingParams params) {
        requireSize("view", params.viewWidth(), params.viewHeight());
        double scaleX = (double) params.viewWidth() / params.imageWidth();
        double scaleY = (double) params.viewHeight() / params.imageHeight();
        double scale = params.scaleMode() == ScaleMode.FILL ? Math.max(scaleX, scaleY) : Math.min(scaleX, scaleY);
        double offsetX = (params.viewWidth() - params.imageWidth() * scale) / 2.0;
        double offsetY = (params.viewHeight() - params.imageHeight() * scale) / 2.0;
        return new ViewLayout(scale, offsetX, offsetY);
    }

    private Rectangle apply(Rectangle rectangle, UnaryOperator<Point> transform, double maxX, double maxY) {
        return orderer.order(
                transform.apply(rectangle.topLeft()).clamp(maxX, maxY),
                transform.apply(rectangle.topRight()).clamp(maxX, maxY),
                transform.apply(rectangle.bottomLeft()).clamp(maxX, maxY),
                transform.apply(rectangle.bottomRight()).clamp(maxX, maxY));
    }

    private static void requireSize(String name, int width, int height) {
        if (width <= 0 || height <= 0) {
            throw new IllegalArgumentException("Mapping needs a positive " + name + " size but got " + width + "x" + height);
        }
    }

    /**
     * Uniform scale and centering offset of the image inside the viewport. Offsets are negative
     * for the cropped axis under {@link ScaleMode#FILL}.
     */
    record ViewLayout(double scale, double offsetX, double offsetY) {
    }
}
