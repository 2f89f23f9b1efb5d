package com.example.docscanner.warp;

import com.example.docscanner.detection.FrameConverter;
import com.example.docscanner.detection.OpenCvRuntime;
import com.example.docscanner.detection.ScratchMats;
import com.example.docscanner.model.Frame;
import org.opencv.core.Core;
import org.opencv.core.Mat;
import org.opencv.imgproc.Imgproc;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Applies brightness, contrast and saturation to a frame. Saturation works on the HSV saturation
 * channel and is ignored for gray frames; brightness and contrast are a single linear transform
 * {@code out = contrast * in + brightness * 255} with 8-bit saturation.
 */
public class ImageAdjuster {

    private final FrameConverter converter;

    public ImageAdjuster() {
        OpenCvRuntime.ensureLoaded();
        this.converter = new FrameConverter();
    }

    public Frame adjust(Frame frame, ColorAdjustment adjustment) {
        Objects.requireNonNull(frame, "Frame must not be null");
        Objects.requireNonNull(adjustment, "Color adjustment must not be null");
        if (adjustment.isNeutral() || frame.isEmpty()) {
            return frame;
        }

        try (ScratchMats scratch = new ScratchMats()) {
            Mat image = converter.toUprightMat(frame, scratch);
            if (adjustment.saturation() != 1.0 && image.channels() == 3) {
                image = scaleSaturation(image, adjustment.saturation(), scratch);
            }
            if (adjustment.contrast() != 1.0 || adjustment.brightness() != 0.0) {
                Mat adjusted = scratch.mat();
                image.convertTo(adjusted, -1, adjustment.contrast(), adjustment.brightness() * 255.0);
                image = adjusted;
            }
            return converter.toFrame(image);
        }
    }

    private static Mat scaleSaturation(Mat rgb, double factor, ScratchMats scratch) {
        Mat hsv = scratch.mat();
        Imgproc.cvtColor(rgb, hsv, Imgproc.COLOR_RGB2HSV);
        List<Mat> channels = new ArrayList<>(3);
        Core.split(hsv, channels);
        channels.forEach(scratch::track);
        channels.get(1).convertTo(channels.get(1), -1, factor, 0.0);
        Core.merge(channels, hsv);
        Mat result = scratch.mat();
        Imgproc.cvtColor(hsv, result, Imgproc.COLOR_HSV2RGB);
        return result;
    }
}
