package com.example.docscanner.detection;

import com.example.docscanner.model.Frame;
import com.example.docscanner.model.PixelFormat;
import org.opencv.core.Core;
import org.opencv.core.CvType;
import org.opencv.core.Mat;
import org.opencv.imgproc.Imgproc;

/**
 * Moves pixels between {@link Frame} values and OpenCV matrices. Every matrix handed out is
 * registered with the caller's {@link ScratchMats}.
 */
public final class FrameConverter {

    public FrameConverter() {
        OpenCvRuntime.ensureLoaded();
    }

    /**
     * Decodes the frame and applies its rotation hint. NV21 buffers are converted to RGB before
     * rotating, gray and RGB buffers keep their channel count.
     *
     * @return an upright 8-bit matrix with one or three channels
     */
    public Mat toUprightMat(Frame frame, ScratchMats scratch) {
        if (frame.isEmpty()) {
            throw new IllegalArgumentException("Cannot convert an empty frame: " + frame);
        }
        Mat decoded = switch (frame.format()) {
            case GRAY -> wrap(frame, CvType.CV_8UC1, frame.height(), scratch);
            case RGB -> wrap(frame, CvType.CV_8UC3, frame.height(), scratch);
            case NV21 -> {
                Mat yuv = wrap(frame, CvType.CV_8UC1, frame.height() + frame.height() / 2, scratch);
                Mat rgb = scratch.mat();
                Imgproc.cvtColor(yuv, rgb, Imgproc.COLOR_YUV2RGB_NV21);
                yield rgb;
            }
        };
        return rotate(decoded, frame.rotation(), scratch);
    }

    /**
     * Rotates clockwise by the given multiple of 90 degrees. Returns the input for 0.
     */
    public Mat rotate(Mat source, int rotation, ScratchMats scratch) {
        Integer rotationCode = switch (rotation) {
            case 0 -> null;
            case 90 -> Core.ROTATE_90_CLOCKWISE;
            case 180 -> Core.ROTATE_180;
            case 270 -> Core.ROTATE_90_COUNTERCLOCKWISE;
            default -> throw new IllegalArgumentException("Unsupported rotation " + rotation);
        };
        if (rotationCode == null) {
            return source;
        }
        Mat rotated = scratch.mat();
        Core.rotate(source, rotated, rotationCode);
        return rotated;
    }

    /**
     * Copies an 8-bit gray or RGB matrix into a new upright frame.
     */
    public Frame toFrame(Mat mat) {
        if (mat.depth() != CvType.CV_8U || (mat.channels() != 1 && mat.channels() != 3)) {
            throw new IllegalArgumentException("Expected an 8-bit gray or RGB matrix but got " + CvType.typeToString(mat.type()));
        }
        Mat continuous = mat.isContinuous() ? mat : mat.clone();
        try {
            byte[] data = new byte[(int) (continuous.total() * continuous.channels())];
            continuous.get(0, 0, data);
            PixelFormat format = continuous.channels() == 1 ? PixelFormat.GRAY : PixelFormat.RGB;
            return new Frame(continuous.cols(), continuous.rows(), format, 0, data);
        } finally {
            if (continuous != mat) {
                continuous.release();
            }
        }
    }

    private Mat wrap(Frame frame, int type, int rows, ScratchMats scratch) {
        Mat mat = scratch.track(new Mat(rows, frame.width(), type));
        mat.put(0, 0, frame.data());
        return mat;
    }
}
