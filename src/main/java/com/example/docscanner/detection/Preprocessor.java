package com.example.docscanner.detection;

import org.opencv.core.Mat;
import org.opencv.core.Size;
import org.opencv.imgproc.CLAHE;
import org.opencv.imgproc.Imgproc;

/**
 * First pipeline stage: grayscale conversion, contrast limited adaptive histogram equalisation
 * to lift faint edges (white card on a white desk) and a small Gaussian blur against sensor
 * noise.
 */
public final class Preprocessor {

    private final DetectionConfig.Preprocessing config;

    public Preprocessor(DetectionConfig.Preprocessing config) {
        this.config = config;
        OpenCvRuntime.ensureLoaded();
    }

    /**
     * @param upright 8-bit gray or RGB matrix in upright orientation
     * @return the contrast enhanced gray image and its blurred copy, both at input resolution
     */
    public Preprocessed process(Mat upright, ScratchMats scratch) {
        Mat gray = scratch.mat();
        if (upright.channels() > 1) {
            Imgproc.cvtColor(upright, gray, Imgproc.COLOR_RGB2GRAY);
        } else {
            upright.copyTo(gray);
        }

        Mat enhanced = scratch.mat();
        int tiles = config.claheTileGridSize();
        CLAHE clahe = Imgproc.createCLAHE(config.claheClipLimit(), new Size(tiles, tiles));
        clahe.apply(gray, enhanced);

        Mat blurred = scratch.mat();
        int kernel = config.blurKernelSize();
        Imgproc.GaussianBlur(enhanced, blurred, new Size(kernel, kernel), 0);
        return new Preprocessed(enhanced, blurred);
    }

    /**
     * @param enhanced gray image after contrast enhancement, used for corner refinement
     * @param blurred  noise filtered copy, used for edge extraction
     */
    public record Preprocessed(Mat enhanced, Mat blurred) {
    }
}
