package com.example.docscanner.model.api;

import com.example.docscanner.model.DetectionPass;
import com.example.docscanner.model.DetectionResult;
import com.example.docscanner.model.Quality;
import com.example.docscanner.model.Rectangle;
import io.swagger.v3.oas.annotations.media.Schema;

@Schema(description = "Detected document boundary for a single frame")
public record DetectionResponse(
        @Schema(description = "Document corners in upright image coordinates, absent when nothing was found", nullable = true)
        Rectangle rectangle,
        @Schema(description = "Upright frame width", example = "960") int frameWidth,
        @Schema(description = "Upright frame height", example = "1280") int frameHeight,
        @Schema(description = "Pipeline pass that produced the rectangle", example = "CANNY") DetectionPass pass,
        @Schema(description = "Image space quality verdict, absent when nothing was found", nullable = true)
        Quality quality,
        @Schema(description = "Time spent in the detector in milliseconds", example = "18") long detectionTimeMs) {

    public static DetectionResponse of(DetectionResult result, Quality quality, long detectionTimeMs) {
        return new DetectionResponse(
                result.rectangle(),
                result.frameWidth(),
                result.frameHeight(),
                result.pass(),
                quality,
                detectionTimeMs);
    }
}
