package com.example.docscanner.model.api;

import com.example.docscanner.detection.DetectionConfig;
import com.example.docscanner.quality.QualityThresholds;
import io.swagger.v3.oas.annotations.media.Schema;

@Schema(description = "Active detection and quality configuration")
public record ConfigResponse(
        @Schema(description = "Detection pipeline settings") DetectionConfig detection,
        @Schema(description = "Quality thresholds") QualityThresholds quality,
        @Schema(description = "Good frames needed before auto-capture", example = "5") int requiredGoodFrames) {
}
