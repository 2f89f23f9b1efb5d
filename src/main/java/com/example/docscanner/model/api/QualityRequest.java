package com.example.docscanner.model.api;

import com.example.docscanner.model.QualitySpace;
import com.example.docscanner.model.Rectangle;
import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;

@Schema(description = "Rectangle to classify against a reference frame")
public record QualityRequest(
        @Schema(description = "Rectangle in the reference frame's coordinates") @NotNull Rectangle rectangle,
        @Schema(description = "Reference width", example = "1080") @PositiveOrZero int referenceWidth,
        @Schema(description = "Reference height", example = "1920") @PositiveOrZero int referenceHeight,
        @Schema(description = "Rule set to apply", example = "VIEW") @NotNull QualitySpace space) {
}
