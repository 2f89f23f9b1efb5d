package com.example.docscanner.model.api;

import com.example.docscanner.mapping.MappingParams;
import com.example.docscanner.model.CoordinateSpace;
import com.example.docscanner.model.Rectangle;
import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotNull;

@Schema(description = "Rectangle to move from one coordinate space to another")
public record MappingRequest(
        @Schema(description = "Rectangle in the source space") @NotNull Rectangle rectangle,
        @Schema(description = "Source space", example = "IMAGE") @NotNull CoordinateSpace from,
        @Schema(description = "Target space", example = "VIEW") @NotNull CoordinateSpace to,
        @Schema(description = "Sizes and policies of the spaces involved") @NotNull MappingParams params) {
}
