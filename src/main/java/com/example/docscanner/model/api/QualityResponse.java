package com.example.docscanner.model.api;

import com.example.docscanner.model.Quality;
import com.example.docscanner.model.QualitySpace;
import io.swagger.v3.oas.annotations.media.Schema;

@Schema(description = "Quality verdict for a rectangle")
public record QualityResponse(
        @Schema(description = "Verdict", example = "GOOD") Quality quality,
        @Schema(description = "Rule set that produced it", example = "VIEW") QualitySpace space) {
}
