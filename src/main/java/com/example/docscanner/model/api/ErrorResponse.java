package com.example.docscanner.model.api;

import io.swagger.v3.oas.annotations.media.Schema;

import java.time.Instant;

@Schema(description = "Error payload returned for failed requests")
public record ErrorResponse(
        @Schema(description = "When the error occurred") Instant timestamp,
        @Schema(description = "HTTP status code", example = "400") int status,
        @Schema(description = "HTTP reason phrase", example = "Bad Request") String error,
        @Schema(description = "What went wrong", example = "Image file is required") String message,
        @Schema(description = "Request path", example = "/api/v1/documents/detect") String path) {
}
