package com.example.docscanner.controller;

import com.example.docscanner.model.Rectangle;
import com.example.docscanner.model.RegionOfInterest;
import com.example.docscanner.model.api.ConfigResponse;
import com.example.docscanner.model.api.DetectionResponse;
import com.example.docscanner.model.api.ErrorResponse;
import com.example.docscanner.model.api.MappingRequest;
import com.example.docscanner.model.api.QualityRequest;
import com.example.docscanner.model.api.QualityResponse;
import com.example.docscanner.service.DocumentScanService;
import com.example.docscanner.warp.ColorAdjustment;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RequestPart;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;
import org.springframework.web.server.ResponseStatusException;

import static org.springframework.http.HttpStatus.BAD_REQUEST;

@RestController
@RequestMapping("/api/v1/documents")
@Tag(name = "Documents", description = "Document boundary detection, quality checks and perspective cropping")
@Validated
public class DocumentController {

    private final DocumentScanService service;

    public DocumentController(DocumentScanService service) {
        this.service = service;
    }

    @Operation(
            summary = "Detect the document boundary in an uploaded image",
            description = "Runs the detection pipeline on a still image. An optional region of interest, e.g. from an "
                    + "object detector, restricts the search.")
    @ApiResponses({
            @ApiResponse(
                    responseCode = "200",
                    description = "Detection finished, the rectangle is absent when no document was found",
                    content = @Content(
                            mediaType = MediaType.APPLICATION_JSON_VALUE,
                            schema = @Schema(implementation = DetectionResponse.class))),
            @ApiResponse(responseCode = "400", description = "Invalid request",
                    content = @Content(schema = @Schema(implementation = ErrorResponse.class)))
    })
    @PostMapping(value = "/detect", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public DetectionResponse detect(
            @Parameter(description = "Photo containing a document", required = true)
            @RequestPart("image") MultipartFile image,
            @RequestParam(required = false) Integer roiX,
            @RequestParam(required = false) Integer roiY,
            @RequestParam(required = false) Integer roiWidth,
            @RequestParam(required = false) Integer roiHeight) {
        requireImage(image);
        return service.detect(image, regionOf(roiX, roiY, roiWidth, roiHeight));
    }

    @Operation(
            summary = "Detect the document boundary in a raw NV21 camera frame",
            description = "The body carries the Y plane followed by the interleaved VU plane. The rotation is applied "
                    + "before detection and the response reports upright dimensions.")
    @PostMapping(value = "/detect/yuv", consumes = MediaType.APPLICATION_OCTET_STREAM_VALUE)
    public DetectionResponse detectYuv(
            @RequestBody byte[] frame,
            @Parameter(description = "Sensor buffer width", required = true) @RequestParam int width,
            @Parameter(description = "Sensor buffer height", required = true) @RequestParam int height,
            @Parameter(description = "Clockwise rotation to upright: 0, 90, 180 or 270")
            @RequestParam(defaultValue = "0") int rotation,
            @RequestParam(required = false) Integer roiX,
            @RequestParam(required = false) Integer roiY,
            @RequestParam(required = false) Integer roiWidth,
            @RequestParam(required = false) Integer roiHeight) {
        return service.detectYuv(frame, width, height, rotation, regionOf(roiX, roiY, roiWidth, roiHeight));
    }

    @Operation(summary = "Classify a rectangle as GOOD, BAD_ANGLE or TOO_FAR")
    @PostMapping(value = "/quality", consumes = MediaType.APPLICATION_JSON_VALUE)
    public QualityResponse quality(@Valid @RequestBody QualityRequest request) {
        return new QualityResponse(
                service.evaluateQuality(request.rectangle(), request.referenceWidth(), request.referenceHeight(), request.space()),
                request.space());
    }

    @Operation(
            summary = "Crop and flatten the document",
            description = "Warps the quadrilateral to an axis-aligned image and applies optional color controls. "
                    + "A degenerate rectangle returns the original image.")
    @ApiResponse(responseCode = "200", description = "Cropped document",
            content = @Content(mediaType = MediaType.IMAGE_PNG_VALUE))
    @PostMapping(value = "/warp", consumes = MediaType.MULTIPART_FORM_DATA_VALUE, produces = MediaType.IMAGE_PNG_VALUE)
    public ResponseEntity<byte[]> warp(
            @Parameter(description = "Photo the rectangle was detected in", required = true)
            @RequestPart("image") MultipartFile image,
            @Parameter(description = "Document corners in upright image coordinates", required = true)
            @RequestPart("rectangle") Rectangle rectangle,
            @RequestParam(defaultValue = "0") double brightness,
            @RequestParam(defaultValue = "1") double contrast,
            @RequestParam(defaultValue = "1") double saturation) {
        requireImage(image);
        ColorAdjustment adjustment = new ColorAdjustment(brightness, contrast, saturation);
        return ResponseEntity.ok()
                .contentType(MediaType.IMAGE_PNG)
                .body(service.warpToPng(image, rectangle, adjustment));
    }

    @Operation(summary = "Map a rectangle between sensor, image, view and bitmap coordinates")
    @PostMapping(value = "/map", consumes = MediaType.APPLICATION_JSON_VALUE)
    public Rectangle map(@Valid @RequestBody MappingRequest request) {
        return service.mapCoordinates(request.rectangle(), request.from(), request.to(), request.params());
    }

    @Operation(summary = "Show the active detection and quality configuration")
    @GetMapping("/config")
    public ConfigResponse config() {
        return service.configuration();
    }

    private static void requireImage(MultipartFile image) {
        if (image == null || image.isEmpty()) {
            throw new ResponseStatusException(BAD_REQUEST, "Image file is required");
        }
    }

    private static RegionOfInterest regionOf(Integer x, Integer y, Integer width, Integer height) {
        if (x == null && y == null && width == null && height == null) {
            return null;
        }
        if (x == null || y == null || width == null || height == null) {
            throw new ResponseStatusException(BAD_REQUEST, "roiX, roiY, roiWidth and roiHeight must be given together");
        }
        return new RegionOfInterest(x, y, width, height);
    }
}
