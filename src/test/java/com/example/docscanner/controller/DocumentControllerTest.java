package com.example.docscanner.controller;

import com.example.docscanner.detection.DetectionConfig;
import com.example.docscanner.model.CoordinateSpace;
import com.example.docscanner.model.DetectionPass;
import com.example.docscanner.model.Quality;
import com.example.docscanner.model.QualitySpace;
import com.example.docscanner.model.Rectangle;
import com.example.docscanner.model.RegionOfInterest;
import com.example.docscanner.model.api.ConfigResponse;
import com.example.docscanner.model.api.DetectionResponse;
import com.example.docscanner.quality.QualityThresholds;
import com.example.docscanner.service.DocumentScanService;
import com.example.docscanner.warp.ColorAdjustment;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.mock.web.MockMultipartFile;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.web.multipart.MultipartFile;

import java.nio.charset.StandardCharsets;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.multipart;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.content;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest
@AutoConfigureMockMvc
class DocumentControllerTest {

    private static final String RECTANGLE_JSON = """
            {
              "topLeft": {"x": 10, "y": 20},
              "topRight": {"x": 110, "y": 20},
              "bottomLeft": {"x": 10, "y": 80},
              "bottomRight": {"x": 110, "y": 80}
            }
            """;

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private DocumentScanService service;

    @Test
    void detectReturnsRectangleAndQuality() throws Exception {
        when(service.detect(any(MultipartFile.class), isNull()))
                .thenReturn(new DetectionResponse(
                        Rectangle.ofBox(10, 20, 100, 60), 640, 480, DetectionPass.CANNY, Quality.TOO_FAR, 12));

        mockMvc.perform(multipart("/api/v1/documents/detect").file(image()))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.pass").value("CANNY"))
                .andExpect(jsonPath("$.quality").value("TOO_FAR"))
                .andExpect(jsonPath("$.frameWidth").value(640))
                .andExpect(jsonPath("$.rectangle.topRight.x").value(110.0))
                .andExpect(jsonPath("$.rectangle.bottomLeft.y").value(80.0));
    }

    @Test
    void detectPassesRegionOfInterest() throws Exception {
        RegionOfInterest roi = new RegionOfInterest(5, 6, 70, 80);
        when(service.detect(any(MultipartFile.class), eq(roi)))
                .thenReturn(new DetectionResponse(null, 640, 480, DetectionPass.NONE, null, 3));

        mockMvc.perform(multipart("/api/v1/documents/detect").file(image())
                        .param("roiX", "5")
                        .param("roiY", "6")
                        .param("roiWidth", "70")
                        .param("roiHeight", "80"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.pass").value("NONE"));

        verify(service).detect(any(MultipartFile.class), eq(roi));
    }

    @Test
    void detectRejectsPartialRegionOfInterest() throws Exception {
        mockMvc.perform(multipart("/api/v1/documents/detect").file(image()).param("roiX", "5"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.status").value(400))
                .andExpect(jsonPath("$.path").value("/api/v1/documents/detect"));

        verifyNoInteractions(service);
    }

    @Test
    void detectRejectsEmptyImage() throws Exception {
        MockMultipartFile empty = new MockMultipartFile("image", "empty.png", MediaType.IMAGE_PNG_VALUE, new byte[0]);

        mockMvc.perform(multipart("/api/v1/documents/detect").file(empty))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message").value("Image file is required"));
    }

    @Test
    void detectReportsUnsupportedImageAsBadRequest() throws Exception {
        when(service.detect(any(MultipartFile.class), isNull()))
                .thenThrow(new IllegalArgumentException("Unsupported image type for file: page.png"));

        mockMvc.perform(multipart("/api/v1/documents/detect").file(image()))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message").value("Unsupported image type for file: page.png"));
    }

    @Test
    void detectYuvForwardsFrameGeometry() throws Exception {
        byte[] frame = new byte[6];
        when(service.detectYuv(any(byte[].class), eq(2), eq(2), eq(90), isNull()))
                .thenReturn(new DetectionResponse(null, 2, 2, DetectionPass.NONE, null, 1));

        mockMvc.perform(post("/api/v1/documents/detect/yuv")
                        .contentType(MediaType.APPLICATION_OCTET_STREAM)
                        .content(frame)
                        .param("width", "2")
                        .param("height", "2")
                        .param("rotation", "90"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.frameWidth").value(2));
    }

    @Test
    void qualityReturnsVerdict() throws Exception {
        when(service.evaluateQuality(any(Rectangle.class), eq(1080), eq(1920), eq(QualitySpace.VIEW)))
                .thenReturn(Quality.BAD_ANGLE);

        mockMvc.perform(post("/api/v1/documents/quality")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"rectangle\": " + RECTANGLE_JSON
                                + ", \"referenceWidth\": 1080, \"referenceHeight\": 1920, \"space\": \"VIEW\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.quality").value("BAD_ANGLE"))
                .andExpect(jsonPath("$.space").value("VIEW"));
    }

    @Test
    void qualityReportsCrossedRectangleAsBadRequest() throws Exception {
        when(service.evaluateQuality(any(Rectangle.class), anyInt(), anyInt(), any()))
                .thenThrow(new IllegalArgumentException("Rectangle is not a valid quadrilateral"));

        mockMvc.perform(post("/api/v1/documents/quality")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"rectangle\": " + RECTANGLE_JSON
                                + ", \"referenceWidth\": 1080, \"referenceHeight\": 1920, \"space\": \"IMAGE\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message").value("Rectangle is not a valid quadrilateral"));
    }

    @Test
    void qualityRejectsMissingRectangle() throws Exception {
        mockMvc.perform(post("/api/v1/documents/quality")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"referenceWidth\": 1080, \"referenceHeight\": 1920, \"space\": \"VIEW\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.status").value(400));

        verifyNoInteractions(service);
    }

    @Test
    void mapReturnsConvertedRectangle() throws Exception {
        when(service.mapCoordinates(any(Rectangle.class), eq(CoordinateSpace.IMAGE), eq(CoordinateSpace.VIEW), any()))
                .thenReturn(Rectangle.ofBox(5, 10, 50, 30));

        mockMvc.perform(post("/api/v1/documents/map")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"rectangle\": " + RECTANGLE_JSON + ", \"from\": \"IMAGE\", \"to\": \"VIEW\", "
                                + "\"params\": {\"imageWidth\": 640, \"imageHeight\": 480, \"rotation\": 0, "
                                + "\"viewWidth\": 320, \"viewHeight\": 240, \"scaleMode\": \"FIT\"}}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.topLeft.x").value(5.0))
                .andExpect(jsonPath("$.bottomRight.y").value(40.0));
    }

    @Test
    void mapReportsMissingSizeAsBadRequest() throws Exception {
        when(service.mapCoordinates(any(Rectangle.class), any(), any(), any()))
                .thenThrow(new IllegalArgumentException("Mapping needs a positive view size"));

        mockMvc.perform(post("/api/v1/documents/map")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"rectangle\": " + RECTANGLE_JSON + ", \"from\": \"IMAGE\", \"to\": \"VIEW\", "
                                + "\"params\": {\"imageWidth\": 640, \"imageHeight\": 480}}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message").value("Mapping needs a positive view size"));
    }

    @Test
    void warpReturnsPng() throws Exception {
        byte[] png = {(byte) 0x89, 'P', 'N', 'G'};
        when(service.warpToPng(any(MultipartFile.class), any(Rectangle.class), eq(new ColorAdjustment(0.1, 1.2, 1.0))))
                .thenReturn(png);
        MockMultipartFile rectangle = new MockMultipartFile(
                "rectangle", "", MediaType.APPLICATION_JSON_VALUE, RECTANGLE_JSON.getBytes(StandardCharsets.UTF_8));

        mockMvc.perform(multipart("/api/v1/documents/warp").file(image()).file(rectangle)
                        .param("brightness", "0.1")
                        .param("contrast", "1.2"))
                .andExpect(status().isOk())
                .andExpect(content().contentType(MediaType.IMAGE_PNG))
                .andExpect(content().bytes(png));
    }

    @Test
    void warpRejectsInvalidColorAdjustment() throws Exception {
        MockMultipartFile rectangle = new MockMultipartFile(
                "rectangle", "", MediaType.APPLICATION_JSON_VALUE, RECTANGLE_JSON.getBytes(StandardCharsets.UTF_8));

        mockMvc.perform(multipart("/api/v1/documents/warp").file(image()).file(rectangle)
                        .param("contrast", "-1"))
                .andExpect(status().isBadRequest());

        verifyNoInteractions(service);
    }

    @Test
    void configReportsActiveSettings() throws Exception {
        when(service.configuration())
                .thenReturn(new ConfigResponse(DetectionConfig.defaults(), QualityThresholds.defaults(), 5));

        mockMvc.perform(get("/api/v1/documents/config"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.requiredGoodFrames").value(5))
                .andExpect(jsonPath("$.quality.edgeMarginPx").value(150.0));
    }

    private static MockMultipartFile image() {
        return new MockMultipartFile("image", "page.png", MediaType.IMAGE_PNG_VALUE, new byte[]{1, 2, 3});
    }
}
