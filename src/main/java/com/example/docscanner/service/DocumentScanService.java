package com.example.docscanner.service;

import com.example.docscanner.capture.RectangleSmoother;
import com.example.docscanner.capture.ScanSession;
import com.example.docscanner.capture.TemporalStabilizer;
import com.example.docscanner.config.DocScannerProperties;
import com.example.docscanner.detection.DocumentDetector;
import com.example.docscanner.mapping.CoordinateMapper;
import com.example.docscanner.mapping.MappingParams;
import com.example.docscanner.model.CoordinateSpace;
import com.example.docscanner.model.DetectionResult;
import com.example.docscanner.model.Frame;
import com.example.docscanner.model.Quality;
import com.example.docscanner.model.QualitySpace;
import com.example.docscanner.model.Rectangle;
import com.example.docscanner.model.RegionOfInterest;
import com.example.docscanner.model.api.ConfigResponse;
import com.example.docscanner.model.api.DetectionResponse;
import com.example.docscanner.quality.QualityEvaluator;
import com.example.docscanner.util.FrameImages;
import com.example.docscanner.warp.ColorAdjustment;
import com.example.docscanner.warp.ImageAdjuster;
import com.example.docscanner.warp.PerspectiveWarper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.io.InputStream;
import java.time.Duration;

@Service
public class DocumentScanService {

    private static final Logger log = LoggerFactory.getLogger(DocumentScanService.class);

    private final DocumentDetector detector;
    private final QualityEvaluator qualityEvaluator;
    private final CoordinateMapper coordinateMapper;
    private final PerspectiveWarper warper;
    private final ImageAdjuster imageAdjuster;
    private final DocScannerProperties properties;

    public DocumentScanService(DocumentDetector detector,
                               QualityEvaluator qualityEvaluator,
                               CoordinateMapper coordinateMapper,
                               PerspectiveWarper warper,
                               ImageAdjuster imageAdjuster,
                               DocScannerProperties properties) {
        this.detector = detector;
        this.qualityEvaluator = qualityEvaluator;
        this.coordinateMapper = coordinateMapper;
        this.warper = warper;
        this.imageAdjuster = imageAdjuster;
        this.properties = properties;
    }

    public DetectionResponse detect(MultipartFile file, RegionOfInterest roi) {
        Frame frame = readFrame(file);
        return detect(frame, roi, displayName(file));
    }

    public DetectionResponse detectYuv(byte[] nv21, int width, int height, int rotation, RegionOfInterest roi) {
        long start = System.nanoTime();
        DetectionResult result = detector.detectInYuv(nv21, width, height, rotation, roi);
        return respond(result, start, "yuv " + width + "x" + height + "@" + rotation);
    }

    public Quality evaluateQuality(Rectangle rectangle, int referenceWidth, int referenceHeight, QualitySpace space) {
        requireValid(rectangle);
        return qualityEvaluator.evaluate(rectangle, referenceWidth, referenceHeight, space);
    }

    /**
     * Crops the document out of the uploaded photo, applies the color controls and encodes the
     * result as PNG.
     */
    public byte[] warpToPng(MultipartFile file, Rectangle rectangle, ColorAdjustment adjustment) {
        requireValid(rectangle);
        Frame source = readFrame(file);
        Frame warped = warper.warpAndCrop(source, rectangle);
        Frame adjusted = imageAdjuster.adjust(warped, adjustment);
        log.debug("Cropped {} to {}x{}", displayName(file), adjusted.width(), adjusted.height());
        return FrameImages.toPng(adjusted);
    }

    public Rectangle mapCoordinates(Rectangle rectangle, CoordinateSpace from, CoordinateSpace to, MappingParams params) {
        return coordinateMapper.map(rectangle, from, to, params);
    }

    public ConfigResponse configuration() {
        return new ConfigResponse(
                detector.config(),
                qualityEvaluator.thresholds(),
                properties.getStabilizer().getRequiredGoodFrames());
    }

    /**
     * Opens a live preview loop for one frame source. Sessions are stateful and must not be
     * shared between sources.
     */
    public ScanSession openSession() {
        DocScannerProperties.Stabilizer stabilizer = properties.getStabilizer();
        return new ScanSession(
                detector,
                qualityEvaluator,
                coordinateMapper,
                new TemporalStabilizer(stabilizer.getRequiredGoodFrames(), stabilizer.getMaxCornerDriftPx()),
                new RectangleSmoother(stabilizer.getHoldLastRectangle()));
    }

    DetectionResponse detect(Frame frame, RegionOfInterest roi, String source) {
        long start = System.nanoTime();
        DetectionResult result = detector.detect(frame, roi);
        return respond(result, start, source);
    }

    private DetectionResponse respond(DetectionResult result, long start, String source) {
        long elapsedMs = Duration.ofNanos(System.nanoTime() - start).toMillis();
        Quality quality = result.detectedRectangle()
                .map(rectangle -> qualityEvaluator.evaluate(rectangle, result.frameWidth(), result.frameHeight(), QualitySpace.IMAGE))
                .orElse(null);
        log.info("Detection for {} finished in {} ms: pass={}, quality={}", source, elapsedMs, result.pass(), quality);
        return DetectionResponse.of(result, quality, elapsedMs);
    }

    private Frame readFrame(MultipartFile file) {
        String fileName = displayName(file);
        try (InputStream inputStream = file.getInputStream()) {
            return FrameImages.decode(inputStream);
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unsupported image type for file: " + fileName, e);
        } catch (IOException e) {
            log.error("Failed to read image {}", fileName, e);
            throw new IllegalStateException("Failed to read image " + fileName, e);
        }
    }

    private static void requireValid(Rectangle rectangle) {
        if (!rectangle.isValid()) {
            throw new IllegalArgumentException("Rectangle is not a valid quadrilateral, corners must be distinct and must not cross: " + rectangle);
        }
    }

    private static String displayName(MultipartFile file) {
        String fileName = file.getOriginalFilename();
        return fileName == null || fileName.isBlank() ? "image" : fileName;
    }
}
