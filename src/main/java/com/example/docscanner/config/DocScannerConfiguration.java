package com.example.docscanner.config;

import com.example.docscanner.detection.DetectionConfig;
import com.example.docscanner.detection.DocumentDetector;
import com.example.docscanner.mapping.CoordinateMapper;
import com.example.docscanner.quality.QualityEvaluator;
import com.example.docscanner.warp.ImageAdjuster;
import com.example.docscanner.warp.PerspectiveWarper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Wires the detection pipeline from {@link DocScannerProperties}. The pipeline classes carry no
 * Spring annotations, so replacing any of these beans swaps the implementation without touching
 * the core.
 */
@Configuration
public class DocScannerConfiguration {

    private static final Logger log = LoggerFactory.getLogger(DocScannerConfiguration.class);

    @Bean
    public DocumentDetector documentDetector(DocScannerProperties properties) {
        DetectionConfig config = properties.toDetectionConfig();
        log.info("Document detector using configuration version {} (adaptive fallback {}, refinement {})",
                config.version(),
                config.edges().fallbackEnabled() ? "on" : "off",
                config.refinement().enabled() ? "on" : "off");
        return new DocumentDetector(config);
    }

    @Bean
    public QualityEvaluator qualityEvaluator(DocScannerProperties properties) {
        return new QualityEvaluator(properties.toQualityThresholds());
    }

    @Bean
    public CoordinateMapper coordinateMapper() {
        return new CoordinateMapper();
    }

    @Bean
    public PerspectiveWarper perspectiveWarper() {
        return new PerspectiveWarper();
    }

    @Bean
    public ImageAdjuster imageAdjuster() {
        return new ImageAdjuster();
    }
}
