package com.example.docscanner;

import com.example.docscanner.config.DocScannerProperties;
import io.swagger.v3.oas.annotations.OpenAPIDefinition;
import io.swagger.v3.oas.annotations.info.Contact;
import io.swagger.v3.oas.annotations.info.Info;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@OpenAPIDefinition(
        info = @Info(
                title = "Document Scanner API",
                version = "1.0",
                description = "REST API for locating document boundaries in photos and camera frames, judging capture "
                        + "quality and producing perspective-corrected crops.",
                contact = @Contact(name = "Document Scanner")))
@SpringBootApplication
@EnableConfigurationProperties(DocScannerProperties.class)
public class DocScannerApplication {

    public static void main(String[] args) {
        SpringApplication.run(DocScannerApplication.class, args);
    }
}
