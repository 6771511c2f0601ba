package com.eyelevel.watermarks.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.util.unit.DataSize;

import java.util.List;
import java.util.Set;

/**
 * Binds application properties under the "app.processing" prefix to a strongly-typed
 * configuration object. This provides centralized control over chunking, watermark rendering,
 * working storage and upload validation.
 */
@Data
@ConfigurationProperties(prefix = "app.processing")
public class WatermarkProcessingConfig {

    private int defaultChunkSize = 10;
    private int maxParallelWorkers = 4;
    private Watermark watermark = new Watermark();
    private Storage storage = new Storage();
    private Validation validation = new Validation();

    @Data
    public static class Watermark {
        private String text = "WATERMARK";
        private float fontSize = 60f;
        private float opacity = 0.3f;
        private float rotationDegrees = 45f;

        /**
         * Palette rotated across chunks, as {@code #RRGGBB} values.
         */
        private List<String> colors = List.of("#FF0000", "#0000FF", "#008000", "#FF8000",
                                              "#800080", "#00CCCC", "#FF00FF", "#996633");
    }

    @Data
    public static class Storage {
        private String tempDir = "temp_files";
        private String uploadDir = "uploads";
        private String processingDir = "processing";
        private String outputDir = "outputs";
    }

    @Data
    public static class Validation {
        private double ramSafetyMargin = 0.7;
        private DataSize absoluteMaxFileSize = DataSize.ofMegabytes(500);
        private boolean recheckSizeOnUpload = true;
        private Set<String> allowedExtensions = Set.of("pdf");
    }
}
