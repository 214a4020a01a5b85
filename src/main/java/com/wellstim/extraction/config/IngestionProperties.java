package com.wellstim.extraction.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;

@Data
@ConfigurationProperties(prefix = "wellstim.ingest")
public class IngestionProperties {

    /** Folder scanned recursively when no folder argument is given. */
    private String folder = "./pdfs";

    /** File extensions (without the dot, any case) treated as reports. */
    private List<String> extensions = new ArrayList<>(List.of("pdf"));

    /** Catch persistence failures per document instead of ending the batch. */
    private boolean continueOnError = true;

    private boolean runOnStartup = false;

    private Ocr ocr = new Ocr();

    @Data
    public static class Ocr {

        /** Rasterization resolution for pages without a text layer. */
        private int dpi = 300;

        /** Tesseract tessdata directory; blank uses the engine default. */
        private String datapath;

        private String language = "eng";
    }
}
