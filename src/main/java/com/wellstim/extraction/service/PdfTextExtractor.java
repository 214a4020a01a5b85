package com.wellstim.extraction.service;

import com.wellstim.extraction.config.IngestionProperties;
import lombok.extern.slf4j.Slf4j;
import org.apache.pdfbox.Loader;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.rendering.PDFRenderer;
import org.apache.pdfbox.text.PDFTextStripper;
import org.springframework.stereotype.Service;

import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Pulls text out of a report PDF.
 *
 * The embedded text layer is read page by page first. Only when every page
 * comes back blank are the pages rendered and handed to OCR. Failures never
 * escape: the caller gets "" and treats the document as having no data.
 */
@Service
@Slf4j
public class PdfTextExtractor {

    private final OcrEngine ocrEngine;
    private final IngestionProperties properties;

    public PdfTextExtractor(OcrEngine ocrEngine, IngestionProperties properties) {
        this.ocrEngine = ocrEngine;
        this.properties = properties;
    }

    public String extract(Path pdfPath) {
        try (PDDocument doc = Loader.loadPDF(pdfPath.toFile())) {
            String text = extractTextLayer(doc, pdfPath);
            if (!text.isBlank()) {
                return text;
            }

            log.info("Falling back to OCR for {}", pdfPath);
            return extractWithOcr(doc, pdfPath);
        } catch (IOException e) {
            log.error("Could not open {}: {}", pdfPath, e.getMessage());
            return "";
        }
    }

    // ─── TEXT LAYER ────────────────────────────────────────────────────

    private String extractTextLayer(PDDocument doc, Path pdfPath) {
        List<String> chunks = new ArrayList<>();
        int totalPages = doc.getNumberOfPages();

        for (int pageNum = 1; pageNum <= totalPages; pageNum++) {
            try {
                PDFTextStripper stripper = new PDFTextStripper();
                stripper.setSortByPosition(true);
                stripper.setStartPage(pageNum);
                stripper.setEndPage(pageNum);
                String pageText = stripper.getText(doc);
                if (pageText != null && !pageText.isBlank()) {
                    chunks.add(pageText);
                }
            } catch (IOException | RuntimeException e) {
                log.warn("Text layer failed for {} page {}: {}", pdfPath, pageNum, e.getMessage());
            }
        }

        return String.join("\n", chunks);
    }

    // ─── OCR FALLBACK ──────────────────────────────────────────────────

    private String extractWithOcr(PDDocument doc, Path pdfPath) {
        PDFRenderer renderer = new PDFRenderer(doc);
        int dpi = properties.getOcr().getDpi();
        int totalPages = doc.getNumberOfPages();

        List<String> pages = new ArrayList<>();
        int failedPages = 0;

        for (int pageIndex = 0; pageIndex < totalPages; pageIndex++) {
            try {
                BufferedImage image = renderer.renderImageWithDPI(pageIndex, dpi);
                String pageText = ocrEngine.recognize(image);
                pages.add(pageText == null ? "" : pageText);
            } catch (OcrUnavailableException e) {
                log.error("OCR unavailable for {}: {}. Install Tesseract and set wellstim.ingest.ocr.datapath if needed.",
                        pdfPath, e.getMessage());
                return "";
            } catch (OcrException | IOException | RuntimeException e) {
                failedPages++;
                log.warn("OCR failed for {} page {}: {}", pdfPath, pageIndex + 1, e.getMessage());
            }
        }

        if (totalPages > 0 && failedPages == totalPages) {
            log.error("OCR failed on every page of {}", pdfPath);
            return "";
        }

        return String.join("\n", pages);
    }
}
