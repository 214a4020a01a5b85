package com.wellstim.extraction.service;

import com.wellstim.extraction.config.IngestionProperties;
import lombok.extern.slf4j.Slf4j;
import net.sourceforge.tess4j.Tesseract;
import net.sourceforge.tess4j.TesseractException;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.awt.image.BufferedImage;

/**
 * Tess4J-backed recognition. The native library is only loaded on the first
 * {@link #recognize} call, so a host without Tesseract still starts.
 */
@Service
@Slf4j
public class TesseractOcrEngine implements OcrEngine {

    private final Tesseract tesseract;

    @Autowired
    public TesseractOcrEngine(IngestionProperties properties) {
        this(new Tesseract());
        IngestionProperties.Ocr ocr = properties.getOcr();
        if (ocr.getDatapath() != null && !ocr.getDatapath().isBlank()) {
            tesseract.setDatapath(ocr.getDatapath());
        }
        tesseract.setLanguage(ocr.getLanguage());
        log.info("Tesseract configured: language={}, datapath={}", ocr.getLanguage(), ocr.getDatapath());
    }

    TesseractOcrEngine(Tesseract tesseract) {
        this.tesseract = tesseract;
    }

    @Override
    public String recognize(BufferedImage pageImage) throws OcrException {
        try {
            return tesseract.doOCR(pageImage);
        } catch (LinkageError e) {
            throw new OcrUnavailableException(
                    "Tesseract native library is not installed: " + e.getMessage(), e);
        } catch (TesseractException e) {
            throw new OcrException("Tesseract failed: " + e.getMessage(), e);
        } catch (RuntimeException | Error e) {
            // JNA reports native faults as plain Errors
            throw new OcrException("Tesseract crashed: " + e.getMessage(), e);
        }
    }
}
