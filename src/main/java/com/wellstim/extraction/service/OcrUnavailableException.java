package com.wellstim.extraction.service;

/**
 * The OCR toolchain itself cannot be used (native library or language data
 * missing). No page of any document can be recognised until it is installed.
 */
public class OcrUnavailableException extends OcrException {

    public OcrUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
