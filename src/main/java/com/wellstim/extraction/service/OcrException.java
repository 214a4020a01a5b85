package com.wellstim.extraction.service;

/**
 * Recognition failed for one page image.
 */
public class OcrException extends Exception {

    public OcrException(String message) {
        super(message);
    }

    public OcrException(String message, Throwable cause) {
        super(message, cause);
    }
}
