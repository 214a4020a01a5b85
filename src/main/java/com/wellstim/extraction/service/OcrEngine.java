package com.wellstim.extraction.service;

import java.awt.image.BufferedImage;

@FunctionalInterface
public interface OcrEngine {

    String recognize(BufferedImage pageImage) throws OcrException;
}
