package com.wellstim.extraction.service;

import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDPage;
import org.apache.pdfbox.pdmodel.PDPageContentStream;
import org.apache.pdfbox.pdmodel.common.PDRectangle;
import org.apache.pdfbox.pdmodel.font.PDType1Font;
import org.apache.pdfbox.pdmodel.font.Standard14Fonts;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/**
 * Builds small report PDFs for tests.
 */
final class TestPdfs {

    static final List<String> FULL_REPORT = List.of(
            "Operator: Acme Oil Co",
            "Well Name: Johnson 1-23H",
            "API #: 33-053-02102",
            "Enseco Job #: S14-123",
            "Job Type: MWD",
            "County, State: McKenzie County, North Dakota",
            "Surface Hole Location (SHL): 250 FNL & 1200 FWL",
            "Latitude: 47.8123 Longitude: -103.4567",
            "Datum: NAD83",
            "Date Stimulated: 01/02/2020",
            "Stimulated Formation: Bakken",
            "Top (ft): 10,100",
            "Bottom (ft): 20,450",
            "Stimulation Stages: 30",
            "Volume (bbls): 125,000",
            "Type Treatment: Sand Frac",
            "Acid: 15% HCL",
            "Lbs Proppant: 4,500,000",
            "Max Treatment Pressure: 9,100",
            "Max Treatment Rate: 85.5",
            "Details: 40/70 white sand");

    private TestPdfs() {
    }

    /** One page with the given lines as a real text layer. */
    static Path textPdf(Path file, List<String> lines) throws IOException {
        try (PDDocument doc = new PDDocument()) {
            PDPage page = new PDPage(PDRectangle.LETTER);
            doc.addPage(page);
            try (PDPageContentStream cs = new PDPageContentStream(doc, page)) {
                cs.beginText();
                cs.setFont(new PDType1Font(Standard14Fonts.FontName.HELVETICA), 10);
                cs.setLeading(14f);
                cs.newLineAtOffset(50, 740);
                for (String line : lines) {
                    cs.showText(line);
                    cs.newLine();
                }
                cs.endText();
            }
            doc.save(file.toFile());
        }
        return file;
    }

    /** Pages with no text layer at all, like a scan. */
    static Path blankPdf(Path file, int pages) throws IOException {
        try (PDDocument doc = new PDDocument()) {
            for (int i = 0; i < pages; i++) {
                doc.addPage(new PDPage(PDRectangle.LETTER));
            }
            doc.save(file.toFile());
        }
        return file;
    }
}
