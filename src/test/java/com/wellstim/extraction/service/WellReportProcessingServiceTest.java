package com.wellstim.extraction.service;

import com.wellstim.extraction.config.IngestionProperties;
import com.wellstim.extraction.entity.StimulationData;
import com.wellstim.extraction.entity.Well;
import com.wellstim.extraction.model.ProcessingResult;
import com.wellstim.extraction.model.UpsertOutcome.Action;
import com.wellstim.extraction.repository.StimulationDataRepository;
import com.wellstim.extraction.repository.WellRepository;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Import;

import java.nio.file.Path;
import java.time.LocalDate;
import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

@DataJpaTest
@Import({
        WellReportProcessingService.class,
        WellReportParser.class,
        FieldExtractionEngine.class,
        ApiNumberRecovery.class,
        WellUpsertService.class
})
class WellReportProcessingServiceTest {

    // Scanned pages in these tests "read" as whatever the OCR stub returns
    static final String SCANNED_TEXT = "Operator: Scan Energy\nWell Name: Dunn 7\nDate Stimulated: 03/15/2019";

    @TestConfiguration
    static class PipelineConfig {

        @Bean
        IngestionProperties ingestionProperties() {
            IngestionProperties properties = new IngestionProperties();
            properties.getOcr().setDpi(36);
            return properties;
        }

        @Bean
        PdfTextExtractor pdfTextExtractor(IngestionProperties ingestionProperties) {
            return new PdfTextExtractor(image -> SCANNED_TEXT + "\nAPI: 33-105-04444", ingestionProperties);
        }
    }

    @TempDir
    Path dir;

    @Autowired
    private WellReportProcessingService processingService;

    @Autowired
    private WellRepository wellRepo;

    @Autowired
    private StimulationDataRepository stimulationRepo;

    @Test
    void fullReportIsStoredOnce() throws Exception {
        Path pdf = TestPdfs.textPdf(dir.resolve("W28190.pdf"), TestPdfs.FULL_REPORT);

        ProcessingResult first = processingService.process(pdf);
        ProcessingResult second = processingService.process(pdf);

        assertEquals(ProcessingResult.Status.PROCESSED, first.getStatus());
        assertEquals(Action.CREATED, first.getWellAction());
        assertEquals(Action.UPDATED, second.getWellAction());
        assertEquals(Action.UPDATED, second.getStimulationAction());
        assertEquals(100.0, first.getCompleteness());

        assertEquals(1, wellRepo.count());
        assertEquals(1, stimulationRepo.count());

        Well well = wellRepo.findByApi("33-053-02102").orElseThrow();
        assertEquals("Acme Oil Co", well.getOperator());
        assertEquals(-103.4567, well.getLongitude());

        StimulationData stim = stimulationRepo.findAll().get(0);
        assertEquals(LocalDate.of(2020, 1, 2), stim.getDateStimulated());
        assertEquals(4500000.0, stim.getLbsProppant());
        assertEquals("bbls", stim.getVolumeUnits());
    }

    @Test
    void undatedReportAppendsAStimulationEachPass() throws Exception {
        List<String> undated = TestPdfs.FULL_REPORT.stream()
                .filter(line -> !line.startsWith("Date Stimulated"))
                .collect(Collectors.toList());
        Path pdf = TestPdfs.textPdf(dir.resolve("undated.pdf"), undated);

        processingService.process(pdf);
        processingService.process(pdf);

        assertEquals(1, wellRepo.count());
        assertEquals(2, stimulationRepo.count());
    }

    @Test
    void reportWithoutIdentifierWritesNothing() throws Exception {
        Path pdf = TestPdfs.textPdf(dir.resolve("anonymous.pdf"), List.of(
                "Operator: Acme Oil Co",
                "Well Name: Johnson 1-23H",
                "Date Stimulated: 01/02/2020",
                "Stimulation Stages: 30",
                "Top (ft): 10,100"));

        ProcessingResult result = processingService.process(pdf);

        assertEquals(ProcessingResult.Status.SKIPPED_NO_API, result.getStatus());
        assertEquals(0, wellRepo.count());
        assertEquals(0, stimulationRepo.count());
    }

    @Test
    void scannedReportIsReadThroughOcr() throws Exception {
        Path pdf = TestPdfs.blankPdf(dir.resolve("scan.pdf"), 1);

        ProcessingResult result = processingService.process(pdf);

        assertEquals("33-105-04444", result.getApi());
        Well well = wellRepo.findByApi("33-105-04444").orElseThrow();
        assertEquals("Scan Energy", well.getOperator());
        assertEquals("Dunn 7", well.getWellName());
    }

    @Test
    void unreadableDocumentIsSkippedWithoutWrites() throws Exception {
        Path pdf = java.nio.file.Files.writeString(dir.resolve("broken.pdf"), "garbage");

        ProcessingResult result = processingService.process(pdf);

        assertEquals(ProcessingResult.Status.SKIPPED_NO_TEXT, result.getStatus());
        assertTrue(result.getWarnings().contains("PDF contains no extractable text"));
        assertEquals(0, wellRepo.count());
    }
}
