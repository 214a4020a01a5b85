package com.wellstim.extraction.service;

import com.wellstim.extraction.model.ParsedRecord;
import com.wellstim.extraction.model.ProcessingResult;
import com.wellstim.extraction.model.UpsertOutcome;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.nio.file.Path;

/**
 * Runs one report through the pipeline: text, fields, normalization, upsert.
 *
 * Extraction and parsing problems end up as a skipped result. Persistence
 * failures propagate to the caller.
 */
@Service
@Slf4j
public class WellReportProcessingService {

    private final PdfTextExtractor textExtractor;
    private final WellReportParser parser;
    private final WellUpsertService upsertService;

    public WellReportProcessingService(PdfTextExtractor textExtractor,
                                       WellReportParser parser,
                                       WellUpsertService upsertService) {
        this.textExtractor = textExtractor;
        this.parser = parser;
        this.upsertService = upsertService;
    }

    public ProcessingResult process(Path pdfPath) {
        // 1. Pull text out of PDF
        String text = textExtractor.extract(pdfPath);

        if (text == null || text.isBlank()) {
            log.warn("{} produced no extractable text", pdfPath);
            return ProcessingResult.skipped(pdfPath.toString(),
                    ProcessingResult.Status.SKIPPED_NO_TEXT, "PDF contains no extractable text");
        }

        // 2. Parse both records
        ParsedRecord well = parser.parseWell(text);
        ParsedRecord stimulation = parser.parseStimulation(text);

        ProcessingResult result = new ProcessingResult();
        result.setSource(pdfPath.toString());
        result.calculateCompleteness(well, stimulation);

        // 3. Persist
        UpsertOutcome outcome = upsertService.upsert(well, stimulation, pdfPath);
        result.apply(outcome);

        log.debug("Processed {}: {} ({}% of fields parsed)",
                pdfPath, result.getStatus(), Math.round(result.getCompleteness()));
        return result;
    }
}
