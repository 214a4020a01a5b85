package com.wellstim.extraction.service;

import com.wellstim.extraction.model.FieldDefinition;
import com.wellstim.extraction.model.ParsedRecord;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Turns report text into normalized well and stimulation records.
 *
 * The field tables do most of the work. On top of them:
 *   - a combined Latitude ... Longitude match overrides both single-field hits
 *   - a missing API number is recovered from loose digit runs
 *   - a multi-line Details block beats the single-line Details capture
 *
 * No defaults are applied here; missing values stay null.
 */
@Service
@Slf4j
public class WellReportParser {

    private final FieldExtractionEngine engine;
    private final ApiNumberRecovery apiRecovery;

    public WellReportParser(FieldExtractionEngine engine, ApiNumberRecovery apiRecovery) {
        this.engine = engine;
        this.apiRecovery = apiRecovery;
    }

    public ParsedRecord parseWell(String text) {
        Map<String, Optional<String>> raw = engine.extractFields(text, WellReportFields.WELL);

        engine.extractPair(text, WellReportFields.LAT_LONG).ifPresent(pair -> {
            raw.put("latitude", Optional.of(pair[0]));
            raw.put("longitude", Optional.of(pair[1]));
        });

        if (raw.get("api").isEmpty()) {
            Optional<String> recovered = apiRecovery.recover(FieldExtractionEngine.normalizeText(text));
            recovered.ifPresent(api -> log.info("No labelled API number; recovered {} from digit runs", api));
            raw.put("api", recovered);
        }

        return normalize(raw, WellReportFields.WELL);
    }

    public ParsedRecord parseStimulation(String text) {
        Map<String, Optional<String>> raw = engine.extractFields(text, WellReportFields.STIMULATION);

        engine.extractBlock(text, WellReportFields.DETAILS_LABEL)
                .ifPresent(block -> raw.put("details", Optional.of(block)));

        return normalize(raw, WellReportFields.STIMULATION);
    }

    private ParsedRecord normalize(Map<String, Optional<String>> raw, List<FieldDefinition> fields) {
        ParsedRecord record = new ParsedRecord();
        for (FieldDefinition field : fields) {
            String captured = raw.getOrDefault(field.getName(), Optional.empty()).orElse(null);
            Object value = FieldNormalizer.normalize(field, captured);
            if (captured != null && value == null) {
                log.debug("Field '{}' captured '{}' but could not be coerced to {}",
                        field.getName(), captured, field.getKind());
            }
            record.put(field.getName(), value);
        }
        return record;
    }
}
