package com.wellstim.extraction.service;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class FieldExtractionEngineTest {

    private final FieldExtractionEngine engine = new FieldExtractionEngine();

    @Test
    void firstPatternInListWinsEvenIfALaterOneMatchesEarlierInText() {
        List<Pattern> patterns = List.of(
                Pattern.compile("Operator Name[:#\\s-]+(.+)", Pattern.CASE_INSENSITIVE),
                Pattern.compile("Operator[:#\\s-]+(.+)", Pattern.CASE_INSENSITIVE));

        Optional<String> value = engine.extractFirstMatch("Operator: Beta\nOPERATOR NAME: Alpha", patterns);

        assertEquals(Optional.of("Alpha"), value);
    }

    @Test
    void blankCaptureFallsThroughToNextPattern() {
        List<Pattern> patterns = List.of(
                Pattern.compile("Datum:([ ]*)$", Pattern.MULTILINE),
                Pattern.compile("Datum\\s+Used:\\s*(\\S+)"));

        assertEquals(Optional.of("NAD27"), engine.extractFirstMatch("Datum:   \nDatum Used: NAD27", patterns));
    }

    @Test
    void everyTableFieldIsReportedInOrder() {
        Map<String, Optional<String>> raw = engine.extractFields(
                "Operator: Acme Oil Co\r\nDatum: NAD83\r\n", WellReportFields.WELL);

        assertEquals(WellReportFields.WELL.size(), raw.size());
        assertEquals("operator", raw.keySet().iterator().next());
        assertEquals(Optional.of("Acme Oil Co"), raw.get("operator"));
        assertEquals(Optional.of("NAD83"), raw.get("datum"));
        assertTrue(raw.get("api").isEmpty());
        assertTrue(raw.get("shl").isEmpty());
    }

    @Test
    void blockRunsUntilNextCapitalisedLabel() {
        String text = "Details: Pumped 30 stages\nscreened out at stage 12\nReviewed By: J. Smith";

        assertEquals(Optional.of("Pumped 30 stages\nscreened out at stage 12"),
                engine.extractBlock(text, "Details"));
    }

    @Test
    void blockRunsToEndOfText() {
        assertEquals(Optional.of("40/70 white sand\n100 mesh tail-in"),
                engine.extractBlock("DETAILS - 40/70 white sand\n100 mesh tail-in\n", "Details"));
    }

    @Test
    void blockMissingLabelIsEmpty() {
        assertTrue(engine.extractBlock("Operator: Acme", "Details").isEmpty());
    }

    @Test
    void pairNeedsBothLabelsClose() {
        Optional<String[]> pair = engine.extractPair("Latitude: 47.81 Longitude: -103.45", WellReportFields.LAT_LONG);
        assertArrayEquals(new String[] {"47.81", "-103.45"}, pair.orElseThrow());

        String farApart = "Latitude: 47.81\n" + "x".repeat(60) + "\nLongitude: -103.45";
        assertTrue(engine.extractPair(farApart, WellReportFields.LAT_LONG).isEmpty());
    }
}
