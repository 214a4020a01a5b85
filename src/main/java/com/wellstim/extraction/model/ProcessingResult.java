package com.wellstim.extraction.model;

import lombok.*;

import java.util.*;

@Data
public class ProcessingResult {

    public enum Status { PROCESSED, SKIPPED_NO_TEXT, SKIPPED_NO_API, FAILED }

    private String source;                           // 'reports/W28190.pdf'
    private Status status = Status.PROCESSED;
    private String api;
    private UpsertOutcome.Action wellAction = UpsertOutcome.Action.NONE;
    private UpsertOutcome.Action stimulationAction = UpsertOutcome.Action.NONE;
    private double completeness;
    private List<String> warnings = new ArrayList<>();

    /**
     * Share of table fields, well and stimulation together, that were parsed
     * from the document before any default substitution.
     */
    public void calculateCompleteness(ParsedRecord well, ParsedRecord stimulation) {
        int totalFields = well.size() + stimulation.size();
        long presentFields = well.presentCount() + stimulation.presentCount();

        this.completeness = totalFields == 0 ? 0.0 : (presentFields * 100.0) / totalFields;
    }

    public void apply(UpsertOutcome outcome) {
        this.api = outcome.getApi();
        this.wellAction = outcome.getWellAction();
        this.stimulationAction = outcome.getStimulationAction();
        if (outcome.isSkipped()) {
            this.status = Status.SKIPPED_NO_API;
            this.warnings.add("No API number was parsed");
        }
    }

    public static ProcessingResult skipped(String source, Status status, String reason) {
        ProcessingResult r = new ProcessingResult();
        r.source = source;
        r.status = status;
        r.warnings.add(reason);
        return r;
    }

    public static ProcessingResult failed(String source, Exception e) {
        ProcessingResult r = new ProcessingResult();
        r.source = source;
        r.status = Status.FAILED;
        r.warnings.add(String.valueOf(e.getMessage()));
        return r;
    }
}
