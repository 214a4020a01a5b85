package com.wellstim.extraction.model;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

@Getter
@ToString
@AllArgsConstructor
public class UpsertOutcome {

    public enum Action { CREATED, UPDATED, SKIPPED, NONE }

    private final String api;
    private final Action wellAction;
    private final Action stimulationAction;

    public static UpsertOutcome skipped() {
        return new UpsertOutcome(null, Action.SKIPPED, Action.NONE);
    }

    public boolean isSkipped() {
        return wellAction == Action.SKIPPED;
    }
}
