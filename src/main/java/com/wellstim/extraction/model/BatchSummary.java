package com.wellstim.extraction.model;

import lombok.Data;

import java.util.ArrayList;
import java.util.List;

@Data
public class BatchSummary {

    private String folder;
    private List<ProcessingResult> results = new ArrayList<>();

    public long count(ProcessingResult.Status status) {
        return results.stream().filter(r -> r.getStatus() == status).count();
    }

    public int getTotal() {
        return results.size();
    }
}
