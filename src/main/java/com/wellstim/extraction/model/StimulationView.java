package com.wellstim.extraction.model;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.*;

import java.time.LocalDate;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class StimulationView {

    private Long id;

    @JsonFormat(shape = JsonFormat.Shape.STRING, pattern = "yyyy-MM-dd")
    private LocalDate dateStimulated;

    private String stimulatedFormation;
    private Double topFt;
    private Double bottomFt;
    private Integer stimulationStages;
    private Double volume;
    private String volumeUnits;
    private String typeTreatment;
    private String acid;
    private Double lbsProppant;
    private Double maxTreatmentPressure;
    private Double maxTreatmentRate;
    private String details;
}
