package com.wellstim.extraction.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.*;

import java.util.ArrayList;
import java.util.List;

/**
 * JSON shape of a well served by the read API.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class WellView {

    private Long id;
    private String api;
    private String operator;
    private String wellName;
    private String ensecoJob;
    private String jobType;
    private String countyState;
    private String shl;
    private Double latitude;
    private Double longitude;
    private String datum;

    @Builder.Default
    private List<StimulationView> stimulations = new ArrayList<>();
}
