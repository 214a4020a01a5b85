package com.wellstim.extraction.entity;

import java.util.ArrayList;
import java.util.List;

import jakarta.persistence.*;
import lombok.*;

@Entity
@Table(name = "wells")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@EqualsAndHashCode(exclude = {"stimulations"})
@ToString(exclude = {"stimulations"})
public class Well {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(length = 64, unique = true)
    private String api;                // '33-053-02102', the dedup key

    @Column(length = 255)
    private String operator;

    @Column(name = "well_name", length = 255)
    private String wellName;

    @Column(name = "enseco_job", length = 64)
    private String ensecoJob;

    @Column(name = "job_type", length = 255)
    private String jobType;

    @Column(name = "county_state", length = 255)
    private String countyState;

    @Lob
    @Column(name = "shl")
    private String shl;                // surface hole location, free text

    private Double latitude;

    private Double longitude;

    @Column(length = 255)
    private String datum;

    @OneToMany(mappedBy = "well", cascade = CascadeType.ALL, orphanRemoval = true, fetch = FetchType.LAZY)
    @OrderBy("dateStimulated ASC, id ASC")
    @Builder.Default
    private List<StimulationData> stimulations = new ArrayList<>();

    public void addStimulation(StimulationData stimulation) {
        stimulation.setWell(this);
        stimulations.add(stimulation);
    }
}
