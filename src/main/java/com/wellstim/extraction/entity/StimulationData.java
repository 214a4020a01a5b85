package com.wellstim.extraction.entity;

import jakarta.persistence.*;
import lombok.*;

import java.time.LocalDate;

/**
 * One treatment event. Owned by exactly one {@link Well} and removed with it.
 *
 * Rows are matched on (well, dateStimulated) during ingestion. A row without a
 * date has no identity and is never matched, so undated treatments append.
 */
@Entity
@Table(name = "stimulation_data")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@EqualsAndHashCode(exclude = {"well"})
@ToString(exclude = {"well"})
public class StimulationData {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "well_id", nullable = false)
    private Well well;

    @Column(name = "date_stimulated")
    private LocalDate dateStimulated;

    @Column(name = "stimulated_formation", length = 255)
    private String stimulatedFormation;

    @Column(name = "top_ft")
    private Double topFt;

    @Column(name = "bottom_ft")
    private Double bottomFt;

    @Column(name = "stimulation_stages")
    private Integer stimulationStages;

    private Double volume;

    @Column(name = "volume_units", length = 32)
    private String volumeUnits;        // 'Barrels', 'bbls', 'Gallons'

    @Column(name = "type_treatment", length = 255)
    private String typeTreatment;

    @Column(length = 255)
    private String acid;

    @Column(name = "lbs_proppant")
    private Double lbsProppant;

    @Column(name = "max_treatment_pressure")
    private Double maxTreatmentPressure;

    @Column(name = "max_treatment_rate")
    private Double maxTreatmentRate;

    @Lob
    @Column(name = "details")
    private String details;
}
