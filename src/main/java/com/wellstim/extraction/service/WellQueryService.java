package com.wellstim.extraction.service;

import com.wellstim.extraction.entity.StimulationData;
import com.wellstim.extraction.entity.Well;
import com.wellstim.extraction.model.StimulationView;
import com.wellstim.extraction.model.WellView;
import com.wellstim.extraction.repository.WellRepository;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Optional;

@Service
@Transactional(readOnly = true)
public class WellQueryService {

    private final WellRepository wellRepo;

    public WellQueryService(WellRepository wellRepo) {
        this.wellRepo = wellRepo;
    }

    /** All wells by operator, then well name, with their stimulations. */
    public List<WellView> listWells() {
        return wellRepo.findAllWithStimulations().stream()
                .map(this::toView)
                .toList();
    }

    public Optional<WellView> findWell(String api) {
        return wellRepo.findByApiWithStimulations(api).map(this::toView);
    }

    private WellView toView(Well well) {
        return WellView.builder()
                .id(well.getId())
                .api(well.getApi())
                .operator(well.getOperator())
                .wellName(well.getWellName())
                .ensecoJob(well.getEnsecoJob())
                .jobType(well.getJobType())
                .countyState(well.getCountyState())
                .shl(well.getShl())
                .latitude(well.getLatitude())
                .longitude(well.getLongitude())
                .datum(well.getDatum())
                .stimulations(well.getStimulations().stream().map(this::toView).toList())
                .build();
    }

    private StimulationView toView(StimulationData stim) {
        return StimulationView.builder()
                .id(stim.getId())
                .dateStimulated(stim.getDateStimulated())
                .stimulatedFormation(stim.getStimulatedFormation())
                .topFt(stim.getTopFt())
                .bottomFt(stim.getBottomFt())
                .stimulationStages(stim.getStimulationStages())
                .volume(stim.getVolume())
                .volumeUnits(stim.getVolumeUnits())
                .typeTreatment(stim.getTypeTreatment())
                .acid(stim.getAcid())
                .lbsProppant(stim.getLbsProppant())
                .maxTreatmentPressure(stim.getMaxTreatmentPressure())
                .maxTreatmentRate(stim.getMaxTreatmentRate())
                .details(stim.getDetails())
                .build();
    }
}
