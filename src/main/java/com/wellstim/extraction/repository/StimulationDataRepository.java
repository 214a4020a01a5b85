package com.wellstim.extraction.repository;

import com.wellstim.extraction.entity.StimulationData;
import com.wellstim.extraction.entity.Well;
import org.springframework.data.jpa.repository.JpaRepository;

import java.time.LocalDate;
import java.util.Optional;

public interface StimulationDataRepository extends JpaRepository<StimulationData, Long> {

    Optional<StimulationData> findByWellAndDateStimulated(Well well, LocalDate dateStimulated);
}
