package com.wellstim.extraction.repository;

import com.wellstim.extraction.entity.Well;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;
import java.util.Optional;

public interface WellRepository extends JpaRepository<Well, Long> {

    Optional<Well> findByApi(String api);

    // Eagerly fetch stimulations for the read API in one query
    @Query("""
        SELECT w FROM Well w
        LEFT JOIN FETCH w.stimulations
        ORDER BY w.operator ASC, w.wellName ASC
    """)
    List<Well> findAllWithStimulations();

    @Query("""
        SELECT w FROM Well w
        LEFT JOIN FETCH w.stimulations
        WHERE w.api = :api
    """)
    Optional<Well> findByApiWithStimulations(@Param("api") String api);
}
