package com.wellstim.extraction.controller;

import com.wellstim.extraction.model.WellView;
import com.wellstim.extraction.service.WellQueryService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.server.ResponseStatusException;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api")
@Slf4j
public class WellQueryController {

    private final WellQueryService queryService;

    public WellQueryController(WellQueryService queryService) {
        this.queryService = queryService;
    }

    @GetMapping("/health")
    public Map<String, String> health() {
        return Map.of("status", "ok");
    }

    @GetMapping("/wells")
    public List<WellView> listWells() {
        return queryService.listWells();
    }

    /**
     * One well by exact API number, e.g. /api/wells/33-053-02102.
     */
    @GetMapping("/wells/{api}")
    public WellView getWell(@PathVariable("api") String api) {
        return queryService.findWell(api)
                .orElseThrow(() -> {
                    log.debug("Well {} requested but not stored", api);
                    return new ResponseStatusException(HttpStatus.NOT_FOUND, "Well with API " + api + " not found");
                });
    }
}
