package com.wellstim.extraction.service;

import com.wellstim.extraction.config.IngestionProperties;
import com.wellstim.extraction.model.BatchSummary;
import com.wellstim.extraction.model.ProcessingResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.util.List;

/**
 * Runs one batch at startup: {@code --wellstim.ingest.run-on-startup=true [folder]}.
 */
@Component
@ConditionalOnProperty(prefix = "wellstim.ingest", name = "run-on-startup", havingValue = "true")
@Slf4j
public class IngestionRunner implements ApplicationRunner {

    private final WellReportBatchService batchService;
    private final IngestionProperties properties;

    public IngestionRunner(WellReportBatchService batchService, IngestionProperties properties) {
        this.batchService = batchService;
        this.properties = properties;
    }

    @Override
    public void run(ApplicationArguments args) {
        List<String> folders = args.getNonOptionArgs();
        Path folder = Path.of(folders.isEmpty() ? properties.getFolder() : folders.get(0)).toAbsolutePath();

        BatchSummary summary = batchService.run(folder);
        if (summary.count(ProcessingResult.Status.FAILED) > 0) {
            log.warn("{} of {} documents failed to store", summary.count(ProcessingResult.Status.FAILED), summary.getTotal());
        }
    }
}
