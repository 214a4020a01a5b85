package com.wellstim.extraction.service;

import com.wellstim.extraction.config.IngestionProperties;
import com.wellstim.extraction.model.BatchSummary;
import com.wellstim.extraction.model.ProcessingResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Processes every report under a folder, one document at a time, in sorted
 * path order.
 */
@Service
@Slf4j
public class WellReportBatchService {

    private final WellReportProcessingService processingService;
    private final IngestionProperties properties;

    public WellReportBatchService(WellReportProcessingService processingService,
                                  IngestionProperties properties) {
        this.processingService = processingService;
        this.properties = properties;
    }

    public BatchSummary run(Path folder) {
        Path root = folder.toAbsolutePath().normalize();
        if (!Files.isDirectory(root)) {
            throw new IllegalArgumentException("PDF folder not found: " + root);
        }

        BatchSummary summary = new BatchSummary();
        summary.setFolder(root.toString());

        List<Path> documents = discover(root);
        if (documents.isEmpty()) {
            log.warn("No PDF files found in {}", root);
            return summary;
        }

        for (Path document : documents) {
            log.info("Processing {}", document);
            summary.getResults().add(processOne(document));
        }

        log.info("Batch finished for {}: {} documents, {} processed, {} without text, {} without API, {} failed",
                root, summary.getTotal(),
                summary.count(ProcessingResult.Status.PROCESSED),
                summary.count(ProcessingResult.Status.SKIPPED_NO_TEXT),
                summary.count(ProcessingResult.Status.SKIPPED_NO_API),
                summary.count(ProcessingResult.Status.FAILED));
        return summary;
    }

    /**
     * Regular files under {@code folder}, at any depth, with a configured
     * extension, sorted by path.
     */
    public List<Path> discover(Path folder) {
        Set<String> extensions = properties.getExtensions().stream()
                .map(e -> e.toLowerCase(Locale.ROOT))
                .collect(Collectors.toSet());

        try (Stream<Path> walk = Files.walk(folder)) {
            return walk
                    .filter(Files::isRegularFile)
                    .filter(p -> extensions.contains(extensionOf(p)))
                    .sorted()
                    .toList();
        } catch (IOException e) {
            throw new UncheckedIOException("Could not scan " + folder, e);
        }
    }

    private ProcessingResult processOne(Path document) {
        if (!properties.isContinueOnError()) {
            return processingService.process(document);
        }
        try {
            return processingService.process(document);
        } catch (RuntimeException e) {
            log.error("Failed to store records from {}", document, e);
            return ProcessingResult.failed(document.toString(), e);
        }
    }

    private static String extensionOf(Path path) {
        String name = path.getFileName().toString();
        int dot = name.lastIndexOf('.');
        return dot < 0 ? "" : name.substring(dot + 1).toLowerCase(Locale.ROOT);
    }
}
