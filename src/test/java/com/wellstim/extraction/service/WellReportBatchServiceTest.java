package com.wellstim.extraction.service;

import com.wellstim.extraction.config.IngestionProperties;
import com.wellstim.extraction.model.BatchSummary;
import com.wellstim.extraction.model.ProcessingResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.dao.DataIntegrityViolationException;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class WellReportBatchServiceTest {

    @TempDir
    Path dir;

    private IngestionProperties properties;
    private RecordingProcessingService processing;
    private WellReportBatchService batchService;

    /**
     * Stands in for the real pipeline: records the order documents arrive in
     * and fails on any file whose name starts with "bad".
     */
    static class RecordingProcessingService extends WellReportProcessingService {

        final List<String> seen = new ArrayList<>();

        RecordingProcessingService() {
            super(null, null, null);
        }

        @Override
        public ProcessingResult process(Path pdfPath) {
            String name = pdfPath.getFileName().toString();
            seen.add(name);
            if (name.startsWith("bad")) {
                throw new DataIntegrityViolationException("Duplicate entry for key 'api'");
            }
            ProcessingResult result = new ProcessingResult();
            result.setSource(pdfPath.toString());
            return result;
        }
    }

    @BeforeEach
    void setUp() {
        properties = new IngestionProperties();
        processing = new RecordingProcessingService();
        batchService = new WellReportBatchService(processing, properties);
    }

    @Test
    void discoversReportsRecursivelyInSortedOrder() throws IOException {
        touch("b.pdf");
        touch("a.PDF");
        touch("notes.txt");
        touch("2019/z.pdf");
        touch("2019/deep/c.pdf");

        List<String> found = batchService.discover(dir).stream()
                .map(p -> dir.relativize(p).toString().replace('\\', '/'))
                .toList();

        assertEquals(List.of("2019/deep/c.pdf", "2019/z.pdf", "a.PDF", "b.pdf"), found);
    }

    @Test
    void extensionListIsConfigurable() throws IOException {
        touch("a.pdf");
        touch("b.tif");
        properties.setExtensions(List.of("TIF"));

        assertEquals(1, batchService.discover(dir).size());
    }

    @Test
    void runsEveryDocumentAndIsolatesFailures() throws IOException {
        touch("a.pdf");
        touch("bad.pdf");
        touch("c.pdf");

        BatchSummary summary = batchService.run(dir);

        assertEquals(List.of("a.pdf", "bad.pdf", "c.pdf"), processing.seen);
        assertEquals(3, summary.getTotal());
        assertEquals(2, summary.count(ProcessingResult.Status.PROCESSED));
        assertEquals(1, summary.count(ProcessingResult.Status.FAILED));
    }

    @Test
    void failureEndsTheBatchWhenNotContinuingOnError() throws IOException {
        touch("a.pdf");
        touch("bad.pdf");
        touch("c.pdf");
        properties.setContinueOnError(false);

        assertThrows(DataIntegrityViolationException.class, () -> batchService.run(dir));
        assertEquals(List.of("a.pdf", "bad.pdf"), processing.seen);
    }

    @Test
    void emptyFolderGivesEmptySummary() {
        BatchSummary summary = batchService.run(dir);

        assertEquals(0, summary.getTotal());
    }

    @Test
    void missingFolderIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> batchService.run(dir.resolve("nope")));
    }

    private void touch(String relative) throws IOException {
        Path file = dir.resolve(relative);
        Files.createDirectories(file.getParent());
        Files.writeString(file, "%PDF-1.4");
    }
}
